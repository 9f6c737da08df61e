package io.github.yok.toonlink.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ToonParserTest {

    private static final String EMPLOYEES = "@employees\n" + "name|department|salary\n"
            + "---\n" + "Alice|Engineering|95000.0\n" + "Bob|Marketing|75000.0";

    private final ToonParser parser = new ToonParser();

    @Test
    void parse_正常ケース_テーブル名と区切り行ありを指定する_全要素が解析されること() throws Exception {
        Document doc = parser.parse(EMPLOYEES);

        assertEquals(Optional.of("employees"), doc.getTableName());
        assertEquals(List.of("name", "department", "salary"), doc.getColumns());
        assertEquals(2, doc.getRowCount());
        assertEquals(List.of(Value.ofString("Alice"), Value.ofString("Engineering"),
                Value.ofFloat(95000.0)), doc.getRow(0));
        assertEquals(List.of(Value.ofString("Bob"), Value.ofString("Marketing"),
                Value.ofFloat(75000.0)), doc.getRow(1));
    }

    @Test
    void parse_正常ケース_テーブル名なしを指定する_テーブル名が空であること() throws Exception {
        Document doc = parser.parse("name|age\n---\nAlice|30\nBob|25");

        assertEquals(Optional.empty(), doc.getTableName());
        assertEquals(List.of("name", "age"), doc.getColumns());
        assertEquals(List.of(Value.ofString("Alice"), Value.ofInt(30L)), doc.getRow(0));
        assertEquals(List.of(Value.ofString("Bob"), Value.ofInt(25L)), doc.getRow(1));
    }

    @Test
    void parse_正常ケース_区切り行なしを指定する_ヘッダ直後の行がデータになること() throws Exception {
        Document doc = parser.parse("@users\nname|age\nAlice|30");

        assertEquals(Optional.of("users"), doc.getTableName());
        assertEquals(1, doc.getRowCount());
        assertEquals(List.of(Value.ofString("Alice"), Value.ofInt(30L)), doc.getRow(0));
    }

    @Test
    void parse_正常ケース_区切り行に続きがある_区切り行として読み飛ばされること() throws Exception {
        Document doc = parser.parse("a|b\n  ------ rows below\n1|2");
        assertEquals(1, doc.getRowCount());
        assertEquals(List.of(Value.ofInt(1L), Value.ofInt(2L)), doc.getRow(0));
    }

    @Test
    void parse_正常ケース_データ行間に空行がある_空行が除外されること() throws Exception {
        Document doc = parser.parse("a|b\n---\n1|x\n\n   \n2|y\n\n");

        assertEquals(2, doc.getRowCount());
        assertEquals(List.of(Value.ofInt(1L), Value.ofString("x")), doc.getRow(0));
        assertEquals(List.of(Value.ofInt(2L), Value.ofString("y")), doc.getRow(1));
    }

    @Test
    void parse_正常ケース_空フィールドとnullキーワードを指定する_Nullになること() throws Exception {
        Document doc = parser.parse("name|age|city\n---\nAlice||New York\nBob|25|\nCarl|NULL|na");

        assertEquals(Value.ofNull(), doc.getRow(0).get(1));
        assertEquals(Value.ofNull(), doc.getRow(1).get(2));
        assertEquals(List.of(Value.ofString("Carl"), Value.ofNull(), Value.ofNull()),
                doc.getRow(2));
    }

    @Test
    void parse_正常ケース_真偽値と数値を指定する_型が推論されること() throws Exception {
        Document doc = parser
                .parse("name|active|score|rank\n---\nAlice|True|95.5|1\nBob|false|3e2|2");

        assertEquals(List.of(Value.ofString("Alice"), Value.ofBool(true), Value.ofFloat(95.5),
                Value.ofInt(1L)), doc.getRow(0));
        assertEquals(List.of(Value.ofString("Bob"), Value.ofBool(false), Value.ofFloat(300.0),
                Value.ofInt(2L)), doc.getRow(1));
    }

    @Test
    void parse_正常ケース_列名とフィールドに空白がある_前後の空白が除去されること() throws Exception {
        Document doc = parser.parse("@  my table  \n name | age \n---\n  Alice  |  30  ");

        assertEquals(Optional.of("my table"), doc.getTableName());
        assertEquals(List.of("name", "age"), doc.getColumns());
        assertEquals(List.of(Value.ofString("Alice"), Value.ofInt(30L)), doc.getRow(0));
    }

    @Test
    void parse_正常ケース_CRLF改行を指定する_LFと同じ結果になること() throws Exception {
        Document crlf = parser.parse(EMPLOYEES.replace("\n", "\r\n") + "\r\n");
        assertEquals(parser.parse(EMPLOYEES), crlf);
    }

    @Test
    void parse_正常ケース_単独のCRを含むフィールド_同じ行のフィールドとして保持されること()
            throws Exception {
        Document doc = parser.parse("a\n---\nx\ry");

        assertEquals(1, doc.getRowCount());
        assertEquals(List.of(Value.ofString("x\ry")), doc.getRow(0));
    }

    @Test
    void parse_正常ケース_重複した列名を指定する_重複が保持されること() throws Exception {
        Document doc = parser.parse("x|x\n---\n1|2");
        assertEquals(List.of("x", "x"), doc.getColumns());
    }

    @Test
    void parse_正常ケース_ヘッダのみを指定する_行が0件であること() throws Exception {
        assertEquals(0, parser.parse("a|b").getRowCount());
        assertEquals(0, parser.parse("@t\na|b\n---").getRowCount());
    }

    @Test
    void parse_正常ケース_名前が空のテーブル名行を指定する_空文字のテーブル名になること() throws Exception {
        Document doc = parser.parse("@\na|b\n---\n1|2");
        assertEquals(Optional.of(""), doc.getTableName());
    }

    @Test
    void parse_正常ケース_寛容モードで列数の異なる行を指定する_そのまま保持されること() throws Exception {
        Document doc = parser.parse("a|b\n---\n1|2|3\n4");

        assertEquals(List.of(Value.ofInt(1L), Value.ofInt(2L), Value.ofInt(3L)), doc.getRow(0));
        assertEquals(List.of(Value.ofInt(4L)), doc.getRow(1));
        assertEquals(ArityPolicy.LENIENT, parser.getArityPolicy());
    }

    @Test
    void parse_異常ケース_厳格モードで列数の異なる行を指定する_ROW_ARITY_MISMATCHが送出されること() {
        ToonParser strict = new ToonParser(ArityPolicy.STRICT);

        ToonParseException ex = assertThrows(ToonParseException.class,
                () -> strict.parse("a|b\n---\n1|2\n3"));
        assertEquals(ToonParseException.Reason.ROW_ARITY_MISMATCH, ex.getReason());
        assertEquals(4, ex.getLineNumber());
        assertTrue(ex.getMessage().contains("1 fields"));
    }

    @Test
    void parse_異常ケース_先頭に空行がある入力を厳格モードで解析する_元の行番号が報告されること() {
        ToonParser strict = new ToonParser(ArityPolicy.STRICT);

        ToonParseException ex =
                assertThrows(ToonParseException.class, () -> strict.parse("\n\na|b\n---\n1"));
        assertEquals(5, ex.getLineNumber());
    }

    @Test
    void parse_正常ケース_厳格モードで列数が一致する_解析できること() throws Exception {
        Document doc = new ToonParser(ArityPolicy.STRICT).parse(EMPLOYEES);
        assertEquals(2, doc.getRowCount());
    }

    @Test
    void parse_異常ケース_空文字を指定する_EMPTY_CONTENTが送出されること() {
        ToonParseException ex = assertThrows(ToonParseException.class, () -> parser.parse(""));
        assertEquals(ToonParseException.Reason.EMPTY_CONTENT, ex.getReason());
    }

    @Test
    void parse_異常ケース_空白と改行のみを指定する_EMPTY_CONTENTが送出されること() {
        ToonParseException ex =
                assertThrows(ToonParseException.class, () -> parser.parse("   \n  "));
        assertEquals(ToonParseException.Reason.EMPTY_CONTENT, ex.getReason());
    }

    @Test
    void parse_異常ケース_nullを指定する_EMPTY_CONTENTが送出されること() {
        ToonParseException ex = assertThrows(ToonParseException.class, () -> parser.parse(null));
        assertEquals(ToonParseException.Reason.EMPTY_CONTENT, ex.getReason());
    }

    @Test
    void parse_異常ケース_テーブル名行のみを指定する_MISSING_HEADERが送出されること() {
        ToonParseException ex =
                assertThrows(ToonParseException.class, () -> parser.parse("@onlyname\n"));
        assertEquals(ToonParseException.Reason.MISSING_HEADER, ex.getReason());
        assertEquals(2, ex.getLineNumber());
    }

    @Test
    void constructor_正常ケース_ポリシーにnullを指定する_寛容モードになること() {
        assertEquals(ArityPolicy.LENIENT, new ToonParser(null).getArityPolicy());
    }
}
