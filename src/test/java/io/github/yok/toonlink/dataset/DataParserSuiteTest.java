package io.github.yok.toonlink.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.toonlink.io.ToonFiles;
import io.github.yok.toonlink.parser.ArityPolicy;
import io.github.yok.toonlink.parser.ToonParseException;
import io.github.yok.toonlink.parser.ToonParser;
import io.github.yok.toonlink.serializer.ToonSerializer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DataParserSuiteTest {

    @TempDir
    Path tempDir;

    private final DataLoaderFactory factory =
            new DataLoaderFactory(DataParserRegistry.withDefaults());

    private void write(String name, String content) throws Exception {
        Files.write(tempDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void parse_正常ケース_ToonDataParserでTOONを読む_テーブル名行の名前で取得できること() throws Exception {
        write("staff.toon", "@employees\nname|salary\n---\nAlice|95000.0\nBob|75000.0");

        IDataSet dataSet = new ToonDataParser().parse(tempDir.toFile());

        ITable table = dataSet.getTable("employees");
        assertEquals(2, table.getRowCount());
        assertEquals("Alice", table.getValue(0, "name"));
        assertEquals(75000.0, table.getValue(1, "salary"));
    }

    @Test
    void parse_正常ケース_テーブル名行のないTOONを読む_ファイル名の大文字がテーブル名になること()
            throws Exception {
        write("book.toon", "id|title\n---\n1|Java\n2|");

        IDataSet dataSet = new ToonDataParser().parse(tempDir.toFile());

        assertEquals("BOOK", dataSet.getTableNames()[0]);
        assertEquals(1L, dataSet.getTable("BOOK").getValue(0, "ID"));
        assertNull(dataSet.getTable("BOOK").getValue(1, "TITLE"));
    }

    @Test
    void parse_正常ケース_CsvDataParserでCSVを読む_テーブル行が取得できること() throws Exception {
        write("BOOK.csv", "ID,NAME\n1,Java\n");
        write("ignored.toon", "a|b");

        IDataSet dataSet = new CsvDataParser().parse(tempDir.toFile());

        assertEquals(1, dataSet.getTableNames().length);
        assertEquals(1, dataSet.getTable("BOOK").getRowCount());
        assertEquals("Java", dataSet.getTable("BOOK").getValue(0, "NAME"));
        assertEquals(1L, dataSet.getTable("BOOK").getValue(0, "ID"));
    }

    @Test
    void parse_正常ケース_区切り文字を指定したCsvDataParserで読む_指定の区切り文字で分割されること()
            throws Exception {
        write("T.csv", "ID;NAME\n1;A,B\n");

        IDataSet dataSet = new CsvDataParser(';').parse(tempDir.toFile());

        assertEquals("A,B", dataSet.getTable("T").getValue(0, "NAME"));
    }

    @Test
    void parse_異常ケース_CsvDataParserにファイルを渡す_DataSetExceptionが送出されること() throws Exception {
        write("single.csv", "ID\n1\n");
        assertThrows(DataSetException.class,
                () -> new CsvDataParser().parse(tempDir.resolve("single.csv").toFile()));
    }

    @Test
    void parse_異常ケース_列数の異なる行を含むTOONを読む_IllegalArgumentExceptionが送出されること()
            throws Exception {
        write("ragged.toon", "a|b\n---\n1");
        assertThrows(IllegalArgumentException.class,
                () -> new ToonDataParser().parse(tempDir.toFile()));
    }

    @Test
    void parse_異常ケース_厳格モードで列数の異なる行を含むTOONを読む_ToonParseExceptionが送出されること()
            throws Exception {
        write("ragged.toon", "a|b\n---\n1");
        ToonDataParser strict = new ToonDataParser(
                new ToonFiles(new ToonParser(ArityPolicy.STRICT), new ToonSerializer()));
        assertThrows(ToonParseException.class, () -> strict.parse(tempDir.toFile()));
    }

    @Test
    void create_正常ケース_同名で複数形式がある_TOON優先で解決されること() throws Exception {
        write("TBL.csv", "ID,NAME\n1,Csv\n");
        write("tbl.toon", "ID|NAME\n---\n1|Toon");

        ITable table = factory.create(tempDir.toFile(), "TBL");

        assertEquals("Toon", table.getValue(0, "NAME"));
    }

    @Test
    void create_正常ケース_CSVのみ存在する_CSVパーサで解決されること() throws Exception {
        write("T2.csv", "ID,NAME\n1,Csv\n");

        ITable table = factory.create(tempDir.toFile(), "t2");

        assertEquals("T2", table.getTableMetaData().getTableName());
        assertEquals("Csv", table.getValue(0, "NAME"));
    }

    @Test
    void create_正常ケース_CSVのみ登録したレジストリを使う_TOONファイルが無視されること() throws Exception {
        write("T3.csv", "ID,NAME\n1,Csv\n");
        write("T3.toon", "ID|NAME\n---\n1|Toon");
        DataParserRegistry registry = new DataParserRegistry();
        registry.register(new CsvDataParser());

        ITable table = new DataLoaderFactory(registry).create(tempDir.toFile(), "T3");

        assertEquals("Csv", table.getValue(0, "NAME"));
    }

    @Test
    void create_異常ケース_対象テーブルファイルが存在しない_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(tempDir.toFile(), "MISSING"));
    }

    @Test
    void create_異常ケース_ディレクトリがファイルである_IllegalArgumentExceptionが送出されること()
            throws Exception {
        write("not-directory.txt", "x");
        assertThrows(IllegalArgumentException.class,
                () -> factory.create(tempDir.resolve("not-directory.txt").toFile(), "MISSING"));
    }

    @Test
    void createAll_正常ケース_複数形式が混在する_同名は優先形式のみ読み込まれること() throws Exception {
        write("A.toon", "X|Y\n---\n1|toon");
        write("A.csv", "X,Y\n1,csv\n");
        write("B.csv", "Z\n2\n");
        write("notes.txt", "ignored");

        IDataSet dataSet = factory.createAll(tempDir.toFile());

        assertEquals(2, dataSet.getTableNames().length);
        assertEquals("toon", dataSet.getTable("A").getValue(0, "Y"));
        assertEquals(2L, dataSet.getTable("B").getValue(0, "Z"));
    }

    @Test
    void createAll_異常ケース_ディレクトリがファイルである_IllegalArgumentExceptionが送出されること()
            throws Exception {
        write("file.toon", "a|b");
        assertThrows(IllegalArgumentException.class,
                () -> factory.createAll(tempDir.resolve("file.toon").toFile()));
    }
}
