package io.github.yok.toonlink.dataset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import java.util.List;
import java.util.Optional;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.datatype.DataType;
import org.junit.jupiter.api.Test;

class DocumentTablesTest {

    private static Document employees() {
        return Document.of("employees", List.of("name", "age", "salary", "active"),
                List.of(List.of(Value.ofString("Alice"), Value.ofInt(30L), Value.ofFloat(95000.0),
                        Value.ofBool(true)),
                        List.of(Value.ofString("Bob"), Value.ofNull(), Value.ofInt(75000L),
                                Value.ofBool(false))));
    }

    @Test
    void toTable_正常ケース_テーブル名ありの文書を指定する_文書の名前と値で生成されること() throws Exception {
        ITable table = DocumentTables.toTable(employees(), "FALLBACK");

        assertEquals("employees", table.getTableMetaData().getTableName());
        assertEquals(2, table.getRowCount());
        assertEquals("Alice", table.getValue(0, "name"));
        assertEquals(30L, table.getValue(0, "AGE"));
        assertNull(table.getValue(1, "age"));
        assertEquals(95000.0, table.getValue(0, "salary"));
        assertEquals(Boolean.FALSE, table.getValue(1, "active"));
    }

    @Test
    void toTable_正常ケース_テーブル名なしの文書を指定する_代替名が使われること() throws Exception {
        Document doc = Document.of(List.of("a"), List.of(List.of(Value.ofInt(1L))));
        assertEquals("T1", DocumentTables.toTable(doc, "T1").getTableMetaData().getTableName());

        Document blank = doc.withTableName("");
        assertEquals("T2", DocumentTables.toTable(blank, "T2").getTableMetaData().getTableName());
    }

    @Test
    void toTable_正常ケース_列の値の種別から_列の型が決まること() throws Exception {
        Column[] columns =
                DocumentTables.toTable(employees(), "E").getTableMetaData().getColumns();

        assertEquals(DataType.VARCHAR, columns[0].getDataType());
        assertEquals(DataType.BIGINT, columns[1].getDataType());
        assertEquals(DataType.DOUBLE, columns[2].getDataType());
        assertEquals(DataType.BOOLEAN, columns[3].getDataType());
    }

    @Test
    void columnType_正常ケース_nullのみの列を指定する_UNKNOWNが返ること() {
        Document doc = Document.of(List.of("a", "b"),
                List.of(List.of(Value.ofNull(), Value.ofInt(1L)),
                        List.of(Value.ofNull(), Value.ofString("x"))));

        assertEquals(DataType.UNKNOWN, DocumentTables.columnType(doc, 0));
        assertEquals(DataType.VARCHAR, DocumentTables.columnType(doc, 1));
    }

    @Test
    void toTable_異常ケース_列数の異なる行を指定する_IllegalArgumentExceptionが送出されること() {
        Document ragged = Document.of(List.of("a", "b"), List.of(List.of(Value.ofInt(1L))));
        assertThrows(IllegalArgumentException.class, () -> DocumentTables.toTable(ragged, "T"));
    }

    @Test
    void toTable_異常ケース_大文字小文字違いの重複列名を指定する_IllegalArgumentExceptionが送出されること() {
        Document dup = Document.of(List.of("id", "ID"), List.of());

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> DocumentTables.toTable(dup, "T"));
        assertEquals("Duplicate column name: ID", ex.getMessage());
    }

    @Test
    void toDocument_正常ケース_DBUnitのテーブルを指定する_値が推論済みの種別で変換されること() throws Exception {
        DefaultTable table = new DefaultTable("BOOK",
                new Column[] {new Column("ID", DataType.INTEGER),
                        new Column("TITLE", DataType.VARCHAR),
                        new Column("PRICE", DataType.DECIMAL)});
        table.addRow(new Object[] {1, "Java", new java.math.BigDecimal("12.5")});
        table.addRow(new Object[] {2, null, null});

        Document doc = DocumentTables.toDocument(table);

        assertEquals(Optional.of("BOOK"), doc.getTableName());
        assertEquals(List.of("ID", "TITLE", "PRICE"), doc.getColumns());
        assertEquals(List.of(Value.ofInt(1L), Value.ofString("Java"), Value.ofFloat(12.5)),
                doc.getRow(0));
        assertEquals(List.of(Value.ofInt(2L), Value.ofNull(), Value.ofNull()), doc.getRow(1));
    }

    @Test
    void toDocument_正常ケース_文書から生成したテーブルを戻す_元の文書と等しいこと() throws Exception {
        Document doc = employees();
        assertEquals(doc, DocumentTables.toDocument(DocumentTables.toTable(doc, "X")));
    }
}
