package io.github.yok.toonlink.dataset;

import com.google.common.base.Preconditions;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.dbunit.dataset.Column;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultTable;
import org.dbunit.dataset.DefaultTableMetaData;
import org.dbunit.dataset.ITable;
import org.dbunit.dataset.ITableMetaData;
import org.dbunit.dataset.datatype.DataType;

/**
 * Converts between {@link Document}s and DBUnit {@link ITable}s.
 *
 * <p>
 * Cells are stored as {@code null}, {@link Boolean}, {@link Long}, {@link Double} or
 * {@link String}, and read back through {@link Value#fromObject(Object)}. Column data types are
 * derived from the non-null values of each column:
 * </p>
 * <ul>
 * <li>only integers: {@link DataType#BIGINT}</li>
 * <li>integers and floats: {@link DataType#DOUBLE}</li>
 * <li>only booleans: {@link DataType#BOOLEAN}</li>
 * <li>only nulls: {@link DataType#UNKNOWN}</li>
 * <li>anything else: {@link DataType#VARCHAR}</li>
 * </ul>
 *
 * <p>
 * DBUnit addresses cells by column name, ignoring case, so documents with column names that only
 * differ in case are rejected.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class DocumentTables {

    private DocumentTables() {
        // Utility class; do not instantiate.
    }

    /**
     * Builds a table from a document.
     *
     * @param doc rectangular document with unique column names
     * @param fallbackName table name used when the document has none or a blank one
     * @return table named by the document or {@code fallbackName}
     * @throws IllegalArgumentException if a row is ragged or a column name repeats
     * @throws DataSetException if DBUnit rejects a row
     */
    public static ITable toTable(Document doc, String fallbackName) throws DataSetException {
        Preconditions.checkArgument(doc.isRectangular(),
                "Every row must have %s values to build a table", doc.getColumnCount());
        Set<String> seen = new HashSet<>();
        for (String column : doc.getColumns()) {
            Preconditions.checkArgument(seen.add(column.toUpperCase(Locale.ROOT)),
                    "Duplicate column name: %s", column);
        }

        String tableName = doc.getTableName().filter(StringUtils::isNotBlank).orElse(fallbackName);
        Column[] columns = new Column[doc.getColumnCount()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = new Column(doc.getColumns().get(i), columnType(doc, i));
        }
        DefaultTable table = new DefaultTable(new DefaultTableMetaData(tableName, columns));
        for (List<Value> row : doc.getRows()) {
            Object[] cells = new Object[row.size()];
            for (int i = 0; i < cells.length; i++) {
                cells[i] = row.get(i).toObject();
            }
            table.addRow(cells);
        }
        return table;
    }

    /**
     * Builds a named document from a table.
     *
     * @param table source table
     * @return document named after the table
     * @throws DataSetException if a cell cannot be read
     */
    public static Document toDocument(ITable table) throws DataSetException {
        ITableMetaData meta = table.getTableMetaData();
        Column[] columns = meta.getColumns();
        List<String> names = new ArrayList<>(columns.length);
        for (Column column : columns) {
            names.add(column.getColumnName());
        }
        List<List<Value>> rows = new ArrayList<>(table.getRowCount());
        for (int r = 0; r < table.getRowCount(); r++) {
            List<Value> row = new ArrayList<>(columns.length);
            for (Column column : columns) {
                row.add(Value.fromObject(table.getValue(r, column.getColumnName())));
            }
            rows.add(row);
        }
        return Document.of(meta.getTableName(), names, rows);
    }

    /**
     * Derives the DBUnit data type of a column from its values.
     *
     * @param doc document
     * @param index column index
     * @return data type
     */
    static DataType columnType(Document doc, int index) {
        EnumSet<Value.Kind> kinds = EnumSet.noneOf(Value.Kind.class);
        for (List<Value> row : doc.getRows()) {
            kinds.add(row.get(index).getKind());
        }
        kinds.remove(Value.Kind.NULL);
        if (kinds.isEmpty()) {
            return DataType.UNKNOWN;
        }
        if (kinds.equals(EnumSet.of(Value.Kind.INT))) {
            return DataType.BIGINT;
        }
        if (kinds.equals(EnumSet.of(Value.Kind.FLOAT))
                || kinds.equals(EnumSet.of(Value.Kind.INT, Value.Kind.FLOAT))) {
            return DataType.DOUBLE;
        }
        if (kinds.equals(EnumSet.of(Value.Kind.BOOL))) {
            return DataType.BOOLEAN;
        }
        return DataType.VARCHAR;
    }
}
