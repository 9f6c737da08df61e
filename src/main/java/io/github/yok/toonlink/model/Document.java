package io.github.yok.toonlink.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * In-memory form of one TOON table: an optional table name, ordered column names and ordered rows
 * of {@link Value}s.
 *
 * <p>
 * A document is a value object. Column and row lists are copied on construction and exposed as
 * immutable lists. Duplicate column names are kept as given.
 * </p>
 *
 * <p>
 * The document itself does not require every row to have {@code columns.size()} values, because
 * a leniently parsed text may carry ragged rows. Use {@link #isRectangular()} to check, and note
 * that serialization rejects ragged documents.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
@ToString
public final class Document {

    // Name from the "@name" line; null when the text had none
    private final String tableName;

    private final ImmutableList<String> columns;

    private final ImmutableList<List<Value>> rows;

    private Document(String tableName, List<String> columns, List<? extends List<Value>> rows) {
        Preconditions.checkNotNull(columns, "columns must not be null");
        Preconditions.checkNotNull(rows, "rows must not be null");
        this.tableName = tableName;
        this.columns = ImmutableList.copyOf(columns);
        ImmutableList.Builder<List<Value>> builder = ImmutableList.builder();
        for (List<Value> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    /**
     * Creates an unnamed document.
     *
     * @param columns column names in order
     * @param rows rows in order
     * @return document without a table name
     */
    public static Document of(List<String> columns, List<? extends List<Value>> rows) {
        return new Document(null, columns, rows);
    }

    /**
     * Creates a document with an optional table name.
     *
     * @param tableName table name, or {@code null} for none
     * @param columns column names in order
     * @param rows rows in order
     * @return document
     */
    public static Document of(String tableName, List<String> columns,
            List<? extends List<Value>> rows) {
        return new Document(tableName, columns, rows);
    }

    /**
     * Returns the table name, if the document carries one.
     *
     * @return table name
     */
    public Optional<String> getTableName() {
        return Optional.ofNullable(tableName);
    }

    /**
     * Returns the column names in order.
     *
     * @return immutable column list
     */
    public List<String> getColumns() {
        return columns;
    }

    /**
     * Returns the rows in order.
     *
     * @return immutable row list
     */
    public List<List<Value>> getRows() {
        return rows;
    }

    /**
     * Returns the row at the given index.
     *
     * @param index zero-based row index
     * @return immutable row
     */
    public List<Value> getRow(int index) {
        return rows.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * Returns a copy of this document with another table name.
     *
     * @param name new table name, or {@code null} to drop it
     * @return renamed document
     */
    public Document withTableName(String name) {
        return new Document(name, columns, rows);
    }

    /**
     * Returns whether every row has exactly {@link #getColumnCount()} values.
     *
     * @return {@code true} if no row is ragged
     */
    public boolean isRectangular() {
        for (List<Value> row : rows) {
            if (row.size() != columns.size()) {
                return false;
            }
        }
        return true;
    }
}
