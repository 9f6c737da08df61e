package io.github.yok.toonlink.serializer;

import com.google.common.base.Preconditions;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import io.github.yok.toonlink.parser.ToonSyntax;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Serializes a {@link Document} into normative TOON text.
 *
 * <p>
 * Output lines, joined with {@code \n} and without a trailing line break:
 * </p>
 * <ol>
 * <li>{@code @name}, only when the document has a table name</li>
 * <li>the header, columns joined with {@code |}</li>
 * <li>the separator {@code ---}</li>
 * <li>one line per row, fields rendered by {@link ValueRenderer}</li>
 * </ol>
 *
 * <p>
 * Column names and string values are written as is. A value containing {@code |} or a line break
 * is therefore not read back as the same row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ToonSerializer {

    /**
     * Serializes a document.
     *
     * @param doc document whose rows all have {@code doc.getColumnCount()} values
     * @return TOON text
     * @throws IllegalArgumentException if a row length differs from the column count
     */
    public String serialize(Document doc) {
        Preconditions.checkNotNull(doc, "doc must not be null");
        List<String> lines = new ArrayList<>(doc.getRowCount() + 3);

        doc.getTableName().ifPresent(name -> lines.add(ToonSyntax.TABLE_NAME_MARKER + name));
        lines.add(ToonSyntax.FIELD_JOINER.join(doc.getColumns()));
        lines.add(ToonSyntax.SEPARATOR);

        int columnCount = doc.getColumnCount();
        for (int i = 0; i < doc.getRowCount(); i++) {
            List<Value> row = doc.getRow(i);
            Preconditions.checkArgument(row.size() == columnCount,
                    "Row %s has %s values but the document has %s columns", i, row.size(),
                    columnCount);
            List<String> fields = new ArrayList<>(row.size());
            for (Value value : row) {
                fields.add(ValueRenderer.render(value));
            }
            lines.add(ToonSyntax.FIELD_JOINER.join(fields));
        }

        log.debug("Serialized TOON table. name={}, columns={}, rows={}",
                doc.getTableName().orElse(null), columnCount, doc.getRowCount());
        return ToonSyntax.LINE_JOINER.join(lines);
    }
}
