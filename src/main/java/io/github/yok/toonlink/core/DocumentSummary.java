package io.github.yok.toonlink.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Shape of a parsed document: name, size, the value kinds seen in each column, and the number of
 * rows whose length differs from the header.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@ToString
public final class DocumentSummary {

    private final String tableName;

    private final List<String> columns;

    private final int rowCount;

    // Kinds per column index; values beyond the header of a ragged row are ignored
    private final List<Set<Value.Kind>> columnKinds;

    private final int raggedRowCount;

    private DocumentSummary(String tableName, List<String> columns, int rowCount,
            List<Set<Value.Kind>> columnKinds, int raggedRowCount) {
        this.tableName = tableName;
        this.columns = columns;
        this.rowCount = rowCount;
        this.columnKinds = columnKinds;
        this.raggedRowCount = raggedRowCount;
    }

    /**
     * Summarizes a document.
     *
     * @param doc document to summarize
     * @return summary
     */
    public static DocumentSummary of(Document doc) {
        List<EnumSet<Value.Kind>> kinds = new ArrayList<>(doc.getColumnCount());
        for (int i = 0; i < doc.getColumnCount(); i++) {
            kinds.add(EnumSet.noneOf(Value.Kind.class));
        }
        int ragged = 0;
        for (List<Value> row : doc.getRows()) {
            if (row.size() != doc.getColumnCount()) {
                ragged++;
            }
            for (int i = 0; i < Math.min(row.size(), kinds.size()); i++) {
                kinds.get(i).add(row.get(i).getKind());
            }
        }
        ImmutableList.Builder<Set<Value.Kind>> frozen = ImmutableList.builder();
        for (EnumSet<Value.Kind> set : kinds) {
            frozen.add(Collections.unmodifiableSet(set));
        }
        return new DocumentSummary(doc.getTableName().orElse(null), doc.getColumns(),
                doc.getRowCount(), frozen.build(), ragged);
    }

    public Optional<String> getTableName() {
        return Optional.ofNullable(tableName);
    }

    public int getColumnCount() {
        return columns.size();
    }
}
