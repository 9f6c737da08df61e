package io.github.yok.toonlink.parser;

import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses TOON text into a {@link Document}.
 *
 * <p>
 * Accepted layout:
 * </p>
 *
 * <pre>
 * [&#64;table_name]
 * col1|col2|col3
 * [---]
 * val1|val2|val3
 * ...
 * </pre>
 *
 * <p>
 * The whole input is stripped first, so leading and trailing blank lines are ignored. The first
 * line is the table name when it starts with {@code @}; the next line is the header. A following
 * line starting with {@code ---} is skipped as the separator, otherwise it is already data. Blank
 * data lines are skipped. Every field is typed by {@link ValueInference}.
 * </p>
 *
 * <p>
 * Under {@link ArityPolicy#LENIENT} rows whose field count differs from the column count are kept
 * as split; under {@link ArityPolicy#STRICT} they fail the parse.
 * </p>
 *
 * <p>
 * Instances are immutable and may be shared between threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class ToonParser {

    private final ArityPolicy arityPolicy;

    /**
     * Creates a lenient parser.
     */
    public ToonParser() {
        this(ArityPolicy.LENIENT);
    }

    /**
     * Creates a parser with the given arity policy.
     *
     * @param arityPolicy policy for ragged rows
     */
    public ToonParser(ArityPolicy arityPolicy) {
        this.arityPolicy = arityPolicy == null ? ArityPolicy.LENIENT : arityPolicy;
    }

    /**
     * Parses TOON text.
     *
     * @param text TOON text (may be {@code null}, read as empty)
     * @return parsed document
     * @throws ToonParseException if the text is empty, has no header line, or (strict policy)
     *         contains a row whose field count differs from the header
     */
    public Document parse(String text) throws ToonParseException {
        String raw = StringUtils.defaultString(text);
        String content = StringUtils.strip(raw);
        List<String> lines = ToonSyntax.LINE_SPLITTER.splitToList(content);

        if (lines.size() == 1 && StringUtils.isBlank(lines.get(0))) {
            throw new ToonParseException(ToonParseException.Reason.EMPTY_CONTENT,
                    "Empty TOON content");
        }

        // Line numbers in messages refer to the unstripped input
        int lineOffset = content.isEmpty() ? 0
                : ToonSyntax.LINE_SPLITTER.splitToList(raw.substring(0, raw.indexOf(content)))
                        .size() - 1;

        String tableName = null;
        int idx = 0;
        if (lines.get(0).charAt(0) == ToonSyntax.TABLE_NAME_MARKER) {
            tableName = StringUtils.strip(lines.get(0).substring(1));
            idx = 1;
            log.debug("Table name line found: {}", tableName);
        }

        if (lines.size() <= idx) {
            throw new ToonParseException(ToonParseException.Reason.MISSING_HEADER,
                    "Missing column headers", lineOffset + idx + 1);
        }

        List<String> columns = ToonSyntax.FIELD_SPLITTER.splitToList(lines.get(idx));
        idx++;

        if (idx < lines.size()
                && StringUtils.strip(lines.get(idx)).startsWith(ToonSyntax.SEPARATOR)) {
            log.debug("Separator line skipped at line {}", lineOffset + idx + 1);
            idx++;
        }

        List<List<Value>> rows = new ArrayList<>();
        for (int i = idx; i < lines.size(); i++) {
            String line = StringUtils.strip(lines.get(i));
            if (line.isEmpty()) {
                continue;
            }
            List<String> fields = ToonSyntax.FIELD_SPLITTER.splitToList(line);
            if (arityPolicy == ArityPolicy.STRICT && fields.size() != columns.size()) {
                int lineNumber = lineOffset + i + 1;
                throw new ToonParseException(ToonParseException.Reason.ROW_ARITY_MISMATCH,
                        String.format("Line %d has %d fields but the header has %d columns",
                                lineNumber, fields.size(), columns.size()),
                        lineNumber);
            }
            List<Value> values = new ArrayList<>(fields.size());
            for (String field : fields) {
                values.add(ValueInference.infer(field));
            }
            rows.add(values);
        }

        log.debug("Parsed TOON table. name={}, columns={}, rows={}", tableName, columns.size(),
                rows.size());
        return Document.of(tableName, columns, rows);
    }
}
