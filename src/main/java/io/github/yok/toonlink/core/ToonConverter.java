package io.github.yok.toonlink.core;

import io.github.yok.toonlink.config.ConvertConfig;
import io.github.yok.toonlink.config.ParserConfig;
import io.github.yok.toonlink.io.ToonFiles;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import io.github.yok.toonlink.parser.ToonParseException;
import io.github.yok.toonlink.parser.ToonSyntax;
import io.github.yok.toonlink.serializer.ToonSerializer;
import io.github.yok.toonlink.util.CsvUtils;
import io.github.yok.toonlink.util.LogPathUtil;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Core class that converts files between CSV and TOON and inspects TOON files.
 *
 * <p>
 * <strong>Main responsibilities:</strong>
 * </p>
 * <ul>
 * <li>Convert a CSV file (header record + rows) into a TOON file, naming the table explicitly or
 * after the CSV file.</li>
 * <li>Convert a TOON file into a CSV file. The table name is not kept in CSV.</li>
 * <li>Summarize a TOON file without writing anything.</li>
 * </ul>
 *
 * <p>
 * When no output path is given, {@link ConvertConfig#resolveOutput(Path, String)} decides it.
 * </p>
 *
 * @see ConvertConfig
 * @see ParserConfig
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ToonConverter {

    private static final String TABLE_NAME_PREFIX = String.valueOf(ToonSyntax.TABLE_NAME_MARKER);

    private final ConvertConfig convertConfig;

    private final ToonFiles toonFiles;

    /**
     * Creates a converter.
     *
     * @param convertConfig conversion settings
     * @param parserConfig parser settings
     */
    public ToonConverter(ConvertConfig convertConfig, ParserConfig parserConfig) {
        this(convertConfig, new ToonFiles(parserConfig.createParser(), new ToonSerializer()));
    }

    ToonConverter(ConvertConfig convertConfig, ToonFiles toonFiles) {
        this.convertConfig = convertConfig;
        this.toonFiles = toonFiles;
    }

    /**
     * Converts a CSV file into a TOON file.
     *
     * @param csv input CSV file
     * @param tableName table name to write; when blank, the CSV base name is used if
     *        {@code convert.table-name-from-file} is enabled
     * @param output output file, or {@code null} for the default location
     * @return path of the written TOON file
     * @throws IOException if reading or writing fails
     * @throws IllegalArgumentException if the CSV has ragged records, or a column name or text cell
     *         that TOON cannot represent ({@code |}, CR or LF, or a leading {@code @} on the first
     *         column when no table name is written)
     */
    public Path csvToToon(Path csv, String tableName, Path output) throws IOException {
        Document doc = CsvUtils.readCsvUtf8(csv.toFile(), convertConfig.getCsvDelimiter());
        log.info("Read CSV file: {} (columns={}, rows={})", LogPathUtil.renderPathForLog(csv),
                doc.getColumnCount(), doc.getRowCount());

        String name = tableName;
        if (StringUtils.isBlank(name) && convertConfig.isTableNameFromFile()) {
            name = FilenameUtils.getBaseName(csv.getFileName().toString());
        }
        doc = doc.withTableName(StringUtils.isBlank(name) ? null : name);
        checkWritable(doc, csv);

        Path target = output != null ? output
                : convertConfig.resolveOutput(csv, ToonSyntax.FILE_EXTENSION);
        toonFiles.write(doc, target);
        return target;
    }

    private static void checkWritable(Document doc, Path csv) {
        if (!doc.isRectangular()) {
            throw new IllegalArgumentException(
                    "Cannot write TOON: records differ in length from the header in " + csv);
        }
        List<String> columns = doc.getColumns();
        for (int c = 0; c < columns.size(); c++) {
            if (!isRepresentable(columns.get(c))) {
                throw new IllegalArgumentException("Cannot write TOON: column " + (c + 1)
                        + " name contains '|' or a line break in " + csv);
            }
        }
        if (!doc.getTableName().isPresent() && !columns.isEmpty() && StringUtils
                .startsWith(StringUtils.strip(columns.get(0)), TABLE_NAME_PREFIX)) {
            throw new IllegalArgumentException("Cannot write TOON: first column name starts with '"
                    + TABLE_NAME_PREFIX + "' and no table name is written in " + csv);
        }
        List<List<Value>> rows = doc.getRows();
        for (int r = 0; r < rows.size(); r++) {
            for (Value cell : rows.get(r)) {
                if (cell.getKind() == Value.Kind.STRING && !isRepresentable(cell.asString())) {
                    throw new IllegalArgumentException("Cannot write TOON: record " + (r + 1)
                            + " contains '|' or a line break in " + csv);
                }
            }
        }
    }

    private static boolean isRepresentable(String text) {
        return StringUtils.containsNone(text, ToonSyntax.FIELD_DELIMITER, '\r', '\n');
    }

    /**
     * Converts a TOON file into a CSV file.
     *
     * @param toon input TOON file
     * @param output output file, or {@code null} for the default location
     * @return path of the written CSV file
     * @throws IOException if reading or writing fails
     * @throws ToonParseException if the TOON file is malformed
     * @throws IllegalArgumentException if the TOON file contains ragged rows
     */
    public Path toonToCsv(Path toon, Path output) throws IOException, ToonParseException {
        Document doc = toonFiles.read(toon);
        if (!doc.isRectangular()) {
            throw new IllegalArgumentException(
                    "Cannot write CSV: rows differ in length from the header in " + toon);
        }
        Path target = output != null ? output : convertConfig.resolveOutput(toon, "csv");
        CsvUtils.writeCsvUtf8(target.toFile(), doc, convertConfig.getCsvDelimiter());
        log.info("Wrote CSV file: {} (columns={}, rows={})", LogPathUtil.renderPathForLog(target),
                doc.getColumnCount(), doc.getRowCount());
        return target;
    }

    /**
     * Reads a TOON file and summarizes it.
     *
     * @param toon input TOON file
     * @return summary of the document
     * @throws IOException if reading fails
     * @throws ToonParseException if the TOON file is malformed
     */
    public DocumentSummary inspect(Path toon) throws IOException, ToonParseException {
        DocumentSummary summary = DocumentSummary.of(toonFiles.read(toon));
        log.info("Table: {}, columns: {}, rows: {}, ragged rows: {}",
                summary.getTableName().orElse("(none)"), summary.getColumns(),
                summary.getRowCount(), summary.getRaggedRowCount());
        for (int i = 0; i < summary.getColumnCount(); i++) {
            log.info("  {}: {}", summary.getColumns().get(i), summary.getColumnKinds().get(i));
        }
        return summary;
    }
}
