package io.github.yok.toonlink.util;

import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.model.Value;
import io.github.yok.toonlink.parser.ValueInference;
import io.github.yok.toonlink.serializer.ValueRenderer;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.FileUtils;

/**
 * Utility class for reading and writing CSV files as {@link Document}s.
 *
 * <p>
 * Files are UTF-8 and handled with Apache Commons CSV. On read, the first record is the header and
 * every cell is typed by {@link ValueInference}, so a CSV file and the TOON file converted from it
 * yield the same values. On write, cells are rendered by {@link ValueRenderer} with minimal quoting
 * and {@code \n} as record separator.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Reads a CSV file into an unnamed document.
     *
     * <p>
     * Records shorter or longer than the header are kept as they are. An empty file yields a
     * document without columns or rows.
     * </p>
     *
     * @param csvFile source CSV file
     * @param delimiter field delimiter
     * @return document with the header as columns and typed cells as rows
     * @throws IOException if the file cannot be read or is not valid CSV
     */
    public static Document readCsvUtf8(File csvFile, char delimiter) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setIgnoreEmptyLines(true).get();
        List<String> columns = new ArrayList<>();
        List<List<Value>> rows = new ArrayList<>();
        try (Reader r = Files.newBufferedReader(csvFile.toPath(), StandardCharsets.UTF_8);
                CSVParser parser = CSVParser.parse(r, fmt)) {
            boolean header = true;
            for (CSVRecord record : parser) {
                if (header) {
                    for (String name : record) {
                        columns.add(name.trim());
                    }
                    header = false;
                    continue;
                }
                List<Value> row = new ArrayList<>(record.size());
                for (String cell : record) {
                    row.add(ValueInference.infer(cell));
                }
                rows.add(row);
            }
        }
        return Document.of(columns, rows);
    }

    /**
     * Writes a document to a CSV file encoded in UTF-8. The table name is not written.
     *
     * @param csvFile the destination CSV file (created or overwritten, parents created)
     * @param doc document to write
     * @param delimiter field delimiter
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(File csvFile, Document doc, char delimiter)
            throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder().setDelimiter(delimiter)
                .setHeader(doc.getColumns().toArray(new String[0]))
                .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator('\n').get();
        File parent = csvFile.getAbsoluteFile().getParentFile();
        if (parent != null) {
            FileUtils.forceMkdir(parent);
        }
        try (Writer w = Files.newBufferedWriter(csvFile.toPath(), StandardCharsets.UTF_8);
                CSVPrinter printer = new CSVPrinter(w, fmt)) {
            for (List<Value> row : doc.getRows()) {
                List<String> cells = new ArrayList<>(row.size());
                for (Value value : row) {
                    cells.add(ValueRenderer.render(value));
                }
                printer.printRecord(cells);
            }
        }
    }
}
