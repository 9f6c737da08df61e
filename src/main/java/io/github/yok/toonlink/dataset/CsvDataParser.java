package io.github.yok.toonlink.dataset;

import io.github.yok.toonlink.util.CsvUtils;
import java.io.File;
import java.io.IOException;
import java.util.Locale;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Implementation of {@link DataParser} that reads {@code .csv} files with a header record.
 *
 * <p>
 * The table name is the upper-cased file base name. Cells are typed the same way TOON fields are,
 * so a CSV file and its TOON conversion load as equal tables.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class CsvDataParser implements DataParser {

    private final char delimiter;

    public CsvDataParser() {
        this(',');
    }

    /**
     * Creates a parser for the given field delimiter.
     *
     * @param delimiter CSV field delimiter
     */
    public CsvDataParser(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public DataFormat getFormat() {
        return DataFormat.CSV;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable parseTable(File file) throws IOException, DataSetException {
        String tableName = FilenameUtils.getBaseName(file.getName()).toUpperCase(Locale.ROOT);
        return DocumentTables.toTable(CsvUtils.readCsvUtf8(file, delimiter), tableName);
    }
}
