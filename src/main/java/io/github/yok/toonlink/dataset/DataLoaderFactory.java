package io.github.yok.toonlink.dataset;

import io.github.yok.toonlink.parser.ToonParseException;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Factory class for resolving table files in a directory and loading them through the parsers of a
 * {@link DataParserRegistry}.
 *
 * <p>
 * A table file is matched when its base name equals the target table name (case-insensitive) and
 * its extension belongs to a registered format. When several formats exist for one table, the
 * following priority order is applied and the others are skipped:
 * </p>
 *
 * <ol>
 * <li>TOON</li>
 * <li>CSV</li>
 * </ol>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataLoaderFactory {

    private final DataParserRegistry registry;

    /**
     * Creates a factory backed by the given registry.
     *
     * @param registry parsers available to this factory
     */
    public DataLoaderFactory(DataParserRegistry registry) {
        this.registry = registry;
    }

    /**
     * Loads the table file for the given table name.
     *
     * @param dir directory containing table files
     * @param tableName the logical table name to match (case-insensitive)
     * @return table parsed from the resolved file
     * @throws IllegalArgumentException if no suitable file is found
     * @throws IOException if the file cannot be read
     * @throws DataSetException if the table cannot be built
     * @throws ToonParseException if the resolved TOON file is malformed
     */
    public ITable create(File dir, String tableName)
            throws IOException, DataSetException, ToonParseException {
        String targetName = tableName.toLowerCase(Locale.ROOT);

        for (DataFormat format : registry.getRegisteredFormats()) {
            File[] matches = dir.listFiles((d, name) -> {
                String base = FilenameUtils.getBaseName(name).toLowerCase(Locale.ROOT);
                String ext = FilenameUtils.getExtension(name);
                return base.equals(targetName) && format.matches(ext);
            });

            if (matches != null && matches.length > 0) {
                Arrays.sort(matches);
                File candidate = matches[0];
                log.info("Resolved dataset file: {}", candidate.getName());
                return parserFor(format).parseTable(candidate);
            }
        }

        throw new IllegalArgumentException("No dataset file found for table: " + tableName);
    }

    /**
     * Loads every table file of every registered format in the directory.
     *
     * <p>
     * Tables are keyed by the file base name. When two formats provide the same base name, the
     * higher-priority format wins and the other file is skipped.
     * </p>
     *
     * @param dir directory containing table files
     * @return data set of all resolved tables
     * @throws IllegalArgumentException if {@code dir} is not a readable directory
     * @throws IOException if a file cannot be read
     * @throws DataSetException if the data set cannot be built
     * @throws ToonParseException if a TOON file is malformed
     */
    public IDataSet createAll(File dir) throws IOException, DataSetException, ToonParseException {
        File[] files = dir.listFiles(File::isFile);
        if (files == null) {
            throw new IllegalArgumentException("Not a readable directory: " + dir);
        }
        Arrays.sort(files);

        DefaultDataSet dataSet = new DefaultDataSet();
        Set<String> loaded = new HashSet<>();
        for (DataFormat format : registry.getRegisteredFormats()) {
            for (File file : files) {
                if (!format.matches(FilenameUtils.getExtension(file.getName()))) {
                    continue;
                }
                String base = FilenameUtils.getBaseName(file.getName()).toLowerCase(Locale.ROOT);
                if (!loaded.add(base)) {
                    log.info("Skipped lower-priority dataset file: {}", file.getName());
                    continue;
                }
                dataSet.addTable(parserFor(format).parseTable(file));
            }
        }
        log.info("Loaded {} table(s) from {}", loaded.size(), dir);
        return dataSet;
    }

    private DataParser parserFor(DataFormat format) {
        return registry.find(format).orElseThrow(
                () -> new IllegalArgumentException("Unsupported format: " + format));
    }
}
