package io.github.yok.toonlink.dataset;

import io.github.yok.toonlink.io.ToonFiles;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.parser.ToonParseException;
import java.io.File;
import java.io.IOException;
import java.util.Locale;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.ITable;

/**
 * Implementation of {@link DataParser} that reads {@code .toon} files.
 *
 * <p>
 * The table name is the {@code @name} annotation of the file; without one, the upper-cased file
 * base name is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ToonDataParser implements DataParser {

    private final ToonFiles toonFiles;

    public ToonDataParser() {
        this(new ToonFiles());
    }

    public ToonDataParser(ToonFiles toonFiles) {
        this.toonFiles = toonFiles;
    }

    @Override
    public DataFormat getFormat() {
        return DataFormat.TOON;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ITable parseTable(File file) throws IOException, DataSetException, ToonParseException {
        Document doc = toonFiles.read(file.toPath());
        String baseName = FilenameUtils.getBaseName(file.getName()).toUpperCase(Locale.ROOT);
        return DocumentTables.toTable(doc, baseName);
    }
}
