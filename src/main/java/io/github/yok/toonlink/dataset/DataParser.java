package io.github.yok.toonlink.dataset;

import io.github.yok.toonlink.parser.ToonParseException;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import org.apache.commons.io.FilenameUtils;
import org.dbunit.dataset.DataSetException;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Reads table files of one {@link DataFormat} into DBUnit tables.
 *
 * <p>
 * Implementations only read a single file; {@link #parse(File)} assembles every matching file of a
 * directory into one {@link IDataSet}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface DataParser {

    /**
     * Returns the format this parser reads.
     *
     * @return data format
     */
    DataFormat getFormat();

    /**
     * Reads one file into a table.
     *
     * @param file table file
     * @return table named after the file content or the file base name
     * @throws IOException if the file cannot be read
     * @throws DataSetException if the table cannot be built
     * @throws ToonParseException if a TOON file is malformed
     */
    ITable parseTable(File file) throws IOException, DataSetException, ToonParseException;

    /**
     * Reads every file of this format in the directory, in file name order.
     *
     * @param dir directory containing the data files
     * @return data set with one table per file
     * @throws IOException if a file cannot be read
     * @throws DataSetException if {@code dir} is not a directory or two files map to one table
     * @throws ToonParseException if a TOON file is malformed
     */
    default IDataSet parse(File dir) throws IOException, DataSetException, ToonParseException {
        File[] files =
                dir.listFiles((d, name) -> getFormat().matches(FilenameUtils.getExtension(name)));
        if (files == null) {
            throw new DataSetException("Not a readable directory: " + dir);
        }
        Arrays.sort(files);
        DefaultDataSet dataSet = new DefaultDataSet();
        for (File file : files) {
            dataSet.addTable(parseTable(file));
        }
        return dataSet;
    }
}
