package io.github.yok.toonlink.io;

import com.google.common.base.Preconditions;
import io.github.yok.toonlink.model.Document;
import io.github.yok.toonlink.parser.ToonParseException;
import io.github.yok.toonlink.parser.ToonParser;
import io.github.yok.toonlink.parser.ToonSyntax;
import io.github.yok.toonlink.serializer.ToonSerializer;
import io.github.yok.toonlink.util.LogPathUtil;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;

/**
 * Reads and writes TOON documents from files, readers and writers, always as UTF-8.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ToonFiles {

    private final ToonParser parser;

    private final ToonSerializer serializer;

    /**
     * Creates an instance using a lenient parser.
     */
    public ToonFiles() {
        this(new ToonParser(), new ToonSerializer());
    }

    /**
     * Creates an instance with the given parser and serializer.
     *
     * @param parser TOON parser
     * @param serializer TOON serializer
     */
    public ToonFiles(ToonParser parser, ToonSerializer serializer) {
        this.parser = Preconditions.checkNotNull(parser, "parser must not be null");
        this.serializer = Preconditions.checkNotNull(serializer, "serializer must not be null");
    }

    /**
     * Returns whether the path has the {@code .toon} extension (case-insensitive).
     *
     * @param path file path
     * @return {@code true} for a TOON file name
     */
    public static boolean isToonFile(Path path) {
        return FilenameUtils.getExtension(path.getFileName().toString())
                .equalsIgnoreCase(ToonSyntax.FILE_EXTENSION);
    }

    /**
     * Reads a TOON file.
     *
     * @param path source file
     * @return parsed document
     * @throws IOException if the file cannot be read
     * @throws ToonParseException if the content is not a TOON table
     */
    public Document read(Path path) throws IOException, ToonParseException {
        String content = FileUtils.readFileToString(path.toFile(), StandardCharsets.UTF_8);
        Document doc = parser.parse(content);
        log.info("Read TOON file: {} (columns={}, rows={})", LogPathUtil.renderPathForLog(path),
                doc.getColumnCount(), doc.getRowCount());
        return doc;
    }

    /**
     * Reads TOON text from a reader. The reader is consumed but not closed.
     *
     * @param reader source
     * @return parsed document
     * @throws IOException if reading fails
     * @throws ToonParseException if the content is not a TOON table
     */
    public Document read(Reader reader) throws IOException, ToonParseException {
        return parser.parse(IOUtils.toString(reader));
    }

    /**
     * Writes a document to a file, creating parent directories as needed.
     *
     * @param doc document to write
     * @param path target file (created or overwritten)
     * @throws IOException if the file cannot be written
     */
    public void write(Document doc, Path path) throws IOException {
        FileUtils.writeStringToFile(path.toFile(), serializer.serialize(doc),
                StandardCharsets.UTF_8);
        log.info("Wrote TOON file: {} (columns={}, rows={})", LogPathUtil.renderPathForLog(path),
                doc.getColumnCount(), doc.getRowCount());
    }

    /**
     * Writes a document to a writer. The writer is flushed but not closed.
     *
     * @param doc document to write
     * @param writer target
     * @throws IOException if writing fails
     */
    public void write(Document doc, Writer writer) throws IOException {
        writer.write(serializer.serialize(doc));
        writer.flush();
    }

    /**
     * Serializes a document to a string.
     *
     * @param doc document
     * @return TOON text
     */
    public String writeToString(Document doc) {
        return serializer.serialize(doc);
    }
}
