package io.github.yok.toonlink.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds settings for CSV/TOON conversion.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code convert.output-dir}: Directory for converted files. If blank, files are written next
 * to their input.</li>
 * <li>{@code convert.table-name-from-file}: Whether a CSV converted without an explicit table name
 * is named after its file base name.</li>
 * <li>{@code convert.csv-delimiter}: CSV field delimiter.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "convert")
@Getter
@Setter
@NoArgsConstructor
public class ConvertConfig {

    /**
     * Output directory for converted files; blank means the input file's directory.
     */
    private String outputDir;

    /**
     * Name CSV-derived TOON tables after the CSV base name when no name is given.
     */
    private boolean tableNameFromFile = true;

    /**
     * CSV field delimiter.
     */
    private char csvDelimiter = ',';

    /**
     * Resolves the default output path for a converted file.
     *
     * <p>
     * The output keeps the input base name and takes the target extension, e.g.
     * {@code data/employees.csv} becomes {@code data/employees.toon}.
     * </p>
     *
     * @param input input file
     * @param extension target extension without the dot
     * @return output path
     */
    public Path resolveOutput(Path input, String extension) {
        String fileName = FilenameUtils.getBaseName(input.getFileName().toString()) + "."
                + extension;
        if (StringUtils.isNotBlank(outputDir)) {
            return Paths.get(outputDir).resolve(fileName);
        }
        Path parent = input.toAbsolutePath().getParent();
        return parent == null ? Paths.get(fileName) : parent.resolve(fileName);
    }
}
