package io.github.yok.toonlink;

import io.github.yok.toonlink.config.ConvertConfig;
import io.github.yok.toonlink.config.ParserConfig;
import io.github.yok.toonlink.core.ToonConverter;
import io.github.yok.toonlink.util.ErrorHandler;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Parses the command-line options and invokes {@link ToonConverter}.
 * </p>
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --to-toon <csv>} or {@code -T <csv>} converts a CSV file into TOON.</li>
 * <li>{@code --to-csv <toon>} or {@code -C <toon>} converts a TOON file into CSV.</li>
 * <li>{@code --inspect <toon>} or {@code -i <toon>} parses a TOON file and logs its shape.</li>
 * <li>{@code --output <path>} or {@code -o <path>} sets the output file. If omitted, the
 * {@code convert.output-dir} setting in {@code application.yml} or the input directory is
 * used.</li>
 * <li>{@code --name <table>} or {@code -n <table>} sets the table name written by
 * {@code --to-toon}.</li>
 * </ul>
 *
 * <p>
 * Spring Boot loads {@link ParserConfig} and {@link ConvertConfig} and passes them to
 * {@link ToonConverter}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see ParserConfig
 * @see ConvertConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ParserConfig.class, ConvertConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final ParserConfig parserConfig;
    private final ConvertConfig convertConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String mode = null;
        String input = null;
        String output = null;
        String tableName = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--to-toon":
                case "-T":
                    mode = "to-toon";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--to-csv":
                case "-C":
                    mode = "to-csv";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--inspect":
                case "-i":
                    mode = "inspect";
                    input = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--output":
                case "-o":
                    output = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--name":
                case "-n":
                    tableName = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (mode == null) {
            ErrorHandler.errorAndExit(
                    "One of --to-toon, --to-csv or --inspect is required.");
            return;
        }
        if (input == null || input.isEmpty()) {
            ErrorHandler.errorAndExit("Input file is required for --" + mode + ".");
            return;
        }

        Path inputPath = Paths.get(input);
        Path outputPath = output == null ? null : Paths.get(output);
        log.info("Mode: {}, Input: {}, Output: {}, Arity policy: {}", mode, inputPath,
                outputPath, parserConfig.getArityPolicy());

        ToonConverter converter = new ToonConverter(convertConfig, parserConfig);
        try {
            switch (mode) {
                case "to-toon":
                    Path toon = converter.csvToToon(inputPath, tableName, outputPath);
                    log.info("Conversion completed. Output [{}]", toon);
                    break;
                case "to-csv":
                    Path csv = converter.toonToCsv(inputPath, outputPath);
                    log.info("Conversion completed. Output [{}]", csv);
                    break;
                default:
                    converter.inspect(inputPath);
                    break;
            }
        } catch (Exception e) {
            log.error("Fatal error occurred (mode={}): {}", mode, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
