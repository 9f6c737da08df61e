package io.github.yok.toonlink.config;

import io.github.yok.toonlink.parser.ArityPolicy;
import io.github.yok.toonlink.parser.ToonParser;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code toon.parser} section in {@code application.yml}.
 *
 * <p>
 * <strong>Supported policies:</strong>
 * </p>
 * <ul>
 * <li>{@link ArityPolicy#LENIENT}: rows with a field count other than the column count are kept as
 * parsed</li>
 * <li>{@link ArityPolicy#STRICT}: such rows fail the parse</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "toon.parser")
@Data
public class ParserConfig {

    /**
     * Policy applied to rows whose field count differs from the header.
     */
    private ArityPolicy arityPolicy = ArityPolicy.LENIENT;

    /**
     * Creates a parser configured by this section.
     *
     * @return new parser
     */
    public ToonParser createParser() {
        return new ToonParser(arityPolicy);
    }
}
