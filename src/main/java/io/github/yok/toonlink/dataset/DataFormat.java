package io.github.yok.toonlink.dataset;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Enumeration of table file formats that can be loaded into a DBUnit data set.
 *
 * <p>
 * Each format defines the file extensions that are recognized as belonging to it, so that callers
 * such as {@link DataLoaderFactory} do not hardcode string comparisons.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public enum DataFormat {

    // Token-Oriented Object Notation (TOON).
    TOON("toon"),

    // Comma-Separated Values format (CSV).
    CSV("csv");

    // Set of valid extensions for this format (all lowercase).
    private final Set<String> extensions;

    DataFormat(String... exts) {
        this.extensions = Arrays.stream(exts).map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Determines whether the given file extension belongs to this format.
     *
     * @param ext file extension to check (case-insensitive, without dot)
     * @return {@code true} if the extension matches this format, {@code false} otherwise
     */
    public boolean matches(String ext) {
        return extensions.contains(ext.toLowerCase(Locale.ROOT));
    }
}
