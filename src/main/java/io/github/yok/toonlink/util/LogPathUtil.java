package io.github.yok.toonlink.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering file paths in log messages.
 *
 * <p>
 * Paths under the working directory are rendered relative to it; other paths are rendered as
 * absolute normalized paths.
 * </p>
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.toonlink.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a path for logs.
     *
     * @param path file or directory path
     * @return path string rendered for logs
     * @throws NullPointerException if {@code path} is {@code null}
     */
    public static String renderPathForLog(Path path) {
        Preconditions.checkNotNull(path, "path must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = path.toAbsolutePath().normalize();

        if (abs.startsWith(base) && !abs.equals(base)) {
            String rel = base.relativize(abs).toString();
            log.debug("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }

        String absolute = abs.toString();
        log.debug("Rendered absolute log path. abs={}", absolute);
        return absolute;
    }
}
