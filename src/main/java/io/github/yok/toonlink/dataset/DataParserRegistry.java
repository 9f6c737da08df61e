package io.github.yok.toonlink.dataset;

import com.google.common.base.Preconditions;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Registry of {@link DataParser}s by {@link DataFormat}.
 *
 * <p>
 * Nothing is registered implicitly: callers register parsers explicitly and keep the returned
 * {@link Registration} to remove them again. At most one parser is registered per format.
 * Registration and lookup are synchronized on the registry.
 * </p>
 *
 * <pre>
 * DataParserRegistry registry = new DataParserRegistry();
 * try (DataParserRegistry.Registration reg = registry.register(new ToonDataParser())) {
 *     ITable table = new DataLoaderFactory(registry).create(dir, "EMPLOYEES");
 * }
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DataParserRegistry {

    private final Map<DataFormat, DataParser> parsers = new EnumMap<>(DataFormat.class);

    /**
     * Creates a registry with the TOON and CSV parsers registered.
     *
     * @return populated registry
     */
    public static DataParserRegistry withDefaults() {
        DataParserRegistry registry = new DataParserRegistry();
        registry.register(new ToonDataParser());
        registry.register(new CsvDataParser());
        return registry;
    }

    /**
     * Registers a parser for its format.
     *
     * @param parser parser to register
     * @return handle that unregisters the parser when closed
     * @throws IllegalStateException if a parser is already registered for the format
     */
    public synchronized Registration register(DataParser parser) {
        Preconditions.checkNotNull(parser, "parser must not be null");
        DataFormat format = parser.getFormat();
        Preconditions.checkState(!parsers.containsKey(format),
                "A parser is already registered for format %s", format);
        parsers.put(format, parser);
        log.debug("Registered data parser. format={}, parser={}", format,
                parser.getClass().getSimpleName());
        return new Registration(format, parser);
    }

    /**
     * Returns the parser registered for a format.
     *
     * @param format data format
     * @return registered parser, if any
     */
    public synchronized Optional<DataParser> find(DataFormat format) {
        return Optional.ofNullable(parsers.get(format));
    }

    /**
     * Returns the registered formats in priority order ({@link DataFormat} declaration order).
     *
     * @return snapshot of registered formats
     */
    public synchronized Set<DataFormat> getRegisteredFormats() {
        return parsers.isEmpty() ? EnumSet.noneOf(DataFormat.class)
                : EnumSet.copyOf(parsers.keySet());
    }

    private synchronized boolean unregister(DataFormat format, DataParser parser) {
        boolean removed = parsers.remove(format, parser);
        if (removed) {
            log.debug("Unregistered data parser. format={}", format);
        }
        return removed;
    }

    /**
     * Handle of one registration. Closing it unregisters the parser; closing again has no effect.
     */
    public final class Registration implements AutoCloseable {

        private final DataFormat format;

        private final DataParser parser;

        private boolean active = true;

        private Registration(DataFormat format, DataParser parser) {
            this.format = format;
            this.parser = parser;
        }

        public DataFormat getFormat() {
            return format;
        }

        /**
         * Returns whether the parser is still registered through this handle.
         *
         * @return {@code false} once closed
         */
        public boolean isActive() {
            synchronized (DataParserRegistry.this) {
                return active;
            }
        }

        @Override
        public void close() {
            synchronized (DataParserRegistry.this) {
                if (active) {
                    unregister(format, parser);
                    active = false;
                }
            }
        }
    }
}
