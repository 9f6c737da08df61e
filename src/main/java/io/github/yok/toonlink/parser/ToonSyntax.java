package io.github.yok.toonlink.parser;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * Lexical constants of the TOON notation, shared by the parser and the serializer.
 *
 * <pre>
 * &#64;employees
 * name|department|salary
 * ---
 * Alice|Engineering|95000.0
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
public final class ToonSyntax {

    /** Marker that starts the optional table-name line. */
    public static final char TABLE_NAME_MARKER = '@';

    /** Delimiter between fields of the header and data lines. */
    public static final char FIELD_DELIMITER = '|';

    /** Token written on the line between the header and the data rows. */
    public static final String SEPARATOR = "---";

    /** Line break written by the serializer. */
    public static final String LINE_BREAK = "\n";

    /** File extension of TOON documents, without the dot. */
    public static final String FILE_EXTENSION = "toon";

    /** Lower-case spellings read as null, besides the empty field. */
    public static final Set<String> NULL_KEYWORDS = ImmutableSet.of("null", "none", "na", "nan");

    public static final String TRUE_KEYWORD = "true";

    public static final String FALSE_KEYWORD = "false";

    // Empty fields are kept; "a||b" has three fields
    static final Splitter FIELD_SPLITTER = Splitter.on(FIELD_DELIMITER).trimResults();

    // A lone CR is field content, not a line break
    static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

    public static final Joiner FIELD_JOINER = Joiner.on(FIELD_DELIMITER);

    public static final Joiner LINE_JOINER = Joiner.on(LINE_BREAK);

    private ToonSyntax() {
        // Constants holder; do not instantiate.
    }
}
