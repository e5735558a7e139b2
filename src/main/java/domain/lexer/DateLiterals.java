package domain.lexer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizer for the accepted date shapes.
 * <ul>
 *   <li>2025-07-21</li>
 *   <li>21/07/2025</li>
 *   <li>21-07-2025</li>
 *   <li>21 de julio de 2025</li>
 * </ul>
 * Each shape must match the whole text.
 */
public final class DateLiterals {

    public static final Pattern LONG_SPANISH = Pattern.compile("\\d{1,2} de [a-z]+ de \\d{4}");

    private static final List<Pattern> SHAPES = List.of(
            Pattern.compile("\\d{4}-\\d{2}-\\d{2}"),
            Pattern.compile("\\d{2}/\\d{2}/\\d{4}"),
            Pattern.compile("\\d{2}-\\d{2}-\\d{4}"),
            LONG_SPANISH
    );

    private DateLiterals() {
    }

    public static boolean isDate(String text) {
        if (text == null || text.isEmpty()) return false;
        String t = text.toLowerCase(Locale.ROOT);
        for (Pattern p : SHAPES) {
            if (p.matcher(t).matches()) return true;
        }
        return false;
    }

    /** Prefix match against the long Spanish shape ("21 de julio de 2025"). */
    public static boolean startsWithLongSpanishDate(String text) {
        return text != null && LONG_SPANISH.matcher(text).lookingAt();
    }
}
