package domain.normalize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps Spanish comparison phrases ("mayor o igual que") to operator symbols (">=").
 *
 * <p>Substitution is literal, word-bounded and case-insensitive, applied in definition order.
 * Longer phrases come first so a shorter phrase ("mayor que", "igual") never re-matches
 * text that an enclosing phrase already replaced. Unknown phrases pass through unchanged.</p>
 */
public final class OperatorNormalizer {

    private static final Map<String, String> PHRASES = new LinkedHashMap<>();

    static {
        PHRASES.put("mayor o igual que", ">=");
        PHRASES.put("menor o igual que", "<=");
        PHRASES.put("mayor o igual a", ">=");
        PHRASES.put("menor o igual a", "<=");
        PHRASES.put("mayor que", ">");
        PHRASES.put("menor que", "<");
        PHRASES.put("mayor a", ">");
        PHRASES.put("menor a", "<");
        PHRASES.put("igual a", "=");
        PHRASES.put("igual", "=");
        PHRASES.put("no es", "!=");
        PHRASES.put("diferente de", "!=");
        PHRASES.put("distinto de", "!=");
    }

    private static final Map<Pattern, String> COMPILED = new LinkedHashMap<>();

    static {
        for (Map.Entry<String, String> e : PHRASES.entrySet()) {
            Pattern p = Pattern.compile("\\b" + Pattern.quote(e.getKey()) + "\\b",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            COMPILED.put(p, Matcher.quoteReplacement(e.getValue()));
        }
    }

    private OperatorNormalizer() {
    }

    public static String normalize(String phrase) {
        if (phrase == null) return "";
        String text = phrase.toLowerCase(Locale.ROOT);
        for (Map.Entry<Pattern, String> e : COMPILED.entrySet()) {
            text = e.getKey().matcher(text).replaceAll(e.getValue());
        }
        return text;
    }

    /** Phrases in substitution order (read-only view). */
    public static Map<String, String> phrases() {
        return Collections.unmodifiableMap(PHRASES);
    }
}
