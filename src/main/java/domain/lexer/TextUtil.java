package domain.lexer;

/** Small text helpers shared by the lexer and the vocabulary loader. */
public final class TextUtil {

    // ASCII punctuation plus the Spanish opening marks
    private static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~¿¡";

    private TextUtil() {
    }

    public static boolean isPunctuation(char c) {
        return PUNCTUATION.indexOf(c) >= 0;
    }

    /** Removes leading and trailing punctuation characters; inner ones are kept ("21/07/2025"). */
    public static String stripPunctuation(String s) {
        if (s == null) return "";
        int start = 0;
        int end = s.length();
        while (start < end && isPunctuation(s.charAt(start))) start++;
        while (end > start && isPunctuation(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    public static String stripTrailing(String s, char c) {
        if (s == null) return "";
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == c) end--;
        return s.substring(0, end);
    }
}
