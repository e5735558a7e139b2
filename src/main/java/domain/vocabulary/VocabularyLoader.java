package domain.vocabulary;

import domain.lexer.TextUtil;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the schema vocabulary {@link Trie} from free-form lines.
 *
 * <p>Each line is split on whitespace and on '#', tokens are stripped of surrounding
 * punctuation, lower-cased, and generic type keywords ("int", "string", ...) are dropped.</p>
 *
 * <p>I/O lives in the infra loaders; this class only sees text.</p>
 */
public final class VocabularyLoader {

    private static final Pattern SPLIT = Pattern.compile("\\s+|#");

    /** Generic type names that show up in schema descriptions but are never identifiers. */
    static final Set<String> TYPE_KEYWORDS = Set.of(
            "int", "integer", "float", "double", "string", "char", "boolean",
            "bool", "void", "long", "short", "byte", "decimal", "date", "time",
            "datetime", "array", "list", "dict", "dictionary", "set", "tuple",
            "object", "class"
    );

    private VocabularyLoader() {
    }

    public static Trie load(Iterable<String> lines) {
        Trie trie = new Trie();
        if (lines == null) return trie;

        for (String line : lines) {
            addLine(trie, line);
        }
        return trie;
    }

    public static Trie load(String text) {
        if (text == null) return new Trie();
        return load(List.of(text.split("\\R")));
    }

    static void addLine(Trie trie, String line) {
        if (line == null || line.isBlank()) return;

        for (String raw : SPLIT.split(line.toLowerCase(Locale.ROOT))) {
            String word = TextUtil.stripPunctuation(raw).strip();
            if (word.isEmpty() || TYPE_KEYWORDS.contains(word)) continue;
            trie.insert(word);
        }
    }
}
