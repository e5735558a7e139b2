package domain.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lexical analysis: lower-case, split on whitespace, strip surrounding punctuation,
 * classify each word against the closed vocabularies in {@link Vocabularies}.
 *
 * <p>A word that is exactly a comparison symbol (">=", "<>", ...) is kept as an
 * {@link TokenKind#OPERATOR} token instead of being stripped away as punctuation.</p>
 */
public final class Lexer {

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) return tokens;

        for (String raw : text.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            if (Vocabularies.OPERATORS.contains(raw)) {
                tokens.add(new Token(TokenKind.OPERATOR, raw));
                continue;
            }
            String word = TextUtil.stripPunctuation(raw);
            if (word.isEmpty()) continue;
            tokens.add(new Token(classify(word), word));
        }
        return tokens;
    }

    public static TokenKind classify(String word) {
        if (Vocabularies.ACTIONS.contains(word)) return TokenKind.ACTION;
        if (Vocabularies.QUANTIFIERS.contains(word)) return TokenKind.QUANTIFIER;
        if (Vocabularies.CONNECTORS.contains(word)) return TokenKind.CONNECTOR;
        if (Vocabularies.OPERATORS.contains(word)) return TokenKind.OPERATOR;
        if (Vocabularies.ENTITY_INDICATORS.contains(word)) return TokenKind.ENTITY_INDICATOR;
        if (Vocabularies.ATTRIBUTE_INDICATORS.contains(word)) return TokenKind.ATTRIBUTE_INDICATOR;
        return TokenKind.WORD;
    }
}
