package domain.parse;

import domain.lexer.Token;
import domain.lexer.TokenKind;
import domain.normalize.OperatorNormalizer;
import domain.query.ComparisonOperator;
import domain.query.Condition;

import java.util.List;
import java.util.Set;

/**
 * Reads {@code attribute [copula] operator value} starting at a given token.
 *
 * <p>The operator is tried as a symbol token, then as a four-word, two-word and one-word
 * phrase, each passed through {@link OperatorNormalizer}. Longer phrases win.</p>
 */
final class ConditionPhrase {

    static final Set<String> COPULAS = Set.of("es", "sea", "son", "sean");

    private static final int[] PHRASE_LENGTHS = {4, 2, 1};

    private ConditionPhrase() {
    }

    /** @return the parsed condition, or null when no valid operator/value follows the attribute */
    static Read read(List<Token> tokens, int attributeIndex) {
        int n = tokens.size();
        if (attributeIndex < 0 || attributeIndex + 2 >= n) return null;

        String attribute = tokens.get(attributeIndex).getValue();
        int k = attributeIndex + 1;
        if (COPULAS.contains(tokens.get(k).getValue()) && k + 2 < n) k++;

        Token first = tokens.get(k);
        if (first.is(TokenKind.OPERATOR)) {
            ComparisonOperator op = ComparisonOperator.fromSymbol(first.getValue());
            if (op != null && k + 1 < n) {
                return new Read(new Condition(attribute, op, tokens.get(k + 1).getValue()), k + 2);
            }
            return null;
        }

        for (int len : PHRASE_LENGTHS) {
            int valueIndex = k + len;
            if (valueIndex >= n) continue;

            ComparisonOperator op = ComparisonOperator.fromSymbol(OperatorNormalizer.normalize(join(tokens, k, len)));
            if (op != null) {
                return new Read(new Condition(attribute, op, tokens.get(valueIndex).getValue()), valueIndex + 1);
            }
        }
        return null;
    }

    static String join(List<Token> tokens, int from, int count) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < from + count && i < tokens.size(); i++) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(tokens.get(i).getValue());
        }
        return sb.toString();
    }

    /** Parsed condition plus the index of the first token after its value. */
    record Read(Condition condition, int next) {}
}
