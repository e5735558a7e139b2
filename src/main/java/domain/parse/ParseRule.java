package domain.parse;

import domain.lexer.Token;

import java.util.List;

/**
 * One phrasing pattern of the parser.
 *
 * <p>A rule inspects the tokens around {@code index} (lookahead and lookbehind) and the
 * fields already recorded in {@code state}, but never mutates anything: it returns the
 * edits it wants, or null when it does not match.</p>
 */
public interface ParseRule {

    RuleMatch apply(List<Token> tokens, int index, ParseState state);

    default String name() {
        return getClass().getSimpleName();
    }
}
