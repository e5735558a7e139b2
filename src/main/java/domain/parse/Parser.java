package domain.parse;

import domain.lexer.Token;
import domain.query.StructuredQuery;

import java.util.List;

/**
 * Heuristic syntactic analysis: a single left-to-right cursor over the tokens.
 *
 * <p>At every position the {@link ParseRule}s are tried in order; the first match
 * applies its edits and moves the cursor by its consumption. No match advances by one.
 * There is no backtracking.</p>
 */
public final class Parser {

    private final List<ParseRule> rules;

    public Parser() {
        this(ParseRules.defaults());
    }

    public Parser(List<ParseRule> rules) {
        if (rules == null || rules.isEmpty()) throw new IllegalArgumentException("rules is empty");
        this.rules = List.copyOf(rules);
    }

    public StructuredQuery parse(List<Token> tokens) {
        ParseState state = new ParseState();
        if (tokens == null) return state.toQuery();

        int i = 0;
        while (i < tokens.size()) {
            RuleMatch match = firstMatch(tokens, i, state);
            if (match == null) {
                i++;
                continue;
            }
            for (QueryEdit e : match.getEdits()) {
                state.apply(e);
            }
            i += match.getConsumed();
        }
        return state.toQuery();
    }

    private RuleMatch firstMatch(List<Token> tokens, int i, ParseState state) {
        for (ParseRule rule : rules) {
            RuleMatch m = rule.apply(tokens, i, state);
            if (m != null) return m;
        }
        return null;
    }
}
