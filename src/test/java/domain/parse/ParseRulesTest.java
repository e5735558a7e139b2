package domain.parse;

import domain.lexer.Lexer;
import domain.lexer.Token;
import domain.query.Condition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParseRulesTest {

    private final Lexer lexer = new Lexer();

    @Test
    void spelledDate_should_consume_up_to_the_year() {
        List<Token> tokens = lexer.tokenize("en 21 de julio de 2025 y algo");

        RuleMatch m = new ParseRules.SpelledDateRule().apply(tokens, 2, new ParseState());

        assertNotNull(m);
        assertEquals(4, m.getConsumed());
        assertEquals(List.of(QueryEdit.condition(Condition.eq("fecha", "21 de julio de 2025"))), m.getEdits());
    }

    @Test
    void spelledDate_should_need_en_two_tokens_back() {
        List<Token> tokens = lexer.tokenize("el 21 de julio de 2025");
        assertNull(new ParseRules.SpelledDateRule().apply(tokens, 2, new ParseState()));
    }

    @Test
    void knownName_should_be_ignored_once_entity_is_set() {
        List<Token> tokens = lexer.tokenize("ventas");
        ParseState state = new ParseState();
        state.apply(QueryEdit.entity("clientes"));

        assertNull(new ParseRules.KnownNameRule().apply(tokens, 0, state));
        assertNotNull(new ParseRules.KnownNameRule().apply(tokens, 0, new ParseState()));
    }

    @Test
    void withClause_should_need_four_following_tokens() {
        assertNull(new ParseRules.WithClauseRule().apply(lexer.tokenize("con precio > 5"), 0, new ParseState()));

        RuleMatch m = new ParseRules.WithClauseRule().apply(lexer.tokenize("con precio igual a 5"), 0, new ParseState());
        assertNotNull(m);
        assertEquals(5, m.getConsumed());
    }

    @Test
    void whereClause_should_skip_ahead_even_without_conditions() {
        List<Token> tokens = lexer.tokenize("que se realizaron ayer por la tarde");

        RuleMatch m = new ParseRules.WhereClauseRule().apply(tokens, 0, new ParseState());

        assertNotNull(m);
        assertTrue(m.getEdits().isEmpty());
        assertEquals(tokens.size() - 2, m.getConsumed());
    }

    @Test
    void ruleMatch_should_reject_non_positive_consumption() {
        assertThrows(IllegalArgumentException.class, () -> RuleMatch.of(0));
    }
}
