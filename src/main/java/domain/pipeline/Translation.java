package domain.pipeline;

import domain.lexer.Token;
import domain.query.StructuredQuery;

import java.util.List;

/** Every intermediate value of one pass through {@link Nl2SqlTranslator}. */
public final class Translation {

    private final String inputText;
    private final List<Token> tokens;
    private final StructuredQuery query;
    private final String conditionsText;
    private final String naturalLanguageQuery;
    private final String sql;

    public Translation(String inputText, List<Token> tokens, StructuredQuery query,
                       String conditionsText, String naturalLanguageQuery, String sql) {
        this.inputText = inputText;
        this.tokens = List.copyOf(tokens);
        this.query = query;
        this.conditionsText = conditionsText;
        this.naturalLanguageQuery = naturalLanguageQuery;
        this.sql = sql;
    }

    public String getInputText() {
        return inputText;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public StructuredQuery getQuery() {
        return query;
    }

    /** "edad mayor 30 y nombre igual lucia" */
    public String getConditionsText() {
        return conditionsText;
    }

    public String getNaturalLanguageQuery() {
        return naturalLanguageQuery;
    }

    public String getSql() {
        return sql;
    }
}
