package domain.pipeline;

import domain.lexer.Lexer;
import domain.lexer.Token;
import domain.model.TranslationWarningSink;
import domain.parse.Parser;
import domain.query.StructuredQuery;
import domain.render.NaturalLanguageRenderer;
import domain.render.SemanticRenderer;
import domain.render.SqlGenerator;

import java.util.List;

/**
 * Spanish question => SQL, without vocabulary checks.
 *
 * <pre>
 * text -> tokens -> structured query -> condition reading -> NL query -> SQL
 * </pre>
 * Each stage is echoed to stdout.
 */
public final class Nl2SqlTranslator {

    private final Lexer lexer;
    private final Parser parser;
    private final SemanticRenderer semanticRenderer;
    private final NaturalLanguageRenderer naturalLanguageRenderer;
    private final SqlGenerator sqlGenerator;

    public Nl2SqlTranslator() {
        this(new Lexer(), new Parser(), new SemanticRenderer(), new NaturalLanguageRenderer(), new SqlGenerator());
    }

    public Nl2SqlTranslator(Lexer lexer, Parser parser, SemanticRenderer semanticRenderer,
                            NaturalLanguageRenderer naturalLanguageRenderer, SqlGenerator sqlGenerator) {
        this.lexer = lexer;
        this.parser = parser;
        this.semanticRenderer = semanticRenderer;
        this.naturalLanguageRenderer = naturalLanguageRenderer;
        this.sqlGenerator = sqlGenerator;
    }

    public Translation translate(String text) {
        return translate(text, TranslationWarningSink.none());
    }

    public Translation translate(String text, TranslationWarningSink warningSink) {
        String input = text == null ? "" : text;
        System.out.println("[LEX] input      = " + input);

        List<Token> tokens = lexer.tokenize(input);
        System.out.println("[LEX] tokens     = " + tokens);

        StructuredQuery query = parser.parse(tokens);
        System.out.println("[PARSE] query    = " + query);

        String conditionsText = semanticRenderer.render(query);
        System.out.println("[SEM] conditions = " + conditionsText);

        String nl = naturalLanguageRenderer.render(query, conditionsText);
        System.out.println("[SEM] nl query   = " + nl);

        String sql = sqlGenerator.generate(query, warningSink);
        System.out.println("[SQL] generated  = " + sql);

        return new Translation(input, tokens, query, conditionsText, nl, sql);
    }

    public SqlGenerator getSqlGenerator() {
        return sqlGenerator;
    }
}
