package app;

import cli.CliPathResolver;
import domain.correct.AutoSuggestRevisionResolver;
import domain.correct.Corrector;
import domain.correct.RevisionResolver;
import domain.correct.ScriptedRevisionResolver;
import domain.correct.SimilarityMatcher;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import domain.pipeline.Nl2SqlTranslator;
import domain.text.QueryTextProvider;
import domain.vocabulary.SchemaVocabularySource;
import infra.console.ConsoleRevisionResolver;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;
import infra.schema.CsvSchemaLoader;
import infra.schema.TextSchemaLoader;
import infra.schema.XlsxSchemaLoader;
import infra.text.ArgumentQueryTextProvider;
import infra.text.FileQueryTextProvider;

import java.nio.file.Path;
import java.util.List;

/**
 * Object-assembly factory for {@link Nl2SqlCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class Nl2SqlComponentsFactory {

    SchemaVocabularySource createSchemaSource(Path schemaPath) {
        return switch (CliPathResolver.extensionOf(schemaPath)) {
            case "csv" -> new CsvSchemaLoader();
            case "xlsx" -> new XlsxSchemaLoader();
            default -> new TextSchemaLoader();
        };
    }

    QueryTextProvider createQueryTextProvider(String queryArg, Path inputPath) {
        if (queryArg != null) return new ArgumentQueryTextProvider(queryArg);
        return new FileQueryTextProvider(inputPath);
    }

    Nl2SqlTranslator createTranslator() {
        return new Nl2SqlTranslator();
    }

    /**
     * Priority: scripted choices (non-null, possibly empty), then auto-suggest, then interactive console.
     */
    RevisionResolver createRevisionResolver(List<Integer> choices, boolean autoSuggest) {
        if (choices != null) return new ScriptedRevisionResolver(choices);
        if (autoSuggest) return new AutoSuggestRevisionResolver();
        return new ConsoleRevisionResolver();
    }

    Corrector createCorrector(RevisionResolver resolver, Nl2SqlTranslator translator) {
        return new Corrector(resolver, translator.getSqlGenerator(), new SimilarityMatcher());
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    ResultWriter createResultWriter(boolean enable) {
        if (!enable) return new NullResultWriter();
        return new XlsxResultWriter();
    }
}
