package domain.correct;

import domain.model.TranslationWarning;
import domain.model.TranslationWarningSink;
import domain.model.WarningCode;
import domain.query.Condition;
import domain.query.StructuredQuery;
import domain.render.SqlGenerator;
import domain.vocabulary.Trie;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cross-checks the entity and attributes of a {@link StructuredQuery} against the schema
 * vocabulary and lets a {@link RevisionResolver} pick a replacement for each unknown one.
 *
 * <p>Patch policy per revision kind:
 * <ul>
 *   <li>entity: "FROM old" => "FROM new" in the current SQL text</li>
 *   <li>shown attribute: first whole-word occurrence replaced in the current SQL text</li>
 *   <li>condition attribute: SQL fully regenerated from the updated query</li>
 * </ul>
 * Every step derives a new query; the input query is never modified.</p>
 */
public final class Corrector {

    private final RevisionResolver resolver;
    private final SqlGenerator sqlGenerator;
    private final SimilarityMatcher matcher;

    public Corrector(RevisionResolver resolver) {
        this(resolver, new SqlGenerator(), new SimilarityMatcher());
    }

    public Corrector(RevisionResolver resolver, SqlGenerator sqlGenerator, SimilarityMatcher matcher) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    public CorrectionResult review(String sql, StructuredQuery query, Trie vocabulary, String originalText) {
        return review(sql, query, vocabulary, originalText, TranslationWarningSink.none());
    }

    public CorrectionResult review(String sql, StructuredQuery query, Trie vocabulary, String originalText,
                                   TranslationWarningSink warningSink) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(vocabulary, "vocabulary");
        TranslationWarningSink sink = warningSink == null ? TranslationWarningSink.none() : warningSink;

        List<Revision> revisions = findRevisions(query, vocabulary);
        if (revisions.isEmpty()) {
            System.out.println("[REVIEW] all tables/columns found in vocabulary.");
            return CorrectionResult.unchanged(query, sql);
        }

        System.out.println("[REVIEW] input    = '" + nullToEmpty(originalText) + "'");
        System.out.println("[REVIEW] sql      = '" + nullToEmpty(sql) + "'");
        System.out.println("[REVIEW] unknown identifiers = " + revisions.size());

        List<String> corpus = vocabulary.enumerate();
        StructuredQuery current = query;
        String currentSql = sql;
        List<AppliedCorrection> applied = new ArrayList<>(revisions.size());

        for (Revision rev : revisions) {
            sink.warn(new TranslationWarning(WarningCode.IDENTIFIER_UNKNOWN, rev.getOriginal(),
                    "not a known table/column", rev.getKind().label()));

            List<String> options = new ArrayList<>();
            options.add(rev.getOriginal());
            options.addAll(matcher.closeMatches(rev.getOriginal(), corpus));

            int choice = resolver.choose(rev, options);
            if (choice < 1 || choice > options.size()) {
                throw new IllegalArgumentException("choice out of range for '" + rev.getOriginal()
                        + "': " + choice + " (1-" + options.size() + ")");
            }
            String chosen = options.get(choice - 1);

            switch (rev.getKind()) {
                case ENTITY -> {
                    String old = current.getEntity();
                    current = current.withEntity(chosen);
                    currentSql = currentSql.replace("FROM " + old, "FROM " + chosen);
                }
                case SHOWN_ATTRIBUTE -> {
                    String old = current.getAttributesToShow().get(rev.getIndex());
                    current = current.withAttributeToShow(rev.getIndex(), chosen);
                    currentSql = replaceFirstWord(currentSql, old, chosen);
                }
                case CONDITION_ATTRIBUTE -> {
                    current = current.withConditionAttribute(rev.getIndex(), chosen);
                    currentSql = sqlGenerator.generate(current, sink);
                }
            }

            AppliedCorrection ac = new AppliedCorrection(rev, options, chosen);
            applied.add(ac);
            if (ac.isChanged()) {
                sink.warn(new TranslationWarning(WarningCode.IDENTIFIER_CORRECTED, rev.getOriginal(),
                        "replaced by '" + chosen + "'", rev.getKind().label()));
            }
            System.out.println("[REVIEW] " + rev + " => '" + chosen + "'");
        }

        System.out.println("[REVIEW] final sql = '" + currentSql + "'");
        return new CorrectionResult(current, currentSql, revisions, applied);
    }

    /** Entity, then shown attributes, then condition attributes: every one missing from the vocabulary. */
    public static List<Revision> findRevisions(StructuredQuery query, Trie vocabulary) {
        List<Revision> out = new ArrayList<>();

        if (query.hasEntity() && !vocabulary.contains(query.getEntity())) {
            out.add(Revision.entity(query.getEntity()));
        }

        List<String> attrs = query.getAttributesToShow();
        for (int i = 0; i < attrs.size(); i++) {
            if (!vocabulary.contains(attrs.get(i))) {
                out.add(new Revision(RevisionKind.SHOWN_ATTRIBUTE, attrs.get(i), i));
            }
        }

        List<Condition> conds = query.getConditions();
        for (int i = 0; i < conds.size(); i++) {
            String attr = conds.get(i).getAttribute();
            if (!attr.isEmpty() && !vocabulary.contains(attr)) {
                out.add(new Revision(RevisionKind.CONDITION_ATTRIBUTE, attr, i));
            }
        }
        return out;
    }

    static String replaceFirstWord(String text, String oldWord, String newWord) {
        if (text == null || oldWord == null || oldWord.isEmpty()) return text;
        Pattern p = Pattern.compile("\\b" + Pattern.quote(oldWord) + "\\b", Pattern.UNICODE_CHARACTER_CLASS);
        return p.matcher(text).replaceFirst(Matcher.quoteReplacement(newWord));
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
