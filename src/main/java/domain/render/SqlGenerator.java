package domain.render;

import domain.lexer.DateLiterals;
import domain.model.TranslationWarning;
import domain.model.TranslationWarningSink;
import domain.model.WarningCode;
import domain.query.Condition;
import domain.query.StructuredQuery;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link StructuredQuery} as a SELECT statement.
 *
 * <pre>
 * SELECT a, b | *  FROM entity  [WHERE c1 AND c2 ...]
 * </pre>
 *
 * Literal rules:
 * <ul>
 *   <li>fecha + "21 de julio de 2025" => fecha = DATE('2025-07-21') (original text kept if it cannot be reparsed)</li>
 *   <li>non-negative integer or decimal with one dot => unquoted</li>
 *   <li>anything else => single-quoted</li>
 * </ul>
 *
 * <p>Without an entity there is no statement to build: {@link #MISSING_ENTITY} is returned
 * as the "SQL" text instead of throwing.</p>
 */
public final class SqlGenerator {

    public static final String MISSING_ENTITY = "-- No se puede generar consulta SQL: entidad desconocida.";

    private static final String DATE_ATTRIBUTE = "fecha";

    public String generate(StructuredQuery query) {
        return generate(query, TranslationWarningSink.none());
    }

    public String generate(StructuredQuery query, TranslationWarningSink warningSink) {
        TranslationWarningSink sink = warningSink == null ? TranslationWarningSink.none() : warningSink;

        if (query == null || !query.hasEntity()) {
            sink.warn(TranslationWarning.of(WarningCode.ENTITY_MISSING, "", "no table recognized in query"));
            return MISSING_ENTITY;
        }

        String fields = query.getAttributesToShow().isEmpty()
                ? "*"
                : String.join(", ", query.getAttributesToShow());

        StringBuilder sql = new StringBuilder("SELECT ").append(fields).append(" FROM ").append(query.getEntity());

        List<String> predicates = new ArrayList<>(query.getConditions().size());
        for (Condition c : query.getConditions()) {
            predicates.add(renderCondition(c, sink));
        }
        if (!predicates.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", predicates));
        }
        return sql.toString();
    }

    static String renderCondition(Condition c, TranslationWarningSink sink) {
        String head = c.getAttribute() + " " + c.getOperator().symbol() + " ";
        String value = c.getValue();

        if (DATE_ATTRIBUTE.equals(c.getAttribute()) && DateLiterals.startsWithLongSpanishDate(value)) {
            String iso = SpanishDates.toIso(value);
            if (iso == null) {
                sink.warn(new TranslationWarning(WarningCode.DATE_REPARSE_FAILED, value,
                        "date kept as spoken", "expected: <d> de <mes> de <yyyy>"));
            } else {
                value = iso;
            }
            return head + "DATE(" + quote(value) + ")";
        }

        if (isNumeric(value)) return head + value;
        return head + quote(value);
    }

    /** Digits with at most one dot ("30", "2.5", "3.", ".5"); no sign. */
    static boolean isNumeric(String value) {
        if (value == null) return false;
        String s = value.replaceFirst("\\.", "");
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch < '0' || ch > '9') return false;
        }
        return true;
    }

    static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
