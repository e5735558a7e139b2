package domain.parse;

import domain.lexer.DateLiterals;
import domain.lexer.TextUtil;
import domain.lexer.Token;
import domain.lexer.TokenKind;
import domain.query.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The fixed catalogue of phrasing patterns, in priority order.
 *
 * <p>Order matters: at each cursor position the first rule that matches wins.
 * The unset-field guards (action/entity already recorded) are part of each rule.</p>
 */
public final class ParseRules {

    static final String DATE_ATTRIBUTE = "fecha";
    static final String DEPT_ATTRIBUTE = "dept";
    static final String NAME_ATTRIBUTE = "nombre";

    private ParseRules() {
    }

    public static List<ParseRule> defaults() {
        return List.of(
                new DateTokenRule(),
                new SpelledDateRule(),
                new ActionRule(),
                new EntityIndicatorRule(),
                new KnownNameRule(),
                new WhereClauseRule(),
                new WithClauseRule(),
                new OfPhraseRule(),
                new CalledRule(),
                new NamedRule()
        );
    }

    // ------------------------------------------------------------
    // 1) "2025-07-21", "21/07/2025", "21-07-2025"
    // ------------------------------------------------------------
    static final class DateTokenRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            String v = tokens.get(i).getValue();
            if (!DateLiterals.isDate(v)) return null;
            return RuleMatch.of(1, QueryEdit.condition(Condition.eq(DATE_ATTRIBUTE, v)));
        }
    }

    // ------------------------------------------------------------
    // 2) "en 21 de julio de 2025": fires on the first "de", window starts at the day
    // ------------------------------------------------------------
    static final class SpelledDateRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (i < 2 || !tokens.get(i).valueIs("de") || !tokens.get(i - 2).valueIs("en")) return null;

            int start = i - 1;
            for (int end = i; end < tokens.size(); end++) {
                String phrase = ConditionPhrase.join(tokens, start, end - start + 1);
                if (DateLiterals.isDate(phrase)) {
                    return RuleMatch.of(end - i + 1, QueryEdit.condition(Condition.eq(DATE_ATTRIBUTE, phrase)));
                }
            }
            return null;
        }
    }

    // ------------------------------------------------------------
    // 3) first action verb wins
    // ------------------------------------------------------------
    static final class ActionRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            Token t = tokens.get(i);
            if (!t.is(TokenKind.ACTION) || state.hasAction()) return null;
            return RuleMatch.of(1, QueryEdit.action(t.getValue()));
        }
    }

    // ------------------------------------------------------------
    // 4) "tabla ventas"
    // ------------------------------------------------------------
    static final class EntityIndicatorRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (!tokens.get(i).is(TokenKind.ENTITY_INDICATOR)) return null;
            if (i + 1 >= tokens.size() || !tokens.get(i + 1).is(TokenKind.WORD)) return null;
            return RuleMatch.of(2, QueryEdit.entity(tokens.get(i + 1).getValue()));
        }
    }

    // ------------------------------------------------------------
    // 5) bare known table/column names, only while no entity is known
    // ------------------------------------------------------------
    static final class KnownNameRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            Token t = tokens.get(i);
            if (!t.is(TokenKind.WORD) || state.hasEntity()) return null;

            if (KnownSchemaNames.TABLES.contains(t.getValue())) {
                return RuleMatch.of(1, QueryEdit.entity(t.getValue()));
            }
            if (KnownSchemaNames.COLUMNS.contains(t.getValue())) {
                return RuleMatch.of(1, QueryEdit.shownAttribute(t.getValue()));
            }
            return null;
        }
    }

    // ------------------------------------------------------------
    // 6) "donde la edad es mayor a 30", "que precio menor que 10"
    //    sliding window up to two tokens before the end; cursor jumps to where the scan stopped
    // ------------------------------------------------------------
    static final class WhereClauseRule implements ParseRule {
        private static final Set<String> TRIGGERS = Set.of("donde", "que");

        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            Token t = tokens.get(i);
            if (!t.is(TokenKind.CONNECTOR) || !TRIGGERS.contains(t.getValue())) return null;

            List<QueryEdit> edits = new ArrayList<>();
            int n = tokens.size();
            int j = i + 1;
            while (j < n - 2) {
                if (tokens.get(j).is(TokenKind.WORD)) {
                    ConditionPhrase.Read read = ConditionPhrase.read(tokens, j);
                    if (read != null) {
                        edits.add(QueryEdit.condition(read.condition()));
                        j = read.next();
                        continue;
                    }
                }
                j++;
            }
            return new RuleMatch(edits, Math.max(1, j - i));
        }
    }

    // ------------------------------------------------------------
    // 7) "con precio mayor que 100"
    // ------------------------------------------------------------
    static final class WithClauseRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (!tokens.get(i).valueIs("con") || i + 4 >= tokens.size()) return null;

            ConditionPhrase.Read read = ConditionPhrase.read(tokens, i + 1);
            if (read == null) return null;
            return RuleMatch.of(read.next() - i, QueryEdit.condition(read.condition()));
        }
    }

    // ------------------------------------------------------------
    // 8) "empleados de ventas" => entity empleados, dept = ventas
    // ------------------------------------------------------------
    static final class OfPhraseRule implements ParseRule {
        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (i < 1 || !tokens.get(i).valueIs("de")) return null;

            Token prev = tokens.get(i - 1);
            if (!prev.is(TokenKind.WORD) || KnownSchemaNames.COLUMNS.contains(prev.getValue())) return null;

            boolean hasNext = i + 1 < tokens.size();
            if (hasNext && DateLiterals.isDate(tokens.get(i + 1).getValue())) return null;

            List<QueryEdit> edits = new ArrayList<>(2);
            if (!state.hasEntity()) edits.add(QueryEdit.entity(prev.getValue()));

            if (hasNext && tokens.get(i + 1).is(TokenKind.WORD)) {
                String dept = TextUtil.stripTrailing(tokens.get(i + 1).getValue(), '.');
                edits.add(QueryEdit.condition(Condition.eq(DEPT_ATTRIBUTE, dept)));
                return new RuleMatch(edits, 2);
            }
            return edits.isEmpty() ? null : new RuleMatch(edits, 1);
        }
    }

    // ------------------------------------------------------------
    // 9) "cliente llamado Lucia"
    // ------------------------------------------------------------
    static final class CalledRule implements ParseRule {
        private static final Set<String> TRIGGERS = Set.of("llamado", "llamados", "llamada");

        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (i < 1 || !TRIGGERS.contains(tokens.get(i).getValue())) return null;
            Token prev = tokens.get(i - 1);
            if (!prev.is(TokenKind.WORD)) return null;

            List<QueryEdit> edits = new ArrayList<>(2);
            if (!state.hasEntity()) edits.add(QueryEdit.entity(prev.getValue()));
            return nameCondition(tokens, i, edits);
        }
    }

    // ------------------------------------------------------------
    // 10) "cliente que se llama Pedro"
    // ------------------------------------------------------------
    static final class NamedRule implements ParseRule {
        private static final Set<String> TRIGGERS = Set.of("llama", "llaman");

        @Override
        public RuleMatch apply(List<Token> tokens, int i, ParseState state) {
            if (i < 2 || !TRIGGERS.contains(tokens.get(i).getValue()) || !tokens.get(i - 1).valueIs("se")) {
                return null;
            }

            List<QueryEdit> edits = new ArrayList<>(2);
            if (!state.hasEntity() && i >= 3) edits.add(QueryEdit.entity(tokens.get(i - 3).getValue()));
            return nameCondition(tokens, i, edits);
        }
    }

    private static RuleMatch nameCondition(List<Token> tokens, int i, List<QueryEdit> edits) {
        if (i + 1 < tokens.size()) {
            edits.add(QueryEdit.condition(Condition.eq(NAME_ATTRIBUTE, tokens.get(i + 1).getValue())));
            return new RuleMatch(edits, 2);
        }
        return edits.isEmpty() ? null : new RuleMatch(edits, 1);
    }
}
