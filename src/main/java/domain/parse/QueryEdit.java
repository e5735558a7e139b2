package domain.parse;

import domain.query.Condition;

import java.util.Objects;

/** One change a parse rule wants applied to the query under construction. */
public final class QueryEdit {

    public enum Type {
        SET_ACTION,
        SET_ENTITY,
        ADD_SHOWN_ATTRIBUTE,
        ADD_CONDITION
    }

    private final Type type;
    private final String text;
    private final Condition condition;

    private QueryEdit(Type type, String text, Condition condition) {
        this.type = type;
        this.text = text;
        this.condition = condition;
    }

    public static QueryEdit action(String action) {
        return new QueryEdit(Type.SET_ACTION, Objects.requireNonNull(action), null);
    }

    public static QueryEdit entity(String entity) {
        return new QueryEdit(Type.SET_ENTITY, Objects.requireNonNull(entity), null);
    }

    public static QueryEdit shownAttribute(String attribute) {
        return new QueryEdit(Type.ADD_SHOWN_ATTRIBUTE, Objects.requireNonNull(attribute), null);
    }

    public static QueryEdit condition(Condition condition) {
        return new QueryEdit(Type.ADD_CONDITION, null, Objects.requireNonNull(condition));
    }

    public Type getType() {
        return type;
    }

    /** Action, entity or attribute text; null for {@link Type#ADD_CONDITION}. */
    public String getText() {
        return text;
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QueryEdit that)) return false;
        return type == that.type && Objects.equals(text, that.text) && Objects.equals(condition, that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, condition);
    }

    @Override
    public String toString() {
        return type + "(" + (condition != null ? condition : text) + ")";
    }
}
