package domain.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Intermediate representation between parsing and SQL rendering.
 *
 * <p>Immutable: the corrector derives a new instance per applied revision
 * ({@link #withEntity}, {@link #withAttributeToShow}, {@link #withConditionAttribute}).
 * Conditions keep encounter order and are never merged, even for the same attribute.</p>
 */
public final class StructuredQuery {

    private final String action;
    private final String entity;
    private final List<String> attributesToShow;
    private final List<Condition> conditions;

    public StructuredQuery(String action, String entity, List<String> attributesToShow, List<Condition> conditions) {
        this.action = action;
        this.entity = entity;
        this.attributesToShow = attributesToShow == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(attributesToShow));
        this.conditions = conditions == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public static StructuredQuery empty() {
        return new StructuredQuery(null, null, List.of(), List.of());
    }

    /** Action verb as spoken ("muéstrame"), or null. */
    public String getAction() {
        return action;
    }

    /** Table name, or null when none was recognized. */
    public String getEntity() {
        return entity;
    }

    public boolean hasEntity() {
        return entity != null && !entity.isEmpty();
    }

    public List<String> getAttributesToShow() {
        return attributesToShow;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public StructuredQuery withEntity(String newEntity) {
        return new StructuredQuery(action, newEntity, attributesToShow, conditions);
    }

    public StructuredQuery withAttributeToShow(int index, String newAttribute) {
        List<String> attrs = new ArrayList<>(attributesToShow);
        attrs.set(index, newAttribute);
        return new StructuredQuery(action, entity, attrs, conditions);
    }

    public StructuredQuery withConditionAttribute(int index, String newAttribute) {
        List<Condition> conds = new ArrayList<>(conditions);
        conds.set(index, conds.get(index).withAttribute(newAttribute));
        return new StructuredQuery(action, entity, attributesToShow, conds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuredQuery that)) return false;
        return Objects.equals(action, that.action)
                && Objects.equals(entity, that.entity)
                && attributesToShow.equals(that.attributesToShow)
                && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(action, entity, attributesToShow, conditions);
    }

    @Override
    public String toString() {
        return "StructuredQuery{" +
                "action='" + action + '\'' +
                ", entity='" + entity + '\'' +
                ", attributesToShow=" + attributesToShow +
                ", conditions=" + conditions +
                '}';
    }
}
