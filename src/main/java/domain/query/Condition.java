package domain.query;

import java.util.Objects;

/** One WHERE predicate: attribute, operator, literal value (raw text as spoken). */
public final class Condition {

    private final String attribute;
    private final ComparisonOperator operator;
    private final String value;

    public Condition(String attribute, ComparisonOperator operator, String value) {
        this.attribute = Objects.requireNonNull(attribute, "attribute");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Condition eq(String attribute, String value) {
        return new Condition(attribute, ComparisonOperator.EQ, value);
    }

    public String getAttribute() {
        return attribute;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public Condition withAttribute(String newAttribute) {
        return new Condition(newAttribute, operator, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition that)) return false;
        return attribute.equals(that.attribute) && operator == that.operator && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, operator, value);
    }

    @Override
    public String toString() {
        return "{" + attribute + " " + operator.symbol() + " " + value + "}";
    }
}
