package domain.render;

import domain.query.Condition;
import domain.query.StructuredQuery;

import java.util.ArrayList;
import java.util.List;

/** Spanish reading of the conditions ("edad mayor 30 y nombre igual lucia"). Explanatory only. */
public final class SemanticRenderer {

    public String render(StructuredQuery query) {
        if (query == null) return "";
        List<String> parts = new ArrayList<>(query.getConditions().size());
        for (Condition c : query.getConditions()) {
            parts.add(c.getAttribute() + " " + c.getOperator().spanish() + " " + c.getValue());
        }
        return String.join(" y ", parts);
    }
}
