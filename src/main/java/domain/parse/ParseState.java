package domain.parse;

import domain.query.Condition;
import domain.query.StructuredQuery;

import java.util.ArrayList;
import java.util.List;

/** Mutable accumulator owned by {@link Parser} while it scans one token sequence. */
public final class ParseState {

    private String action;
    private String entity;
    private final List<String> attributesToShow = new ArrayList<>();
    private final List<Condition> conditions = new ArrayList<>();

    public String getAction() {
        return action;
    }

    public String getEntity() {
        return entity;
    }

    public boolean hasAction() {
        return action != null;
    }

    public boolean hasEntity() {
        return entity != null;
    }

    void apply(QueryEdit edit) {
        switch (edit.getType()) {
            case SET_ACTION -> action = edit.getText();
            case SET_ENTITY -> entity = edit.getText();
            case ADD_SHOWN_ATTRIBUTE -> attributesToShow.add(edit.getText());
            case ADD_CONDITION -> conditions.add(edit.getCondition());
        }
    }

    StructuredQuery toQuery() {
        return new StructuredQuery(action, entity, attributesToShow, conditions);
    }
}
