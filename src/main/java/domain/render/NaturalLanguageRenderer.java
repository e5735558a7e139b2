package domain.render;

import domain.query.StructuredQuery;

/** Pseudo-query in Spanish: "selecciona * de clientes donde edad mayor 30." */
public final class NaturalLanguageRenderer {

    public static final String MISSING_ENTITY = "-- No se puede generar consulta en LN: entidad desconocida.";

    public String render(StructuredQuery query, String conditionsText) {
        if (query == null || !query.hasEntity()) return MISSING_ENTITY;

        StringBuilder sb = new StringBuilder("selecciona * de ").append(query.getEntity());
        if (conditionsText != null && !conditionsText.isEmpty()) {
            sb.append(" donde ").append(conditionsText);
        }
        return sb.append('.').toString();
    }
}
