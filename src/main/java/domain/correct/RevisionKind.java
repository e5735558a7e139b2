package domain.correct;

/** Where an unresolved identifier sits in the structured query. */
public enum RevisionKind {
    ENTITY("entidad"),
    SHOWN_ATTRIBUTE("atributo_mostrar"),
    CONDITION_ATTRIBUTE("atributo_condicion");

    private final String label;

    RevisionKind(String label) {
        this.label = label;
    }

    /** Spanish label used in prompts and reports. */
    public String label() {
        return label;
    }
}
