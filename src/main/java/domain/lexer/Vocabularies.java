package domain.lexer;

import java.util.Set;

/**
 * Closed Spanish word lists used for token classification.
 *
 * <p>Membership is exact and evaluated after lower-casing and punctuation stripping.</p>
 */
public final class Vocabularies {

    private Vocabularies() {
    }

    public static final Set<String> ACTIONS = Set.of(
            "muéstrame", "muestrame", "mostrar", "muestra", "dame", "dámelos", "dámelas",
            "enséñame", "ensename", "quiero", "consultar", "consulta", "ver", "visualizar",
            "verifica", "explora", "lista", "listar", "recupera", "recuperar", "busca",
            "buscar", "obtén", "obtener", "extrae", "extraer", "filtra", "filtrar",
            "accede", "acceder", "selecciona", "seleccionar", "deseo", "necesito"
    );

    public static final Set<String> QUANTIFIERS = Set.of(
            "todos", "todas", "los", "las", "algunos", "algunas", "ninguno", "ninguna",
            "cada", "varios", "cualquier", "cualquiera", "muchos", "muchas", "pocos", "pocas",
            "uno", "una", "el", "la", "este", "esta", "estos", "estas"
    );

    public static final Set<String> CONNECTORS = Set.of(
            "que", "donde", "cuyo", "cuyos", "cual", "cuales", "si", "cuando", "mientras",
            "aunque", "y", "o"
    );

    public static final Set<String> OPERATORS = Set.of("=", ">", "<", ">=", "<=", "!=", "<>");

    public static final Set<String> ENTITY_INDICATORS = Set.of(
            "tabla", "tablas", "base", "bases", "entidad", "entidades"
    );

    public static final Set<String> ATTRIBUTE_INDICATORS = Set.of(
            "columna", "columnas", "campo", "campos", "atributo", "atributos"
    );
}
