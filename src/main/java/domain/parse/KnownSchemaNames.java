package domain.parse;

import java.util.Set;

/** Small closed sets of table/column names the parser recognizes without an indicator word. */
public final class KnownSchemaNames {

    public static final Set<String> TABLES = Set.of("clientes", "productos", "ventas");

    public static final Set<String> COLUMNS = Set.of("nombre", "edad", "id", "dept", "precio", "fecha");

    private KnownSchemaNames() {
    }
}
