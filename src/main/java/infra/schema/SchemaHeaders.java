package infra.schema;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Header-row detection shared by the tabular (CSV/XLSX) schema loaders. */
final class SchemaHeaders {

    private static final Set<String> HEADER_NAMES = Set.of(
            "table", "tables", "table_name", "tablename", "table_id",
            "column", "columns", "column_name", "columnname", "column_id",
            "type", "data_type", "datatype", "description", "comment",
            "tabla", "tablas", "columna", "columnas", "campo", "campos",
            "tipo", "descripcion", "descripción", "comentario"
    );

    private SchemaHeaders() {
    }

    /** True when every non-blank cell is a known header name ("tabla,columna,tipo"). */
    static boolean isHeader(List<String> cells) {
        boolean any = false;
        for (String c : cells) {
            String k = c == null ? "" : stripBom(c).trim().toLowerCase(Locale.ROOT);
            if (k.isEmpty()) continue;
            if (!HEADER_NAMES.contains(k)) return false;
            any = true;
        }
        return any;
    }

    static String stripBom(String s) {
        if (s == null || s.isEmpty()) return s;
        if (s.charAt(0) == '\uFEFF') return s.substring(1);
        return s;
    }
}
