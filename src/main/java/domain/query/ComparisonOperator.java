package domain.query;

/** Canonical comparison operators, with their SQL symbol and Spanish reading. */
public enum ComparisonOperator {

    EQ("=", "igual"),
    GT(">", "mayor"),
    LT("<", "menor"),
    GE(">=", "mayor o igual"),
    LE("<=", "menor o igual"),
    NE("!=", "diferente"),
    NE_ANSI("<>", "diferente");

    private final String symbol;
    private final String spanish;

    ComparisonOperator(String symbol, String spanish) {
        this.symbol = symbol;
        this.spanish = spanish;
    }

    public String symbol() {
        return symbol;
    }

    public String spanish() {
        return spanish;
    }

    /** @return the operator for {@code symbol}, or null when it is not a valid symbol */
    public static ComparisonOperator fromSymbol(String symbol) {
        if (symbol == null) return null;
        String s = symbol.trim();
        for (ComparisonOperator op : values()) {
            if (op.symbol.equals(s)) return op;
        }
        return null;
    }
}
