package domain.lexer;

import java.util.Objects;

/** (kind, literal) pair produced by {@link Lexer}. */
public final class Token {

    private final TokenKind kind;
    private final String value;

    public Token(TokenKind kind, String value) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.value = Objects.requireNonNull(value, "value");
    }

    public static Token word(String value) {
        return new Token(TokenKind.WORD, value);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public boolean is(TokenKind k) {
        return kind == k;
    }

    public boolean valueIs(String v) {
        return value.equals(v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token that)) return false;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return "(" + kind + ", " + value + ")";
    }
}
