package domain.lexer;

/** Lexical class of a normalized input word. */
public enum TokenKind {
    ACTION,
    QUANTIFIER,
    CONNECTOR,
    OPERATOR,
    ENTITY_INDICATOR,
    ATTRIBUTE_INDICATOR,
    WORD
}
