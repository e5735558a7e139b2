package domain.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private final Lexer lexer = new Lexer();

    @Test
    void should_classify_words_against_closed_vocabularies() {
        List<Token> tokens = lexer.tokenize("¿Muéstrame los clientes, donde edad >= 30?");

        assertEquals(List.of(
                new Token(TokenKind.ACTION, "muéstrame"),
                new Token(TokenKind.QUANTIFIER, "los"),
                new Token(TokenKind.WORD, "clientes"),
                new Token(TokenKind.CONNECTOR, "donde"),
                new Token(TokenKind.WORD, "edad"),
                new Token(TokenKind.OPERATOR, ">="),
                new Token(TokenKind.WORD, "30")
        ), tokens);
    }

    @Test
    void should_recognize_indicator_words() {
        assertEquals(TokenKind.ENTITY_INDICATOR, Lexer.classify("tabla"));
        assertEquals(TokenKind.ATTRIBUTE_INDICATOR, Lexer.classify("campo"));
        assertEquals(TokenKind.WORD, Lexer.classify("tablas_temp"));
    }

    @Test
    void should_drop_punctuation_only_words_and_keep_inner_punctuation() {
        List<Token> tokens = lexer.tokenize("ventas ... del 21/07/2025.");

        assertEquals(3, tokens.size());
        assertEquals("ventas", tokens.get(0).getValue());
        assertEquals("del", tokens.get(1).getValue());
        assertEquals(Token.word("21/07/2025"), tokens.get(2));
    }

    @Test
    void should_return_no_tokens_for_blank_text() {
        assertTrue(lexer.tokenize("   ").isEmpty());
        assertTrue(lexer.tokenize(null).isEmpty());
    }
}
