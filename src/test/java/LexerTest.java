import org.junit.jupiter.api.Test;

import com.coinscript.error.ErrorKind;
import com.coinscript.error.LexError;
import com.coinscript.script.parser.Lexer;
import com.coinscript.script.parser.Token;
import com.coinscript.script.parser.TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void keywordsTypesAndIdentifiers() {
        List<Token> tokens = new Lexer("coin Vault { storage address owner = 0xAB; }").tokenize();

        assertEquals(TokenType.COIN, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("Vault", tokens.get(1).lexeme);
        assertEquals(TokenType.STORAGE, tokens.get(3).type);
        assertEquals(TokenType.TYPE, tokens.get(4).type);
        assertEquals(TokenType.HEX, tokens.get(7).type);
        assertEquals("0xab", tokens.get(7).literal);
        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type);
    }

    @Test
    void multiCharacterOperators() {
        assertEquals(List.of(
                TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.LESS_LESS, TokenType.GREATER_GREATER, TokenType.AMP_AMP, TokenType.PIPE_PIPE,
                TokenType.PLUS_EQUAL, TokenType.MINUS_EQUAL, TokenType.ARROW, TokenType.FAT_ARROW,
                TokenType.GREATER_S, TokenType.EOF),
                types("== != <= >= << >> && || += -= -> => >s"));
    }

    @Test
    void greaterThenIdentifier_isNotSignedCompare() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.GREATER, TokenType.IDENTIFIER, TokenType.EOF),
                types("a >sum"));
    }

    @Test
    void numbers_allowUnderscoreSeparators() {
        List<Token> tokens = new Lexer("1_000_000 42").tokenize();

        assertEquals(new BigInteger("1000000"), tokens.get(0).literal);
        assertEquals(BigInteger.valueOf(42), tokens.get(1).literal);
    }

    @Test
    void strings_handleEscapesAndBothQuotes() {
        List<Token> tokens = new Lexer("\"a\\n\\\"b\" 'it\\'s'").tokenize();

        assertEquals("a\n\"b", tokens.get(0).literal);
        assertEquals("it's", tokens.get(1).literal);
    }

    @Test
    void comments_areSkippedAndLinesCounted() {
        List<Token> tokens = new Lexer("// line\n/* block\n comment */ coin").tokenize();

        assertEquals(TokenType.COIN, tokens.get(0).type);
        assertEquals(3, tokens.get(0).line);
        assertEquals(13, tokens.get(0).column);
    }

    @Test
    void unexpectedCharacter_reportsPosition() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("coin X {\n  # }").tokenize());

        assertEquals(ErrorKind.LEX, e.getKind());
        assertEquals('#', e.getOffendingChar());
        assertEquals(2, e.getPosition().line);
        assertEquals(3, e.getPosition().column);
    }

    @Test
    void malformedLiterals_fail() {
        assertThrows(LexError.class, () -> new Lexer("\"open").tokenize());
        assertThrows(LexError.class, () -> new Lexer("12abc").tokenize());
        assertThrows(LexError.class, () -> new Lexer("0xfg").tokenize());
        assertThrows(LexError.class, () -> new Lexer("\"\\q\"").tokenize());
        assertThrows(LexError.class, () -> new Lexer("/* never closed").tokenize());
    }
}
