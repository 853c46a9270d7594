package figura.lang;

import static figura.lang.Token.Type.EOF;
import static figura.lang.Token.Type.ID;
import static figura.lang.Token.Type.NUMBER;
import static figura.lang.Token.Type.POINT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenStreamTest {

    TokenStream stream;

    boolean expectAtEnd;

    private void assertNextToken(Token expect) {
        assertEquals(expectAtEnd, stream.isAtEnd());
        assertEquals(expect, stream.peek());
        assertEquals(expect, stream.advance());
        assertEquals(expect, stream.previous());
    }

    @BeforeEach
    void setUp() {
        var source = "точку A\n42";
        var scanner = new Scanner(source);
        stream = new TokenStream(scanner.getTokens());
        expectAtEnd = false;
    }

    @Test
    void visible() {
        assertNextToken(new Token(POINT, "точку", 0, 1, 1));
        assertNextToken(new Token(ID, "A", 6, 1, 7));
        assertNextToken(new Token(NUMBER, "42", 8, 2, 1));
        expectAtEnd = true;
        assertNextToken(new Token(EOF, "", 10, 2, 3));
    }

    @Test
    void staysAtEnd() {
        stream.advance();
        stream.advance();
        stream.advance();
        assertEquals(3, stream.position());
        assertEquals(EOF, stream.advance().type());
        assertEquals(EOF, stream.peekNext().type());
        assertEquals(3, stream.position());
    }

    @Test
    void peekNext() {
        assertEquals(POINT, stream.peek().type());
        assertEquals(ID, stream.peekNext().type());
        assertEquals(0, stream.position());
    }

    @Test
    void previousBeforeAdvance() {
        assertEquals(stream.peek(), stream.previous());
    }

    @Test
    void requiresEof() {
        var tokens = List.of(new Token(ID, "A", 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(tokens));
        assertThrows(IllegalArgumentException.class, () -> new TokenStream(List.of()));
    }
}
