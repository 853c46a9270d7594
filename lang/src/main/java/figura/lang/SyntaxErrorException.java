package figura.lang;

import lombok.Getter;

@Getter
public class SyntaxErrorException extends FiguraException {

    private final Token.Type expected;
    private final Token.Type actual;
    private final int position;

    SyntaxErrorException(Token.Type expected, Token actual, int position) {
        super(actual, "Expected " + expected + ", got " + actual.type() + " at position " + position);
        this.expected = expected;
        this.actual = actual.type();
        this.position = position;
    }
}
