package figura.lang;

import lombok.NonNull;

public record Token(
    @NonNull Type type,
    @NonNull String lexeme,
    int offset,
    int line,
    int column) {

    @Override
    public String toString() {
        return "(Token " + type + " \"" + lexeme + "\" " + line + ":" + column + ")";
    }

    public enum Type {
        // keywords, in tie-break priority order
        PLACE,
        POINT,
        BUILD,
        RECTANGLE,
        TRIANGLE,
        CONNECT,
        LINE,

        ID,
        LPAREN,
        RPAREN,
        COMMA,
        NUMBER,
        DOT,

        // end-of-file
        EOF;
    }
}
