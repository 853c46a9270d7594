package figura.lang;

import lombok.NonNull;

/**
 * A non-fatal remark about the parsed text, such as a redefined point or a point
 * placed at random coordinates.
 */
public record Warning(@NonNull Token token, @NonNull String message) {

    @Override
    public String toString() {
        return message + " [line " + token.line() + ", col " + token.column() + "]";
    }
}
