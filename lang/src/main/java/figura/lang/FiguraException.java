package figura.lang;

import lombok.Getter;

/**
 * Base class of every error that aborts a parse. The message is suffixed with the
 * line and column of the token where the fault was detected.
 */
public abstract class FiguraException extends RuntimeException {

    @Getter
    private final Token token;

    FiguraException(Token token, String message) {
        super(message + " [line " + token.line() + ", col " + token.column() + "]");
        this.token = token;
    }
}
