package figura.lang;

import java.util.List;

import lombok.Getter;

/** One or more points used by a statement were not placed before it. */
@Getter
public class UndefinedReferenceException extends FiguraException {

    private final List<String> names;

    UndefinedReferenceException(Token token, List<String> names) {
        super(token, "Points are not defined: " + String.join(", ", names));
        this.names = List.copyOf(names);
    }
}
