package figura.lang;

import java.util.List;

import lombok.Getter;

/** The vertices of a triangle lie on one line. */
@Getter
public class DegenerateGeometryException extends FiguraException {

    private final List<String> names;

    DegenerateGeometryException(Token token, List<String> names) {
        super(token, "Points are collinear: " + String.join(", ", names));
        this.names = List.copyOf(names);
    }
}
