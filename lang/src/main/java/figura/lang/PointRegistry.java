package figura.lang;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import figura.lang.Shape.Point;
import lombok.NonNull;

/**
 * Points placed so far in one parse, by name. Lookups only see points defined
 * earlier in token order.
 */
final class PointRegistry {

    private final Map<String, Point> points = new HashMap<>();

    /**
     * Registers the point, replacing any earlier point of the same name.
     *
     * @return the replaced point, or {@code null}
     */
    Point define(@NonNull Point point) {
        return points.put(point.name(), point);
    }

    int size() {
        return points.size();
    }

    /**
     * Resolves every identifier of a statement.
     *
     * @throws UndefinedReferenceException naming every unknown identifier, once each,
     *         located at the first of them
     */
    List<Point> resolve(List<Token> ids) {
        var missing = new LinkedHashSet<String>();
        var resolved = new ArrayList<Point>(ids.size());
        Token first = null;
        for (var id : ids) {
            var point = points.get(id.lexeme());
            if (point == null) {
                if (first == null) {
                    first = id;
                }
                missing.add(id.lexeme());
            } else {
                resolved.add(point);
            }
        }
        if (!missing.isEmpty()) {
            throw new UndefinedReferenceException(first, new ArrayList<>(missing));
        }
        return resolved;
    }
}
