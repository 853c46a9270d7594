package figura.lang;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import figura.lang.Shape.Point;
import lombok.NonNull;

/**
 * Shapes produced by one parse, in the order of the statements that declared them,
 * and the warnings raised while parsing.
 */
public record Scene(@NonNull List<Shape> shapes, @NonNull List<Warning> warnings) {

    public Scene {
        shapes = List.copyOf(shapes);
        warnings = List.copyOf(warnings);
    }

    public Scene(List<Shape> shapes) {
        this(shapes, List.of());
    }

    public int size() {
        return shapes.size();
    }

    public boolean isEmpty() {
        return shapes.isEmpty();
    }

    /** Applies the visitor to every shape, in order. */
    public <R> List<R> accept(Shape.Visitor<R> visitor) {
        var results = new ArrayList<R>(shapes.size());
        for (var shape : shapes) {
            results.add(shape.accept(visitor));
        }
        return results;
    }

    /** Every point declaration, including redeclarations of the same name. */
    public List<Point> points() {
        var points = new ArrayList<Point>();
        for (var shape : shapes) {
            if (shape instanceof Point point) {
                points.add(point);
            }
        }
        return points;
    }

    /** The last declaration of the named point. */
    public Optional<Point> find(String name) {
        Point found = null;
        for (var point : points()) {
            if (point.name().equals(name)) {
                found = point;
            }
        }
        return Optional.ofNullable(found);
    }
}
