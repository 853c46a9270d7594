package figura.lang;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import lombok.NonNull;

/**
 * A node of a parsed {@link Scene}. The hierarchy is closed, consumers dispatch
 * through {@link Visitor} so that a new kind of shape fails to compile until every
 * consumer handles it.
 */
public sealed interface Shape {

    <R> R accept(Visitor<R> visitor);

    /** Points in drawing order. */
    List<Point> vertices();

    /** Segments to draw, including the closing edge of polygons. */
    List<Segment> edges();

    /**
     * Coordinates are exact decimals with trailing zeros stripped, so {@code 1} and
     * {@code 1.0} make equal points.
     */
    record Point(@NonNull String name, @NonNull BigDecimal x, @NonNull BigDecimal y) implements Shape {

        public Point {
            x = x.stripTrailingZeros();
            y = y.stripTrailingZeros();
        }

        /** Takes the shortest decimal that reads back as the given double. */
        public Point(String name, double x, double y) {
            this(name, BigDecimal.valueOf(x), BigDecimal.valueOf(y));
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPointShape(this);
        }

        public List<Point> vertices() {
            return List.of(this);
        }

        public List<Segment> edges() {
            return List.of();
        }

        @Override
        public String toString() {
            return "Point(" + name + ", " + x.toPlainString() + ", " + y.toPlainString() + ")";
        }
    }

    record Rectangle(@NonNull List<Point> points) implements Shape {

        public Rectangle {
            if (points.size() != 4) {
                throw new IllegalArgumentException("Rectangle needs 4 points, got " + points.size());
            }
            points = List.copyOf(points);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRectangleShape(this);
        }

        public List<Point> vertices() {
            return points;
        }

        public List<Segment> edges() {
            return Segment.closed(points);
        }

        @Override
        public String toString() {
            return "Rectangle(" + names(points) + ")";
        }
    }

    record Triangle(@NonNull List<Point> points) implements Shape {

        public Triangle {
            if (points.size() != 3) {
                throw new IllegalArgumentException("Triangle needs 3 points, got " + points.size());
            }
            if (Geometry.isCollinear(points.get(0), points.get(1), points.get(2))) {
                throw new IllegalArgumentException("Triangle points are collinear: " + names(points));
            }
            points = List.copyOf(points);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTriangleShape(this);
        }

        public List<Point> vertices() {
            return points;
        }

        public List<Segment> edges() {
            return Segment.closed(points);
        }

        @Override
        public String toString() {
            return "Triangle(" + names(points) + ")";
        }
    }

    record Line(@NonNull Point start, @NonNull Point end) implements Shape {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLineShape(this);
        }

        public List<Point> vertices() {
            return List.of(start, end);
        }

        public List<Segment> edges() {
            return List.of(new Segment(start, end));
        }

        @Override
        public String toString() {
            return "Line(" + start.name() + ", " + end.name() + ")";
        }
    }

    record Segment(@NonNull Point from, @NonNull Point to) {

        static List<Segment> closed(List<Point> points) {
            var edges = new ArrayList<Segment>(points.size());
            for (int i = 0; i < points.size(); i++) {
                edges.add(new Segment(points.get(i), points.get((i + 1) % points.size())));
            }
            return List.copyOf(edges);
        }
    }

    interface Visitor<R> {
        R visitPointShape(Point shape);
        R visitRectangleShape(Rectangle shape);
        R visitTriangleShape(Triangle shape);
        R visitLineShape(Line shape);
    }

    private static String names(List<Point> points) {
        return String.join(" ", points.stream().map(Point::name).toList());
    }
}
