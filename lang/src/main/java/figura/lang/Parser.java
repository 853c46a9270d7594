package figura.lang;

import static figura.lang.Token.Type.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import figura.lang.Shape.Line;
import figura.lang.Shape.Point;
import figura.lang.Shape.Rectangle;
import figura.lang.Shape.Triangle;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recursive descent parser over a {@link TokenStream}. The first error aborts the
 * parse; a parser instance is good for a single {@link #parse()}.
 */
@Slf4j
@RequiredArgsConstructor
final class Parser {

    private final @NonNull TokenStream tokens;
    private final @NonNull CoordinateSource coordinates;
    private final @NonNull FiguraProperties properties;

    private final PointRegistry registry = new PointRegistry();

    @Getter
    private final List<Warning> warnings = new ArrayList<>();

    private boolean parsed = false;

    public Scene parse() {
        if (parsed) {
            throw new IllegalStateException("Parser has already been used");
        }
        parsed = true;
        var scene = program();
        log.debug("Parsed {} shapes, {} distinct points", scene.size(), registry.size());
        return scene;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: statement* EOF
     * </pre>
     * A stray {@code "."} between statements is skipped.
     */
    private Scene program() {
        var shapes = new ArrayList<Shape>();
        while (!isAtEnd()) {
            if (match(DOT)) {
                continue;
            }
            shapes.addAll(statement());
        }
        return new Scene(shapes, warnings);
    }

    /**
     * <pre>
     * statement   :: place | rectangle | triangle | line
     * </pre>
     */
    private List<? extends Shape> statement() {
        if (check(PLACE)) {
            return place();
        }
        if (check(CONNECT)) {
            return List.of(line());
        }
        if (check(BUILD)) {
            if (peekNext().type() == TRIANGLE) {
                return List.of(triangle());
            }
            return List.of(rectangle());
        }
        throw error(PLACE);
    }

    /**
     * <pre>
     * place       :: PLACE declaration+ DOT?
     * </pre>
     */
    private List<Point> place() {
        consume(PLACE);
        var points = new ArrayList<Point>();
        do {
            points.add(declaration());
        } while (check(POINT));
        match(DOT);
        return points;
    }

    /**
     * <pre>
     * declaration :: POINT ID DOT* ( "(" NUMBER "," NUMBER ")" )? ","?
     * </pre>
     */
    private Point declaration() {
        consume(POINT);
        var name = consume(ID);
        while (match(DOT)) {
            // "точку A. (1, 2)" still declares A at (1, 2)
        }

        BigDecimal x;
        BigDecimal y;
        if (match(LPAREN)) {
            x = number();
            consume(COMMA);
            y = number();
            consume(RPAREN);
        } else {
            x = fallback();
            y = fallback();
            log.debug("Point {} placed without coordinates, using ({}, {})", name.lexeme(), x, y);
            warning(name, "No coordinates for point " + name.lexeme()
                + ", placed at (" + x.toPlainString() + ", " + y.toPlainString() + ")");
        }
        match(COMMA);

        var point = new Point(name.lexeme(), x, y);
        var replaced = registry.define(point);
        if (replaced != null && properties.warnOnRedefinition()) {
            log.warn("Point {} redefined: {} replaces {}", name.lexeme(), point, replaced);
            warning(name, "Point " + name.lexeme() + " redefined");
        }
        return point;
    }

    /**
     * <pre>
     * rectangle   :: BUILD RECTANGLE ID ID ID ID
     * </pre>
     */
    private Rectangle rectangle() {
        consume(BUILD);
        consume(RECTANGLE);
        return new Rectangle(registry.resolve(identifiers(4)));
    }

    /**
     * <pre>
     * triangle    :: BUILD TRIANGLE ID ID ID
     * </pre>
     */
    private Triangle triangle() {
        var build = consume(BUILD);
        consume(TRIANGLE);
        var points = registry.resolve(identifiers(3));
        if (Geometry.isCollinear(points.get(0), points.get(1), points.get(2))) {
            var names = points.stream().map(Point::name).toList();
            throw new DegenerateGeometryException(build, names);
        }
        return new Triangle(points);
    }

    /**
     * <pre>
     * line        :: CONNECT LINE ID "," ID
     * </pre>
     */
    private Line line() {
        consume(CONNECT);
        consume(LINE);
        var start = consume(ID);
        consume(COMMA);
        var end = consume(ID);
        var points = registry.resolve(List.of(start, end));
        return new Line(points.get(0), points.get(1));
    }

    //// utility methods ////

    private List<Token> identifiers(int count) {
        var ids = new ArrayList<Token>(count);
        for (int i = 0; i < count; i++) {
            ids.add(consume(ID));
        }
        return ids;
    }

    private BigDecimal number() {
        return new BigDecimal(consume(NUMBER).lexeme());
    }

    private BigDecimal fallback() {
        var value = coordinates.next();
        if (!Double.isFinite(value)) {
            throw new IllegalStateException("Coordinate source produced " + value);
        }
        // exact binary value, no rounding
        return new BigDecimal(value);
    }

    private Token consume(Token.Type type) {
        if (check(type)) {
            return advance();
        }

        throw error(type);
    }

    private SyntaxErrorException error(Token.Type expected) {
        return new SyntaxErrorException(expected, peek(), tokens.position());
    }

    private void warning(Token token, String message) {
        warnings.add(new Warning(token, message));
    }

    private boolean match(Token.Type type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }
}
