package figura.lang;

import java.math.BigDecimal;

import figura.lang.Shape.Point;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Geometry {

    /**
     * Twice the signed area of the triangle {@code a b c}; positive when the points
     * turn counter-clockwise. Computed exactly.
     */
    public static BigDecimal signedArea(Point a, Point b, Point c) {
        return a.x().multiply(b.y().subtract(c.y()))
            .add(b.x().multiply(c.y().subtract(a.y())))
            .add(c.x().multiply(a.y().subtract(b.y())));
    }

    public static boolean isCollinear(Point a, Point b, Point c) {
        return signedArea(a, b, c).signum() == 0;
    }
}
