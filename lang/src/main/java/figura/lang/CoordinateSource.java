package figura.lang;

/**
 * Supplies coordinates for points that are placed without an explicit position.
 */
@FunctionalInterface
public interface CoordinateSource {

    /** Next coordinate value. Called once for x, then once for y. */
    double next();
}
