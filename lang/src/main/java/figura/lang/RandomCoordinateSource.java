package figura.lang;

import java.util.Random;

import lombok.Getter;
import lombok.NonNull;

/**
 * Draws coordinates uniformly from {@code [-range, range)}.
 */
public final class RandomCoordinateSource implements CoordinateSource {

    @Getter
    private final double range;
    private final Random random;

    public RandomCoordinateSource(double range, @NonNull Random random) {
        if (!(range > 0) || Double.isInfinite(range)) {
            throw new IllegalArgumentException("Range must be positive and finite: " + range);
        }
        this.range = range;
        this.random = random;
    }

    public RandomCoordinateSource(double range) {
        this(range, new Random());
    }

    public static RandomCoordinateSource seeded(double range, long seed) {
        return new RandomCoordinateSource(range, new Random(seed));
    }

    @Override
    public double next() {
        return range * (2 * random.nextDouble() - 1);
    }
}
