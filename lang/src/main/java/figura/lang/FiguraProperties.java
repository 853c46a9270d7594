package figura.lang;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;

/**
 * Tunables of the parser.
 *
 * @param fallbackRange half-width of the square that random coordinates are drawn from
 * @param warnOnRedefinition whether placing an already placed point is reported
 */
public record FiguraProperties(
    double fallbackRange,
    boolean warnOnRedefinition) {

    private static final Logger log = LoggerFactory.getLogger(FiguraProperties.class);

    public static final String RESOURCE = "figura.properties";
    public static final String FALLBACK_RANGE = "figura.fallback.range";
    public static final String WARN_ON_REDEFINITION = "figura.warn-on-redefinition";

    public static final double DEFAULT_FALLBACK_RANGE = 10.0;

    public FiguraProperties {
        if (!(fallbackRange > 0) || Double.isInfinite(fallbackRange)) {
            throw new IllegalArgumentException(FALLBACK_RANGE + " must be positive and finite: " + fallbackRange);
        }
    }

    public FiguraProperties() {
        this(DEFAULT_FALLBACK_RANGE, true);
    }

    /**
     * Reads {@value #RESOURCE} from the classpath, falling back to the defaults when
     * it is absent.
     */
    public static FiguraProperties load() {
        var stream = FiguraProperties.class.getClassLoader().getResourceAsStream(RESOURCE);
        if (stream == null) {
            log.debug("No {} on classpath, using defaults", RESOURCE);
            return new FiguraProperties();
        }
        try (var reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            var properties = new Properties();
            properties.load(reader);
            return from(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, ex);
        }
    }

    public static FiguraProperties from(@NonNull Properties properties) {
        var defaults = new FiguraProperties();
        var range = properties.getProperty(FALLBACK_RANGE);
        var warn = properties.getProperty(WARN_ON_REDEFINITION);
        try {
            return new FiguraProperties(
                range != null ? Double.parseDouble(range.trim()) : defaults.fallbackRange(),
                warn != null ? Boolean.parseBoolean(warn.trim()) : defaults.warnOnRedefinition());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(FALLBACK_RANGE + " is not a number: " + range, ex);
        }
    }
}
