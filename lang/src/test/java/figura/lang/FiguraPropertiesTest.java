package figura.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class FiguraPropertiesTest {

    @Test
    void defaults() {
        var properties = new FiguraProperties();
        assertEquals(FiguraProperties.DEFAULT_FALLBACK_RANGE, properties.fallbackRange());
        assertEquals(true, properties.warnOnRedefinition());
        assertEquals(properties, FiguraProperties.from(new Properties()));
    }

    @Test
    void fromProperties() {
        var raw = new Properties();
        raw.setProperty(FiguraProperties.FALLBACK_RANGE, " 2.5 ");
        raw.setProperty(FiguraProperties.WARN_ON_REDEFINITION, "false");
        assertEquals(new FiguraProperties(2.5, false), FiguraProperties.from(raw));
    }

    @Test
    void loadFromClasspath() {
        assertEquals(new FiguraProperties(5, false), FiguraProperties.load());
    }

    @Test
    void rejectsBadRange() {
        assertThrows(IllegalArgumentException.class, () -> new FiguraProperties(0, true));
        assertThrows(IllegalArgumentException.class, () -> new FiguraProperties(-1, true));
        assertThrows(IllegalArgumentException.class, () -> new FiguraProperties(Double.NaN, true));
        assertThrows(IllegalArgumentException.class, () -> new FiguraProperties(Double.POSITIVE_INFINITY, true));

        var raw = new Properties();
        raw.setProperty(FiguraProperties.FALLBACK_RANGE, "ten");
        assertThrows(IllegalArgumentException.class, () -> FiguraProperties.from(raw));
    }
}
