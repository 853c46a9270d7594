package figura.lang;

import static figura.lang.Token.Type.ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import figura.lang.Shape.Point;

public class PointRegistryTest {

    PointRegistry registry = new PointRegistry();

    private static Token id(String name, int offset) {
        return new Token(ID, name, offset, 1, offset + 1);
    }

    @Test
    void defineReturnsReplaced() {
        var first = new Point("A", 0, 0);
        var second = new Point("A", 1, 1);
        assertNull(registry.define(first));
        assertEquals(first, registry.define(second));
        assertEquals(1, registry.size());
        assertEquals(List.of(second), registry.resolve(List.of(id("A", 0))));
    }

    @Test
    void resolveKeepsOrder() {
        var a = new Point("A", 0, 0);
        var b = new Point("B", 1, 0);
        registry.define(a);
        registry.define(b);
        assertEquals(List.of(b, a, b), registry.resolve(List.of(id("B", 0), id("A", 2), id("B", 4))));
    }

    @Test
    void missingNamesOnceEachAtFirstUse() {
        registry.define(new Point("A", 0, 0));
        var ex = assertThrows(UndefinedReferenceException.class,
            () -> registry.resolve(List.of(id("A", 0), id("C", 2), id("B", 4), id("C", 6))));
        assertEquals(List.of("C", "B"), ex.getNames());
        assertEquals(2, ex.getToken().offset());
    }
}
