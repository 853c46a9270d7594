package figura.lang;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point: scans and parses construction sentences into a {@link Scene}.
 *
 * <pre>
 * var scene = Figura.create().parse("Поставити точку A (1,1). Поставити точку B (3,1).");
 * </pre>
 *
 * Instances are immutable; every call uses its own scanner, registry and parser.
 */
@Slf4j
@Getter
public final class Figura {

    private final FiguraProperties properties;
    private final CoordinateSource coordinateSource;

    /**
     * @param properties defaults to {@link FiguraProperties#FiguraProperties()}
     * @param coordinateSource defaults to a {@link RandomCoordinateSource} over the
     *        configured fallback range
     */
    @Builder
    private Figura(FiguraProperties properties, CoordinateSource coordinateSource) {
        this.properties = properties != null ? properties : new FiguraProperties();
        this.coordinateSource = coordinateSource != null
            ? coordinateSource
            : new RandomCoordinateSource(this.properties.fallbackRange());
    }

    /** Uses the properties found on the classpath. */
    public static Figura create() {
        return builder().properties(FiguraProperties.load()).build();
    }

    public List<Token> tokenize(@NonNull String source) {
        return new Scanner(source).getTokens();
    }

    /**
     * @return the scene, carrying any non-fatal {@link Scene#warnings() warnings}
     * @throws SyntaxErrorException if the token sequence does not follow the grammar
     * @throws UndefinedReferenceException if a shape uses a point not placed before it
     * @throws DegenerateGeometryException if a triangle's points are collinear
     */
    public Scene parse(@NonNull String source) {
        var parser = new Parser(new TokenStream(tokenize(source)), coordinateSource, properties);
        var scene = parser.parse();
        if (!scene.warnings().isEmpty()) {
            log.debug("Parse finished with {} warnings", scene.warnings().size());
        }
        return scene;
    }
}
