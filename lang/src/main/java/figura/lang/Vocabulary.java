package figura.lang;

import static figura.lang.Token.Type.*;
import static java.util.Map.entry;

import java.util.Map;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * The inflected keyword forms recognized by the {@link Scanner}.
 * Matching is case-sensitive and whole-word only.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Vocabulary {

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("Поставити", PLACE),
        entry("Поставлено", PLACE),
        entry("Поставте", PLACE),

        entry("точку", POINT),
        entry("точка", POINT),
        entry("точкою", POINT),
        entry("точки", POINT),

        entry("Побудувати", BUILD),
        entry("Побудуйте", BUILD),
        entry("Побудова", BUILD),

        entry("прямокутник", RECTANGLE),
        entry("прямокутника", RECTANGLE),
        entry("прямокутнику", RECTANGLE),
        entry("прямокутником", RECTANGLE),
        entry("прямокутники", RECTANGLE),

        entry("трикутник", TRIANGLE),
        entry("трикутника", TRIANGLE),
        entry("трикутнику", TRIANGLE),
        entry("трикутником", TRIANGLE),
        entry("трикутники", TRIANGLE),

        entry("Провести", CONNECT),
        entry("Проведено", CONNECT),

        entry("відрізок", LINE),
        entry("відрізка", LINE),
        entry("відрізку", LINE),
        entry("відрізком", LINE),
        entry("відрізки", LINE));

    public static Optional<Token.Type> keyword(String word) {
        return Optional.ofNullable(keywords.get(word));
    }
}
