package figura.lang;

import static figura.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Single pass, maximal munch scanner. Keywords are only recognized as whole words,
 * so a capital letter that is part of a longer word is never split off as an
 * {@link Token.Type#ID} unless the word itself is not a keyword. Characters that do
 * not start any token are skipped.
 */
@Slf4j
@RequiredArgsConstructor
public final class Scanner {

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    public List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return Collections.unmodifiableList(tokens);
        }

        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        start = current; // report the correct EOF column
        tokens.add(new Token(EOF, "", current, line, getColumn()));
        log.debug("Scanned {} tokens from {} characters", tokens.size() - 1, source.length());
        return Collections.unmodifiableList(tokens);
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        var c = advance();
        if (isWordChar(c) && isWordStart() && keyword()) {
            return;
        }

        switch (c) {
        case '(':
            addToken(LPAREN);
            break;
        case ')':
            addToken(RPAREN);
            break;
        case ',':
            addToken(COMMA);
            break;
        case '.':
            addToken(DOT);
            break;
        case '-':
            if (isDigit(peek())) {
                number();
            }
            break;

        case '\n':
            line++;
            lineStart = current;
            break;

        default:
            if (isDigit(c)) {
                number();
            } else if (isIdentifier(c)) {
                addToken(ID);
            }
            // anything else is not part of the vocabulary
        }
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isIdentifier(char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isWordStart() {
        return start == 0 || !isWordChar(source.charAt(start - 1));
    }

    /**
     * Reads the whole word starting at {@code start}. Emits a keyword token if the
     * word is one of the vocabulary forms, otherwise rewinds to just after the first
     * character so it can be scanned on its own.
     */
    private boolean keyword() {
        while (isWordChar(peek())) {
            advance();
        }
        var type = Vocabulary.keyword(source.substring(start, current));
        if (type.isPresent()) {
            addToken(type.get());
            return true;
        }
        current = start + 1;
        return false;
    }

    private void number() {
        while (isDigit(peek())) {
            advance();
        }

        // is decimal?
        if (peek() == '.' && isDigit(peekNext())) {
            // consume the decimal
            advance();

            while (isDigit(peek())) {
                advance();
            }
        }
        addToken(NUMBER);
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private void addToken(Token.Type type) {
        var text = source.substring(start, current);
        tokens.add(new Token(type, text, start, line, getColumn()));
    }
}
