package fountain.lang;

import static fountain.lang.Token.Type.EOF;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.NonNull;

/**
 * Parser-side view of the tokens of a program.
 *
 * <p>Tokens are pulled from the {@link Scanner} only when the parser looks at
 * them, and kept so that {@link #mark()} and {@link #reset(int)} can rewind.
 */
public final class TokenStream {

    private final Scanner scanner;
    private final List<Token> tokens = new ArrayList<>();

    private int current = 0;
    private Token previous = null;

    TokenStream(@NonNull Scanner scanner) {
        this.scanner = scanner;
    }

    Token previous() {
        return previous != null ? previous : peek();
    }

    boolean isAtEnd() {
        return peek().type() == EOF;
    }

    Token peek() {
        return peekFrom(current);
    }

    Token peekNext() {
        if (isAtEnd()) {
            return peek();
        }
        return peekFrom(current + 1);
    }

    Token advance() {
        previous = peek();
        if (!isAtEnd()) {
            current++;
        }
        return previous;
    }

    int mark() {
        return current;
    }

    void reset(int mark) {
        current = mark;
        previous = mark > 0 ? tokens.get(mark - 1) : null;
    }

    /**
     * @return the tokens scanned so far, in source order
     */
    List<Token> scannedTokens() {
        return Collections.unmodifiableList(tokens);
    }

    private Token peekFrom(int index) {
        while (index >= tokens.size()) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == EOF) {
                return tokens.get(tokens.size() - 1);
            }
            tokens.add(scanner.nextToken());
        }
        return tokens.get(index);
    }
}
