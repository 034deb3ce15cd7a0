package fountain.lang;

import lombok.Getter;

/**
 * Base of every error the language core reports to its host.
 *
 * <p>Positions are 1-based; a line of 0 means the position is unknown.
 */
@Getter
public abstract class FountainException extends RuntimeException {

    private final int line;
    private final int column;
    private String sourceName;

    protected FountainException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    protected FountainException(String message, Token token) {
        this(message, token.line(), token.column());
    }

    /**
     * Short name of the error kind, as shown in {@link #describe()}.
     */
    public String getKind() {
        return getClass().getSimpleName();
    }

    FountainException withSourceName(String sourceName) {
        if (this.sourceName == null) {
            this.sourceName = sourceName;
        }
        return this;
    }

    /**
     * Renders the error as {@code source:line:column: Kind: message}.
     */
    public String describe() {
        var where = new StringBuilder();
        if (sourceName != null) {
            where.append(sourceName).append(':');
        }
        if (line > 0) {
            where.append(line).append(':').append(column).append(':');
        }
        if (where.length() > 0) {
            where.append(' ');
        }
        return where + getKind() + ": " + getMessage();
    }
}
