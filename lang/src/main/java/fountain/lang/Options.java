package fountain.lang;

import java.util.Properties;
import java.util.function.Consumer;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Settings of a {@link Fountain} instance.
 */
@Getter
@Builder(toBuilder = true)
public final class Options {

    public static final int DEFAULT_MAX_CALL_DEPTH = 512;

    static final String MAX_CALL_DEPTH_PROPERTY = "fountain.maxCallDepth";
    static final String PRINT_TOKENS_PROPERTY = "fountain.printTokens";
    static final String PRINT_AST_PROPERTY = "fountain.printAst";

    /** Nested calls allowed before a {@link ResourceError}. */
    @Builder.Default
    private final int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

    /** Log every scanned token at INFO. */
    @Builder.Default
    private final boolean printTokens = false;

    /** Log the parsed program at INFO. */
    @Builder.Default
    private final boolean printAst = false;

    /** Receives one rendered line per {@code print} statement. */
    @Builder.Default
    private final @NonNull Consumer<String> output = System.out::println;

    public static Options defaults() {
        return builder().build();
    }

    /**
     * Reads {@code fountain.maxCallDepth}, {@code fountain.printTokens} and
     * {@code fountain.printAst} from the system properties.
     */
    public static Options fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    static Options fromProperties(Properties properties) {
        var builder = builder();
        var maxCallDepth = properties.getProperty(MAX_CALL_DEPTH_PROPERTY);
        if (maxCallDepth != null) {
            try {
                builder.maxCallDepth(Integer.parseInt(maxCallDepth.trim()));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                    MAX_CALL_DEPTH_PROPERTY + " must be an integer, got '" + maxCallDepth + "'", ex);
            }
        }
        var printTokens = properties.getProperty(PRINT_TOKENS_PROPERTY);
        if (printTokens != null) {
            builder.printTokens(Boolean.parseBoolean(printTokens.trim()));
        }
        var printAst = properties.getProperty(PRINT_AST_PROPERTY);
        if (printAst != null) {
            builder.printAst(Boolean.parseBoolean(printAst.trim()));
        }
        return builder.build();
    }
}
