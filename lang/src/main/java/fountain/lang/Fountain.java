package fountain.lang;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;

/**
 * Entry point for hosts embedding the fountain language.
 *
 * <p>An instance owns one global environment that persists across
 * {@link #run} calls, so a REPL can feed it one input at a time. Instances are
 * not thread-safe; a host running programs from several threads must
 * serialize access.
 *
 * <pre>{@code
 * var fountain = new Fountain(Options.builder().output(lines::add).build())
 *     .define(Builtin.of("clock", args -> Value.of(System.nanoTime() / 1e9)));
 * fountain.run("main.ftn", source);
 * }</pre>
 */
public final class Fountain {

    private static final Logger log = LoggerFactory.getLogger(Fountain.class);

    public static final String DEFAULT_SOURCE_NAME = "<string>";

    static final String NESTING_LIMIT_MESSAGE = "program is nested too deeply";

    @Getter
    private final Options options;
    private final Interpreter interpreter;

    public Fountain() {
        this(Options.defaults());
    }

    public Fountain(@NonNull Options options) {
        this.options = options;
        this.interpreter = new Interpreter(options);
    }

    /**
     * Binds a host function in the global environment under its own name.
     */
    public Fountain define(@NonNull Builtin builtin) {
        return define(builtin.name(), builtin);
    }

    /**
     * Binds any value in the global environment.
     */
    public Fountain define(@NonNull String name, @NonNull Value value) {
        log.debug("Defining global {} as {}", name, value.typeName());
        interpreter.getGlobals().define(name, value);
        return this;
    }

    /**
     * @return the global binding of {@code name}, if any
     */
    public Optional<Value> lookup(@NonNull String name) {
        return interpreter.getGlobals().lookup(name);
    }

    public Value run(@NonNull String source) {
        return run(DEFAULT_SOURCE_NAME, source);
    }

    /**
     * Lexes, parses, checks and executes a program.
     *
     * @param sourceName name used in error positions, e.g. a file path
     * @return the value of the last top-level expression statement, or {@code nil}
     * @throws FountainException the first error; nothing runs after a lex or parse error
     */
    public Value run(@NonNull String sourceName, @NonNull String source) {
        log.debug("Running {}", sourceName);
        try {
            var statements = parseAndCheck(source);
            var result = interpreter.interpret(statements);
            log.debug("Finished {} ({} statements)", sourceName, statements.size());
            return result;
        } catch (FountainException ex) {
            ex.withSourceName(sourceName);
            log.debug("Run of {} failed: {}", sourceName, ex.describe());
            throw ex;
        }
    }

    private List<Stmt> parseAndCheck(String source) {
        try {
            var statements = parse(source);
            new ControlFlowChecker().check(statements);
            return statements;
        } catch (StackOverflowError ex) {
            throw new ResourceError(NESTING_LIMIT_MESSAGE);
        }
    }

    List<Stmt> parse(String source) {
        var tokens = new TokenStream(new Scanner(source));
        try {
            var statements = new Parser(tokens).parse();
            if (options.isPrintAst()) {
                log.info("ast:\n{}", AstPrinter.print(statements));
            }
            return statements;
        } finally {
            if (options.isPrintTokens()) {
                tokens.scannedTokens().forEach(token -> log.info("token {}", token));
            }
        }
    }
}
