package fountain.lang;

import static fountain.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;

/**
 * Tree-walking evaluator.
 *
 * <p>Statements report how they finished as a {@link Completion};
 * {@code for} loops consume {@code break} and {@code continue}, call frames
 * consume {@code return}. Runtime failures are thrown as
 * {@link RuntimeErrorException}s and abort the program.
 */
final class Interpreter implements Expr.Visitor<Value>, Stmt.Visitor<Completion> {

    private static final Logger log = LoggerFactory.getLogger(Interpreter.class);

    static final String RECURSION_LIMIT_MESSAGE = "maximum recursion depth exceeded";

    @Getter
    private final Environment globals = new Environment();
    private final Consumer<String> output;
    private final int maxCallDepth;

    private Environment environment = globals;
    private int callDepth = 0;

    Interpreter(@NonNull Options options) {
        if (options.getMaxCallDepth() < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive, got " + options.getMaxCallDepth());
        }
        this.output = options.getOutput();
        this.maxCallDepth = options.getMaxCallDepth();
    }

    /**
     * Runs a program in the global environment.
     *
     * @return the value of the last top-level expression statement, or {@code nil}
     */
    Value interpret(List<Stmt> statements) {
        Value last = Value.NIL;
        try {
            for (var stmt : statements) {
                if (log.isTraceEnabled()) {
                    log.trace("execute {}", SourcePrinter.print(stmt));
                }
                if (stmt instanceof Stmt.Expression expression) {
                    last = evaluate(expression.expression());
                    continue;
                }
                var completion = execute(stmt);
                if (!completion.isNormal()) {
                    throw escaped(completion);
                }
            }
        } catch (StackOverflowError ex) {
            environment = globals;
            callDepth = 0;
            throw new ResourceError(RECURSION_LIMIT_MESSAGE);
        }
        return last;
    }

    private Completion execute(Stmt stmt) {
        return stmt.accept(this);
    }

    private Value evaluate(Expr expr) {
        return expr.accept(this);
    }

    private Completion executeAll(List<Stmt> statements) {
        for (var stmt : statements) {
            var completion = execute(stmt);
            if (!completion.isNormal()) {
                return completion;
            }
        }
        return Completion.NORMAL;
    }

    Completion executeBlock(List<Stmt> statements, Environment scope) {
        var previous = this.environment;
        try {
            this.environment = scope;
            return executeAll(statements);
        } finally {
            this.environment = previous;
        }
    }

    //// statements ////

    @Override
    public Completion visitAssertStmt(Stmt.Assert stmt) {
        if (Values.isTruthy(evaluate(stmt.condition()))) {
            return Completion.NORMAL;
        }
        var payload = stmt.message() != null
            ? evaluate(stmt.message())
            : Value.of(FailedAssertionError.DEFAULT_MESSAGE);
        throw new FailedAssertionError(stmt.keyword(), payload);
    }

    @Override
    public Completion visitAssignStmt(Stmt.Assign stmt) {
        var target = stmt.target();
        var operator = stmt.operator();

        if (target instanceof Expr.Variable variable) {
            var name = variable.name();
            var current = operator.type() == EQUAL ? null : environment.get(name);
            environment.assign(name.lexeme(), combine(operator, current, stmt.value()));
        } else if (target instanceof Expr.Index index) {
            var table = asTable(evaluate(index.object()), index.bracket());
            var key = evaluate(index.key());
            var current = operator.type() == EQUAL ? null : table.get(key);
            store(table, key, combine(operator, current, stmt.value()), index.bracket());
        } else if (target instanceof Expr.Get get) {
            var table = asTable(evaluate(get.object()), get.name());
            var key = Value.of(get.name().lexeme());
            var current = operator.type() == EQUAL ? null : table.get(key);
            store(table, key, combine(operator, current, stmt.value()), get.name());
        } else {
            throw new IllegalStateException("unsupported assignment target: " + target);
        }
        return Completion.NORMAL;
    }

    /**
     * Evaluates the right-hand side of an assignment and, for compound
     * operators, applies the arithmetic to the current value.
     */
    private Value combine(Token operator, Value current, Expr valueExpr) {
        var value = evaluate(valueExpr);
        switch (operator.type()) {
        case EQUAL:
            return value;
        case PLUS_EQUAL:
            return arithmetic(PLUS, operator, current, value);
        case MINUS_EQUAL:
            return arithmetic(MINUS, operator, current, value);
        case STAR_EQUAL:
            return arithmetic(STAR, operator, current, value);
        case SLASH_EQUAL:
            return arithmetic(SLASH, operator, current, value);
        default:
            throw new IllegalStateException("unexpected assignment operator: " + operator);
        }
    }

    @Override
    public Completion visitBlockStmt(Stmt.Block stmt) {
        return executeBlock(stmt.statements(), new Environment(environment));
    }

    @Override
    public Completion visitBreakStmt(Stmt.Break stmt) {
        return new Completion.Break(stmt.keyword());
    }

    @Override
    public Completion visitContinueStmt(Stmt.Continue stmt) {
        return new Completion.Continue(stmt.keyword());
    }

    @Override
    public Completion visitExpressionStmt(Stmt.Expression stmt) {
        evaluate(stmt.expression());
        return Completion.NORMAL;
    }

    @Override
    public Completion visitForStmt(Stmt.For stmt) {
        for (;;) {
            var completion = executeAll(stmt.body());
            if (completion instanceof Completion.Break) {
                return Completion.NORMAL;
            }
            if (completion instanceof Completion.Return) {
                return completion;
            }
        }
    }

    @Override
    public Completion visitFunctionStmt(Stmt.Function stmt) {
        environment.define(stmt.name().lexeme(), new Closure(stmt, environment));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitIfStmt(Stmt.If stmt) {
        if (Values.isTruthy(evaluate(stmt.condition()))) {
            return executeAll(stmt.thenBranch());
        }
        return executeAll(stmt.elseBranch());
    }

    @Override
    public Completion visitPrintStmt(Stmt.Print stmt) {
        output.accept(Values.stringify(evaluate(stmt.expression())));
        return Completion.NORMAL;
    }

    @Override
    public Completion visitReturnStmt(Stmt.Return stmt) {
        var value = stmt.value() != null ? evaluate(stmt.value()) : Value.NIL;
        return new Completion.Return(stmt.keyword(), value);
    }

    //// expressions ////

    @Override
    public Value visitBinaryExpr(Expr.Binary expr) {
        var left = evaluate(expr.left());
        var right = evaluate(expr.right());
        var operator = expr.operator();

        switch (operator.type()) {
        case PLUS:
        case MINUS:
        case STAR:
        case SLASH:
            return arithmetic(operator.type(), operator, left, right);
        case GREATER:
            checkNumberOperands(operator, left, right);
            return Value.of(number(left) > number(right));
        case GREATER_EQUAL:
            checkNumberOperands(operator, left, right);
            return Value.of(number(left) >= number(right));
        case LESS:
            checkNumberOperands(operator, left, right);
            return Value.of(number(left) < number(right));
        case LESS_EQUAL:
            checkNumberOperands(operator, left, right);
            return Value.of(number(left) <= number(right));
        case EQUAL_EQUAL:
            return Value.of(Values.isEqual(left, right));
        case BANG_EQUAL:
            return Value.of(!Values.isEqual(left, right));
        default:
            throw new IllegalStateException("unexpected binary operator: " + operator);
        }
    }

    @Override
    public Value visitCallExpr(Expr.Call expr) {
        var callee = evaluate(expr.callee());
        if (!(callee instanceof Callable function)) {
            throw new TypeError(expr.paren(), "can only call functions, got " + callee.typeName());
        }

        var arguments = new ArrayList<Value>(expr.arguments().size());
        for (var argument : expr.arguments()) {
            arguments.add(evaluate(argument));
        }
        var namedArguments = new LinkedHashMap<String, Value>();
        for (var named : expr.namedArguments()) {
            namedArguments.put(named.name().lexeme(), evaluate(named.value()));
        }

        return call(function, arguments, namedArguments, expr.paren());
    }

    /**
     * Binds arguments to the parameters of {@code function} and runs it.
     */
    Value call(Callable function, List<Value> arguments, Map<String, Value> namedArguments, Token paren) {
        if (callDepth >= maxCallDepth) {
            throw new ResourceError(paren, RECURSION_LIMIT_MESSAGE);
        }

        var slots = bind(function.parameterNames(), arguments, namedArguments, paren);

        callDepth++;
        try {
            if (function instanceof Builtin builtin) {
                checkMissing(function.parameterNames(), slots, i -> false, paren);
                return builtin.call(List.of(slots));
            }
            return callClosure((Closure) function, slots, paren);
        } finally {
            callDepth--;
        }
    }

    private Value[] bind(List<String> parameters, List<Value> arguments, Map<String, Value> namedArguments, Token paren) {
        var slots = new Value[parameters.size()];

        if (arguments.size() > slots.length) {
            throw new ArgumentError(paren, "expected " + plural(slots.length, "argument")
                + ", got " + arguments.size());
        }
        for (var i = 0; i < arguments.size(); i++) {
            slots[i] = arguments.get(i);
        }

        for (var named : namedArguments.entrySet()) {
            var i = parameters.indexOf(named.getKey());
            if (i < 0) {
                throw new ArgumentError(paren, "got an unexpected keyword argument '" + named.getKey() + "'");
            }
            if (slots[i] != null) {
                throw new ArgumentError(paren, "got multiple values for argument '" + named.getKey() + "'");
            }
            slots[i] = named.getValue();
        }
        return slots;
    }

    private interface Optionality {
        boolean hasDefault(int index);
    }

    private void checkMissing(List<String> parameters, Value[] slots, Optionality optionality, Token paren) {
        var missing = new ArrayList<String>();
        for (var i = 0; i < slots.length; i++) {
            if (slots[i] == null && !optionality.hasDefault(i)) {
                missing.add("'" + parameters.get(i) + "'");
            }
        }
        if (!missing.isEmpty()) {
            throw new ArgumentError(paren, "missing " + plural(missing.size(), "required argument")
                + ": " + missing.stream().collect(Collectors.joining(", ")));
        }
    }

    private Value callClosure(Closure closure, Value[] slots, Token paren) {
        var parameters = closure.parameters();
        checkMissing(closure.parameterNames(), slots, i -> parameters.get(i).hasDefault(), paren);

        var scope = new Environment(closure.getClosure());
        var previous = this.environment;
        try {
            this.environment = scope;
            for (var i = 0; i < slots.length; i++) {
                if (slots[i] != null) {
                    scope.define(parameters.get(i).name().lexeme(), slots[i]);
                }
            }
            // defaults see the call's bindings, including earlier defaults
            for (var i = 0; i < slots.length; i++) {
                if (slots[i] == null) {
                    var param = parameters.get(i);
                    scope.define(param.name().lexeme(), evaluate(param.defaultValue()));
                }
            }

            var completion = executeAll(closure.getDeclaration().body());
            if (completion instanceof Completion.Return returned) {
                return returned.value();
            }
            if (!completion.isNormal()) {
                throw escaped(completion);
            }
            return Value.NIL;
        } finally {
            this.environment = previous;
        }
    }

    @Override
    public Value visitConditionalExpr(Expr.Conditional expr) {
        if (Values.isTruthy(evaluate(expr.condition()))) {
            return evaluate(expr.thenBranch());
        }
        return evaluate(expr.elseBranch());
    }

    @Override
    public Value visitGetExpr(Expr.Get expr) {
        var table = asTable(evaluate(expr.object()), expr.name());
        return table.get(Value.of(expr.name().lexeme()));
    }

    @Override
    public Value visitGroupingExpr(Expr.Grouping expr) {
        return evaluate(expr.expression());
    }

    @Override
    public Value visitIndexExpr(Expr.Index expr) {
        var table = asTable(evaluate(expr.object()), expr.bracket());
        return table.get(evaluate(expr.key()));
    }

    @Override
    public Value visitLiteralExpr(Expr.Literal expr) {
        return expr.value();
    }

    @Override
    public Value visitLogicalExpr(Expr.Logical expr) {
        var left = evaluate(expr.left());

        if (expr.operator().type() == OR) {
            if (Values.isTruthy(left)) {
                return left;
            }
        } else if (!Values.isTruthy(left)) {
            return left;
        }

        return evaluate(expr.right());
    }

    @Override
    public Value visitTableLiteralExpr(Expr.TableLiteral expr) {
        var table = new Table();
        var index = 0;
        for (var entry : expr.entries()) {
            var key = entry.isPositional() ? Value.of(index++) : evaluate(entry.key());
            store(table, key, evaluate(entry.value()), expr.brace());
        }
        return table;
    }

    @Override
    public Value visitUnaryExpr(Expr.Unary expr) {
        var right = evaluate(expr.right());

        switch (expr.operator().type()) {
        case MINUS:
            checkNumberOperand(expr.operator(), right);
            return Value.of(-number(right));
        case NOT:
            return Value.of(!Values.isTruthy(right));
        default:
            throw new IllegalStateException("unexpected unary operator: " + expr.operator());
        }
    }

    @Override
    public Value visitVariableExpr(Expr.Variable expr) {
        return environment.get(expr.name());
    }

    //// utilities ////

    private Value arithmetic(Token.Type type, Token operator, Value left, Value right) {
        checkNumberOperands(operator, left, right);
        var a = number(left);
        var b = number(right);
        switch (type) {
        case PLUS:
            return Value.of(a + b);
        case MINUS:
            return Value.of(a - b);
        case STAR:
            return Value.of(a * b);
        case SLASH:
            // IEEE semantics: x/0 is inf or nan, not an error
            return Value.of(a / b);
        default:
            throw new IllegalStateException("unexpected arithmetic operator: " + type);
        }
    }

    private static double number(Value value) {
        return ((Value.Num) value).value();
    }

    private void checkNumberOperand(Token operator, Value operand) {
        if (!(operand instanceof Value.Num)) {
            throw new TypeError(operator, "operand must be a number, got " + operand.typeName());
        }
    }

    private void checkNumberOperands(Token operator, Value left, Value right) {
        if (!(left instanceof Value.Num)) {
            throw new TypeError(operator, "left operand must be a number, got " + left.typeName());
        }
        if (!(right instanceof Value.Num)) {
            throw new TypeError(operator, "right operand must be a number, got " + right.typeName());
        }
    }

    private Table asTable(Value value, Token token) {
        if (value instanceof Table table) {
            return table;
        }
        throw new TypeError(token, "can only index tables, got " + value.typeName());
    }

    private void store(Table table, Value key, Value value, Token token) {
        if (key instanceof Value.Num num && Double.isNaN(num.value())) {
            throw new TypeError(token, "table key cannot be nan");
        }
        table.put(key, value);
    }

    private ControlFlowError escaped(Completion completion) {
        if (completion instanceof Completion.Break signal) {
            return new ControlFlowError(signal.keyword(), "break outside loop");
        }
        if (completion instanceof Completion.Continue signal) {
            return new ControlFlowError(signal.keyword(), "continue outside loop");
        }
        if (completion instanceof Completion.Return signal) {
            return new ControlFlowError(signal.keyword(), "return outside function");
        }
        throw new IllegalStateException("not a control signal: " + completion);
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
