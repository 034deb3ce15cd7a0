package fountain.lang;

import static fountain.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive-descent parser, one method per grammar rule.
 *
 * <p>Parsing stops at the first grammar violation with a {@link ParseError};
 * there is no recovery. The returned tree is immutable.
 */
@RequiredArgsConstructor
final class Parser {

    private static final int MAX_ARGUMENTS = 255;

    private static final Set<Token.Type> EXPRESSION_START = Set.of(
        IDENTIFIER, NUMBER, STRING, TRUE, FALSE, NIL, PAREN_LEFT, BRACE_LEFT, MINUS, NOT);

    private final @NonNull TokenStream tokens;

    List<Stmt> parse() {
        return program();
    }

    /**
     * Parses a single expression spanning the whole input.
     */
    Expr parseExpression() {
        var expr = expression();
        if (!isAtEnd()) {
            throw error(peek(), "expected end of expression");
        }
        return expr;
    }

    //// grammar rules ////

    /**
     * <pre>
     *  program     :: stmt* EOF
     * </pre>
     */
    private List<Stmt> program() {
        var statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return List.copyOf(statements);
    }

    /**
     * <pre>
     *  stmt        :: simple_stmt ";"?
     * </pre>
     */
    private Stmt statement() {
        var stmt = simpleStatement();
        match(SEMICOLON);
        return stmt;
    }

    /**
     * <pre>
     *  simple_stmt :: block | print_stmt | if_stmt | for_stmt | fn_stmt
     *              | "break" | "continue" | "return" expression?
     *              | assert_stmt | assign_stmt | expr_stmt
     * </pre>
     */
    private Stmt simpleStatement() {
        if (match(DO)) {
            return block();
        }
        if (match(PRINT)) {
            return printStatement();
        }
        if (match(IF)) {
            return ifStatement();
        }
        if (match(FOR)) {
            return forStatement();
        }
        if (match(FN)) {
            return function();
        }
        if (match(BREAK)) {
            return new Stmt.Break(previous());
        }
        if (match(CONTINUE)) {
            return new Stmt.Continue(previous());
        }
        if (match(RETURN)) {
            return returnStatement();
        }
        if (match(ASSERT)) {
            return assertStatement();
        }
        return assignmentOrExpression();
    }

    /**
     * <pre>
     *  block       :: "do" stmt* "end"
     * </pre>
     */
    private Stmt block() {
        var keyword = previous();
        var statements = statementsUntil("expected 'end' after block");
        return new Stmt.Block(keyword, statements);
    }

    /**
     * <pre>
     *  print_stmt  :: "print" expression
     * </pre>
     */
    private Stmt printStatement() {
        var keyword = previous();
        return new Stmt.Print(keyword, expression());
    }

    /**
     * <pre>
     *  if_stmt     :: "if" expression "do" stmt* ( "else" stmt* )? "end"
     * </pre>
     */
    private Stmt ifStatement() {
        var keyword = previous();
        var condition = expression();
        consume(DO, "expected 'do' after condition");

        var thenBranch = new ArrayList<Stmt>();
        while (!check(ELSE) && !check(END) && !isAtEnd()) {
            thenBranch.add(statement());
        }

        List<Stmt> elseBranch = List.of();
        if (match(ELSE)) {
            elseBranch = statementsUntil("expected 'end' to close 'if'");
        } else {
            consume(END, "expected 'end' to close 'if'");
        }
        return new Stmt.If(keyword, condition, List.copyOf(thenBranch), elseBranch);
    }

    /**
     * <pre>
     *  for_stmt    :: "for" "do" stmt* "end"
     * </pre>
     */
    private Stmt forStatement() {
        var keyword = previous();
        consume(DO, "expected 'do' after 'for'");
        var body = statementsUntil("expected 'end' to close 'for'");
        return new Stmt.For(keyword, body);
    }

    /**
     * <pre>
     *  fn_stmt     :: "fn" IDENTIFIER "(" parameters? ")" stmt* "end"
     *  parameters  :: param ( "," param )*
     *  param       :: IDENTIFIER ( "=" expression )?
     * </pre>
     */
    private Stmt function() {
        var name = consume(IDENTIFIER, "expected function name");
        consume(PAREN_LEFT, "expected '(' after function name");

        var params = new ArrayList<Parameter>();
        var names = new HashSet<String>();
        var sawDefault = false;
        if (!check(PAREN_RIGHT)) {
            do {
                var param = consume(IDENTIFIER, "expected parameter name");
                if (!names.add(param.lexeme())) {
                    throw error(param, "duplicate parameter '" + param.lexeme() + "'");
                }
                Expr defaultValue = null;
                if (match(EQUAL)) {
                    defaultValue = expression();
                    sawDefault = true;
                } else if (sawDefault) {
                    throw error(param, "non-default parameter '" + param.lexeme() + "' follows default parameter");
                }
                params.add(new Parameter(param, defaultValue));
            } while (match(COMMA));
        }
        consume(PAREN_RIGHT, "expected ')' after parameters");

        var body = statementsUntil("expected 'end' to close function");
        return new Stmt.Function(name, List.copyOf(params), body);
    }

    /**
     * <pre>
     *  return_stmt :: "return" expression?
     * </pre>
     */
    private Stmt returnStatement() {
        var keyword = previous();
        Expr value = null;
        if (EXPRESSION_START.contains(peek().type())) {
            value = expression();
        }
        return new Stmt.Return(keyword, value);
    }

    /**
     * <pre>
     *  assert_stmt :: "assert" expression ( "," expression )?
     * </pre>
     */
    private Stmt assertStatement() {
        var keyword = previous();
        var condition = expression();
        Expr message = null;
        if (match(COMMA)) {
            message = expression();
        }
        return new Stmt.Assert(keyword, condition, message);
    }

    /**
     * <pre>
     *  assign_stmt :: ( IDENTIFIER | index_expr | field_expr ) ( "=" | "+=" | "-=" | "*=" | "/=" ) expression
     *  expr_stmt   :: expression
     * </pre>
     *
     * The left-hand side is parsed as an expression and checked afterwards,
     * so targets like {@code a.b[c].d} need only one token of lookahead.
     */
    private Stmt assignmentOrExpression() {
        var expr = expression();

        if (match(EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL)) {
            var operator = previous();
            if (expr instanceof Expr.Variable
                    || expr instanceof Expr.Index
                    || expr instanceof Expr.Get) {
                var value = expression();
                return new Stmt.Assign(expr, operator, value);
            }
            throw error(operator, "cannot assign to " + describe(expr));
        }

        return new Stmt.Expression(expr);
    }

    /**
     * <pre>
     *  expression  :: conditional
     * </pre>
     */
    private Expr expression() {
        return conditional();
    }

    /**
     * <pre>
     *  conditional :: disjunction ( "if" disjunction "else" expression )?
     * </pre>
     *
     * An {@code if} without a matching {@code else} is not part of this
     * expression; it starts the next statement, so the stream is rewound.
     */
    private Expr conditional() {
        var expr = disjunction();
        if (check(IF)) {
            var mark = tokens.mark();
            var keyword = advance();
            var condition = disjunction();
            if (match(ELSE)) {
                var elseBranch = expression();
                return new Expr.Conditional(expr, keyword, condition, elseBranch);
            }
            tokens.reset(mark);
        }
        return expr;
    }

    /**
     * <pre>
     *  disjunction :: conjunction ( "or" conjunction )*
     * </pre>
     */
    private Expr disjunction() {
        var expr = conjunction();
        while (match(OR)) {
            var operator = previous();
            var right = conjunction();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  conjunction :: equality ( "and" equality )*
     * </pre>
     */
    private Expr conjunction() {
        var expr = equality();
        while (match(AND)) {
            var operator = previous();
            var right = equality();
            expr = new Expr.Logical(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  equality    :: comparison ( ( "==" | "!=" ) comparison )*
     * </pre>
     */
    private Expr equality() {
        var expr = comparison();
        while (match(EQUAL_EQUAL, BANG_EQUAL)) {
            var operator = previous();
            var right = comparison();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  comparison  :: term ( ( "<" | "<=" | ">" | ">=" ) term )*
     * </pre>
     */
    private Expr comparison() {
        var expr = term();
        while (match(LESS, LESS_EQUAL, GREATER, GREATER_EQUAL)) {
            var operator = previous();
            var right = term();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  term        :: factor ( ( "+" | "-" ) factor )*
     * </pre>
     */
    private Expr term() {
        var expr = factor();
        while (match(PLUS, MINUS)) {
            var operator = previous();
            var right = factor();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  factor      :: unary ( ( "*" | "/" ) unary )*
     * </pre>
     */
    private Expr factor() {
        var expr = unary();
        while (match(STAR, SLASH)) {
            var operator = previous();
            var right = unary();
            expr = new Expr.Binary(expr, operator, right);
        }
        return expr;
    }

    /**
     * <pre>
     *  unary       :: ( "-" | "not" ) unary | call
     * </pre>
     */
    private Expr unary() {
        if (match(MINUS, NOT)) {
            var operator = previous();
            var right = unary();
            return new Expr.Unary(operator, right);
        }
        return call();
    }

    /**
     * <pre>
     *  call        :: primary ( "(" arguments? ")" | "[" expression "]" | "." IDENTIFIER )*
     * </pre>
     */
    private Expr call() {
        var expr = primary();
        for (;;) {
            if (match(PAREN_LEFT)) {
                expr = finishCall(expr);
            } else if (match(BRACKET_LEFT)) {
                var bracket = previous();
                var key = expression();
                consume(BRACKET_RIGHT, "expected ']' after index");
                expr = new Expr.Index(expr, bracket, key);
            } else if (match(DOT)) {
                var name = consume(IDENTIFIER, "expected field name after '.'");
                expr = new Expr.Get(expr, name);
            } else {
                return expr;
            }
        }
    }

    /**
     * <pre>
     *  arguments   :: pos_args ( "," kw_args )? | kw_args
     *  pos_args    :: expression ( "," expression )*
     *  kw_args     :: IDENTIFIER "=" expression ( "," IDENTIFIER "=" expression )*
     * </pre>
     */
    private Expr finishCall(Expr callee) {
        var paren = previous();
        var arguments = new ArrayList<Expr>();
        var namedArguments = new ArrayList<NamedArgument>();
        var names = new HashSet<String>();

        if (!check(PAREN_RIGHT)) {
            do {
                if (arguments.size() + namedArguments.size() >= MAX_ARGUMENTS) {
                    throw error(peek(), "more than " + MAX_ARGUMENTS + " arguments");
                }
                if (checkNamedItem()) {
                    var name = advance();
                    advance(); // EQUAL
                    if (!names.add(name.lexeme())) {
                        throw error(name, "keyword argument repeated: '" + name.lexeme() + "'");
                    }
                    namedArguments.add(new NamedArgument(name, expression()));
                } else {
                    if (!namedArguments.isEmpty()) {
                        throw error(peek(), "positional argument follows keyword argument");
                    }
                    arguments.add(expression());
                }
            } while (match(COMMA));
        }
        consume(PAREN_RIGHT, "expected ')' after arguments");

        return new Expr.Call(callee, paren, List.copyOf(arguments), List.copyOf(namedArguments));
    }

    /**
     * <pre>
     *  primary     :: IDENTIFIER | "true" | "false" | "nil" | NUMBER | STRING
     *              | "(" expression ")" | "{" table_items? "}"
     * </pre>
     */
    private Expr primary() {
        if (match(FALSE)) {
            return new Expr.Literal(Value.FALSE, previous());
        }
        if (match(TRUE)) {
            return new Expr.Literal(Value.TRUE, previous());
        }
        if (match(NIL)) {
            return new Expr.Literal(Value.NIL, previous());
        }
        if (match(NUMBER)) {
            var value = Double.parseDouble(previous().lexeme());
            return new Expr.Literal(Value.of(value), previous());
        }
        if (match(STRING)) {
            var lexeme = previous().lexeme();
            var string = lexeme.substring(1, lexeme.length() - 1); // strip quotes
            return new Expr.Literal(Value.of(string), previous());
        }
        if (match(IDENTIFIER)) {
            return new Expr.Variable(previous());
        }
        if (match(PAREN_LEFT)) {
            var expression = expression();
            consume(PAREN_RIGHT, "expected ')' after expression");
            return new Expr.Grouping(expression);
        }
        if (match(BRACE_LEFT)) {
            return table();
        }
        throw error(peek(), "expected expression");
    }

    /**
     * <pre>
     *  table_items :: item ( "," item )* ","?
     *  item        :: IDENTIFIER "=" expression
     *              | "[" expression "]" "=" expression
     *              | expression
     * </pre>
     */
    private Expr table() {
        var brace = previous();
        var entries = new ArrayList<TableEntry>();

        while (!check(BRACE_RIGHT) && !isAtEnd()) {
            if (checkNamedItem()) {
                var name = advance();
                advance(); // EQUAL
                var key = new Expr.Literal(Value.of(name.lexeme()), name);
                entries.add(new TableEntry(key, expression()));
            } else if (match(BRACKET_LEFT)) {
                var key = expression();
                consume(BRACKET_RIGHT, "expected ']' after table key");
                consume(EQUAL, "expected '=' after table key");
                entries.add(new TableEntry(key, expression()));
            } else {
                entries.add(new TableEntry(null, expression()));
            }

            if (!match(COMMA)) {
                break;
            }
        }
        consume(BRACE_RIGHT, "expected '}' after table items");

        return new Expr.TableLiteral(brace, List.copyOf(entries));
    }

    //// utility methods ////

    private static String describe(Expr expr) {
        if (expr instanceof Expr.TableLiteral) {
            return "table literal";
        }
        return expr.getClass().getSimpleName().toLowerCase();
    }

    private boolean checkNamedItem() {
        return check(IDENTIFIER) && peekNext().type() == EQUAL;
    }

    private List<Stmt> statementsUntil(String message) {
        var statements = new ArrayList<Stmt>();
        while (!check(END) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(END, message);
        return List.copyOf(statements);
    }

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return advance();
        }

        throw error(peek(), message);
    }

    private ParseError error(Token token, String message) {
        return new ParseError(token, message);
    }

    private boolean match(Token.Type... types) {
        for (var type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }

        return false;
    }

    private boolean check(Token.Type type) {
        return !isAtEnd() && peek().type() == type;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private Token previous() {
        return tokens.previous();
    }
}
