package fountain.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders syntax trees in a parenthesized prefix form, e.g. {@code (+ 1 (* 2 3))}.
 */
final class AstPrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {

    static String print(Expr expr) {
        return expr.accept(new AstPrinter());
    }

    static String print(Stmt stmt) {
        return stmt.accept(new AstPrinter());
    }

    static String print(List<Stmt> statements) {
        var printer = new AstPrinter();
        var builder = new StringBuilder();
        for (var stmt : statements) {
            builder.append(stmt.accept(printer)).append('\n');
        }
        return builder.toString();
    }

    //// statements ////

    @Override
    public String visitAssertStmt(Stmt.Assert stmt) {
        if (stmt.message() == null) {
            return parenthesize("assert", stmt.condition());
        }
        return parenthesize("assert", stmt.condition(), stmt.message());
    }

    @Override
    public String visitAssignStmt(Stmt.Assign stmt) {
        return parenthesize(stmt.operator().lexeme(), stmt.target(), stmt.value());
    }

    @Override
    public String visitBlockStmt(Stmt.Block stmt) {
        return parenthesize("do", stmt.statements().toArray());
    }

    @Override
    public String visitBreakStmt(Stmt.Break stmt) {
        return "(break)";
    }

    @Override
    public String visitContinueStmt(Stmt.Continue stmt) {
        return "(continue)";
    }

    @Override
    public String visitExpressionStmt(Stmt.Expression stmt) {
        return stmt.expression().accept(this);
    }

    @Override
    public String visitForStmt(Stmt.For stmt) {
        return parenthesize("for", stmt.body().toArray());
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        var params = new StringBuilder("(");
        for (var param : stmt.params()) {
            if (params.length() > 1) {
                params.append(' ');
            }
            params.append(param.name().lexeme());
            if (param.hasDefault()) {
                params.append('=').append(param.defaultValue().accept(this));
            }
        }
        params.append(')');
        return parenthesize("fn " + stmt.name().lexeme() + " " + params, stmt.body().toArray());
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        var then = parenthesize("then", stmt.thenBranch().toArray());
        if (stmt.elseBranch().isEmpty()) {
            return parenthesize("if", stmt.condition(), then);
        }
        var orElse = parenthesize("else", stmt.elseBranch().toArray());
        return parenthesize("if", stmt.condition(), then, orElse);
    }

    @Override
    public String visitPrintStmt(Stmt.Print stmt) {
        return parenthesize("print", stmt.expression());
    }

    @Override
    public String visitReturnStmt(Stmt.Return stmt) {
        if (stmt.value() == null) {
            return "(return)";
        }
        return parenthesize("return", stmt.value());
    }

    //// expressions ////

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return parenthesize(expr.operator().lexeme(), expr.left(), expr.right());
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        var parts = new ArrayList<Object>();
        parts.add(expr.callee());
        parts.addAll(expr.arguments());
        for (var named : expr.namedArguments()) {
            parts.add(named.name().lexeme() + "=" + named.value().accept(this));
        }
        return parenthesize("call", parts.toArray());
    }

    @Override
    public String visitConditionalExpr(Expr.Conditional expr) {
        return parenthesize("if", expr.condition(), expr.thenBranch(), expr.elseBranch());
    }

    @Override
    public String visitGetExpr(Expr.Get expr) {
        return parenthesize(".", expr.object(), expr.name().lexeme());
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return parenthesize("group", expr.expression());
    }

    @Override
    public String visitIndexExpr(Expr.Index expr) {
        return parenthesize("index", expr.object(), expr.key());
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        return Values.repr(expr.value());
    }

    @Override
    public String visitLogicalExpr(Expr.Logical expr) {
        return parenthesize(expr.operator().lexeme(), expr.left(), expr.right());
    }

    @Override
    public String visitTableLiteralExpr(Expr.TableLiteral expr) {
        var parts = new Object[expr.entries().size()];
        for (var i = 0; i < parts.length; i++) {
            var entry = expr.entries().get(i);
            if (entry.isPositional()) {
                parts[i] = entry.value();
            } else {
                parts[i] = "[" + entry.key().accept(this) + "]=" + entry.value().accept(this);
            }
        }
        return parenthesize("table", parts);
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        return parenthesize(expr.operator().lexeme(), expr.right());
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name().lexeme();
    }

    private String parenthesize(String name, Object... parts) {
        var builder = new StringBuilder();
        builder.append('(').append(name);
        for (var part : parts) {
            builder.append(' ');
            if (part instanceof Expr expr) {
                builder.append(expr.accept(this));
            } else if (part instanceof Stmt stmt) {
                builder.append(stmt.accept(this));
            } else {
                builder.append(part);
            }
        }
        builder.append(')');
        return builder.toString();
    }
}
