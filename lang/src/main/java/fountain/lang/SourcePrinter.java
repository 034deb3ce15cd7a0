package fountain.lang;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders syntax trees back as fountain source on a single line.
 *
 * <p>Parentheses appear only where the tree has a grouping, so parsing the
 * output yields the same tree. Statements in a body are separated by
 * {@code ;} so that a following {@code (} is never read as a call.
 */
final class SourcePrinter implements Expr.Visitor<String>, Stmt.Visitor<String> {

    static String print(Expr expr) {
        return expr.accept(new SourcePrinter());
    }

    static String print(Stmt stmt) {
        return stmt.accept(new SourcePrinter());
    }

    static String print(List<Stmt> statements) {
        return new SourcePrinter().join(statements);
    }

    //// statements ////

    @Override
    public String visitAssertStmt(Stmt.Assert stmt) {
        var text = "assert " + render(stmt.condition());
        if (stmt.message() != null) {
            text += ", " + render(stmt.message());
        }
        return text;
    }

    @Override
    public String visitAssignStmt(Stmt.Assign stmt) {
        return render(stmt.target()) + " " + stmt.operator().lexeme() + " " + render(stmt.value());
    }

    @Override
    public String visitBlockStmt(Stmt.Block stmt) {
        return "do" + body(stmt.statements()) + "end";
    }

    @Override
    public String visitBreakStmt(Stmt.Break stmt) {
        return "break";
    }

    @Override
    public String visitContinueStmt(Stmt.Continue stmt) {
        return "continue";
    }

    @Override
    public String visitExpressionStmt(Stmt.Expression stmt) {
        return render(stmt.expression());
    }

    @Override
    public String visitForStmt(Stmt.For stmt) {
        return "for do" + body(stmt.body()) + "end";
    }

    @Override
    public String visitFunctionStmt(Stmt.Function stmt) {
        var params = new ArrayList<String>();
        for (var param : stmt.params()) {
            if (param.hasDefault()) {
                params.add(param.name().lexeme() + " = " + render(param.defaultValue()));
            } else {
                params.add(param.name().lexeme());
            }
        }
        return "fn " + stmt.name().lexeme() + "(" + String.join(", ", params) + ")"
            + body(stmt.body()) + "end";
    }

    @Override
    public String visitIfStmt(Stmt.If stmt) {
        var text = "if " + render(stmt.condition()) + " do" + body(stmt.thenBranch());
        if (!stmt.elseBranch().isEmpty()) {
            text += "else" + body(stmt.elseBranch());
        }
        return text + "end";
    }

    @Override
    public String visitPrintStmt(Stmt.Print stmt) {
        return "print " + render(stmt.expression());
    }

    @Override
    public String visitReturnStmt(Stmt.Return stmt) {
        if (stmt.value() == null) {
            return "return";
        }
        return "return " + render(stmt.value());
    }

    //// expressions ////

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return render(expr.left()) + " " + expr.operator().lexeme() + " " + render(expr.right());
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        var arguments = new ArrayList<String>();
        for (var argument : expr.arguments()) {
            arguments.add(render(argument));
        }
        for (var named : expr.namedArguments()) {
            arguments.add(named.name().lexeme() + " = " + render(named.value()));
        }
        return render(expr.callee()) + "(" + String.join(", ", arguments) + ")";
    }

    @Override
    public String visitConditionalExpr(Expr.Conditional expr) {
        return render(expr.thenBranch()) + " if " + render(expr.condition()) + " else " + render(expr.elseBranch());
    }

    @Override
    public String visitGetExpr(Expr.Get expr) {
        return render(expr.object()) + "." + expr.name().lexeme();
    }

    @Override
    public String visitGroupingExpr(Expr.Grouping expr) {
        return "(" + render(expr.expression()) + ")";
    }

    @Override
    public String visitIndexExpr(Expr.Index expr) {
        return render(expr.object()) + "[" + render(expr.key()) + "]";
    }

    @Override
    public String visitLiteralExpr(Expr.Literal expr) {
        return Values.repr(expr.value());
    }

    @Override
    public String visitLogicalExpr(Expr.Logical expr) {
        return render(expr.left()) + " " + expr.operator().lexeme() + " " + render(expr.right());
    }

    @Override
    public String visitTableLiteralExpr(Expr.TableLiteral expr) {
        var items = new ArrayList<String>();
        for (var entry : expr.entries()) {
            var value = render(entry.value());
            if (entry.isPositional()) {
                items.add(value);
            } else if (entry.key() instanceof Expr.Literal literal
                    && literal.value() instanceof Value.Str str
                    && Values.isIdentifier(str.value())) {
                items.add(str.value() + " = " + value);
            } else {
                items.add("[" + render(entry.key()) + "] = " + value);
            }
        }
        return "{" + String.join(", ", items) + "}";
    }

    @Override
    public String visitUnaryExpr(Expr.Unary expr) {
        var operator = expr.operator().lexeme();
        var right = render(expr.right());
        // "--" would start a comment
        if (expr.operator().type() == Token.Type.NOT || right.startsWith("-")) {
            return operator + " " + right;
        }
        return operator + right;
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name().lexeme();
    }

    private String render(Expr expr) {
        return expr.accept(this);
    }

    private String join(List<Stmt> statements) {
        var parts = new ArrayList<String>();
        for (var stmt : statements) {
            parts.add(stmt.accept(this));
        }
        return String.join("; ", parts);
    }

    private String body(List<Stmt> statements) {
        if (statements.isEmpty()) {
            return " ";
        }
        return " " + join(statements) + " ";
    }
}
