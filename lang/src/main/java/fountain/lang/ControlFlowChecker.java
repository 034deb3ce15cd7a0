package fountain.lang;

import java.util.List;

/**
 * Rejects {@code break} and {@code continue} outside a loop and {@code return}
 * outside a function before a program runs.
 *
 * <p>A function body starts outside any loop, even when the function is
 * declared inside one.
 */
final class ControlFlowChecker implements Stmt.Visitor<Void> {

    private int loopDepth = 0;
    private int functionDepth = 0;

    void check(List<Stmt> statements) {
        for (var stmt : statements) {
            stmt.accept(this);
        }
    }

    @Override
    public Void visitBreakStmt(Stmt.Break stmt) {
        if (loopDepth == 0) {
            throw new ControlFlowError(stmt.keyword(), "break outside loop");
        }
        return null;
    }

    @Override
    public Void visitContinueStmt(Stmt.Continue stmt) {
        if (loopDepth == 0) {
            throw new ControlFlowError(stmt.keyword(), "continue outside loop");
        }
        return null;
    }

    @Override
    public Void visitReturnStmt(Stmt.Return stmt) {
        if (functionDepth == 0) {
            throw new ControlFlowError(stmt.keyword(), "return outside function");
        }
        return null;
    }

    @Override
    public Void visitForStmt(Stmt.For stmt) {
        loopDepth++;
        try {
            check(stmt.body());
        } finally {
            loopDepth--;
        }
        return null;
    }

    @Override
    public Void visitFunctionStmt(Stmt.Function stmt) {
        var enclosingLoops = loopDepth;
        loopDepth = 0;
        functionDepth++;
        try {
            check(stmt.body());
        } finally {
            functionDepth--;
            loopDepth = enclosingLoops;
        }
        return null;
    }

    @Override
    public Void visitBlockStmt(Stmt.Block stmt) {
        check(stmt.statements());
        return null;
    }

    @Override
    public Void visitIfStmt(Stmt.If stmt) {
        check(stmt.thenBranch());
        check(stmt.elseBranch());
        return null;
    }

    @Override
    public Void visitAssertStmt(Stmt.Assert stmt) {
        return null;
    }

    @Override
    public Void visitAssignStmt(Stmt.Assign stmt) {
        return null;
    }

    @Override
    public Void visitExpressionStmt(Stmt.Expression stmt) {
        return null;
    }

    @Override
    public Void visitPrintStmt(Stmt.Print stmt) {
        return null;
    }
}
