package com.deeplearningdsl.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

import static com.deeplearningdsl.dsl.RuntimeError.Kind.*;

public class Interpreter implements Expr.Visitor<DslValue>, Stmt.Visitor<Void> {
    final Environment globals;
    final BuiltinDispatcher dispatcher;
    Environment environment;

    final Stack<StackFrame> stack = new Stack<>();

    public Interpreter(BuiltinDispatcher dispatcher) {
        this(new Environment(), dispatcher);
    }

    public Interpreter(Environment globals, BuiltinDispatcher dispatcher) {
        this.globals = globals;
        this.environment = globals;
        this.dispatcher = dispatcher;
    }

    /**
     * Runs {@code program} against {@code globals}. The first runtime error
     * aborts the run and is rethrown with the call stack at the point of
     * failure attached.
     */
    public static void evaluate(Program program, Environment globals, BuiltinDispatcher dispatcher) {
        new Interpreter(globals, dispatcher).interpret(program);
    }

    public void interpret(Program program) {
        try {
            executeStmts(program.statements);
        } catch (RuntimeError error) {
            error.attachCallStack(stacktraceLines());
            throw error;
        } finally {
            clearStack();
            this.environment = globals;
        }
    }

    public Environment getGlobals() {
        return globals;
    }

    @Override
    public Void visitAssignStmt(Stmt.Assign stmt) {
        DslValue value = evaluate(stmt.value);
        environment.define(stmt.name.lexeme, value);
        return null;
    }

    @Override
    public Void visitIfStmt(Stmt.If stmt) {
        if (test(stmt.condition)) {
            executeStmts(stmt.thenBranch);
        } else if (stmt.elseBranch != null) {
            executeStmts(stmt.elseBranch);
        }
        return null;
    }

    // no iteration limit: a loop whose condition never fails runs forever
    @Override
    public Void visitWhileStmt(Stmt.While stmt) {
        while (test(stmt.condition)) {
            executeStmts(stmt.body);
        }
        return null;
    }

    @Override
    public Void visitForStmt(Stmt.For stmt) {
        execute(stmt.initializer);
        while (test(stmt.condition)) {
            executeStmts(stmt.body);
            execute(stmt.increment);
        }
        return null;
    }

    @Override
    public Void visitFunctionStmt(Stmt.Function stmt) {
        // last definition wins
        environment.define(stmt.name.lexeme, new DslFunction(stmt, environment));
        return null;
    }

    @Override
    public Void visitExpressionStmt(Stmt.Expression stmt) {
        evaluate(stmt.expression);
        return null;
    }

    @Override
    public DslValue visitLiteralExpr(Expr.Literal expr) {
        if (expr.value instanceof Double) {
            return DslNumber.of((Double)expr.value);
        }
        return new DslString((String)expr.value);
    }

    @Override
    public DslValue visitVariableExpr(Expr.Variable expr) {
        return environment.get(expr.name);
    }

    @Override
    public DslValue visitGroupingExpr(Expr.Grouping expr) {
        return evaluate(expr.expression);
    }

    @Override
    public DslValue visitUnaryExpr(Expr.Unary expr) {
        DslValue right = evaluate(expr.right);
        return DslNumber.of(-checkNumberOperand(expr.operator, right));
    }

    @Override
    public DslValue visitTrigExpr(Expr.Trig expr) {
        double arg = checkNumberOperand(expr.function, evaluate(expr.argument));
        switch (expr.function.type) {
            case SIN: return DslNumber.of(Math.sin(arg));
            case COS: return DslNumber.of(Math.cos(arg));
            case TAN: return DslNumber.of(Math.tan(arg));
            case SQRT:
                if (arg < 0) {
                    throw new RuntimeError(DOMAIN_ERROR, expr.function,
                            "sqrt of negative number " + DslNumber.format(arg) + ".");
                }
                return DslNumber.of(Math.sqrt(arg));
            default:
                throw new IllegalStateException("unreachable: " + expr.function.type);
        }
    }

    @Override
    public DslValue visitBinaryExpr(Expr.Binary expr) {
        DslValue left = evaluate(expr.left);
        DslValue right = evaluate(expr.right);
        Token op = expr.operator;

        switch (op.type) {
            case PLUS: {
                if (left instanceof DslString && right instanceof DslString) {
                    return new DslString(((DslString)left).value + ((DslString)right).value);
                }
                if (left instanceof DslNumber && right instanceof DslNumber) {
                    return DslNumber.of(((DslNumber)left).value + ((DslNumber)right).value);
                }
                throw new RuntimeError(TYPE_MISMATCH, op,
                        "operands for '+' must be two numbers or two strings, LHS=" +
                        left.typeName() + ", RHS=" + right.typeName());
            }
            case MINUS:
                checkNumberOperands(op, left, right);
                return DslNumber.of(num(left) - num(right));
            case STAR:
                checkNumberOperands(op, left, right);
                return DslNumber.of(num(left) * num(right));
            case SLASH:
                checkNumberOperands(op, left, right);
                if (num(right) == 0.0) {
                    throw new RuntimeError(DIVISION_BY_ZERO, op, "division by 0");
                }
                return DslNumber.of(num(left) / num(right));
            case PERCENT:
                checkNumberOperands(op, left, right);
                if (num(right) == 0.0) {
                    throw new RuntimeError(DIVISION_BY_ZERO, op, "remainder of division by 0");
                }
                return DslNumber.of(num(left) % num(right));
            case CARET:
                checkNumberOperands(op, left, right);
                return DslNumber.of(power(op, num(left), num(right)));
            default:
                throw new IllegalStateException("unreachable: " + op.type);
        }
    }

    // negative base with fractional exponent (NaN) and 0 to a negative power
    private double power(Token op, double base, double exponent) {
        double result = Math.pow(base, exponent);
        boolean undefined = (Double.isNaN(result) && !Double.isNaN(base) && !Double.isNaN(exponent)) ||
                            (base == 0.0 && exponent < 0);
        if (undefined) {
            throw new RuntimeError(DOMAIN_ERROR, op,
                    DslNumber.format(base) + " ^ " + DslNumber.format(exponent) +
                    " is not defined over the reals.");
        }
        return result;
    }

    @Override
    public DslValue visitListLiteralExpr(Expr.ListLiteral expr) {
        if (expr.rows.isEmpty() || expr.noneBracketed()) {
            List<DslValue> elements = new ArrayList<>();
            for (Expr.Row row : expr.rows) {
                elements.add(evaluate(row.elements.get(0)));
            }
            return new DslList(elements);
        }
        if (!expr.allBracketed()) {
            throw new RuntimeError(SHAPE_ERROR, expr.lbracket,
                    "list literal mixes bracketed rows with bare elements.");
        }

        int cols = expr.rows.get(0).elements.size();
        double[][] cells = new double[expr.rows.size()][];
        for (int i = 0; i < expr.rows.size(); i++) {
            Expr.Row row = expr.rows.get(i);
            if (row.elements.size() != cols) {
                throw new RuntimeError(SHAPE_ERROR, row.lbracket,
                        "matrix row " + (i + 1) + " has " + row.elements.size() +
                        " element(s), expected " + cols + ".");
            }
            cells[i] = new double[cols];
            for (int j = 0; j < cols; j++) {
                DslValue cell = evaluate(row.elements.get(j));
                if (!(cell instanceof DslNumber)) {
                    throw new RuntimeError(TYPE_MISMATCH, row.lbracket,
                            "matrix cells must be numbers, got " + cell.typeName() + ".");
                }
                cells[i][j] = ((DslNumber)cell).value;
            }
        }
        return new DslMatrix(cells);
    }

    @Override
    public DslValue visitMatrixOpExpr(Expr.MatrixOp expr) {
        Token tok = expr.keyword;
        List<DslMatrix> operands = new ArrayList<>();
        for (Expr operand : expr.operands) {
            DslValue value = evaluate(operand);
            if (!(value instanceof DslMatrix)) {
                throw new RuntimeError(TYPE_MISMATCH, tok,
                        tok.lexeme + " expects matrix operands, got " + value.typeName() + ".");
            }
            operands.add((DslMatrix)value);
        }

        switch (tok.type) {
            case TRANSPOSE: return MatrixOps.transpose(operands.get(0));
            case INVERSE:   return MatrixOps.inverse(tok, operands.get(0));
            case MATMULT:   return MatrixOps.multiply(tok, operands.get(0), operands.get(1));
            case MATADD:    return MatrixOps.add(tok, operands.get(0), operands.get(1));
            case MATSUB:    return MatrixOps.subtract(tok, operands.get(0), operands.get(1));
            default:
                throw new IllegalStateException("unreachable: " + tok.type);
        }
    }

    @Override
    public DslValue visitCallExpr(Expr.Call expr) {
        if (expr.category == CallCategory.USER) {
            return callUserFunction(expr);
        }

        List<DslValue> args = new ArrayList<>();
        for (Expr arg : expr.args) {
            args.add(evaluate(arg));
        }
        if (expr.category == CallCategory.IO && expr.callee.type != TokenType.PRINT) {
            DslValue path = args.get(0);
            if (!(path instanceof DslString)) {
                throw new RuntimeError(TYPE_MISMATCH, expr.callee,
                        expr.callee.lexeme + " expects a string path, got " + path.typeName() + ".");
            }
        }

        try {
            DslValue result = dispatcher.dispatch(expr.category, expr.callee.lexeme, args);
            return result == null ? DslNone.NONE : result;
        } catch (DispatchError err) {
            throw new RuntimeError(DISPATCH_FAILURE, expr.callee,
                    expr.category.label() + "." + expr.callee.lexeme + " failed: " + err.getMessage(), err);
        }
    }

    private DslValue callUserFunction(Expr.Call expr) {
        Token callee = expr.callee;
        DslValue value = environment.lookup(callee.lexeme);
        if (value == null) {
            throw new RuntimeError(UNDEFINED_FUNCTION, callee,
                    "Undefined function '" + callee.lexeme + "'.");
        }
        if (!(value instanceof DslFunction)) {
            throw new RuntimeError(TYPE_MISMATCH, callee,
                    "'" + callee.lexeme + "' is a " + value.typeName() + ", not a function.");
        }
        List<DslValue> args = new ArrayList<>();
        for (Expr arg : expr.args) {
            args.add(evaluate(arg));
        }
        return ((DslFunction)value).call(this, args, callee);
    }

    boolean test(Condition cond) {
        DslValue left = evaluate(cond.left);
        if (cond.isTruthinessTest()) {
            return left.isTruthy();
        }
        DslValue right = evaluate(cond.right);
        Token op = cond.operator;
        switch (op.type) {
            case EQUAL_EQUAL: return left.equals(right);
            case BANG_EQUAL:  return !left.equals(right);
            default:
                break;
        }

        if (left instanceof DslNumber && right instanceof DslNumber) {
            double a = num(left);
            double b = num(right);
            switch (op.type) {
                case LESS:          return a < b;
                case LESS_EQUAL:    return a <= b;
                case GREATER:       return a > b;
                case GREATER_EQUAL: return a >= b;
                default:
                    throw new IllegalStateException("unreachable: " + op.type);
            }
        }
        if (left instanceof DslString && right instanceof DslString) {
            int cmp = ((DslString)left).value.compareTo(((DslString)right).value);
            switch (op.type) {
                case LESS:          return cmp < 0;
                case LESS_EQUAL:    return cmp <= 0;
                case GREATER:       return cmp > 0;
                case GREATER_EQUAL: return cmp >= 0;
                default:
                    throw new IllegalStateException("unreachable: " + op.type);
            }
        }
        throw new RuntimeError(TYPE_MISMATCH, op,
                "operands for '" + op.lexeme + "' must be two numbers or two strings, LHS=" +
                left.typeName() + ", RHS=" + right.typeName());
    }

    public DslValue evaluate(Expr expr) {
        return expr.accept(this);
    }

    private void execute(Stmt stmt) {
        stmt.accept(this);
    }

    // runs in the current frame, blocks do not open a scope
    void executeStmts(List<Stmt> stmts) {
        for (Stmt stmt : stmts) {
            execute(stmt);
        }
    }

    private static double num(DslValue value) {
        return ((DslNumber)value).value;
    }

    private double checkNumberOperand(Token operator, DslValue operand) {
        if (operand instanceof DslNumber) return num(operand);
        throw new RuntimeError(TYPE_MISMATCH, operator,
                "Operand of '" + operator.lexeme + "' must be a number, is: " + operand.typeName());
    }

    private void checkNumberOperands(Token operator, DslValue a, DslValue b) {
        if (a instanceof DslNumber && b instanceof DslNumber) return;
        throw new RuntimeError(TYPE_MISMATCH, operator,
                "Operands of '" + operator.lexeme + "' must be numbers, LHS=" +
                a.typeName() + ", RHS=" + b.typeName());
    }

    // stacktrace lines, most recent call first in list
    public List<String> stacktraceLines() {
        List<String> ret = new ArrayList<>();
        int i = stack.size() - 1;
        while (i >= 0) {
            ret.add(stack.get(i).toString());
            i--;
        }
        ret.add("<main>");
        return ret;
    }

    public void clearStack() {
        this.stack.clear();
    }
}
