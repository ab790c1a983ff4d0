package io.surfworks.yovec.testing;

import io.surfworks.yovec.ast.NodeKind;
import io.surfworks.yovec.ast.SyntaxNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes YOLOL output trees over doubles, line by line, statement by statement.
 *
 * <p>Reading a variable that was never assigned or supplied fails the test instead
 * of defaulting to zero, so lowering bugs show up as errors.
 */
public final class ProgramEvaluator {

    private final Map<String, Double> variables = new HashMap<>();
    private final Map<String, Double> externals = new HashMap<>();

    public ProgramEvaluator withVariable(String name, double value) {
        variables.put(name, value);
        return this;
    }

    public ProgramEvaluator withExternal(String text, double value) {
        externals.put(text, value);
        return this;
    }

    public Map<String, Double> run(SyntaxNode program) {
        if (program.kind() != NodeKind.PROGRAM) {
            throw new IllegalArgumentException("not a program: " + program.kind());
        }
        for (SyntaxNode line : program.children()) {
            runStatements(line.child(0).children());
        }
        return variables;
    }

    public Map<String, Double> runStatements(List<SyntaxNode> statements) {
        for (SyntaxNode assignment : statements) {
            if (assignment.kind() != NodeKind.ASSIGNMENT) {
                throw new IllegalArgumentException("not an assignment: " + assignment.kind());
            }
            variables.put(assignment.child(0).value(), eval(assignment.child(1)));
        }
        return variables;
    }

    public double eval(SyntaxNode expr) {
        switch (expr.kind()) {
            case NUMBER:
                return Double.parseDouble(expr.value());
            case VARIABLE:
                return read(variables, expr.value());
            case EXTERNAL:
                return read(externals, expr.value());
            case UNARY_OP:
                return unary(expr.value(), eval(expr.child(0)));
            case BINARY_OP:
                return binary(expr.value(), eval(expr.child(0)), eval(expr.child(1)));
            default:
                throw new IllegalArgumentException("not an expression: " + expr.kind());
        }
    }

    private static double read(Map<String, Double> scope, String name) {
        Double value = scope.get(name);
        if (value == null) {
            throw new IllegalStateException("read of unassigned name: " + name);
        }
        return value;
    }

    private static double unary(String op, double x) {
        return switch (op) {
            case "-" -> -x;
            case "not" -> x == 0 ? 1 : 0;
            case "abs" -> Math.abs(x);
            case "sqrt" -> Math.sqrt(x);
            case "sin" -> Math.sin(Math.toRadians(x));
            case "cos" -> Math.cos(Math.toRadians(x));
            case "tan" -> Math.tan(Math.toRadians(x));
            case "asin" -> Math.toDegrees(Math.asin(x));
            case "acos" -> Math.toDegrees(Math.acos(x));
            case "atan" -> Math.toDegrees(Math.atan(x));
            case "!" -> factorial(x);
            default -> throw new IllegalArgumentException("unknown unary op: " + op);
        };
    }

    private static double binary(String op, double a, double b) {
        return switch (op) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            case "/" -> a / b;
            case "%" -> a % b;
            case "^" -> Math.pow(a, b);
            case "==" -> a == b ? 1 : 0;
            case "!=" -> a != b ? 1 : 0;
            case "<" -> a < b ? 1 : 0;
            case "<=" -> a <= b ? 1 : 0;
            case ">" -> a > b ? 1 : 0;
            case ">=" -> a >= b ? 1 : 0;
            case "and" -> (a != 0 && b != 0) ? 1 : 0;
            case "or" -> (a != 0 || b != 0) ? 1 : 0;
            default -> throw new IllegalArgumentException("unknown binary op: " + op);
        };
    }

    private static double factorial(double x) {
        double result = 1;
        for (int i = 2; i <= (int) x; i++) {
            result *= i;
        }
        return result;
    }
}
