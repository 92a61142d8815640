package com.mathsolver.parser;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Expression tree produced by {@link Parser}.
 *
 * Nodes are immutable and own their children exclusively. Every operation over the
 * tree implements {@link ExprVisitor}, which has one method per node kind, so an
 * operation that forgets a kind does not compile.
 */
public final class Expr {

    private Expr() {}

    public interface Node {
        <R> R accept(ExprVisitor<R> visitor);

        List<Node> children();

        SourcePosition position();
    }

    public interface ExprVisitor<R> {
        R visitNumber(NumberLiteral expr);
        R visitVariable(Variable expr);
        R visitBinary(Binary expr);
        R visitParenthesis(Parenthesis expr);
        R visitFunction(FunctionCall expr);
        R visitFactorial(Factorial expr);
        R visitIteration(Iteration expr);
    }

    public enum BinaryOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        EXPONENT("^");

        public final String symbol;

        BinaryOperator(String symbol) {
            this.symbol = symbol;
        }
    }

    public enum IterationKind {
        SUMMATION("sum"),
        PRODUCT("prod");

        public final String command;

        IterationKind(String command) {
            this.command = command;
        }
    }

    // -------------------------
    // Leaves
    // -------------------------

    public static final class NumberLiteral implements Node {
        public final BigDecimal value;
        private final SourcePosition position;

        public NumberLiteral(BigDecimal value, SourcePosition position) {
            this.value = value;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNumber(this);
        }

        @Override
        public List<Node> children() {
            return Collections.emptyList();
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    public static final class Variable implements Node {
        public final String name;
        private final SourcePosition position;

        public Variable(String name, SourcePosition position) {
            this.name = name;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }

        @Override
        public List<Node> children() {
            return Collections.emptyList();
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    // -------------------------
    // Composite nodes
    // -------------------------

    public static final class Binary implements Node {
        public final BinaryOperator operator;
        public final Node left;
        public final Node right;
        private final SourcePosition position;

        public Binary(BinaryOperator operator, Node left, Node right, SourcePosition position) {
            this.operator = operator;
            this.left = left;
            this.right = right;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }

        @Override
        public List<Node> children() {
            return List.of(left, right);
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    public static final class Parenthesis implements Node {
        public final Node inner;
        private final SourcePosition position;

        public Parenthesis(Node inner, SourcePosition position) {
            this.inner = inner;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitParenthesis(this);
        }

        @Override
        public List<Node> children() {
            return List.of(inner);
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    public static final class FunctionCall implements Node {
        public final String name;
        public final List<Node> arguments;
        private final SourcePosition position;

        public FunctionCall(String name, List<Node> arguments, SourcePosition position) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFunction(this);
        }

        @Override
        public List<Node> children() {
            return arguments;
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    public static final class Factorial implements Node {
        public final Node operand;
        private final SourcePosition position;

        public Factorial(Node operand, SourcePosition position) {
            this.operand = operand;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFactorial(this);
        }

        @Override
        public List<Node> children() {
            return List.of(operand);
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }

    /** \sum or \prod over an inclusive integer range, binding {@code variable} for each term. */
    public static final class Iteration implements Node {
        public final IterationKind kind;
        public final String variable;
        public final Node start;
        public final Node end;
        public final Node body;
        private final SourcePosition position;

        public Iteration(IterationKind kind, String variable, Node start, Node end, Node body, SourcePosition position) {
            this.kind = kind;
            this.variable = variable;
            this.start = start;
            this.end = end;
            this.body = body;
            this.position = position;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIteration(this);
        }

        @Override
        public List<Node> children() {
            return List.of(start, end, body);
        }

        @Override
        public SourcePosition position() {
            return position;
        }
    }
}
