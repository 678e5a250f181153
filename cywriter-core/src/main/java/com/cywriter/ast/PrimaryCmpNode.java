package com.cywriter.ast;

import java.util.List;

/**
 * Comparison chain {@code a < b <= c}. Each {@link Comparison} compares the previous operand
 * (initially {@code operand1}) with its own operand.
 */
public record PrimaryCmpNode(
    ExprNode operand1,
    List<Comparison> comparisons
) implements ExprNode {
    public PrimaryCmpNode {
        comparisons = List.copyOf(comparisons);
    }

    public PrimaryCmpNode(ExprNode operand1, String operator, ExprNode operand2) {
        this(operand1, List.of(new Comparison(operator, operand2)));
    }

    @Override
    public String type() {
        return "PrimaryCmpNode";
    }

    @Override
    public void accept(TreeVisitor visitor) {
        visitor.visitPrimaryCmp(this);
    }

    public record Comparison(String operator, ExprNode operand) {}
}
