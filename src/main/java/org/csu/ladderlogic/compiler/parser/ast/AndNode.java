package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 逻辑与, 在梯级中表现为触点串联
 */
public record AndNode(ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public AndNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }

    @Override
    public boolean containsOr() {
        return left.containsOr() || right.containsOr();
    }

    @Override
    public String toString() {
        return "(" + left + " AND " + right + ")";
    }
}
