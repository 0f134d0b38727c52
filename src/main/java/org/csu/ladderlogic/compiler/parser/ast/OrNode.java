package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 逻辑或, 生成时拆分为多条并列的梯级
 */
public record OrNode(ExpressionNode left, ExpressionNode right) implements ExpressionNode {

    public OrNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitOr(this);
    }

    @Override
    public boolean containsOr() {
        return true;
    }

    @Override
    public String toString() {
        return "(" + left + " OR " + right + ")";
    }
}
