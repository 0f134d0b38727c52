package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 逻辑非, 对应常闭触点
 */
public record NotNode(ExpressionNode operand) implements ExpressionNode {

    public NotNode {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public boolean containsOr() {
        return operand.containsOr();
    }

    @Override
    public String toString() {
        return "NOT(" + operand + ")";
    }
}
