package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 布尔变量 (输入点、内部继电器等)
 */
public record VariableNode(String name) implements ExpressionNode {

    public VariableNode {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
