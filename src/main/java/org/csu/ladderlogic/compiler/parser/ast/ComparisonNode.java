package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 比较表达式 (e.g., Temp > 50), 作为一个整体的触点渲染
 *
 * @param left 左操作数, 总是一个标识符
 * @param operator 比较运算符的原始文本
 * @param right 右操作数, 标识符或数字
 */
public record ComparisonNode(String left, String operator, String right) implements ExpressionNode {

    public ComparisonNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
