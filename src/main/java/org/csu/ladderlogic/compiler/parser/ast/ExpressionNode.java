package org.csu.ladderlogic.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 条件表达式 AST 的根类型。
 * 七种节点构成封闭的集合, 每个实现都是不可变的 record, 子节点非空且只属于一个父节点。
 * 各节点的 toString() 输出可被重新词法分析和解析的文本形式。
 */
public sealed interface ExpressionNode
        permits AndNode, OrNode, NotNode, VariableNode, ComparisonNode, TimerNode, CounterNode {

    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * 子树中是否存在 OR 节点
     */
    default boolean containsOr() {
        return false;
    }
}
