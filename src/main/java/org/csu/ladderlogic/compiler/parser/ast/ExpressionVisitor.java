package org.csu.ladderlogic.compiler.parser.ast;

/**
 * @author hidyouth
 * @description: 对 {@link ExpressionNode} 七种节点的访问者。新增节点类型时编译器会强制所有访问者补全处理。
 */
public interface ExpressionVisitor<R> {

    R visitAnd(AndNode node);

    R visitOr(OrNode node);

    R visitNot(NotNode node);

    R visitVariable(VariableNode node);

    R visitComparison(ComparisonNode node);

    R visitTimer(TimerNode node);

    R visitCounter(CounterNode node);
}
