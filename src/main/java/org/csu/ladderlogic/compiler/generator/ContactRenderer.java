package org.csu.ladderlogic.compiler.generator;

import org.csu.ladderlogic.compiler.parser.ast.AndNode;
import org.csu.ladderlogic.compiler.parser.ast.ComparisonNode;
import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionVisitor;
import org.csu.ladderlogic.compiler.parser.ast.NotNode;
import org.csu.ladderlogic.compiler.parser.ast.OrNode;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;
import org.csu.ladderlogic.compiler.parser.ast.VariableNode;

import java.util.Optional;

/**
 * @author hidyouth
 * @description: 把不含 OR 的条件表达式渲染成一条梯级上串联的触点。
 * 返回 {@link Optional#empty()} 表示该表达式无法在一条梯级内表示。
 */
public class ContactRenderer implements ExpressionVisitor<Optional<String>> {

    static final String NORMALLY_OPEN = "[ ] ";
    static final String NORMALLY_CLOSED = "[/] ";
    static final String SERIES = "----";

    @Override
    public Optional<String> visitAnd(AndNode node) {
        Optional<String> left = node.left().accept(this);
        Optional<String> right = node.right().accept(this);
        if (left.isEmpty() || right.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(left.get() + SERIES + right.get());
    }

    @Override
    public Optional<String> visitOr(OrNode node) {
        // OR 只能拆成多条梯级, 由 LadderGenerator 处理
        return Optional.empty();
    }

    @Override
    public Optional<String> visitNot(NotNode node) {
        return node.operand().accept(this).map(child -> NORMALLY_CLOSED + child);
    }

    @Override
    public Optional<String> visitVariable(VariableNode node) {
        return Optional.of(NORMALLY_OPEN + node.name());
    }

    @Override
    public Optional<String> visitComparison(ComparisonNode node) {
        return Optional.of(NORMALLY_OPEN + node.left() + " " + node.operator() + " " + node.right());
    }

    @Override
    public Optional<String> visitTimer(TimerNode node) {
        return Optional.empty();
    }

    @Override
    public Optional<String> visitCounter(CounterNode node) {
        return Optional.empty();
    }
}
