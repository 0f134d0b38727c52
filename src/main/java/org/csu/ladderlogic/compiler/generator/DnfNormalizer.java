package org.csu.ladderlogic.compiler.generator;

import org.csu.ladderlogic.common.exception.LadderGenerationException;
import org.csu.ladderlogic.compiler.parser.ast.AndNode;
import org.csu.ladderlogic.compiler.parser.ast.ComparisonNode;
import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionVisitor;
import org.csu.ladderlogic.compiler.parser.ast.NotNode;
import org.csu.ladderlogic.compiler.parser.ast.OrNode;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;
import org.csu.ladderlogic.compiler.parser.ast.VariableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 把条件表达式展开为析取范式 (DNF): 返回若干不含 OR 的项, 每一项对应一条梯级。
 * <p>
 * 不含 OR 的子树原样保留; NOT 作用在含 OR 的子树上时按德摩根定律向内推。
 */
public class DnfNormalizer implements ExpressionVisitor<List<ExpressionNode>> {

    private final int maxTerms;

    public DnfNormalizer(int maxTerms) {
        if (maxTerms < 1) {
            throw new IllegalArgumentException("maxTerms must be positive: " + maxTerms);
        }
        this.maxTerms = maxTerms;
    }

    public List<ExpressionNode> normalize(ExpressionNode expression) {
        return expression.accept(this);
    }

    @Override
    public List<ExpressionNode> visitOr(OrNode node) {
        List<ExpressionNode> terms = new ArrayList<>(node.left().accept(this));
        terms.addAll(node.right().accept(this));
        return checkSize(terms);
    }

    @Override
    public List<ExpressionNode> visitAnd(AndNode node) {
        if (!node.containsOr()) {
            return List.of(node);
        }
        List<ExpressionNode> leftTerms = node.left().accept(this);
        List<ExpressionNode> rightTerms = node.right().accept(this);
        checkSize((long) leftTerms.size() * rightTerms.size());
        List<ExpressionNode> terms = new ArrayList<>();
        for (ExpressionNode left : leftTerms) {
            for (ExpressionNode right : rightTerms) {
                terms.add(new AndNode(left, right));
            }
        }
        return terms;
    }

    @Override
    public List<ExpressionNode> visitNot(NotNode node) {
        ExpressionNode operand = node.operand();
        if (!operand.containsOr()) {
            return List.of(node);
        }
        if (operand instanceof OrNode or) {
            return new AndNode(new NotNode(or.left()), new NotNode(or.right())).accept(this);
        }
        if (operand instanceof AndNode and) {
            return new OrNode(new NotNode(and.left()), new NotNode(and.right())).accept(this);
        }
        if (operand instanceof NotNode not) {
            return not.operand().accept(this);
        }
        throw new LadderGenerationException("Cannot negate expression: " + operand);
    }

    @Override
    public List<ExpressionNode> visitVariable(VariableNode node) {
        return List.of(node);
    }

    @Override
    public List<ExpressionNode> visitComparison(ComparisonNode node) {
        return List.of(node);
    }

    @Override
    public List<ExpressionNode> visitTimer(TimerNode node) {
        return List.of(node);
    }

    @Override
    public List<ExpressionNode> visitCounter(CounterNode node) {
        return List.of(node);
    }

    private List<ExpressionNode> checkSize(List<ExpressionNode> terms) {
        checkSize(terms.size());
        return terms;
    }

    private void checkSize(long size) {
        if (size > maxTerms) {
            throw new LadderGenerationException(
                    "Condition expands to " + size + " rungs, more than the limit of " + maxTerms);
        }
    }
}
