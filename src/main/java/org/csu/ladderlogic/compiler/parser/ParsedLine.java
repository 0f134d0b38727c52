package org.csu.ladderlogic.compiler.parser;

import org.csu.ladderlogic.compiler.parser.ast.ExpressionNode;
import org.csu.ladderlogic.compiler.parser.ast.RungOutput;

import java.util.List;
import java.util.Objects;

/**
 * 一行逻辑描述的解析结果: 条件表达式 + THEN 之后的输出列表。
 * 输出要么是单个定时器/计数器, 要么是一个或多个普通线圈, 不会混合出现。
 */
public record ParsedLine(ExpressionNode condition, List<RungOutput> outputs) {

    public ParsedLine {
        Objects.requireNonNull(condition, "condition");
        outputs = List.copyOf(outputs);
    }
}
