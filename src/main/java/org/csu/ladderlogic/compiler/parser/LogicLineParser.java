package org.csu.ladderlogic.compiler.parser;

import org.csu.ladderlogic.common.exception.ParseException;
import org.csu.ladderlogic.compiler.lexer.Lexer;
import org.csu.ladderlogic.compiler.parser.ast.BlockType;
import org.csu.ladderlogic.compiler.parser.ast.CoilOutput;
import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionNode;
import org.csu.ladderlogic.compiler.parser.ast.RungOutput;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * @author hidyouth
 * @description: 行拆分器: 把一行 "IF 条件 THEN 输出" 拆成条件表达式和输出部分,
 * 并判断输出部分是定时器、计数器还是普通输出列表。
 */
public class LogicLineParser {

    private static final Pattern IF_PREFIX = Pattern.compile("^IF(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);
    private static final Pattern THEN_KEYWORD = Pattern.compile("(?<![A-Za-z0-9_])THEN(?![A-Za-z0-9_])", Pattern.CASE_INSENSITIVE);

    // 只匹配前缀, 与输出列表语法互斥
    private static final Pattern TIMER_SPEC = Pattern.compile("(TON|TOF)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*,\\s*([0-9]+(?:ms|s))");
    private static final Pattern COUNTER_SPEC = Pattern.compile("(CTU|CTD)\\s+([A-Za-z_][A-Za-z0-9_]*)\\s*,\\s*([0-9]+)");

    /**
     * 解析一行输入
     * @param rawLine 原始文本行
     * @return 解析结果, 永不抛出语法异常
     */
    public LineResult parseLine(String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return new LineResult.NotApplicable("blank line");
        }
        if (!IF_PREFIX.matcher(line).find()) {
            return new LineResult.NotApplicable("line does not start with IF");
        }

        String remainder = line.substring(2);
        Matcher then = THEN_KEYWORD.matcher(remainder);
        if (!then.find()) {
            return new LineResult.Malformed("missing THEN");
        }
        String conditionPart = remainder.substring(0, then.start()).trim();
        String consequencePart = remainder.substring(then.end()).trim();

        try {
            ExpressionNode condition = parseCondition(conditionPart);
            List<RungOutput> outputs = classifyConsequence(consequencePart);
            return new LineResult.Matched(new ParsedLine(condition, outputs));
        } catch (ParseException e) {
            return new LineResult.Malformed(e.getMessage());
        }
    }

    /**
     * 原始的"静默丢弃"接口: 只有成功解析的行才有值
     */
    public Optional<ParsedLine> parseLogicLine(String rawLine) {
        if (parseLine(rawLine) instanceof LineResult.Matched matched) {
            return Optional.of(matched.line());
        }
        return Optional.empty();
    }

    public ExpressionNode parseCondition(String condition) {
        Lexer lexer = new Lexer(condition);
        Parser parser = new Parser(lexer.tokenize());
        return parser.parse();
    }

    List<RungOutput> classifyConsequence(String consequence) {
        Matcher timer = TIMER_SPEC.matcher(consequence);
        if (timer.lookingAt()) {
            return List.of(new TimerNode(BlockType.valueOf(timer.group(1)), timer.group(2), timer.group(3)));
        }
        Matcher counter = COUNTER_SPEC.matcher(consequence);
        if (counter.lookingAt()) {
            return List.of(new CounterNode(BlockType.valueOf(counter.group(1)), counter.group(2), counter.group(3)));
        }
        List<RungOutput> outputs = new ArrayList<>();
        for (String name : consequence.split(",", -1)) {
            outputs.add(new CoilOutput(name.trim()));
        }
        return outputs;
    }
}
