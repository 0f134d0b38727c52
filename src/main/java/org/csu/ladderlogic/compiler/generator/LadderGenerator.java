package org.csu.ladderlogic.compiler.generator;

import org.csu.ladderlogic.common.exception.LadderGenerationException;
import org.csu.ladderlogic.compiler.parser.ast.CoilOutput;
import org.csu.ladderlogic.compiler.parser.ast.CounterNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionNode;
import org.csu.ladderlogic.compiler.parser.ast.OrNode;
import org.csu.ladderlogic.compiler.parser.ast.RungOutput;
import org.csu.ladderlogic.compiler.parser.ast.TimerNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * @author hidyouth
 * @description: 梯形图生成器: 把一行的条件 AST 和输出列表转换为梯级文本。
 * <p>
 * 顶层 OR 拆分为多条并列梯级, 共用同一组输出。
 * 嵌套在 AND / NOT 之下的 OR 先展开为析取范式再逐项生成;
 * 关闭展开时则直接报错, 不会再产生空梯级。
 */
public class LadderGenerator {

    public static final int DEFAULT_MAX_RUNGS_PER_LINE = 64;

    static final String RUNG_COMMENT = "// Rung";
    static final String LEFT_RAIL = "|----";
    static final String COIL_AND_RIGHT_RAIL = "----( )----|";
    static final String INDENT = "     ";

    private final ContactRenderer contactRenderer = new ContactRenderer();
    private final DnfNormalizer dnfNormalizer;
    private final boolean expandNestedOr;

    public LadderGenerator() {
        this(true, DEFAULT_MAX_RUNGS_PER_LINE);
    }

    public LadderGenerator(boolean expandNestedOr, int maxRungsPerLine) {
        this.expandNestedOr = expandNestedOr;
        this.dnfNormalizer = new DnfNormalizer(maxRungsPerLine);
    }

    /**
     * 生成一行对应的全部梯级文本, 多条梯级之间以空行分隔
     */
    public String generate(ExpressionNode condition, List<RungOutput> outputs, Platform platform) {
        return String.join("\n", generateRungs(condition, outputs, platform));
    }

    public String generate(ExpressionNode condition, List<RungOutput> outputs, String platformId) {
        return generate(condition, outputs, Platform.fromId(platformId));
    }

    /**
     * 生成梯级列表, 每个元素是一条完整的梯级 (以空行结尾)
     */
    public List<String> generateRungs(ExpressionNode condition, List<RungOutput> outputs, Platform platform) {
        List<String> rungs = new ArrayList<>();
        for (ExpressionNode term : splitIntoTerms(condition)) {
            renderRung(term, outputs, platform).ifPresent(rungs::add);
        }
        return rungs;
    }

    private List<ExpressionNode> splitIntoTerms(ExpressionNode condition) {
        if (expandNestedOr) {
            return dnfNormalizer.normalize(condition);
        }
        List<ExpressionNode> terms = new ArrayList<>();
        collectTopLevelTerms(condition, terms);
        return terms;
    }

    private void collectTopLevelTerms(ExpressionNode node, List<ExpressionNode> terms) {
        if (node instanceof OrNode or) {
            collectTopLevelTerms(or.left(), terms);
            collectTopLevelTerms(or.right(), terms);
            return;
        }
        if (node.containsOr()) {
            throw new LadderGenerationException(
                    "OR nested inside AND/NOT is not supported when nested-OR expansion is disabled: " + node);
        }
        terms.add(node);
    }

    private Optional<String> renderRung(ExpressionNode term, List<RungOutput> outputs, Platform platform) {
        Optional<String> body = term.accept(contactRenderer);
        if (body.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder rung = new StringBuilder();
        rung.append(RUNG_COMMENT).append('\n');
        rung.append(LEFT_RAIL).append(body.get()).append(COIL_AND_RIGHT_RAIL).append('\n');

        List<String> coils = outputs.stream()
                .filter(CoilOutput.class::isInstance)
                .map(output -> ((CoilOutput) output).name())
                .collect(Collectors.toList());
        if (!coils.isEmpty()) {
            rung.append(INDENT).append(String.join(", ", coils)).append('\n');
        }
        for (RungOutput output : outputs) {
            if (output instanceof TimerNode timer) {
                rung.append(INDENT).append(platform.formatTimer(timer)).append('\n');
            } else if (output instanceof CounterNode counter) {
                rung.append(INDENT).append(platform.formatCounter(counter)).append('\n');
            }
        }
        rung.append('\n');
        return Optional.of(rung.toString());
    }
}
