package org.csu.ladderlogic.engine;

import org.csu.ladderlogic.common.exception.LadderGenerationException;
import org.csu.ladderlogic.compiler.generator.LadderGenerator;
import org.csu.ladderlogic.compiler.generator.Platform;
import org.csu.ladderlogic.compiler.parser.LineResult;
import org.csu.ladderlogic.compiler.parser.LogicLineParser;
import org.csu.ladderlogic.compiler.parser.ParsedLine;
import org.csu.ladderlogic.config.LadderProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 转换引擎: 逐行执行 拆分 -> 词法分析 -> 语法分析 -> 生成, 按输入顺序拼接输出。
 * 行与行之间没有共享状态; 无法解析的行不进入输出, 记录在诊断列表中。
 */
@Component
public class LadderCompiler {

    private final LogicLineParser lineParser = new LogicLineParser();
    private final LadderGenerator generator;

    public LadderCompiler(LadderProperties properties) {
        this.generator = new LadderGenerator(properties.isExpandNestedOr(), properties.getMaxRungsPerLine());
    }

    public CompilationResult compile(List<String> lines, Platform platform) {
        StringBuilder text = new StringBuilder();
        List<LineDiagnostic> diagnostics = new ArrayList<>();
        int rungCount = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            LineResult result = lineParser.parseLine(line);

            if (result instanceof LineResult.Malformed malformed) {
                diagnostics.add(new LineDiagnostic(i + 1, line, malformed.reason()));
            } else if (result instanceof LineResult.Matched matched) {
                ParsedLine parsed = matched.line();
                try {
                    List<String> rungs = generator.generateRungs(parsed.condition(), parsed.outputs(), platform);
                    text.append(String.join("\n", rungs));
                    rungCount += rungs.size();
                } catch (LadderGenerationException e) {
                    diagnostics.add(new LineDiagnostic(i + 1, line, e.getMessage()));
                }
            }
        }
        return new CompilationResult(text.toString(), rungCount, diagnostics);
    }

    public CompilationResult compile(String source, Platform platform) {
        return compile(source.lines().toList(), platform);
    }
}
