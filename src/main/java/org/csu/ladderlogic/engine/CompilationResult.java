package org.csu.ladderlogic.engine;

import java.util.List;

/**
 * 一次完整转换的结果: 生成的梯形图文本、生成的梯级数, 以及被跳过的错误行。
 */
public record CompilationResult(String text, int rungCount, List<LineDiagnostic> diagnostics) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }
}
