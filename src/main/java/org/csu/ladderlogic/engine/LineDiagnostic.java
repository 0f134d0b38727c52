package org.csu.ladderlogic.engine;

/**
 * 一条被跳过的输入行
 *
 * @param lineNumber 行号, 从1开始
 * @param line 原始文本
 * @param reason 跳过原因
 */
public record LineDiagnostic(int lineNumber, String line, String reason) {

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + reason;
    }
}
