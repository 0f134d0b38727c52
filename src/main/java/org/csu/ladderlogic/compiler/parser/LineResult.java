package org.csu.ladderlogic.compiler.parser;

/**
 * 单行处理结果:
 * <ul>
 *   <li>{@link Matched} 成功解析的逻辑行</li>
 *   <li>{@link NotApplicable} 空行、注释等不以 IF 开头的行, 直接忽略</li>
 *   <li>{@link Malformed} 以 IF 开头但无法解析的行, 附带原因</li>
 * </ul>
 */
public sealed interface LineResult permits LineResult.Matched, LineResult.NotApplicable, LineResult.Malformed {

    record Matched(ParsedLine line) implements LineResult {
    }

    record NotApplicable(String reason) implements LineResult {
    }

    record Malformed(String reason) implements LineResult {
    }
}
