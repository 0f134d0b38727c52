package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * 普通输出线圈, 名称保留去除首尾空白后的原文 (可以为空字符串)
 */
public record CoilOutput(String name) implements RungOutput {

    public CoilOutput {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
