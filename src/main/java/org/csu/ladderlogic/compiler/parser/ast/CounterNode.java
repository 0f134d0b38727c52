package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 计数器输出 (CTU / CTD)
 *
 * @param type 计数器类型
 * @param name 计数器名称
 * @param preset 整数预设值
 */
public record CounterNode(BlockType type, String name, String preset) implements ExpressionNode, RungOutput {

    public CounterNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(preset, "preset");
        if (type.isTimer()) {
            throw new IllegalArgumentException("Not a counter type: " + type);
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCounter(this);
    }

    @Override
    public String toString() {
        return type + " " + name + ", " + preset;
    }
}
