package org.csu.ladderlogic.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 定时器输出 (TON / TOF)
 *
 * @param type 定时器类型
 * @param name 定时器名称
 * @param preset 带单位的时间参数, e.g., 5s, 500ms
 */
public record TimerNode(BlockType type, String name, String preset) implements ExpressionNode, RungOutput {

    public TimerNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(preset, "preset");
        if (!type.isTimer()) {
            throw new IllegalArgumentException("Not a timer type: " + type);
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTimer(this);
    }

    @Override
    public String toString() {
        return type + " " + name + ", " + preset;
    }
}
