package org.csu.ladderlogic.compiler.parser.ast;

/**
 * 功能块类型: 定时器和计数器
 */
public enum BlockType {
    TON(true),
    TOF(true),
    CTU(false),
    CTD(false);

    private final boolean timer;

    BlockType(boolean timer) {
        this.timer = timer;
    }

    public boolean isTimer() {
        return timer;
    }
}
