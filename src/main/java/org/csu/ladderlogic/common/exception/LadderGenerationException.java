package org.csu.ladderlogic.common.exception;

/**
 * @author hidyouth
 * @description: 梯形图生成阶段的异常: 表达式无法展开成合法的梯级。
 */
public class LadderGenerationException extends RuntimeException {
    public LadderGenerationException(String message) {
        super(message);
    }
}
