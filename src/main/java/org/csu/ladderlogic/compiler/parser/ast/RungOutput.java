package org.csu.ladderlogic.compiler.parser.ast;

/**
 * THEN 之后的一个输出: 普通线圈, 或者一个定时器/计数器功能块。
 */
public sealed interface RungOutput permits CoilOutput, TimerNode, CounterNode {
}
