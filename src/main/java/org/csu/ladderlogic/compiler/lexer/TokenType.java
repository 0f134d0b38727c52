package org.csu.ladderlogic.compiler.lexer;

/**
 * @author hidyouth
 * @description: 条件表达式中所有可能出现的"单词"的分类。
 */
public enum TokenType {
    // ---- 逻辑关键字 ----
    AND,        // "AND"
    OR,         // "OR"
    NOT,        // "NOT"

    // ---- 定时器 / 计数器关键字 ----
    TON,        // 通电延时定时器
    TOF,        // 断电延时定时器
    CTU,        // 加计数器
    CTD,        // 减计数器

    // ---- 标识符 ----
    IDENTIFIER, // 变量、定时器、计数器名称

    // ---- 常量 ----
    NUMBER,     // 123, 1.5, 500ms, 5s

    // ---- 比较运算符 ----
    EQUAL(true),         // ==
    NOT_EQUAL(true),     // !=
    GREATER(true),       // >
    LESS(true),          // <
    GREATER_EQUAL(true), // >=
    LESS_EQUAL(true),    // <=

    // ---- 分隔符 ----
    COMMA,      // ,
    LPAREN,     // (
    RPAREN,     // )

    EOF;        // 输入结束

    private final boolean comparison;

    TokenType() {
        this(false);
    }

    TokenType(boolean comparison) {
        this.comparison = comparison;
    }

    public boolean isComparison() {
        return comparison;
    }
}
