package org.csu.ladderlogic.compiler.lexer;

/**
 * @author hidyouth
 * @description: @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param column 在条件表达式中的列号, 从1开始
 */
public record Token(TokenType type, String lexeme, int column) {

    public boolean isComparisonOperator() {
        return type.isComparison();
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-13s, Lexeme='%s', Column=%d]", type, lexeme, column);
    }
}
