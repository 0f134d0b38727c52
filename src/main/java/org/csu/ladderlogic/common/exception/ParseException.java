package org.csu.ladderlogic.common.exception;

import org.csu.ladderlogic.compiler.lexer.Token;

/**
 * @author hidyouth
 * @description: 条件表达式的语法错误 (括号不匹配、多余的Token、空表达式等)。
 */
public class ParseException extends RuntimeException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String expected) {
        super(String.format("Syntax Error at column %d: Expected %s, but found '%s' (%s)",
                token.column(),
                expected,
                token.lexeme(),
                token.type()));
    }
}
