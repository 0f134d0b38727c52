package org.csu.ladderlogic.compiler.lexer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @author hidyouth
 * @description: 词法分析器
 *
 * 负责将 IF 与 THEN 之间的条件表达式分解为一系列Token。
 * 无法识别的字符会被直接跳过, 不产生Token也不报错。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置

    // 关键字映射表, 区分大小写
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("AND", TokenType.AND);
        keywords.put("OR", TokenType.OR);
        keywords.put("NOT", TokenType.NOT);
        keywords.put("TON", TokenType.TON);
        keywords.put("TOF", TokenType.TOF);
        keywords.put("CTU", TokenType.CTU);
        keywords.put("CTD", TokenType.CTD);
    }

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * 执行词法分析并返回所有Token, 最后一个总是 EOF
     * @return Token列表
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        while (true) {
            skipWhitespace();

            if (position >= input.length()) {
                return new Token(TokenType.EOF, "", position + 1);
            }

            char currentChar = peek();

            if (isLetter(currentChar)) {
                return readIdentifierOrKeyword();
            }
            if (isDigit(currentChar)) {
                return readNumber();
            }

            switch (currentChar) {
                case '(':
                    return consumeAndReturn(TokenType.LPAREN, "(");
                case ')':
                    return consumeAndReturn(TokenType.RPAREN, ")");
                case ',':
                    return consumeAndReturn(TokenType.COMMA, ",");
                case '>':
                    if (peekNext() == '=') {
                        return consumeAndReturn(TokenType.GREATER_EQUAL, ">=");
                    }
                    return consumeAndReturn(TokenType.GREATER, ">");
                case '<':
                    if (peekNext() == '=') {
                        return consumeAndReturn(TokenType.LESS_EQUAL, "<=");
                    }
                    return consumeAndReturn(TokenType.LESS, "<");
                case '=':
                    if (peekNext() == '=') {
                        return consumeAndReturn(TokenType.EQUAL, "==");
                    }
                    break;
                case '!':
                    if (peekNext() == '=') {
                        return consumeAndReturn(TokenType.NOT_EQUAL, "!=");
                    }
                    break;
                default:
                    break;
            }
            // 无法识别的字符: 跳过后继续扫描
            advance();
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, startPos + 1);
    }

    private Token readNumber() {
        int startPos = position;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
        }
        // 时间单位后缀 ms / s, 后面不能紧跟标识符字符
        if (peek() == 'm' && peekNext() == 's' && !isLetterOrDigit(peekAt(2))) {
            advance();
            advance();
        } else if (peek() == 's' && !isLetterOrDigit(peekNext())) {
            advance();
        }
        return new Token(TokenType.NUMBER, input.substring(startPos, position), startPos + 1);
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            advance();
        }
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (position + offset >= input.length()) return '\0';
        return input.charAt(position + offset);
    }

    private void advance() {
        position++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, position + 1);
        position += lexeme.length();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
