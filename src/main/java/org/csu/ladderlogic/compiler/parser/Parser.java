package org.csu.ladderlogic.compiler.parser;

import org.csu.ladderlogic.common.exception.ParseException;
import org.csu.ladderlogic.compiler.lexer.Token;
import org.csu.ladderlogic.compiler.lexer.TokenType;
import org.csu.ladderlogic.compiler.parser.ast.AndNode;
import org.csu.ladderlogic.compiler.parser.ast.ComparisonNode;
import org.csu.ladderlogic.compiler.parser.ast.ExpressionNode;
import org.csu.ladderlogic.compiler.parser.ast.NotNode;
import org.csu.ladderlogic.compiler.parser.ast.OrNode;
import org.csu.ladderlogic.compiler.parser.ast.VariableNode;

import java.util.ArrayList;
import java.util.List;

/**
 * @author hidyouth
 * @description: 条件表达式的语法分析器
 * 采用递归下降法, 将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * expr       := or_expr
 * or_expr    := and_expr (OR and_expr)*
 * and_expr   := not_expr (AND not_expr)*
 * not_expr   := NOT not_expr | atom
 * atom       := '(' expr ')' | comparison | IDENT
 * comparison := IDENT CMP_OP (IDENT | NUMBER)
 * </pre>
 *
 * NOT、括号的嵌套层数与 AND/OR 运算符个数之和不得超过 {@link #MAX_NESTING_DEPTH},
 * 以保证 AST 的高度有界, 后续的递归遍历不会栈溢出。
 */
public class Parser {

    public static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private int position = 0;
    // 当前 NOT / 括号的嵌套层数
    private int nesting = 0;
    // 已消费的 AND / OR 运算符个数, 左结合链的高度随之增长
    private int binaryOperators = 0;

    public Parser(List<Token> tokens) {
        List<Token> copy = new ArrayList<>(tokens);
        if (copy.isEmpty() || copy.get(copy.size() - 1).type() != TokenType.EOF) {
            int column = copy.isEmpty() ? 1 : copy.get(copy.size() - 1).column() + 1;
            copy.add(new Token(TokenType.EOF, "", column));
        }
        this.tokens = copy;
    }

    public ExpressionNode parse() {
        if (isAtEnd()) {
            throw new ParseException("Empty expression: a condition is required between IF and THEN");
        }

        ExpressionNode expression = parseExpression();

        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of expression (unexpected tokens at end)");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        return parseOrExpression();
    }

    private ExpressionNode parseOrExpression() {
        ExpressionNode left = parseAndExpression();
        while (match(TokenType.OR)) {
            countBinaryOperator();
            ExpressionNode right = parseAndExpression();
            left = new OrNode(left, right);
        }
        return left;
    }

    private ExpressionNode parseAndExpression() {
        ExpressionNode left = parseNotExpression();
        while (match(TokenType.AND)) {
            countBinaryOperator();
            ExpressionNode right = parseNotExpression();
            left = new AndNode(left, right);
        }
        return left;
    }

    private ExpressionNode parseNotExpression() {
        if (match(TokenType.NOT)) {
            enterNesting();
            ExpressionNode operand = parseNotExpression();
            nesting--;
            return new NotNode(operand);
        }
        return parseAtom();
    }

    private ExpressionNode parseAtom() {
        if (match(TokenType.LPAREN)) {
            enterNesting();
            ExpressionNode expr = parseExpression();
            if (!check(TokenType.RPAREN)) {
                throw new ParseException(peek(), "')' (mismatched parentheses)");
            }
            advance();
            nesting--;
            return expr;
        }
        if (check(TokenType.IDENTIFIER)) {
            Token identifier = advance();
            // 向前看一个Token: 标识符后紧跟比较运算符时整体作为一个比较触点
            if (peek().isComparisonOperator()) {
                Token operator = advance();
                Token right = consumeOperand("identifier or number after '" + operator.lexeme() + "'");
                return new ComparisonNode(identifier.lexeme(), operator.lexeme(), right.lexeme());
            }
            return new VariableNode(identifier.lexeme());
        }
        throw new ParseException(peek(), "an operand (a variable, a comparison, or '(')");
    }

    private void enterNesting() {
        nesting++;
        checkDepth();
    }

    private void countBinaryOperator() {
        binaryOperators++;
        checkDepth();
    }

    private void checkDepth() {
        if (nesting + binaryOperators > MAX_NESTING_DEPTH) {
            throw new ParseException(String.format(
                    "Syntax Error at column %d: expression nested too deeply (more than %d levels of NOT, parentheses and AND/OR)",
                    previous().column(), MAX_NESTING_DEPTH));
        }
    }

    private Token consumeOperand(String message) {
        if (check(TokenType.IDENTIFIER) || check(TokenType.NUMBER)) {
            return advance();
        }
        throw new ParseException(peek(), message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
