package org.quarterlang.compiler.frontend.parser;

import org.quarterlang.compiler.api.SourceInfo;
import org.quarterlang.compiler.diagnostics.DiagnosticsEngine;
import org.quarterlang.compiler.frontend.lexer.Token;
import org.quarterlang.compiler.frontend.lexer.TokenType;
import org.quarterlang.compiler.frontend.parser.ast.AssignmentNode;
import org.quarterlang.compiler.frontend.parser.ast.BinaryExpressionNode;
import org.quarterlang.compiler.frontend.parser.ast.BinaryOperator;
import org.quarterlang.compiler.frontend.parser.ast.CallNode;
import org.quarterlang.compiler.frontend.parser.ast.ExpressionNode;
import org.quarterlang.compiler.frontend.parser.ast.FunctionDefinitionNode;
import org.quarterlang.compiler.frontend.parser.ast.LiteralNode;
import org.quarterlang.compiler.frontend.parser.ast.LoopNode;
import org.quarterlang.compiler.frontend.parser.ast.OperandNode;
import org.quarterlang.compiler.frontend.parser.ast.ProgramNode;
import org.quarterlang.compiler.frontend.parser.ast.ReturnNode;
import org.quarterlang.compiler.frontend.parser.ast.StatementNode;
import org.quarterlang.compiler.frontend.parser.ast.ValueDeclarationNode;
import org.quarterlang.compiler.frontend.parser.ast.VariableNode;
import org.quarterlang.compiler.frontend.parser.ast.WhenNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The parser for the QuarterLang surface syntax. It consumes a list of tokens
 * from the {@link org.quarterlang.compiler.frontend.lexer.Lexer} and produces a {@link ProgramNode}.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine}; the parser then skips to the next
 * statement boundary and continues, so that a single run reports as many errors as possible.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
    }

    /**
     * Parses the entire token stream.
     * @return The program tree. Statements that failed to parse are left out.
     */
    public ProgramNode parse() {
        List<StatementNode> statements = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                continue;
            }
            StatementNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        return new ProgramNode(statements);
    }

    /**
     * Parses a single statement and recovers from errors.
     * @return The parsed statement, or null if an error occurred.
     */
    private StatementNode declaration() {
        try {
            StatementNode statement = statement();
            if (statement != null) {
                endOfStatement();
            }
            return statement;
        } catch (ParseError error) {
            synchronize();
            return null;
        }
    }

    private StatementNode statement() {
        if (match(TokenType.VAL)) return valueDeclaration(previous());
        if (match(TokenType.FN)) return functionDefinition(previous());
        if (match(TokenType.LOOP)) return loop(previous());
        if (match(TokenType.WHEN)) return when(previous());
        if (match(TokenType.RETURN)) return returnStatement(previous());

        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            return call(advance());
        }
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.EQUALS)) {
            Token name = advance();
            advance();
            return new AssignmentNode(name.text(), expression(), sourceOf(name));
        }

        Token unexpected = advance();
        diagnostics.reportError("Expected statement, but got '" + unexpected.text() + "'.", unexpected.fileName(), unexpected.line());
        return null;
    }

    private ValueDeclarationNode valueDeclaration(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "Expected value name after 'val'.");
        consume(TokenType.COLON, "Expected ':' and a type after value name '" + name.text() + "'.");
        Token type = consume(TokenType.IDENTIFIER, "Expected type name after ':'.");
        consume(TokenType.EQUALS, "Expected '=' after type of value '" + name.text() + "'.");
        return new ValueDeclarationNode(name.text(), type.text(), expression(), sourceOf(keyword));
    }

    private FunctionDefinitionNode functionDefinition(Token keyword) {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name after 'fn'.");
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name '" + name.text() + "'.");
        List<String> parameters = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                Token parameter = consume(TokenType.IDENTIFIER, "Expected parameter name.");
                if (parameters.contains(parameter.text())) {
                    diagnostics.reportError("Duplicate parameter '" + parameter.text() + "' in function '" + name.text() + "'.", parameter.fileName(), parameter.line());
                }
                parameters.add(parameter.text());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters of function '" + name.text() + "'.");
        return new FunctionDefinitionNode(name.text(), parameters, block(), sourceOf(keyword));
    }

    private LoopNode loop(Token keyword) {
        String counterName = null;
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.IN)) {
            counterName = advance().text();
            advance();
        }
        OperandNode start = operand();
        consume(TokenType.TO, "Expected 'to' after loop start value.");
        OperandNode end = operand();
        return new LoopNode(counterName, start, end, block(), sourceOf(keyword));
    }

    private WhenNode when(Token keyword) {
        OperandNode left = operand();
        consume(TokenType.IS, "Expected 'is' after left operand of 'when'.");
        OperandNode right = operand();
        return new WhenNode(left, right, block(), sourceOf(keyword));
    }

    private ReturnNode returnStatement(Token keyword) {
        if (isStatementEnd()) {
            return new ReturnNode(null, sourceOf(keyword));
        }
        return new ReturnNode(expression(), sourceOf(keyword));
    }

    private CallNode call(Token callee) {
        consume(TokenType.LEFT_PAREN, "Expected '(' after function name '" + callee.text() + "'.");
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments of call to '" + callee.text() + "'.");
        return new CallNode(callee.text(), arguments, sourceOf(callee));
    }

    /**
     * Parses a block in braces. Newlines inside the block are statement separators.
     */
    private List<StatementNode> block() {
        consume(TokenType.LEFT_BRACE, "Expected '{' to open a block.");
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) {
                continue;
            }
            StatementNode statement = declaration();
            if (statement != null) {
                statements.add(statement);
            }
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}' to close a block.");
        return statements;
    }

    /**
     * Parses an expression: a call, or an operand optionally followed by one operator and a second operand.
     * @return The parsed expression.
     */
    private ExpressionNode expression() {
        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)) {
            return call(advance());
        }
        OperandNode left = operand();
        BinaryOperator operator = binaryOperator();
        if (operator == null) {
            return left;
        }
        return new BinaryExpressionNode(left, operator, operand());
    }

    private BinaryOperator binaryOperator() {
        if (match(TokenType.PLUS)) return BinaryOperator.ADD;
        if (match(TokenType.MINUS)) return BinaryOperator.SUBTRACT;
        if (match(TokenType.STAR)) return BinaryOperator.MULTIPLY;
        if (match(TokenType.SLASH)) return BinaryOperator.DIVIDE;
        return null;
    }

    private OperandNode operand() {
        if (match(TokenType.NUMBER)) {
            return new LiteralNode(previous().text());
        }
        if (match(TokenType.MINUS)) {
            Token number = consume(TokenType.NUMBER, "Expected a number after '-'.");
            return new LiteralNode("-" + number.text());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new VariableNode(previous().text());
        }
        Token unexpected = peek();
        String text = unexpected.type() == TokenType.NEWLINE ? "end of line" : unexpected.text();
        diagnostics.reportError("Expected a number or a name, but got '" + text + "'.", unexpected.fileName(), unexpected.line());
        throw new ParseError();
    }

    private void endOfStatement() {
        if (isStatementEnd()) {
            match(TokenType.NEWLINE, TokenType.SEMICOLON);
            return;
        }
        Token unexpected = peek();
        diagnostics.reportError("Unexpected '" + unexpected.text() + "' after statement.", unexpected.fileName(), unexpected.line());
        throw new ParseError();
    }

    private boolean isStatementEnd() {
        return isAtEnd() || check(TokenType.NEWLINE) || check(TokenType.SEMICOLON) || check(TokenType.RIGHT_BRACE);
    }

    /**
     * Skips tokens up to the next statement boundary. A closing brace is left in place for the enclosing block.
     */
    private void synchronize() {
        while (!isAtEnd()) {
            if (match(TokenType.NEWLINE, TokenType.SEMICOLON)) return;
            if (check(TokenType.RIGHT_BRACE)) return;
            advance();
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        Token unexpected = peek();
        diagnostics.reportError(errorMessage, unexpected.fileName(), unexpected.line());
        throw new ParseError();
    }

    private static SourceInfo sourceOf(Token token) {
        return new SourceInfo(token.fileName(), token.line(), token.column());
    }

    /**
     * Unwinds the parser to the statement loop after an error has been reported.
     */
    private static final class ParseError extends RuntimeException {
        ParseError() {
            super(null, null, false, false);
        }
    }
}
