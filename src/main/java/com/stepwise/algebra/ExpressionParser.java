package com.stepwise.algebra;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the infix algebra notation learners type.
 * <p>
 * Grammar, loosest binding first:
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary | power)*      -- the bare power is implicit multiplication,
 *                                                            a number only right after ')'
 * unary          := ('-' | '+') unary | power
 * power          := primary ('^' unary)?
 * primary        := number | variable | function '(' additive ')' | '(' additive ')'
 * </pre>
 * Letters are single-character variables, so {@code xy} reads as {@code x * y}; only the names in
 * {@link Operator#FUNCTIONS} are read as words. A minus sign applied directly to a number literal
 * becomes a negative {@link Constant}.
 * </p>
 * Instances are single-use: create one per input string.
 */
public final class ExpressionParser {

    private enum TokenType { NUMBER, VARIABLE, FUNCTION, PLUS, MINUS, STAR, SLASH, CARET, LPAREN, RPAREN, END }

    private record Token(TokenType type, String text, int position) {}

    private final List<Token> tokens;
    private int index;

    private ExpressionParser(String text) {
        this.tokens = tokenize(text);
    }

    /**
     * Parses {@code text} into a tree.
     *
     * @param text The expression (no {@code =} sign).
     * @return The parsed tree, with explicit parentheses preserved.
     * @throws AlgebraParseException if the text is empty or not well-formed.
     */
    public static Node parse(String text) {
        if (text == null || text.isBlank()) {
            throw new AlgebraParseException("Empty expression", 0);
        }
        var parser = new ExpressionParser(text);
        Node node = parser.additive();
        Token trailing = parser.peek();
        if (trailing.type() != TokenType.END) {
            throw new AlgebraParseException("Unexpected '" + trailing.text() + "'", trailing.position());
        }
        return node;
    }

    private Node additive() {
        Node left = multiplicative();
        while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
            String op = next().text();
            left = Operator.binary(op, left, multiplicative());
        }
        return left;
    }

    private Node multiplicative() {
        Node left = unary();
        while (true) {
            TokenType type = peek().type();
            if (type == TokenType.STAR || type == TokenType.SLASH) {
                String op = next().text();
                left = Operator.binary(op, left, unary());
            } else if (type == TokenType.VARIABLE || type == TokenType.FUNCTION || type == TokenType.LPAREN
                    || (type == TokenType.NUMBER && previousType() == TokenType.RPAREN)) {
                left = Operator.binary(Operator.MULTIPLY, left, power());
            } else {
                return left;
            }
        }
    }

    private Node unary() {
        if (peek().type() == TokenType.PLUS) {
            next();
            return unary();
        }
        if (peek().type() == TokenType.MINUS) {
            next();
            Node operand = unary();
            if (operand instanceof Constant constant) {
                return new Constant(constant.value().negate());
            }
            return Operator.negate(operand);
        }
        return power();
    }

    private Node power() {
        Node base = primary();
        if (peek().type() == TokenType.CARET) {
            next();
            return Operator.binary(Operator.POWER, base, unary());
        }
        return base;
    }

    private Node primary() {
        Token token = next();
        switch (token.type()) {
            case NUMBER:
                return new Constant(new BigDecimal(token.text()));
            case VARIABLE:
                return new Symbol(token.text());
            case FUNCTION: {
                expect(TokenType.LPAREN, "'(' after " + token.text());
                Node argument = additive();
                expect(TokenType.RPAREN, "')'");
                return new Operator(token.text(), List.of(argument));
            }
            case LPAREN: {
                Node inner = additive();
                expect(TokenType.RPAREN, "')'");
                return new Parenthesis(inner);
            }
            case END:
                throw new AlgebraParseException("Unexpected end of expression", token.position());
            default:
                throw new AlgebraParseException("Unexpected '" + token.text() + "'", token.position());
        }
    }

    private void expect(TokenType type, String description) {
        Token token = next();
        if (token.type() != type) {
            String found = token.type() == TokenType.END ? "end of expression" : "'" + token.text() + "'";
            throw new AlgebraParseException("Expected " + description + " but found " + found, token.position());
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private TokenType previousType() {
        return index == 0 ? null : tokens.get(index - 1).type();
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type() != TokenType.END) {
            index++;
        }
        return token;
    }

    private static List<Token> tokenize(String text) {
        List<Token> result = new ArrayList<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || c == '.') {
                int start = i;
                boolean seenPoint = false;
                while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
                    if (text.charAt(i) == '.') {
                        if (seenPoint) {
                            throw new AlgebraParseException("Malformed number", start);
                        }
                        seenPoint = true;
                    }
                    i++;
                }
                String number = text.substring(start, i);
                if (number.equals(".")) {
                    throw new AlgebraParseException("Malformed number", start);
                }
                result.add(new Token(TokenType.NUMBER, number, start));
            } else if (Character.isLetter(c)) {
                int start = i;
                while (i < text.length() && Character.isLetter(text.charAt(i))) {
                    i++;
                }
                String word = text.substring(start, i);
                if (Operator.FUNCTIONS.contains(word)) {
                    result.add(new Token(TokenType.FUNCTION, word, start));
                } else {
                    for (int k = 0; k < word.length(); k++) {
                        result.add(new Token(TokenType.VARIABLE, String.valueOf(word.charAt(k)), start + k));
                    }
                }
            } else {
                TokenType type = switch (c) {
                    case '+' -> TokenType.PLUS;
                    case '-' -> TokenType.MINUS;
                    case '*' -> TokenType.STAR;
                    case '/' -> TokenType.SLASH;
                    case '^' -> TokenType.CARET;
                    case '(' -> TokenType.LPAREN;
                    case ')' -> TokenType.RPAREN;
                    default -> throw new AlgebraParseException("Unexpected character '" + c + "'", i);
                };
                result.add(new Token(type, String.valueOf(c), i));
                i++;
            }
        }
        result.add(new Token(TokenType.END, "", text.length()));
        return result;
    }
}
