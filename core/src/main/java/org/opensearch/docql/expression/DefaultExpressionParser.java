/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docql.expression;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.opensearch.docql.common.utils.StringUtils;

/**
 * Recursive descent parser for the expression subset used in plans and index definitions.
 *
 * <pre>
 *   expr       := or
 *   or         := and ("or" and)*
 *   and        := not ("and" not)*
 *   not        := "not" not | comparison
 *   comparison := primary (op primary)?
 *   primary    := "(" expr ")" | literal | "[" list "]" | parameter | call | path
 * </pre>
 *
 * <p>The parser is stateless and safe to share between threads.
 */
public class DefaultExpressionParser implements ExpressionParser {

  private static final ObjectMapper JSON = new ObjectMapper();

  @Override
  public Expression parse(String text) {
    if (text == null || text.isBlank()) {
      throw new ExpressionSyntaxException("empty expression");
    }
    Parser parser = new Parser(new Lexer(text).tokenize(), text);
    Expression expr = parser.expr();
    parser.expect(TokenType.EOF);
    return expr;
  }

  private enum TokenType {
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,
    DOT,
    OPERATOR,
    STRING,
    NUMBER,
    PARAMETER,
    IDENTIFIER,
    QUOTED_IDENTIFIER,
    EOF
  }

  private static class Token {
    private final TokenType type;
    private final String text;
    private final int position;

    Token(TokenType type, String text, int position) {
      this.type = type;
      this.text = text;
      this.position = position;
    }

    boolean isKeyword(String keyword) {
      return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
    }
  }

  private static class Lexer {
    private final String input;
    private int pos;

    Lexer(String input) {
      this.input = input;
    }

    List<Token> tokenize() {
      List<Token> tokens = new ArrayList<>();
      while (true) {
        skipWhitespace();
        if (pos >= input.length()) {
          tokens.add(new Token(TokenType.EOF, "", pos));
          return tokens;
        }
        tokens.add(next());
      }
    }

    private void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    private Token next() {
      int start = pos;
      char c = input.charAt(pos);
      switch (c) {
        case '(':
          pos++;
          return new Token(TokenType.LPAREN, "(", start);
        case ')':
          pos++;
          return new Token(TokenType.RPAREN, ")", start);
        case '[':
          pos++;
          return new Token(TokenType.LBRACKET, "[", start);
        case ']':
          pos++;
          return new Token(TokenType.RBRACKET, "]", start);
        case ',':
          pos++;
          return new Token(TokenType.COMMA, ",", start);
        case '.':
          pos++;
          return new Token(TokenType.DOT, ".", start);
        case '"':
          return string();
        case '`':
          return quotedIdentifier();
        case '$':
          return parameter();
        default:
          break;
      }
      if (c == '=' || c == '!' || c == '<' || c == '>') {
        return operator();
      }
      if (Character.isDigit(c) || (c == '-' && pos + 1 < input.length()
          && Character.isDigit(input.charAt(pos + 1)))) {
        return number();
      }
      if (Character.isLetter(c) || c == '_') {
        while (pos < input.length()
            && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
          pos++;
        }
        return new Token(TokenType.IDENTIFIER, input.substring(start, pos), start);
      }
      throw error("unexpected character '" + c + "'", start);
    }

    private Token operator() {
      int start = pos;
      String two = pos + 2 <= input.length() ? input.substring(pos, pos + 2) : "";
      switch (two) {
        case "<=":
        case ">=":
        case "!=":
          pos += 2;
          return new Token(TokenType.OPERATOR, two, start);
        case "<>":
          pos += 2;
          return new Token(TokenType.OPERATOR, "!=", start);
        case "==":
          pos += 2;
          return new Token(TokenType.OPERATOR, "=", start);
        default:
          break;
      }
      char c = input.charAt(pos);
      if (c == '!') {
        throw error("unexpected character '!'", start);
      }
      pos++;
      return new Token(TokenType.OPERATOR, String.valueOf(c), start);
    }

    private Token string() {
      int start = pos++;
      while (pos < input.length() && input.charAt(pos) != '"') {
        if (input.charAt(pos) == '\\') {
          pos++;
        }
        pos++;
      }
      if (pos >= input.length()) {
        throw error("unterminated string literal", start);
      }
      pos++;
      return new Token(TokenType.STRING, input.substring(start, pos), start);
    }

    private Token quotedIdentifier() {
      int start = pos++;
      StringBuilder name = new StringBuilder();
      while (true) {
        if (pos >= input.length()) {
          throw error("unterminated quoted identifier", start);
        }
        char c = input.charAt(pos++);
        if (c == '`') {
          if (pos < input.length() && input.charAt(pos) == '`') {
            name.append('`');
            pos++;
          } else {
            return new Token(TokenType.QUOTED_IDENTIFIER, name.toString(), start);
          }
        } else {
          name.append(c);
        }
      }
    }

    private Token parameter() {
      int start = pos++;
      while (pos < input.length()
          && (Character.isLetterOrDigit(input.charAt(pos)) || input.charAt(pos) == '_')) {
        pos++;
      }
      if (pos == start + 1) {
        throw error("parameter name expected", start);
      }
      return new Token(TokenType.PARAMETER, input.substring(start + 1, pos), start);
    }

    private Token number() {
      int start = pos;
      if (input.charAt(pos) == '-') {
        pos++;
      }
      digits();
      if (pos < input.length() && input.charAt(pos) == '.'
          && pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1))) {
        pos++;
        digits();
      }
      if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
        pos++;
        if (pos < input.length() && (input.charAt(pos) == '-' || input.charAt(pos) == '+')) {
          pos++;
        }
        digits();
      }
      return new Token(TokenType.NUMBER, input.substring(start, pos), start);
    }

    private void digits() {
      while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
        pos++;
      }
    }

    private ExpressionSyntaxException error(String message, int at) {
      return new ExpressionSyntaxException(
          StringUtils.format("%s at position %d in [%s]", message, at, input));
    }
  }

  private static class Parser {
    private final List<Token> tokens;
    private final String input;
    private int index;

    Parser(List<Token> tokens, String input) {
      this.tokens = tokens;
      this.input = input;
    }

    Expression expr() {
      return or();
    }

    private Expression or() {
      List<Expression> operands = new ArrayList<>();
      operands.add(and());
      while (peek().isKeyword("or")) {
        index++;
        operands.add(and());
      }
      return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    private Expression and() {
      List<Expression> operands = new ArrayList<>();
      operands.add(not());
      while (peek().isKeyword("and")) {
        index++;
        operands.add(not());
      }
      return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    private Expression not() {
      if (peek().isKeyword("not")) {
        index++;
        return new Not(not());
      }
      return comparison();
    }

    private Expression comparison() {
      Expression left = primary();
      Token token = peek();
      if (token.type == TokenType.OPERATOR || token.isKeyword("in")) {
        index++;
        ComparisonOperator op =
            ComparisonOperator.fromSymbol(token.text)
                .orElseThrow(() -> error("unknown operator " + token.text, token));
        Expression right = primary();
        return new Comparison(op, left, right);
      }
      return left;
    }

    private Expression primary() {
      Token token = tokens.get(index++);
      switch (token.type) {
        case LPAREN:
          Expression inner = expr();
          expect(TokenType.RPAREN);
          return inner;
        case LBRACKET:
          return array();
        case STRING:
          return Constant.of(unquote(token));
        case NUMBER:
          return number(token);
        case PARAMETER:
          return new Parameter(token.text);
        case QUOTED_IDENTIFIER:
          return path(token.text);
        case IDENTIFIER:
          return identifier(token);
        default:
          throw error("unexpected token '" + token.text + "'", token);
      }
    }

    private Expression identifier(Token token) {
      switch (token.text.toLowerCase(Locale.ROOT)) {
        case "true":
          return Constant.TRUE;
        case "false":
          return Constant.FALSE;
        case "null":
          return Constant.NULL;
        case "and":
        case "or":
        case "not":
        case "in":
          throw error("unexpected keyword '" + token.text + "'", token);
        default:
          break;
      }
      if (peek().type == TokenType.LPAREN) {
        index++;
        List<Expression> args = new ArrayList<>();
        if (peek().type != TokenType.RPAREN) {
          args.add(expr());
          while (peek().type == TokenType.COMMA) {
            index++;
            args.add(expr());
          }
        }
        expect(TokenType.RPAREN);
        return new FunctionCall(token.text, args);
      }
      return path(token.text);
    }

    private Expression path(String head) {
      List<String> path = new ArrayList<>();
      path.add(head);
      while (peek().type == TokenType.DOT) {
        index++;
        Token next = tokens.get(index++);
        if (next.type != TokenType.IDENTIFIER && next.type != TokenType.QUOTED_IDENTIFIER) {
          throw error("field name expected", next);
        }
        path.add(next.text);
      }
      return new Field(path);
    }

    private Expression array() {
      List<Expression> elements = new ArrayList<>();
      if (peek().type != TokenType.RBRACKET) {
        elements.add(expr());
        while (peek().type == TokenType.COMMA) {
          index++;
          elements.add(expr());
        }
      }
      expect(TokenType.RBRACKET);
      return new ArrayConstruct(elements);
    }

    private Expression number(Token token) {
      String text = token.text;
      try {
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
          return Constant.of(Double.parseDouble(text));
        }
        return Constant.of(Long.parseLong(text));
      } catch (NumberFormatException e) {
        throw error("invalid number " + text, token);
      }
    }

    private String unquote(Token token) {
      try {
        return JSON.readValue(token.text, String.class);
      } catch (JsonProcessingException e) {
        throw new ExpressionSyntaxException("invalid string literal " + token.text, e);
      }
    }

    private Token peek() {
      return tokens.get(index);
    }

    void expect(TokenType type) {
      Token token = tokens.get(index);
      if (token.type != type) {
        throw error("expected " + type + " but found '" + token.text + "'", token);
      }
      index++;
    }

    private ExpressionSyntaxException error(String message, Token token) {
      return new ExpressionSyntaxException(
          StringUtils.format("%s at position %d in [%s]", message, token.position, input));
    }
  }
}
