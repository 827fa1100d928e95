/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.lex;


import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A statement validated and classified by the {@linkplain Lexer}.
 * 
 * @param lineNo  1-based source line number
 * @param text    statement text (tabs expanded, trailing whitespace trimmed)
 * @param type    inferred statement type
 * @param tokens  tokens covering the entire text (empty for comments,
 *                library directives and blank lines)
 */
public record LexedStatement(int lineNo, String text, StatementType type, List<Token> tokens) {
  
  public LexedStatement {
    Objects.requireNonNull(text, "null text");
    Objects.requireNonNull(type, "null type");
    tokens = List.copyOf(tokens);
  }
  
  
  /** Returns the tokens sans {@linkplain TokenType#SPACE SPACE}s. */
  public List<Token> significantTokens() {
    return tokens.stream().filter(t -> !t.is(TokenType.SPACE)).toList();
  }
  
  
  /** Reassembles the text from the tokens. */
  public String joinTokens() {
    return tokens.stream().map(Token::text).collect(Collectors.joining());
  }

}
