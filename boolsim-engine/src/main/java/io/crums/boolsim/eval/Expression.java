/*
 * Copyright 2025 Babak Farhang
 */
package io.crums.boolsim.eval;


import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

import io.crums.boolsim.lex.Lexemes;
import io.crums.boolsim.lex.Token;
import io.crums.boolsim.lex.TokenType;

/**
 * A parsed right-hand side of an (expanded) assignment. Vectors must already
 * have been expanded; concatenations, constants, parentheses and operators
 * are kept. The implicit AND between juxtaposed operands is made explicit.
 * Instances are immutable.
 */
public final class Expression {
  
  
  /**
   * Parses the given tokens.
   * 
   * @param rhs the tokens following the assignment operator, sans the
   *            terminating {@code ;}. Assumed valid (lexed and verified).
   */
  public static Expression parse(List<Token> rhs) {
    List<Term> terms = new ArrayList<>();
    var opens = new ArrayDeque<Integer>();
    int parens = 0;
    boolean negateNext = false;
    
    for (int index = 0; index < rhs.size(); ++index) {
      var token = rhs.get(index);
      switch (token.type()) {
      case SPACE:
        break;
      
      case NOT:
        negateNext = (token.text().length() & 1) == 1;
        break;
      
      case LPAREN:
        andIfJuxtaposed(terms);
        opens.push(parens);
        terms.add(new Term.Open(parens++, negateNext));
        negateNext = false;
        break;
      
      case RPAREN:
        terms.add(new Term.Close(opens.pop()));
        break;
      
      case LBRACE: {
        List<Term> members = new ArrayList<>();
        for (++index; !rhs.get(index).is(TokenType.RBRACE); ++index) {
          var member = rhs.get(index);
          if (member.type().isOperand())
            members.add(operand(member));
        }
        andIfJuxtaposed(terms);
        terms.add(new Term.Concat(members, negateNext));
        negateNext = false;
        break;
      }
      
      case SCALAR:
      case CONSTANT:
        andIfJuxtaposed(terms);
        terms.add(operand(token));
        break;
      
      case VECTOR:
        throw new IllegalArgumentException("unexpanded vector: " + token.text());
      
      default:
        terms.add(new Term.Op(Operator.of(token.type())));
      }
    }
    String text = rhs.stream().map(Token::text).collect(Collectors.joining()).trim();
    return new Expression(terms, parens, text);
  }
  
  
  private static Term operand(Token token) {
    if (token.is(TokenType.SCALAR))
      return new Term.Scalar(token.body(), token.negated());
    var c = Lexemes.constant(token.body()).get();
    return new Term.Literal(c.text(), c.value(), c.width(), token.negated());
  }
  
  
  private static void andIfJuxtaposed(List<Term> terms) {
    if (terms.isEmpty())
      return;
    var last = terms.get(terms.size() - 1);
    if (last instanceof Term.Scalar ||
        last instanceof Term.Literal ||
        last instanceof Term.Concat ||
        last instanceof Term.Close)
      terms.add(new Term.Op(Operator.AND));
  }
  
  
  
  
  private final List<Term> terms;
  private final int parenCount;
  private final String text;
  
  
  private Expression(List<Term> terms, int parenCount, String text) {
    this.terms = List.copyOf(terms);
    this.parenCount = parenCount;
    this.text = text;
  }
  
  
  public List<Term> terms() {
    return terms;
  }
  
  
  /** Returns the number of parenthesis pairs. */
  public int parenCount() {
    return parenCount;
  }
  
  
  /** Returns the expression's source text. */
  public String text() {
    return text;
  }
  
  
  /** Returns the distinct names of the variables read, in order of appearance. */
  public List<String> reads() {
    var names = new LinkedHashSet<String>();
    for (var term : terms) {
      if (term instanceof Term.Scalar s)
        names.add(s.name());
      else if (term instanceof Term.Concat c) {
        for (var m : c.members())
          if (m instanceof Term.Scalar s)
            names.add(s.name());
      }
    }
    return List.copyOf(names);
  }
  
  
  /** Returns {@code true} if the expression uses {@code +} or {@code -}. */
  public boolean isMath() {
    return terms.stream().anyMatch(
        t -> t instanceof Term.Op op &&
        (op.operator() == Operator.PLUS || op.operator() == Operator.MINUS));
  }
  
  
  @Override
  public String toString() {
    return text;
  }

}
