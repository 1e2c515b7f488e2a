package edu.washington.escience.datalog.parser;

import java.util.EnumSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;

import edu.washington.escience.datalog.token.Token;
import edu.washington.escience.datalog.token.TokenType;

/**
 * Single-token lookahead over an upstream token iterator.
 *
 * <p>
 * The upstream is treated as unbounded. If it does report exhaustion, the stream keeps returning its last token, so
 * reading past the end is an ordinary state and never an error. An upstream that is empty from the start yields an
 * {@link TokenType#EOF} token on line 0.
 * </p>
 */
public final class TokenStream {
  /** Where tokens come from. */
  private final Iterator<Token> tokens;
  /** The current token. Never null. */
  private Token current;

  /**
   * Reads the first token.
   *
   * @param tokens the upstream tokens, usually a {@link edu.washington.escience.datalog.token.DatalogLexer}.
   */
  public TokenStream(final Iterator<Token> tokens) {
    this.tokens = Objects.requireNonNull(tokens, "tokens");
    current = Token.eof(0);
    advance();
  }

  /**
   * @return the current token.
   */
  public Token current() {
    return current;
  }

  /**
   * @return the type of the current token.
   */
  public TokenType type() {
    return current.getType();
  }

  /**
   * @return the literal text of the current token.
   */
  public String value() {
    return current.getValue();
  }

  /**
   * Move to the next token. At the end of the input the current token stays where it is.
   */
  public void advance() {
    if (tokens.hasNext()) {
      current = Objects.requireNonNull(tokens.next(), "upstream returned a null token");
    }
  }

  /**
   * Check the type of the current token without consuming it.
   *
   * @param type the required type.
   * @throws UnexpectedTokenException if the current token is of a different type.
   */
  public void expect(final TokenType type) throws UnexpectedTokenException {
    if (current.getType() != type) {
      throw new UnexpectedTokenException(type, current);
    }
  }

  /**
   * {@link #expect(TokenType)} followed by {@link #advance()}.
   *
   * @param type the required type.
   * @return the consumed token.
   * @throws UnexpectedTokenException if the current token is of a different type. Nothing is consumed in that case.
   */
  public Token match(final TokenType type) throws UnexpectedTokenException {
    expect(type);
    final Token matched = current;
    advance();
    return matched;
  }

  /**
   * @param types a set of token types, typically a FIRST or FOLLOW set.
   * @return true if the current token's type is in the set.
   */
  public boolean isOneOf(final Set<TokenType> types) {
    return types.contains(current.getType());
  }

  /**
   * @param first a token type.
   * @param rest more token types.
   * @return true if the current token's type is one of those given.
   */
  public boolean isOneOf(final TokenType first, final TokenType... rest) {
    return isOneOf(EnumSet.of(first, rest));
  }
}
