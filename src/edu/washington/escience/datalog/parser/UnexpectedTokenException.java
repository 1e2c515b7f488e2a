package edu.washington.escience.datalog.parser;

import java.util.Objects;

import edu.washington.escience.datalog.token.Token;
import edu.washington.escience.datalog.token.TokenType;

/**
 * Thrown when the current token does not have the type the grammar requires. Parsing stops at the first such token;
 * no partial program is returned.
 */
public class UnexpectedTokenException extends Exception {
  /** Required for serialization. */
  private static final long serialVersionUID = 1L;

  /** The type the grammar required. */
  private final TokenType expectedType;
  /** The token actually found. */
  private final Token token;

  /**
   * @param expectedType the type the grammar required.
   * @param token the token actually found.
   */
  public UnexpectedTokenException(final TokenType expectedType, final Token token) {
    super("Expected " + Objects.requireNonNull(expectedType, "expectedType") + " but found "
        + Objects.requireNonNull(token, "token"));
    this.expectedType = expectedType;
    this.token = token;
  }

  /**
   * @return the type the grammar required.
   */
  public TokenType getExpectedType() {
    return expectedType;
  }

  /**
   * @return the token actually found.
   */
  public Token getToken() {
    return token;
  }
}
