package edu.washington.escience.datalog.token;

import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * A single token of a Datalog program: its type, its literal text and the line it starts on. Immutable.
 *
 */
public final class Token {
  /** The type of this token. */
  private final TokenType type;
  /** The literal text of this token. Quotes are already stripped from {@link TokenType#STRING} tokens. */
  private final String value;
  /** The line on which this token starts; 0 for a synthesized token. */
  private final int line;

  /**
   * @param type the type of the token.
   * @param value the literal text of the token.
   * @param line the line on which the token starts.
   */
  public Token(final TokenType type, final String value, final int line) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(value, "value");
    Preconditions.checkArgument(line >= 0, "line %s must be non-negative", line);
    this.type = type;
    this.value = value;
    this.line = line;
  }

  /**
   * @param value the identifier text.
   * @param line the line of the token.
   * @return an {@link TokenType#ID} token.
   */
  public static Token id(final String value, final int line) {
    return new Token(TokenType.ID, value, line);
  }

  /**
   * @param value the literal text, without quotes.
   * @param line the line of the token.
   * @return a {@link TokenType#STRING} token.
   */
  public static Token string(final String value, final int line) {
    return new Token(TokenType.STRING, value, line);
  }

  /**
   * @param type a token type whose text is fixed, e.g. {@link TokenType#COMMA}.
   * @param line the line of the token.
   * @return a token of the given type carrying its canonical spelling.
   */
  public static Token of(final TokenType type, final int line) {
    return new Token(type, spelling(type), line);
  }

  /**
   * @param line the line on which the input ends.
   * @return an {@link TokenType#EOF} token.
   */
  public static Token eof(final int line) {
    return new Token(TokenType.EOF, "", line);
  }

  /**
   * @param type a token type.
   * @return the fixed text of tokens of that type.
   * @throws IllegalArgumentException if tokens of this type have no fixed text.
   */
  public static String spelling(final TokenType type) {
    switch (type) {
      case COLON:
        return ":";
      case COMMA:
        return ",";
      case LEFT_PAREN:
        return "(";
      case RIGHT_PAREN:
        return ")";
      case COLON_DASH:
        return ":-";
      case PERIOD:
        return ".";
      case QUESTION:
        return "?";
      case SCHEMES:
        return "Schemes";
      case FACTS:
        return "Facts";
      case RULES:
        return "Rules";
      case QUERIES:
        return "Queries";
      case EOF:
        return "";
      default:
        throw new IllegalArgumentException("Token type " + type + " has no fixed spelling");
    }
  }

  /**
   * @return the type of this token.
   */
  public TokenType getType() {
    return type;
  }

  /**
   * @return the literal text of this token.
   */
  public String getValue() {
    return value;
  }

  /**
   * @return the line on which this token starts.
   */
  public int getLine() {
    return line;
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value, line);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !(other instanceof Token)) {
      return false;
    }
    Token o = (Token) other;
    return type == o.type && value.equals(o.value) && line == o.line;
  }

  /**
   * @return <code>(TYPE,"text",line)</code>.
   */
  @Override
  public String toString() {
    return "(" + type + ",\"" + value + "\"," + line + ")";
  }
}
