package edu.washington.escience.datalog.token;

import java.util.Iterator;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableMap;

/**
 * Turns the text of a Datalog program into tokens. The iterator never runs dry: once the input is exhausted it returns
 * the same {@link TokenType#EOF} token on every call to {@link #next()}.
 *
 * <p>
 * Whitespace, <code>#</code> line comments and <code>#| ... |#</code> block comments are skipped. A string literal is
 * delimited by single quotes, <code>''</code> stands for a quote inside it, and the token carries the text between the
 * delimiters. Anything else that cannot start a token, as well as an unterminated string or block comment, becomes an
 * {@link TokenType#UNDEFINED} token.
 * </p>
 */
public final class DatalogLexer implements Iterator<Token> {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DatalogLexer.class);

  /** Keyword spellings. */
  private static final ImmutableMap<String, TokenType> KEYWORDS =
      ImmutableMap.of(
          Token.spelling(TokenType.SCHEMES), TokenType.SCHEMES,
          Token.spelling(TokenType.FACTS), TokenType.FACTS,
          Token.spelling(TokenType.RULES), TokenType.RULES,
          Token.spelling(TokenType.QUERIES), TokenType.QUERIES);

  /** The program text. */
  private final String input;
  /** Index of the next unread character. */
  private int pos;
  /** Current line, starting at 1. */
  private int line;
  /** The end-of-input token, once reached. */
  private Token eof;

  /**
   * @param input the text of a Datalog program.
   */
  public DatalogLexer(final String input) {
    this.input = Objects.requireNonNull(input, "input");
    pos = 0;
    line = 1;
    eof = null;
  }

  /**
   * @return always true.
   */
  @Override
  public boolean hasNext() {
    return true;
  }

  @Override
  public Token next() {
    if (eof != null) {
      return eof;
    }
    Token comment = skipBlanks();
    if (comment != null) {
      return comment;
    }
    if (pos >= input.length()) {
      eof = Token.eof(line);
      LOGGER.debug("end of input at line {}", line);
      return eof;
    }

    final char c = input.charAt(pos);
    switch (c) {
      case ':':
        if (pos + 1 < input.length() && input.charAt(pos + 1) == '-') {
          return fixed(TokenType.COLON_DASH);
        }
        return fixed(TokenType.COLON);
      case ',':
        return fixed(TokenType.COMMA);
      case '(':
        return fixed(TokenType.LEFT_PAREN);
      case ')':
        return fixed(TokenType.RIGHT_PAREN);
      case '.':
        return fixed(TokenType.PERIOD);
      case '?':
        return fixed(TokenType.QUESTION);
      case '\'':
        return string();
      default:
        if (Character.isLetter(c)) {
          return identifier();
        }
        pos++;
        return new Token(TokenType.UNDEFINED, String.valueOf(c), line);
    }
  }

  /**
   * The lexer is read-only.
   */
  @Override
  public void remove() {
    throw new UnsupportedOperationException("remove");
  }

  /**
   * Skip whitespace and comments.
   *
   * @return an UNDEFINED token if an unterminated block comment was hit, otherwise null.
   */
  private Token skipBlanks() {
    while (pos < input.length()) {
      final char c = input.charAt(pos);
      if (c == '\n') {
        line++;
        pos++;
      } else if (Character.isWhitespace(c)) {
        pos++;
      } else if (c == '#' && input.startsWith("#|", pos)) {
        final int end = input.indexOf("|#", pos + 2);
        final int startLine = line;
        if (end < 0) {
          final String text = input.substring(pos);
          countLines(text);
          pos = input.length();
          return new Token(TokenType.UNDEFINED, text, startLine);
        }
        countLines(input.substring(pos, end + 2));
        pos = end + 2;
      } else if (c == '#') {
        while (pos < input.length() && input.charAt(pos) != '\n') {
          pos++;
        }
      } else {
        break;
      }
    }
    return null;
  }

  /**
   * @param type a punctuation token type.
   * @return the token, after consuming its spelling.
   */
  private Token fixed(final TokenType type) {
    final String spelling = Token.spelling(type);
    pos += spelling.length();
    return new Token(type, spelling, line);
  }

  /**
   * @return a STRING token, or UNDEFINED if the closing quote is missing.
   */
  private Token string() {
    final int startLine = line;
    final int start = pos;
    final StringBuilder sb = new StringBuilder();
    pos++;
    while (pos < input.length()) {
      final char c = input.charAt(pos);
      if (c == '\'') {
        if (pos + 1 < input.length() && input.charAt(pos + 1) == '\'') {
          sb.append('\'');
          pos += 2;
          continue;
        }
        pos++;
        return Token.string(sb.toString(), startLine);
      }
      if (c == '\n') {
        line++;
      }
      sb.append(c);
      pos++;
    }
    return new Token(TokenType.UNDEFINED, input.substring(start), startLine);
  }

  /**
   * @return an ID token, or a keyword token if the identifier is a keyword.
   */
  private Token identifier() {
    final int start = pos;
    while (pos < input.length() && Character.isLetterOrDigit(input.charAt(pos))) {
      pos++;
    }
    final String text = input.substring(start, pos);
    final TokenType keyword = KEYWORDS.get(text);
    if (keyword != null) {
      return new Token(keyword, text, line);
    }
    return Token.id(text, line);
  }

  /**
   * @param text consumed text.
   */
  private void countLines(final String text) {
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        line++;
      }
    }
  }
}
