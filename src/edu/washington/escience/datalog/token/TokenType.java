package edu.washington.escience.datalog.token;

/**
 * The closed set of token types produced by {@link DatalogLexer} and consumed by the parser.
 */
public enum TokenType {
  /** An identifier: relation name, column name or variable. */
  ID,
  /** A quoted literal; the token text has its quotes stripped. */
  STRING,
  /** <code>:</code> */
  COLON,
  /** <code>,</code> */
  COMMA,
  /** <code>(</code> */
  LEFT_PAREN,
  /** <code>)</code> */
  RIGHT_PAREN,
  /** <code>:-</code> */
  COLON_DASH,
  /** <code>.</code> */
  PERIOD,
  /** <code>?</code> */
  QUESTION,
  /** The <code>Schemes</code> keyword. */
  SCHEMES,
  /** The <code>Facts</code> keyword. */
  FACTS,
  /** The <code>Rules</code> keyword. */
  RULES,
  /** The <code>Queries</code> keyword. */
  QUERIES,
  /** Input the lexer could not classify. No grammar rule accepts it. */
  UNDEFINED,
  /** End of input. Repeated forever once reached. */
  EOF;
}
