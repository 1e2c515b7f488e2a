package edu.washington.escience.datalog.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Sets;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Parameter;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;
import edu.washington.escience.datalog.token.Token;
import edu.washington.escience.datalog.token.TokenType;

/**
 * Recursive-descent parser for Datalog programs. There is one method per grammar production and each returns the piece
 * of the program it recognized:
 *
 * <pre>
 * program     -> SCHEMES COLON scheme schemeList FACTS COLON fact factList
 *                RULES COLON ruleList QUERIES COLON query queryList EOF
 * scheme      -> ID LEFT_PAREN ID (COMMA ID)* RIGHT_PAREN
 * fact        -> predicate PERIOD
 * rule        -> predicate COLON_DASH predicate (COMMA predicate)* PERIOD
 * query       -> predicate QUESTION
 * predicate   -> ID LEFT_PAREN parameter (COMMA parameter)* RIGHT_PAREN
 * parameter   -> ID | STRING
 * </pre>
 *
 * A scheme names columns, so its parameters must be identifiers: a quoted string in a scheme is rejected here with an
 * {@link UnexpectedTokenException} expecting {@link TokenType#ID}.
 *
 * The grammar is LL(1). List productions are loops that stop when the current token is in the production's FOLLOW
 * set. The first token that does not fit aborts the parse with an {@link UnexpectedTokenException}.
 */
public final class DatalogParser {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DatalogParser.class);

  /** FOLLOW(schemeList). */
  static final Set<TokenType> SCHEME_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.FACTS);
  /** FOLLOW(factList). */
  static final Set<TokenType> FACT_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.RULES);
  /** FOLLOW(ruleList). */
  static final Set<TokenType> RULE_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.QUERIES);
  /** FOLLOW(queryList). */
  static final Set<TokenType> QUERY_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.EOF);
  /** FOLLOW(parameterList). */
  static final Set<TokenType> PARAMETER_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.RIGHT_PAREN);
  /** FOLLOW(predicateList), the tail of a rule body. */
  static final Set<TokenType> PREDICATE_LIST_FOLLOW = Sets.immutableEnumSet(TokenType.PERIOD);
  /** FIRST(parameter). */
  static final Set<TokenType> PARAMETER_FIRST = Sets.immutableEnumSet(TokenType.ID, TokenType.STRING);

  /** Utility classes cannot be constructed. */
  private DatalogParser() {}

  /**
   * Parse a whole program.
   *
   * @param tokens the tokens of the program, normally ending in a repeated {@link TokenType#EOF}.
   * @return a new program.
   * @throws UnexpectedTokenException at the first token the grammar does not allow.
   */
  public static DatalogProgram parse(final Iterator<Token> tokens) throws UnexpectedTokenException {
    return program(new TokenStream(tokens));
  }

  /**
   * program -> SCHEMES COLON scheme schemeList FACTS COLON fact factList RULES COLON ruleList QUERIES COLON query
   * queryList EOF.
   *
   * @param ts the token stream.
   * @return a new program.
   * @throws UnexpectedTokenException at the first token the grammar does not allow.
   */
  static DatalogProgram program(final TokenStream ts) throws UnexpectedTokenException {
    final DatalogProgram program = new DatalogProgram();

    ts.match(TokenType.SCHEMES);
    ts.match(TokenType.COLON);
    program.addScheme(scheme(ts));
    for (final Predicate scheme : schemeList(ts)) {
      program.addScheme(scheme);
    }
    LOGGER.debug("parsed {} schemes", program.getSchemes().size());

    ts.match(TokenType.FACTS);
    ts.match(TokenType.COLON);
    program.addFact(fact(ts));
    for (final Predicate fact : factList(ts)) {
      program.addFact(fact);
    }
    LOGGER.debug("parsed {} facts", program.getFacts().size());

    ts.match(TokenType.RULES);
    ts.match(TokenType.COLON);
    for (final Rule rule : ruleList(ts)) {
      program.addRule(rule);
    }
    LOGGER.debug("parsed {} rules", program.getRules().size());

    ts.match(TokenType.QUERIES);
    ts.match(TokenType.COLON);
    program.addQuery(query(ts));
    for (final Predicate query : queryList(ts)) {
      program.addQuery(query);
    }
    LOGGER.debug("parsed {} queries", program.getQueries().size());

    ts.expect(TokenType.EOF);
    return program;
  }

  /**
   * scheme -> ID LEFT_PAREN ID (COMMA ID)* RIGHT_PAREN.
   *
   * @param ts the token stream.
   * @return the scheme.
   * @throws UnexpectedTokenException if the tokens do not form a scheme.
   */
  static Predicate scheme(final TokenStream ts) throws UnexpectedTokenException {
    final String name = ts.match(TokenType.ID).getValue();
    ts.match(TokenType.LEFT_PAREN);
    final List<Parameter> columns = new ArrayList<Parameter>();
    columns.add(Parameter.id(ts.match(TokenType.ID).getValue()));
    while (!ts.isOneOf(PARAMETER_LIST_FOLLOW)) {
      if (!ts.isOneOf(TokenType.COMMA)) {
        throw new UnexpectedTokenException(TokenType.RIGHT_PAREN, ts.current());
      }
      ts.advance();
      columns.add(Parameter.id(ts.match(TokenType.ID).getValue()));
    }
    ts.match(TokenType.RIGHT_PAREN);
    return new Predicate(name, columns);
  }

  /**
   * schemeList -> scheme schemeList | (empty, on FACTS).
   *
   * @param ts the token stream.
   * @return the schemes, possibly none.
   * @throws UnexpectedTokenException if a scheme is malformed.
   */
  static List<Predicate> schemeList(final TokenStream ts) throws UnexpectedTokenException {
    final List<Predicate> schemes = new ArrayList<Predicate>();
    while (!ts.isOneOf(SCHEME_LIST_FOLLOW)) {
      schemes.add(scheme(ts));
    }
    return schemes;
  }

  /**
   * fact -> predicate PERIOD. That a fact holds only literals is checked downstream, not here.
   *
   * @param ts the token stream.
   * @return the fact.
   * @throws UnexpectedTokenException if the tokens do not form a fact.
   */
  static Predicate fact(final TokenStream ts) throws UnexpectedTokenException {
    final Predicate fact = predicate(ts);
    ts.match(TokenType.PERIOD);
    return fact;
  }

  /**
   * factList -> fact factList | (empty, on RULES).
   *
   * @param ts the token stream.
   * @return the facts, possibly none.
   * @throws UnexpectedTokenException if a fact is malformed.
   */
  static List<Predicate> factList(final TokenStream ts) throws UnexpectedTokenException {
    final List<Predicate> facts = new ArrayList<Predicate>();
    while (!ts.isOneOf(FACT_LIST_FOLLOW)) {
      facts.add(fact(ts));
    }
    return facts;
  }

  /**
   * rule -> predicate COLON_DASH predicate (COMMA predicate)* PERIOD.
   *
   * @param ts the token stream.
   * @return the rule.
   * @throws UnexpectedTokenException if the tokens do not form a rule.
   */
  static Rule rule(final TokenStream ts) throws UnexpectedTokenException {
    final Predicate head = predicate(ts);
    ts.match(TokenType.COLON_DASH);
    final List<Predicate> body = new ArrayList<Predicate>();
    body.add(predicate(ts));
    while (!ts.isOneOf(PREDICATE_LIST_FOLLOW)) {
      if (!ts.isOneOf(TokenType.COMMA)) {
        throw new UnexpectedTokenException(TokenType.PERIOD, ts.current());
      }
      ts.advance();
      body.add(predicate(ts));
    }
    ts.match(TokenType.PERIOD);
    return new Rule(head, body);
  }

  /**
   * ruleList -> rule ruleList | (empty, on QUERIES).
   *
   * @param ts the token stream.
   * @return the rules, possibly none.
   * @throws UnexpectedTokenException if a rule is malformed.
   */
  static List<Rule> ruleList(final TokenStream ts) throws UnexpectedTokenException {
    final List<Rule> rules = new ArrayList<Rule>();
    while (!ts.isOneOf(RULE_LIST_FOLLOW)) {
      rules.add(rule(ts));
    }
    return rules;
  }

  /**
   * query -> predicate QUESTION.
   *
   * @param ts the token stream.
   * @return the query.
   * @throws UnexpectedTokenException if the tokens do not form a query.
   */
  static Predicate query(final TokenStream ts) throws UnexpectedTokenException {
    final Predicate query = predicate(ts);
    ts.match(TokenType.QUESTION);
    return query;
  }

  /**
   * queryList -> query queryList | (empty, on EOF).
   *
   * @param ts the token stream.
   * @return the queries, possibly none.
   * @throws UnexpectedTokenException if a query is malformed.
   */
  static List<Predicate> queryList(final TokenStream ts) throws UnexpectedTokenException {
    final List<Predicate> queries = new ArrayList<Predicate>();
    while (!ts.isOneOf(QUERY_LIST_FOLLOW)) {
      queries.add(query(ts));
    }
    return queries;
  }

  /**
   * predicate -> ID LEFT_PAREN parameter (COMMA parameter)* RIGHT_PAREN.
   *
   * @param ts the token stream.
   * @return the predicate.
   * @throws UnexpectedTokenException if the tokens do not form a predicate.
   */
  static Predicate predicate(final TokenStream ts) throws UnexpectedTokenException {
    final String name = ts.match(TokenType.ID).getValue();
    ts.match(TokenType.LEFT_PAREN);
    final List<Parameter> parameters = new ArrayList<Parameter>();
    parameters.add(parameter(ts));
    while (!ts.isOneOf(PARAMETER_LIST_FOLLOW)) {
      if (!ts.isOneOf(TokenType.COMMA)) {
        throw new UnexpectedTokenException(TokenType.RIGHT_PAREN, ts.current());
      }
      ts.advance();
      parameters.add(parameter(ts));
    }
    ts.match(TokenType.RIGHT_PAREN);
    return new Predicate(name, parameters);
  }

  /**
   * parameter -> ID | STRING.
   *
   * @param ts the token stream.
   * @return the parameter.
   * @throws UnexpectedTokenException naming {@link TokenType#ID} if the current token is neither.
   */
  static Parameter parameter(final TokenStream ts) throws UnexpectedTokenException {
    if (!ts.isOneOf(PARAMETER_FIRST)) {
      throw new UnexpectedTokenException(TokenType.ID, ts.current());
    }
    final Token token = ts.current();
    ts.advance();
    if (token.getType() == TokenType.STRING) {
      return Parameter.string(token.getValue());
    }
    return Parameter.id(token.getValue());
  }
}
