package edu.washington.escience.datalog.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Parameter;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;
import edu.washington.escience.datalog.token.DatalogLexer;
import edu.washington.escience.datalog.token.Token;
import edu.washington.escience.datalog.token.TokenType;
import edu.washington.escience.datalog.util.TestUtils;
import edu.washington.escience.datalog.util.TestUtils.CountingTokens;

public class DatalogParserTest {

  /**
   * @param text program text.
   * @return the parsed program.
   * @throws UnexpectedTokenException if the program does not parse.
   */
  private static DatalogProgram parse(final String text) throws UnexpectedTokenException {
    return DatalogParser.parse(new DatalogLexer(text));
  }

  /**
   * @param text program text that must not parse.
   * @return the exception it fails with.
   */
  private static UnexpectedTokenException parseFailure(final String text) {
    try {
      parse(text);
    } catch (UnexpectedTokenException e) {
      return e;
    }
    fail("parsed: " + text);
    return null;
  }

  /**
   * @param text tokens of a production.
   * @return a stream over them.
   */
  private static TokenStream stream(final String text) {
    return new TokenStream(new DatalogLexer(text));
  }

  @Test
  public void testSimpleProgram() throws Exception {
    final DatalogProgram program = parse(TestUtils.SIMPLE_PROGRAM);
    assertEquals(ImmutableList.of(Predicate.of("a", Parameter.id("A"), Parameter.id("B"))), program.getSchemes());
    assertEquals(
        ImmutableList.of(Predicate.of("a", Parameter.string("1"), Parameter.string("2"))), program.getFacts());
    assertTrue(program.getRules().isEmpty());
    assertEquals(ImmutableList.of(Predicate.of("a", Parameter.id("X"), Parameter.id("Y"))), program.getQueries());
  }

  @Test
  public void testFullProgram() throws Exception {
    final DatalogProgram program = parse(TestUtils.FULL_PROGRAM);
    assertEquals(2, program.getSchemes().size());
    assertEquals("HasSameAddress", program.getSchemes().get(1).getName());
    assertEquals(2, program.getFacts().size());
    assertEquals(Parameter.string("C. Brown"), program.getFacts().get(0).getParameters().get(1));
    assertEquals(1, program.getRules().size());
    final Rule rule = program.getRules().get(0);
    assertEquals(Predicate.of("HasSameAddress", Parameter.id("X"), Parameter.id("Y")), rule.getHead());
    assertEquals(2, rule.getBody().size());
    assertEquals("snap(D,Y,B,E)", rule.getBody().get(1).toString());
    assertEquals(
        ImmutableList.of(Predicate.of("HasSameAddress", Parameter.string("Snoopy"), Parameter.id("Who"))),
        program.getQueries());
  }

  @Test
  public void testOrderIsPreserved() throws Exception {
    final DatalogProgram program =
        parse("Schemes: c(X) a(X) b(X) Facts: c('3'). a('1'). c('3'). Rules: Queries: b(X)? a(X)?");
    assertEquals("c", program.getSchemes().get(0).getName());
    assertEquals("a", program.getSchemes().get(1).getName());
    assertEquals("b", program.getSchemes().get(2).getName());
    assertEquals(3, program.getFacts().size());
    assertEquals(program.getFacts().get(0), program.getFacts().get(2));
    assertEquals("b", program.getQueries().get(0).getName());
  }

  @Test
  public void testEachParseIsIndependent() throws Exception {
    final DatalogProgram first = parse(TestUtils.SIMPLE_PROGRAM);
    final DatalogProgram second = parse(TestUtils.SIMPLE_PROGRAM);
    assertNotSame(first, second);
    assertEquals(1, first.getSchemes().size());
    assertEquals(1, second.getSchemes().size());
    assertEquals(first.getFacts(), second.getFacts());
  }

  @Test
  public void testFactsMayHoldIdentifiers() throws Exception {
    final DatalogProgram program = parse("Schemes: a(A) Facts: a(b). Rules: Queries: a(X)?");
    assertEquals(Parameter.id("b"), program.getFacts().get(0).getParameters().get(0));
  }

  @Test
  public void testMissingRightParenStopsAtNextToken() {
    final CountingTokens tokens =
        new CountingTokens(
            Token.of(TokenType.SCHEMES, 1),
            Token.of(TokenType.COLON, 1),
            Token.id("a", 2),
            Token.of(TokenType.LEFT_PAREN, 2),
            Token.id("A", 2),
            Token.of(TokenType.FACTS, 3),
            Token.of(TokenType.COLON, 3),
            Token.eof(3));
    try {
      DatalogParser.parse(tokens);
      fail();
    } catch (UnexpectedTokenException e) {
      assertEquals(TokenType.RIGHT_PAREN, e.getExpectedType());
      assertEquals(Token.of(TokenType.FACTS, 3), e.getToken());
    }
    assertEquals(6, tokens.getTaken());
  }

  @Test
  public void testEndsAfterSchemesKeyword() {
    final UnexpectedTokenException e =
        parseFailure("Schemes:");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.EOF, e.getToken().getType());
  }

  @Test
  public void testEmptyInput() {
    final UnexpectedTokenException e = parseFailure("");
    assertEquals(TokenType.SCHEMES, e.getExpectedType());
    assertEquals(Token.eof(1), e.getToken());
  }

  @Test
  public void testFactsSectionMissing() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Rules: Queries: a(X)?");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.RULES, e.getToken().getType());
  }

  @Test
  public void testAtLeastOneFact() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Facts: Rules: Queries: a(X)?");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.RULES, e.getToken().getType());
  }

  @Test
  public void testAtLeastOneQuery() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Facts: a('1'). Rules: Queries:");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.EOF, e.getToken().getType());
  }

  @Test
  public void testSchemeRejectsLiterals() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A,'b') Facts: a('1','2'). Rules: Queries: a(X,Y)?");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(Token.string("b", 1), e.getToken());
  }

  @Test
  public void testRuleWithoutPeriod() {
    final UnexpectedTokenException e =
        parseFailure("Schemes: a(A) Facts: a('1'). Rules: b(X) :- a(X) a(X). Queries: b(X)?");
    assertEquals(TokenType.PERIOD, e.getExpectedType());
    assertEquals(Token.id("a", 1), e.getToken());
  }

  @Test
  public void testRuleWithoutBody() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Facts: a('1'). Rules: b(X) :- . Queries: b(X)?");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.PERIOD, e.getToken().getType());
  }

  @Test
  public void testQueryWithoutQuestionMark() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Facts: a('1'). Rules: Queries: a(X).");
    assertEquals(TokenType.QUESTION, e.getExpectedType());
    assertEquals(TokenType.PERIOD, e.getToken().getType());
  }

  @Test
  public void testUndefinedToken() {
    final UnexpectedTokenException e = parseFailure("Schemes: a(A) Facts: a('1'). Rules: Queries: a($)?");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(new Token(TokenType.UNDEFINED, "$", 1), e.getToken());
  }

  @Test
  public void testTrailingInput() {
    final UnexpectedTokenException e = parseFailure(TestUtils.SIMPLE_PROGRAM + "Schemes:");
    assertEquals(TokenType.ID, e.getExpectedType());
    assertEquals(TokenType.SCHEMES, e.getToken().getType());
  }

  @Test
  public void testPredicateProduction() throws Exception {
    final TokenStream ts = stream("f(X,'y',Z) ?");
    assertEquals(
        Predicate.of("f", Parameter.id("X"), Parameter.string("y"), Parameter.id("Z")), DatalogParser.predicate(ts));
    assertEquals(TokenType.QUESTION, ts.type());
  }

  @Test
  public void testParameterProduction() throws Exception {
    assertEquals(Parameter.id("X"), DatalogParser.parameter(stream("X")));
    assertEquals(Parameter.string("x"), DatalogParser.parameter(stream("'x'")));
    try {
      DatalogParser.parameter(stream(","));
      fail();
    } catch (UnexpectedTokenException e) {
      assertEquals(TokenType.ID, e.getExpectedType());
    }
  }

  @Test
  public void testRuleListMayBeEmpty() throws Exception {
    assertTrue(DatalogParser.ruleList(stream("Queries")).isEmpty());
  }

  @Test
  public void testRuleProduction() throws Exception {
    final Rule rule = DatalogParser.rule(stream("p(X) :- q(X),r(X,'c'),s(X)."));
    assertEquals("p(X) :- q(X),r(X,c),s(X)", rule.toString());
  }

  @Test
  public void testLongListsAreIterative() throws Exception {
    final StringBuilder sb = new StringBuilder("Schemes: a(A) Facts: ");
    final int n = 20000;
    for (int i = 0; i < n; ++i) {
      sb.append("a('").append(i).append("'). ");
    }
    sb.append("Rules: Queries: a(X)?");
    assertEquals(n, parse(sb.toString()).getFacts().size());
  }
}
