package edu.washington.escience.datalog.syntax;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;

import com.google.common.collect.ImmutableList;

public class RuleTest {

  private final Predicate head = Predicate.of("p", Parameter.id("X"));
  private final Predicate q = Predicate.of("q", Parameter.id("X"), Parameter.string("c"));
  private final Predicate r = Predicate.of("r", Parameter.id("X"));

  @Test
  public void testToString() {
    assertEquals("p(X) :- q(X,c),r(X)", new Rule(head, ImmutableList.of(q, r)).toString());
  }

  @Test
  public void testAccessors() {
    final Rule rule = new Rule(head, ImmutableList.of(q, r));
    assertEquals(head, rule.getHead());
    assertEquals(ImmutableList.of(q, r), rule.getBody());
    assertEquals(rule, new Rule(head, ImmutableList.of(q, r)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyBody() {
    new Rule(head, ImmutableList.<Predicate>of());
  }

  @Test(expected = NullPointerException.class)
  public void testNullHead() {
    final List<Predicate> body = ImmutableList.of(q);
    new Rule(null, body);
  }
}
