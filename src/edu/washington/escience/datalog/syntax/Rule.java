package edu.washington.escience.datalog.syntax;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Rule wraps a head predicate and a non-empty body of predicates into a single Datalog rule.
 *
 */
public final class Rule {
  /** The head of this rule. */
  private final Predicate head;
  /** The body of this rule. */
  private final ImmutableList<Predicate> body;

  /**
   * Builds a Rule from a given head and body.
   *
   * @param head the head predicate of this rule.
   * @param body the body predicates of this rule, in order.
   * @throws IllegalArgumentException if the body is empty.
   */
  public Rule(final Predicate head, final List<Predicate> body) {
    Objects.requireNonNull(head, "head");
    Objects.requireNonNull(body, "body");
    Preconditions.checkArgument(!body.isEmpty(), "the body of rule %s is empty", head);
    this.head = head;
    this.body = ImmutableList.copyOf(body);
  }

  /** @return the head predicate of this rule. */
  public Predicate getHead() {
    return head;
  }

  /** @return the body predicates of this rule. */
  public ImmutableList<Predicate> getBody() {
    return body;
  }

  @Override
  public int hashCode() {
    return Objects.hash(head, body);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !(other instanceof Rule)) {
      return false;
    }
    Rule o = (Rule) other;
    return head.equals(o.head) && body.equals(o.body);
  }

  /**
   * @return <code>head :- b1,b2</code>, without the closing period.
   */
  @Override
  public String toString() {
    return head + " :- " + Joiner.on(',').join(body);
  }
}
