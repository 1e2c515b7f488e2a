package edu.washington.escience.datalog.syntax;

import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * A relation name applied to an ordered list of parameters. Used for schemes, facts, rule heads, rule bodies and
 * queries alike. Immutable.
 *
 */
public final class Predicate {
  /** The relation name. */
  private final String name;
  /** The parameters, in column order. */
  private final ImmutableList<Parameter> parameters;

  /**
   * @param name the relation name.
   * @param parameters the parameters, in column order. May be empty.
   */
  public Predicate(final String name, final List<Parameter> parameters) {
    this.name = Objects.requireNonNull(name, "name");
    this.parameters = ImmutableList.copyOf(Objects.requireNonNull(parameters, "parameters"));
  }

  /**
   * @param name the relation name.
   * @param parameters the parameters, in column order.
   * @return a new predicate.
   */
  public static Predicate of(final String name, final Parameter... parameters) {
    return new Predicate(name, ImmutableList.copyOf(parameters));
  }

  /** @return the relation name. */
  public String getName() {
    return name;
  }

  /** @return the parameters, in column order. */
  public ImmutableList<Parameter> getParameters() {
    return parameters;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters);
  }

  @Override
  public boolean equals(final Object other) {
    if (other == null || !(other instanceof Predicate)) {
      return false;
    }
    Predicate o = (Predicate) other;
    return name.equals(o.name) && parameters.equals(o.parameters);
  }

  /**
   * @return <code>name(p1,p2,...)</code>, parameters in their raw text.
   */
  @Override
  public String toString() {
    return name + "(" + Joiner.on(',').join(parameters) + ")";
  }
}
