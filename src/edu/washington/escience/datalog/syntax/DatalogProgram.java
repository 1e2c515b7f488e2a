package edu.washington.escience.datalog.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The schemes, facts, rules and queries of a Datalog program, each in the order they were added. Filled in by the
 * parser through the add methods and read-only for everything downstream.
 */
public final class DatalogProgram {
  /** Relation declarations. */
  private final List<Predicate> schemes = new ArrayList<Predicate>();
  /** Ground facts. */
  private final List<Predicate> facts = new ArrayList<Predicate>();
  /** Inference rules. */
  private final List<Rule> rules = new ArrayList<Rule>();
  /** Queries. */
  private final List<Predicate> queries = new ArrayList<Predicate>();

  /** Creates an empty program. */
  public DatalogProgram() {
  }

  /**
   * @param scheme a relation declaration.
   */
  public void addScheme(final Predicate scheme) {
    schemes.add(Objects.requireNonNull(scheme, "scheme"));
  }

  /**
   * @param fact a ground fact.
   */
  public void addFact(final Predicate fact) {
    facts.add(Objects.requireNonNull(fact, "fact"));
  }

  /**
   * @param rule an inference rule.
   */
  public void addRule(final Rule rule) {
    rules.add(Objects.requireNonNull(rule, "rule"));
  }

  /**
   * @param query a query.
   */
  public void addQuery(final Predicate query) {
    queries.add(Objects.requireNonNull(query, "query"));
  }

  /** @return the schemes, read-only. */
  public List<Predicate> getSchemes() {
    return Collections.unmodifiableList(schemes);
  }

  /** @return the facts, read-only. */
  public List<Predicate> getFacts() {
    return Collections.unmodifiableList(facts);
  }

  /** @return the rules, read-only. */
  public List<Rule> getRules() {
    return Collections.unmodifiableList(rules);
  }

  /** @return the queries, read-only. */
  public List<Predicate> getQueries() {
    return Collections.unmodifiableList(queries);
  }

  @Override
  public String toString() {
    return "DatalogProgram[schemes=" + schemes.size() + ", facts=" + facts.size() + ", rules=" + rules.size()
        + ", queries=" + queries.size() + "]";
  }
}
