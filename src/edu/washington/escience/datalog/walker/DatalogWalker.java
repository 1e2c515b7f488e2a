package edu.washington.escience.datalog.walker;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;

/**
 * Drives a {@link DatalogListener} over a {@link DatalogProgram}: program entry, schemes, facts, rules, queries,
 * program exit. The program is only read.
 *
 */
public final class DatalogWalker {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DatalogWalker.class);

  /** The listener receiving the callbacks. */
  private final DatalogListener listener;

  /**
   * @param listener the listener receiving the callbacks.
   */
  public DatalogWalker(final DatalogListener listener) {
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  /**
   * Traverse a program with the given listener.
   *
   * @param program the program.
   * @param listener the listener receiving the callbacks.
   */
  public static void walk(final DatalogProgram program, final DatalogListener listener) {
    new DatalogWalker(listener).walk(program);
  }

  /**
   * Traverse a program with this walker's listener.
   *
   * @param program the program.
   */
  public void walk(final DatalogProgram program) {
    Objects.requireNonNull(program, "program");
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("walking {} with {}", program, listener.getClass().getSimpleName());
    }
    listener.enterProgram(program);

    final List<Predicate> schemes = program.getSchemes();
    listener.enterSchemes(schemes);
    for (final Predicate scheme : schemes) {
      listener.enterScheme(scheme);
      listener.exitScheme(scheme);
    }
    listener.exitSchemes(schemes);

    final List<Predicate> facts = program.getFacts();
    listener.enterFacts(facts);
    for (final Predicate fact : facts) {
      listener.enterFact(fact);
      listener.exitFact(fact);
    }
    listener.exitFacts(facts);

    final List<Rule> rules = program.getRules();
    listener.enterRules(rules);
    for (final Rule rule : rules) {
      listener.enterRule(rule);
      listener.exitRule(rule);
    }
    listener.exitRules(rules);

    final List<Predicate> queries = program.getQueries();
    listener.enterQueries(queries);
    for (final Predicate query : queries) {
      listener.enterQuery(query);
      listener.exitQuery(query);
    }
    listener.exitQueries(queries);

    listener.exitProgram(program);
  }
}
