package edu.washington.escience.datalog.walker;

import static edu.washington.escience.datalog.DatalogConstants.INDENT;
import static edu.washington.escience.datalog.DatalogConstants.NEWLINE;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import com.google.common.collect.ImmutableSortedSet;

import edu.washington.escience.datalog.DatalogConstants;
import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Parameter;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;

/**
 * Renders a program to its canonical text and collects the domain, i.e. the distinct literals used in facts.
 *
 * <pre>
 * Schemes(1):
 *   a(A,B)
 *
 * Facts(1):
 *   a(1,2).
 *
 * Rules(0):
 *
 * Queries(1):
 *   a(X,Y)?
 *
 * Domain(2):
 *   1
 *   2
 * </pre>
 *
 * A listener instance renders one program; walk a fresh instance for each program.
 */
public final class PrintListener extends DatalogBaseListener {
  /** The rendered text so far. */
  private final StringBuilder text = new StringBuilder();
  /** Literals seen in facts, sorted. */
  private final SortedSet<String> domain = new TreeSet<String>();

  /**
   * @param program a program.
   * @return the canonical text of the program.
   */
  public static String render(final DatalogProgram program) {
    final PrintListener printer = new PrintListener();
    DatalogWalker.walk(program, printer);
    return printer.toString();
  }

  /**
   * @param name a section name.
   * @param count the number of elements in the section.
   */
  private void header(final String name, final int count) {
    text.append(name).append('(').append(count).append("):").append(NEWLINE);
  }

  /**
   * @param line an element line, without indentation.
   */
  private void line(final String line) {
    text.append(INDENT).append(line).append(NEWLINE);
  }

  /** A blank line between sections. */
  private void separator() {
    text.append(NEWLINE);
  }

  @Override
  public void enterSchemes(final List<Predicate> schemes) {
    header(DatalogConstants.SCHEMES_KEYWORD, schemes.size());
  }

  @Override
  public void exitSchemes(final List<Predicate> schemes) {
    separator();
  }

  @Override
  public void enterScheme(final Predicate scheme) {
    line(scheme.toString());
  }

  @Override
  public void enterFacts(final List<Predicate> facts) {
    header(DatalogConstants.FACTS_KEYWORD, facts.size());
  }

  @Override
  public void exitFacts(final List<Predicate> facts) {
    separator();
  }

  @Override
  public void enterFact(final Predicate fact) {
    line(fact + ".");
    for (final Parameter p : fact.getParameters()) {
      if (p.isString()) {
        domain.add(p.getValue());
      }
    }
  }

  @Override
  public void enterRules(final List<Rule> rules) {
    header(DatalogConstants.RULES_KEYWORD, rules.size());
  }

  @Override
  public void exitRules(final List<Rule> rules) {
    separator();
  }

  @Override
  public void enterRule(final Rule rule) {
    line(rule + ".");
  }

  @Override
  public void enterQueries(final List<Predicate> queries) {
    header(DatalogConstants.QUERIES_KEYWORD, queries.size());
  }

  @Override
  public void exitQueries(final List<Predicate> queries) {
    separator();
  }

  @Override
  public void enterQuery(final Predicate query) {
    line(query + "?");
  }

  @Override
  public void exitProgram(final DatalogProgram program) {
    header(DatalogConstants.DOMAIN_HEADER, domain.size());
    for (final String literal : domain) {
      line(literal);
    }
  }

  /**
   * @return the literals seen in facts so far, sorted.
   */
  public ImmutableSortedSet<String> getDomain() {
    return ImmutableSortedSet.copyOfSorted(domain);
  }

  /**
   * @return the text rendered so far.
   */
  @Override
  public String toString() {
    return text.toString();
  }
}
