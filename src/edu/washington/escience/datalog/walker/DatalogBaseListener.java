package edu.washington.escience.datalog.walker;

import java.util.List;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;

/**
 * A {@link DatalogListener} whose callbacks do nothing.
 */
public abstract class DatalogBaseListener implements DatalogListener {

  @Override
  public void enterProgram(final DatalogProgram program) {}

  @Override
  public void exitProgram(final DatalogProgram program) {}

  @Override
  public void enterSchemes(final List<Predicate> schemes) {}

  @Override
  public void exitSchemes(final List<Predicate> schemes) {}

  @Override
  public void enterScheme(final Predicate scheme) {}

  @Override
  public void exitScheme(final Predicate scheme) {}

  @Override
  public void enterFacts(final List<Predicate> facts) {}

  @Override
  public void exitFacts(final List<Predicate> facts) {}

  @Override
  public void enterFact(final Predicate fact) {}

  @Override
  public void exitFact(final Predicate fact) {}

  @Override
  public void enterRules(final List<Rule> rules) {}

  @Override
  public void exitRules(final List<Rule> rules) {}

  @Override
  public void enterRule(final Rule rule) {}

  @Override
  public void exitRule(final Rule rule) {}

  @Override
  public void enterQueries(final List<Predicate> queries) {}

  @Override
  public void exitQueries(final List<Predicate> queries) {}

  @Override
  public void enterQuery(final Predicate query) {}

  @Override
  public void exitQuery(final Predicate query) {}
}
