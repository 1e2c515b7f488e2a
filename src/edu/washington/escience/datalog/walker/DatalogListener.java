package edu.washington.escience.datalog.walker;

import java.util.EventListener;
import java.util.List;

import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.syntax.Predicate;
import edu.washington.escience.datalog.syntax.Rule;

/**
 * Callbacks invoked by {@link DatalogWalker} while it traverses a {@link DatalogProgram}. Every enter call is matched
 * by an exit call once the element's traversal is done. Extend {@link DatalogBaseListener} to override only the
 * callbacks of interest.
 *
 * <h3>Order</h3>
 *
 * Program, then the scheme section, the fact section, the rule section and the query section, each element in the
 * order it was parsed. This is the order in which an evaluator declares relations, loads facts, applies rules and
 * answers queries.
 */
public interface DatalogListener extends EventListener {

  /**
   * @param program the program about to be traversed.
   */
  void enterProgram(DatalogProgram program);

  /**
   * @param program the program just traversed.
   */
  void exitProgram(DatalogProgram program);

  /**
   * @param schemes all schemes of the program.
   */
  void enterSchemes(List<Predicate> schemes);

  /**
   * @param schemes all schemes of the program.
   */
  void exitSchemes(List<Predicate> schemes);

  /**
   * @param scheme a scheme.
   */
  void enterScheme(Predicate scheme);

  /**
   * @param scheme a scheme.
   */
  void exitScheme(Predicate scheme);

  /**
   * @param facts all facts of the program.
   */
  void enterFacts(List<Predicate> facts);

  /**
   * @param facts all facts of the program.
   */
  void exitFacts(List<Predicate> facts);

  /**
   * @param fact a fact.
   */
  void enterFact(Predicate fact);

  /**
   * @param fact a fact.
   */
  void exitFact(Predicate fact);

  /**
   * @param rules all rules of the program, possibly none.
   */
  void enterRules(List<Rule> rules);

  /**
   * @param rules all rules of the program, possibly none.
   */
  void exitRules(List<Rule> rules);

  /**
   * @param rule a rule.
   */
  void enterRule(Rule rule);

  /**
   * @param rule a rule.
   */
  void exitRule(Rule rule);

  /**
   * @param queries all queries of the program.
   */
  void enterQueries(List<Predicate> queries);

  /**
   * @param queries all queries of the program.
   */
  void exitQueries(List<Predicate> queries);

  /**
   * @param query a query.
   */
  void enterQuery(Predicate query);

  /**
   * @param query a query.
   */
  void exitQuery(Predicate query);
}
