package edu.washington.escience.datalog.syntax;

/**
 * The kinds of predicate parameters.
 */
public enum ParameterType {
  /** Names a relation column or a variable. */
  ID,
  /** A literal constant. */
  STRING;
}
