package edu.washington.escience.datalog;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * This class holds the constants for the Datalog front end.
 *
 */
public final class DatalogConstants {
  /**
   * Keyword introducing the scheme section.
   */
  public static final String SCHEMES_KEYWORD = "Schemes";

  /**
   * Keyword introducing the fact section.
   */
  public static final String FACTS_KEYWORD = "Facts";

  /**
   * Keyword introducing the rule section.
   */
  public static final String RULES_KEYWORD = "Rules";

  /**
   * Keyword introducing the query section.
   */
  public static final String QUERIES_KEYWORD = "Queries";

  /**
   * Header of the literal domain in the rendered program.
   */
  public static final String DOMAIN_HEADER = "Domain";

  /**
   * Indentation of every element line in the rendered program.
   */
  public static final String INDENT = "  ";

  /**
   * Line separator of the rendered program. Fixed so that rendering does not depend on the platform.
   */
  public static final String NEWLINE = "\n";

  /**
   * First line of the report when a program parses.
   */
  public static final String SUCCESS_MARKER = "Success!";

  /**
   * First line of the report when a program does not parse.
   */
  public static final String FAILURE_MARKER = "Failure!";

  /**
   * Charset used to read program files.
   */
  public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

  /**
   * Utility classes cannot be constructed.
   */
  private DatalogConstants() {}
}
