package edu.washington.escience.datalog.tool;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.datalog.DatalogConstants;
import edu.washington.escience.datalog.parser.DatalogParser;
import edu.washington.escience.datalog.parser.UnexpectedTokenException;
import edu.washington.escience.datalog.syntax.DatalogProgram;
import edu.washington.escience.datalog.token.DatalogLexer;
import edu.washington.escience.datalog.walker.PrintListener;

/**
 * Lexes, parses and renders Datalog program text.
 */
public final class DatalogFrontEnd {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DatalogFrontEnd.class);

  /** Utility classes cannot be constructed. */
  private DatalogFrontEnd() {}

  /**
   * @param input the text of a Datalog program.
   * @return the parsed program.
   * @throws UnexpectedTokenException at the first token the grammar does not allow.
   */
  public static DatalogProgram parse(final String input) throws UnexpectedTokenException {
    Objects.requireNonNull(input, "input");
    return DatalogParser.parse(new DatalogLexer(input));
  }

  /**
   * @param input the text of a Datalog program.
   * @return <code>Success!</code> followed by the rendered program, or <code>Failure!</code> followed by the offending
   *         token.
   */
  public static String run(final String input) {
    try {
      final DatalogProgram program = parse(input);
      LOGGER.debug("parsed {}", program);
      return DatalogConstants.SUCCESS_MARKER + DatalogConstants.NEWLINE + PrintListener.render(program);
    } catch (final UnexpectedTokenException e) {
      LOGGER.warn(e.getMessage());
      return DatalogConstants.FAILURE_MARKER + DatalogConstants.NEWLINE + DatalogConstants.INDENT + e.getToken();
    }
  }
}
