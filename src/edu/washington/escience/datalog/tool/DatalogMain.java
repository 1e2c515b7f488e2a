package edu.washington.escience.datalog.tool;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.washington.escience.datalog.DatalogConstants;

/** Command line entry point: parses the program in a file and prints the report. */
public final class DatalogMain {
  /** The logger for this class. */
  private static final Logger LOGGER = LoggerFactory.getLogger(DatalogMain.class);
  /** usage. */
  public static final String USAGE = "usage: datalog <input file>";
  /** Exit status when the input file cannot be read. */
  public static final int EXIT_IO_ERROR = 1;

  /** entry point class. */
  private DatalogMain() {}

  /**
   * entry point.
   *
   * @param args args.
   */
  public static void main(final String[] args) {
    final int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  /**
   * Run the command line without exiting the JVM.
   *
   * @param args the command line arguments.
   * @param out where the report or the usage line goes.
   * @param err where read errors go.
   * @return the exit status: 0, or {@link #EXIT_IO_ERROR} if the input file cannot be read.
   */
  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    if (args.length != 1) {
      out.println(USAGE);
      return 0;
    }
    final String report;
    try {
      report = runFile(new File(args[0]));
    } catch (IOException e) {
      LOGGER.error("cannot read {}", args[0], e);
      err.println("cannot read " + args[0] + ": " + e.getMessage());
      return EXIT_IO_ERROR;
    }
    /* A success report already ends its last line. */
    out.print(report);
    if (!report.endsWith(DatalogConstants.NEWLINE)) {
      out.print(DatalogConstants.NEWLINE);
    }
    out.flush();
    return 0;
  }

  /**
   * @param input the program file.
   * @return the front end's report for the program.
   * @throws IOException if the file cannot be read.
   */
  public static String runFile(final File input) throws IOException {
    final String text = FileUtils.readFileToString(input, DatalogConstants.DEFAULT_CHARSET);
    LOGGER.info("read {} characters from {}", text.length(), input);
    return DatalogFrontEnd.run(text);
  }
}
