package edu.washington.escience.datalog.tool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.PrintStream;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.washington.escience.datalog.DatalogConstants;
import edu.washington.escience.datalog.util.TestUtils;

public class DatalogMainTest {

  @Rule public TemporaryFolder folder = new TemporaryFolder();

  private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
  private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
  private PrintStream out;
  private PrintStream err;
  private PrintStream savedOut;

  @Before
  public void setUp() throws Exception {
    out = new PrintStream(outBytes, true, "UTF-8");
    err = new PrintStream(errBytes, true, "UTF-8");
    savedOut = System.out;
  }

  @After
  public void tearDown() {
    System.setOut(savedOut);
  }

  /**
   * @param text the program text.
   * @return a file holding it.
   * @throws Exception if the file cannot be written.
   */
  private File programFile(final String text) throws Exception {
    final File input = folder.newFile();
    FileUtils.writeStringToFile(input, text, DatalogConstants.DEFAULT_CHARSET);
    return input;
  }

  @Test
  public void testRunFile() throws Exception {
    assertEquals(
        DatalogFrontEnd.run(TestUtils.SIMPLE_PROGRAM), DatalogMain.runFile(programFile(TestUtils.SIMPLE_PROGRAM)));
  }

  @Test(expected = FileNotFoundException.class)
  public void testMissingFile() throws Exception {
    DatalogMain.runFile(new File(folder.getRoot(), "missing.dl"));
  }

  @Test
  public void testMainPrintsUsageOnWrongArgumentCount() throws Exception {
    System.setOut(out);
    DatalogMain.main(new String[0]);
    DatalogMain.main(new String[] {"a", "b"});
    assertEquals(DatalogMain.USAGE + "\n" + DatalogMain.USAGE + "\n", outBytes.toString("UTF-8").replace("\r\n", "\n"));
  }

  @Test
  public void testSuccessReportEndsWithOneNewline() throws Exception {
    final String[] args = {programFile(TestUtils.SIMPLE_PROGRAM).getPath()};
    assertEquals(0, DatalogMain.run(args, out, err));
    final String printed = outBytes.toString("UTF-8");
    assertEquals(DatalogFrontEnd.run(TestUtils.SIMPLE_PROGRAM), printed);
    assertTrue(printed.endsWith("Domain(2):\n  1\n  2\n"));
    assertEquals("", errBytes.toString("UTF-8"));
  }

  @Test
  public void testFailureReportIsTerminated() throws Exception {
    final String[] args = {programFile("Schemes:").getPath()};
    assertEquals(0, DatalogMain.run(args, out, err));
    assertEquals("Failure!\n  (EOF,\"\",1)\n", outBytes.toString("UTF-8"));
  }

  @Test
  public void testUnreadableFileGivesErrorStatus() throws Exception {
    final String missing = new File(folder.getRoot(), "missing.dl").getPath();
    assertEquals(DatalogMain.EXIT_IO_ERROR, DatalogMain.run(new String[] {missing}, out, err));
    assertTrue(errBytes.toString("UTF-8").startsWith("cannot read " + missing));
    assertEquals("", outBytes.toString("UTF-8"));
  }
}
