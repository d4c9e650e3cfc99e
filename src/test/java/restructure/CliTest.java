package restructure;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import com.google.common.jimfs.Jimfs;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.junit.Before;
import org.junit.Test;

public class CliTest {

  private static final String DIAMOND =
      String.join(
          "\n",
          "region main",
          "code a",
          "code b",
          "code c",
          "code d",
          "edge a b",
          "edge a c",
          "edge b d",
          "edge c d",
          "end");

  ByteArrayOutputStream out;
  ByteArrayOutputStream err;
  FileSystem fs;
  Cli cli;

  @Before
  public void setup() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    fs = Jimfs.newFileSystem();
    cli = new Cli(out, err, fs);
  }

  private Path file(String content) throws Exception {
    Path file = fs.getPath("region.txt");
    Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test
  public void fileDoesNotExist_printErrorMessageAndSignalFailure() throws Exception {
    String filename = "non-existing-file";
    int status = cli.run(filename);
    assertThat(status, is(not(0)));
    assertThat(err.toString(), allOf(containsString(filename), containsString("doesn't exist")));
  }

  @Test
  public void multipleMainArguments_printUsageAndSignalFailure() throws Exception {
    int status = cli.run("--print-ast", "foo", "bar");
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void twoModesSet_printUsageAndSignalFailure() throws Exception {
    Path file = file(DIAMOND);
    int status = cli.run("--print-ast", "--check", file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void negativeUntangleFactor_printUsageAndSignalFailure() throws Exception {
    Path file = file(DIAMOND);
    int status = cli.run("--untangle-factor", "-2", file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void helpAndInvalidOptionCombinationIsSet_printUsageAndSignalSuccess() throws Exception {
    int status = cli.run("--print-graph", "--help", "--check", "arg1", "arg2");
    assertThat(status, is(0));
    assertThat(out.toString(), containsString(Cli.usage));
  }

  @Test
  public void printAst_isTheDefault() throws Exception {
    Path file = file(DIAMOND);
    int status = cli.run(file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), equalTo(String.format("if (a) {%n  b;%n} else {%n  c;%n}%nd;%n")));
  }

  @Test
  public void printAst_structuresTheFile() throws Exception {
    Path file =
        file(
            String.join(
                "\n",
                "region main",
                "code a",
                "code b",
                "code c",
                "code d",
                "code e",
                "edge a b",
                "edge a c",
                "edge b d",
                "edge b e",
                "edge c e",
                "edge d e",
                "end"));
    int status = cli.run("--print-ast", "--no-untangle", file.toString());
    assertThat(status, is(0));
    assertThat(
        out.toString(),
        equalTo(String.format("if (a) {%n  if (b) {%n    d;%n  }%n} else {%n  c;%n}%ne;%n")));
  }

  @Test
  public void printGraph_writesDot() throws Exception {
    Path file = file(DIAMOND);
    int status = cli.run("--print-graph", file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), startsWith("digraph \"main\""));
  }

  @Test
  public void check_printsNothing() throws Exception {
    Path file = file(DIAMOND);
    int status = cli.run("--check", file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), emptyString());
    assertThat(err.toString(), emptyString());
  }

  @Test
  public void parseError_isReportedWithItsLine() throws Exception {
    Path file = file("region main\ncode a\nedge a b\nend");
    int status = cli.run(file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString("error: Parse error at line 3: unknown node b"));
  }

  @Test
  public void unstructurableRegion_isReported() throws Exception {
    Path file = file("region main\ncode a\ncode b\nedge a b\nedge b a\nentry a\nend");
    int status = cli.run(file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString("error: Region main has a cycle"));
  }
}
