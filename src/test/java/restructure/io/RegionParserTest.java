package restructure.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import com.google.common.base.Joiner;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import restructure.ast.AstPrinter;
import restructure.graph.Node;
import restructure.graph.NodeKind;
import restructure.graph.RegionGraph;
import restructure.pipeline.Restructurer;

public class RegionParserTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines);
  }

  private static void assertParseError(String text, int line, String message) {
    try {
      RegionParser.parse(text);
      fail("expected a parse error");
    } catch (RegionParseError e) {
      assertThat(e.line, is(line));
      assertThat(e.getMessage(), containsString(message));
    }
  }

  @Test
  public void diamond() {
    RegionGraph<String> graph =
        RegionParser.parse(
            lines(
                "# a diamond",
                "region main",
                "  code a 3",
                "  code b",
                "  code c",
                "  code d   # the join",
                "  edge a b",
                "  edge a c",
                "  edge b d",
                "  edge c d",
                "end"));

    assertThat(graph.name(), is("main"));
    assertThat(graph.size(), is(4));
    Node<String> entry = graph.entry();
    assertThat(entry.name(), is("a"));
    assertThat(entry.block().get(), is("main:a"));
    assertThat(entry.weight(), is(3));
    assertThat(entry.successor(1).weight(), is(1));
    assertThat(graph.exitNodes().get(0).name(), is("d"));
  }

  @Test
  public void nestedRegionsAndChecks() {
    RegionGraph<String> graph =
        RegionParser.parse(
            lines(
                "region main",
                "code a",
                "collapsed l body",
                "check k 1",
                "code x",
                "code y",
                "edge a l",
                "edge l k",
                "true k x",
                "false k y",
                "end",
                "",
                "region body",
                "code inner 7",
                "end"));

    Node<String> collapsed = graph.entry().successor(0);
    assertThat(collapsed.kind(), is(NodeKind.COLLAPSED));
    assertThat(collapsed.collapsedRegion().name(), is("body"));
    assertThat(collapsed.weight(), is(7));
    Node<String> check = collapsed.successor(0);
    assertThat(check.name(), is("k"));
    assertThat(check.stateIndex(), is(1));
    assertThat(check.getTrue().name(), is("x"));
    assertThat(check.getFalse().name(), is("y"));
  }

  @Test
  public void explicitEntry() {
    RegionGraph<String> graph =
        RegionParser.parse(lines("region r", "code a", "code b", "edge b a", "entry b", "end"));

    assertThat(graph.entry().name(), is("b"));
  }

  @Test
  public void loopsAreCollapsed() throws IOException {
    String text =
        lines(
            "region main",
            "code a",
            "code h",
            "code b",
            "code x",
            "edge a h",
            "edge h b",
            "edge h x",
            "edge b h",
            "loop h b",
            "end");

    RegionGraph<String> graph =
        RegionParser.parse(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));

    assertThat(graph.size(), is(3));
    assertThat(
        AstPrinter.print(new Restructurer().generateAst(graph)).toString(),
        is(
            String.format(
                "a;%nwhile (true) {%n  if (h) {%n    b;%n    continue;%n"
                    + "  } else {%n    break;%n  }%n}%nx;%n")));
  }

  @Test
  public void errorsCarryTheirLine() {
    assertParseError(lines("region r", "code a", "edge a b", "end"), 3, "unknown node b");
    assertParseError(lines("region r", "code a", "jump a", "end"), 3, "unknown directive 'jump'");
    assertParseError(lines("region r", "code a"), 2, "region r is not closed");
    assertParseError(lines("region r", "code a x", "end"), 2, "expected a number but got 'x'");
    assertParseError(lines("region r", "code a -1", "end"), 2, "negative weight");
    assertParseError(lines("region r", "code a", "code a", "end"), 3, "defined twice");
    assertParseError(lines("code a"), 1, "outside of a region");
    assertParseError(lines("region r", "end", "end"), 3, "'end' outside of a region");
    assertParseError(lines("region r", "code a b c", "end"), 2, "takes 1 to 2 arguments");
    assertParseError(lines("region r", "end"), 1, "region r is empty");
    assertParseError("", 1, "no region declared");
  }

  @Test
  public void regionsMayNotNestThemselves() {
    assertParseError(
        lines("region r", "collapsed x s", "end", "region s", "collapsed y r", "end"),
        5,
        "region r nests itself");
  }

  @Test
  public void branchesOnlyLeaveChecks() {
    assertParseError(
        lines("region r", "code a", "code b", "true a b", "end"), 4, "a is not a check");
  }

  @Test
  public void graphErrorsAreReportedWithTheirLine() {
    // a third successor
    assertParseError(
        lines(
            "region r",
            "code a",
            "code b",
            "code c",
            "code d",
            "edge a b",
            "edge a c",
            "edge a d",
            "end"),
        8,
        "already has two successors");
  }
}
