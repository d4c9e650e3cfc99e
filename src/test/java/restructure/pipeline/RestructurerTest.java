package restructure.pipeline;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import restructure.RestructureError;
import restructure.ast.Ast;
import restructure.ast.AstNode;
import restructure.ast.AstPaths;
import restructure.ast.AstPrinter;
import restructure.graph.GraphBuilder;
import restructure.graph.LoopCollapser;
import restructure.graph.RegionGraph;

public class RestructurerTest {
  private final Restructurer restructurer = new Restructurer();

  private String structure(RegionGraph<String> graph) {
    return AstPrinter.print(restructurer.generateAst(graph)).toString();
  }

  @Test
  public void diamond() {
    assertThat(
        structure(GraphBuilder.diamond().build()),
        is(String.format("if (a) {%n  b;%n} else {%n  c;%n}%nd;%n")));
  }

  @Test
  public void joinOfThreeEdges() {
    RegionGraph<String> graph =
        GraphBuilder.region("r")
            .code("a", "b", "c", "d", "e")
            .edge("a", "b", "c")
            .edge("b", "d", "e")
            .edge("c", "e")
            .edge("d", "e")
            .build();

    assertThat(
        structure(graph),
        is(String.format("if (a) {%n  if (b) {%n    d;%n  }%n} else {%n  c;%n}%ne;%n")));
  }

  @Test
  public void sharedCode_isDuplicated() {
    RegionGraph<String> graph =
        GraphBuilder.region("r")
            .code("a", "b", "c", "d", "e", "f")
            .edge("a", "b", "c")
            .edge("b", "d", "e")
            .edge("c", "d")
            .edge("d", "f")
            .edge("e", "f")
            .build();

    assertThat(
        structure(graph),
        is(
            String.format(
                "if (a) {%n  if (b) {%n    d;%n  } else {%n    e;%n  }%n"
                    + "} else {%n  c;%n  d;%n}%nf;%n")));
  }

  @Test
  public void loopWithSingleExit() {
    GraphBuilder b =
        GraphBuilder.region("main")
            .code("a", "h", "b", "x")
            .edge("a", "h")
            .edge("h", "b", "x")
            .edge("b", "h");
    RegionGraph<String> graph = b.build();
    LoopCollapser.collapseLoop(graph, b.node("h"), ImmutableSet.of(b.node("h"), b.node("b")));

    assertThat(
        structure(graph),
        is(
            String.format(
                "a;%nwhile (true) {%n  if (h) {%n    b;%n    continue;%n"
                    + "  } else {%n    break;%n  }%n}%nx;%n")));
  }

  @Test
  public void loopWithTwoExits_dispatchesOnState() {
    GraphBuilder b =
        GraphBuilder.region("main")
            .code("h", "b", "x", "y")
            .edge("h", "b", "x")
            .edge("b", "h", "y");
    RegionGraph<String> graph = b.build();
    LoopCollapser.collapseLoop(graph, b.node("h"), ImmutableSet.of(b.node("h"), b.node("b")));

    assertThat(
        structure(graph),
        is(
            String.format(
                "while (true) {%n"
                    + "  if (h) {%n"
                    + "    if (b) {%n"
                    + "      continue;%n"
                    + "    } else {%n"
                    + "      state = 1;%n"
                    + "      break;%n"
                    + "    }%n"
                    + "  } else {%n"
                    + "    state = 0;%n"
                    + "    break;%n"
                    + "  }%n"
                    + "}%n"
                    + "if (state == 0) {%n"
                    + "  x;%n"
                    + "} else {%n"
                    + "  y;%n"
                    + "}%n")));
  }

  @Test
  public void regionsAreStructuredOnce() {
    RegionGraph<String> nested = GraphBuilder.diamond().build();
    GraphBuilder b = GraphBuilder.region("outer").collapsed("l", nested);
    RegionGraph<String> graph = b.build();

    Ast<String> ast = restructurer.generateAst(graph);

    assertThat(restructurer.generateAst(graph), is(sameInstance(ast)));
    Ast<String> nestedAst = nested.ast().get();
    assertThat(restructurer.generateAst(nested), is(sameInstance(nestedAst)));
    assertThat(
        AstPrinter.print(ast).toString(),
        is(
            String.format(
                "while (true) {%n  if (a) {%n    b;%n  } else {%n    c;%n  }%n  d;%n}%n")));
  }

  @Test
  public void dummiesAreGoneAfterwards() {
    RegionGraph<String> graph =
        GraphBuilder.region("r")
            .code("a", "b", "c", "d", "e")
            .edge("a", "b", "c")
            .edge("b", "d", "e")
            .edge("c", "e")
            .edge("d", "e")
            .build();

    Ast<String> ast = restructurer.generateAst(graph);

    for (AstNode.Code<String> code : AstPaths.codeNodes(ast.root())) {
      assertThat(code.node.isEmpty(), is(false));
    }
  }

  @Test
  public void joinBelowANestedConditional_staysInsideItsBranches() {
    // m follows b and x, but not y
    RegionGraph<String> graph =
        GraphBuilder.region("r")
            .code("a", "b", "c", "x", "y", "m")
            .edge("a", "b", "c")
            .edge("b", "m")
            .edge("c", "x", "y")
            .edge("x", "m")
            .build();

    assertThat(
        structure(graph),
        is(
            String.format(
                "if (a) {%n"
                    + "  b;%n"
                    + "  m;%n"
                    + "} else {%n"
                    + "  if (c) {%n"
                    + "    x;%n"
                    + "    m;%n"
                    + "  } else {%n"
                    + "    y;%n"
                    + "  }%n"
                    + "}%n")));
  }

  @Test
  public void everyPassIsTraced() {
    RecordingTracer tracer = new RecordingTracer();
    Restructurer traced = new Restructurer(StructuringOptions.DEFAULT.withTracer(tracer));

    traced.generateAst(GraphBuilder.diamond().build());

    assertThat(tracer.snapshots, hasItem("untangle/diamond/initial-state"));
    assertThat(tracer.snapshots, hasItem("inflate/diamond/after-combing"));
    assertThat(tracer.snapshots, hasItem("ast/diamond/raw"));
    assertThat(tracer.snapshots, hasItem("ast/diamond/normalized"));
    assertThat(tracer.snapshots, hasItem("restructure/diamond/final"));
  }

  @Test
  public void untanglingCanBeSwitchedOff() {
    RecordingTracer tracer = new RecordingTracer();
    StructuringOptions options =
        StructuringOptions.DEFAULT.withTracer(tracer).withUntangle(false);

    new Restructurer(options).generateAst(GraphBuilder.diamond().build());

    assertThat(tracer.snapshots, not(hasItem("untangle/diamond/initial-state")));
    assertThat(tracer.snapshots, hasItem("restructure/diamond/final"));
  }

  @Test(expected = RestructureError.class)
  public void uncollapsedLoop_isRejected() {
    restructurer.generateAst(
        GraphBuilder.region("r").code("a", "b").edge("a", "b").edge("b", "a").build());
  }

  private static class RecordingTracer implements GraphTracer {
    final List<String> snapshots = new ArrayList<>();

    @Override
    public boolean isEnabled() {
      return true;
    }

    @Override
    public <B> void traceGraph(RegionGraph<B> graph, String pass, String stage) {
      snapshots.add(pass + "/" + graph.name() + "/" + stage);
    }

    @Override
    public <B> void traceAst(Ast<B> ast, String region, String stage) {
      snapshots.add("ast/" + region + "/" + stage);
    }
  }
}
