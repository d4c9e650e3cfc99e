package restructure.ast;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.Test;
import restructure.graph.GraphBuilder;
import restructure.graph.Node;
import restructure.graph.RegionGraph;

public class AstPrinterTest {
  private final GraphBuilder b = GraphBuilder.region("r").code("a", "b", "c");
  private final RegionGraph<String> graph = b.build();

  private AstNode.Code<String> code(String name) {
    return new AstNode.Code<>(b.node(name), null);
  }

  private AstNode.If<String> ifA(AstNode<String> then, AstNode<String> else_) {
    return new AstNode.If<>(b.node("a"), new Condition<>(b.node("a")), then, else_, null);
  }

  @Test
  public void ifElse_isIndented() {
    AstNode.If<String> ifNode = ifA(code("b"), code("c"));

    assertThat(
        AstPrinter.print(ifNode).toString(),
        is(String.format("if (a) {%n  b;%n} else {%n  c;%n}%n")));
  }

  @Test
  public void missingThen_negatesTheCondition() {
    AstNode.If<String> ifNode = ifA(null, code("c"));

    assertThat(AstPrinter.print(ifNode).toString(), is(String.format("if (!(a)) {%n  c;%n}%n")));
  }

  @Test
  public void successors_followTheirPredecessor() {
    AstNode.Code<String> a = new AstNode.Code<>(b.node("a"), code("b"));

    assertThat(AstPrinter.print(a).toString(), is(String.format("a;%nb;%n")));
  }

  @Test
  public void clones_printAsTheirOrigin() {
    Node<String> clone = graph.cloneNode(graph.cloneNode(b.node("c")));

    assertThat(
        AstPrinter.print(new AstNode.Code<>(clone, null)).toString(), is(String.format("c;%n")));
  }

  @Test
  public void loopWithExitState() {
    Node<String> set = graph.addSet(2);
    Node<String> check = graph.addCheck(2);
    AstNode.Sequence<String> body = new AstNode.Sequence<>();
    body.elements.add(code("a"));
    body.elements.add(new AstNode.SetState<>(set, new AstNode.Break<>()));
    AstNode.IfCheck<String> dispatch = new AstNode.IfCheck<>(check, code("b"), code("c"), null);
    AstNode.Scs<String> loop =
        new AstNode.Scs<>(graph.addCodeNode("loop"), body, dispatch);

    assertThat(
        AstPrinter.print(loop).toString(),
        is(
            String.format(
                "while (true) {%n  a;%n  state = 2;%n  break;%n}%n"
                    + "if (state == 2) {%n  b;%n} else {%n  c;%n}%n")));
  }

  @Test
  public void continue_endsTheLine() {
    AstNode.If<String> ifNode = ifA(new AstNode.Continue<>(), null);

    assertThat(
        AstPrinter.print(ifNode).toString(), is(String.format("if (a) {%n  continue;%n}%n")));
  }
}
