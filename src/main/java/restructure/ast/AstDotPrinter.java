package restructure.ast;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Renders an AST as a GraphViz tree, successor links included. */
public class AstDotPrinter<B> implements AstNode.Visitor<B, String> {
  private static final String NL = System.lineSeparator();

  private final StringBuilder out = new StringBuilder();
  private final Map<AstNode<B>, String> ids = new IdentityHashMap<>();

  public static <B> String toDot(Ast<B> ast) {
    AstDotPrinter<B> printer = new AstDotPrinter<>();
    printer.out.append("digraph \"").append(ast.region.replace("\"", "\\\"")).append("\" {");
    printer.out.append(NL);
    ast.root().acceptVisitor(printer);
    return printer.out.append('}').append(NL).toString();
  }

  /** Declares {@code node} and its successor chain, returns the id of {@code node}. */
  private String declare(AstNode<B> node, String label) {
    String id = ids.get(node);
    if (id != null) {
      return id;
    }
    id = "n" + ids.size();
    ids.put(node, id);
    out.append("  ").append(id).append(" [label=\"").append(label.replace("\"", "\\\""));
    out.append("\"];").append(NL);
    String from = id;
    node.successor().ifPresent(s -> edge(from, s, "next"));
    return id;
  }

  private void edge(String from, @Nullable AstNode<B> to, String label) {
    if (to == null) {
      return;
    }
    String target = to.acceptVisitor(this);
    out.append("  ").append(from).append(" -> ").append(target);
    out.append(" [label=\"").append(label).append("\"];").append(NL);
  }

  @Override
  public String visitCode(AstNode.Code<B> that) {
    return declare(that, "code " + that.node.name());
  }

  @Override
  public String visitSequence(AstNode.Sequence<B> that) {
    String id = declare(that, "sequence");
    List<AstNode<B>> elements = that.elements;
    for (int i = 0; i < elements.size(); ++i) {
      edge(id, elements.get(i), String.valueOf(i));
    }
    return id;
  }

  @Override
  public String visitIf(AstNode.If<B> that) {
    String id = declare(that, "if " + that.condition);
    edge(id, that.then, "then");
    edge(id, that.else_, "else");
    return id;
  }

  @Override
  public String visitIfCheck(AstNode.IfCheck<B> that) {
    String id = declare(that, "check " + that.state);
    edge(id, that.then, "then");
    edge(id, that.else_, "else");
    return id;
  }

  @Override
  public String visitScs(AstNode.Scs<B> that) {
    String id = declare(that, "loop " + that.node.name());
    edge(id, that.body, "body");
    return id;
  }

  @Override
  public String visitSetState(AstNode.SetState<B> that) {
    return declare(that, "set " + that.state);
  }

  @Override
  public String visitBreak(AstNode.Break<B> that) {
    return declare(that, "break");
  }

  @Override
  public String visitContinue(AstNode.Continue<B> that) {
    return declare(that, "continue");
  }
}
