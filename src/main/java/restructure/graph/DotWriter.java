package restructure.graph;

/** Renders regions in the GraphViz dot language. */
public class DotWriter {
  private static final String NL = System.lineSeparator();

  public static <B> String toDot(RegionGraph<B> graph) {
    StringBuilder sb = new StringBuilder("digraph \"").append(escape(graph.name())).append("\" {");
    sb.append(NL);
    Node<B> entry = graph.size() == 0 ? null : graph.entry();
    for (Node<B> node : graph.nodes()) {
      sb.append("  \"").append(node.id()).append("\" [label=\"ID: ").append(node.id());
      sb.append(" Name: ").append(escape(node.name())).append('"');
      if (node == entry) {
        sb.append(",fillcolor=green,style=filled");
      }
      sb.append("];").append(NL);
      for (Node<B> succ : node.successors()) {
        sb.append("  \"").append(node.id()).append("\" -> \"").append(succ.id()).append('"');
        if (node.isCheck() && node.getFalse() == succ) {
          sb.append(" [color=red];");
        } else {
          sb.append(" [color=green];");
        }
        sb.append(NL);
      }
    }
    return sb.append('}').append(NL).toString();
  }

  static String escape(String text) {
    return text.replace("\\", "\\\\").replace("\"", "\\\"");
  }
}
