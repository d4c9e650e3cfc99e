package restructure.dominance;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import restructure.graph.Node;

public class DominatorTree<B> {
  public final Vertex<B> root;
  private final Map<Node<B>, Vertex<B>> vertices = new HashMap<>();

  private DominatorTree(Vertex<B> root) {
    this.root = root;
    ArrayDeque<Vertex<B>> toVisit = new ArrayDeque<>();
    toVisit.add(root);
    while (!toVisit.isEmpty()) {
      Vertex<B> cur = toVisit.removeFirst();
      vertices.put(cur.node, cur);
      toVisit.addAll(cur.children);
    }
  }

  /** Builds the tree below {@code root}, asking {@code children} for the children of each node. */
  public static <B> DominatorTree<B> of(Node<B> root, Function<Node<B>, List<Node<B>>> children) {
    Vertex<B> rootVertex = new Vertex<>(root);
    ArrayDeque<Vertex<B>> toVisit = new ArrayDeque<>();
    toVisit.add(rootVertex);
    while (!toVisit.isEmpty()) {
      Vertex<B> cur = toVisit.removeFirst();
      for (Node<B> child : children.apply(cur.node)) {
        Vertex<B> vertex = new Vertex<>(child);
        cur.children.add(vertex);
        toVisit.add(vertex);
      }
    }
    return new DominatorTree<>(rootVertex);
  }

  public boolean contains(Node<B> node) {
    return vertices.containsKey(node);
  }

  public List<Node<B>> children(Node<B> node) {
    Vertex<B> vertex = vertices.get(node);
    checkArgument(vertex != null, "%s is not part of the dominator tree", node);
    return Collections.unmodifiableList(
        vertex.children.stream().map(v -> v.node).collect(Collectors.toList()));
  }

  public List<Node<B>> preorder() {
    List<Node<B>> ret = new ArrayList<>();
    ArrayDeque<Vertex<B>> toVisit = new ArrayDeque<>();
    toVisit.add(root);
    while (!toVisit.isEmpty()) {
      Vertex<B> cur = toVisit.removeLast();
      ret.add(cur.node);
      toVisit.addAll(Lists.reverse(cur.children));
    }
    return ret;
  }

  /** Every node comes after all the nodes it dominates. */
  public List<Node<B>> postorder() {
    List<Node<B>> ret = new ArrayList<>();
    ArrayDeque<Vertex<B>> toVisit = new ArrayDeque<>();
    ArrayDeque<Vertex<B>> finished = new ArrayDeque<>();
    toVisit.add(root);
    while (!toVisit.isEmpty()) {
      Vertex<B> cur = toVisit.removeLast();
      finished.addFirst(cur);
      toVisit.addAll(cur.children);
    }
    for (Vertex<B> vertex : finished) {
      ret.add(vertex.node);
    }
    return ret;
  }

  public int size() {
    return vertices.size();
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    prettyPrintSExpr(root, builder);
    return builder.toString();
  }

  private void prettyPrintSExpr(Vertex<B> parent, StringBuilder builder) {
    builder.append('(');
    builder.append(parent.node.name());
    for (Vertex<B> child : parent.children) {
      builder.append(' ');
      prettyPrintSExpr(child, builder);
    }
    builder.append(')');
  }

  public static class Vertex<B> {
    public final Node<B> node;
    public final List<Vertex<B>> children = new ArrayList<>();

    Vertex(Node<B> node) {
      this.node = node;
    }
  }
}
