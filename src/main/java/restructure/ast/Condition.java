package restructure.ast;

import restructure.graph.Node;

/** The branch condition computed by a node of the input region, referenced atomically. */
public class Condition<B> {
  public final Node<B> node;

  public Condition(Node<B> node) {
    this.node = node.origin();
  }

  @Override
  public String toString() {
    return node.name();
  }
}
