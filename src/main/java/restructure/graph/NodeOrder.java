package restructure.graph;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * A doubly-linked order of nodes addressed by the nodes themselves. Unlike an index into a list, a
 * position in this order is a node, so inserting or removing other nodes never moves a cursor. A
 * cursor sitting on a node that is about to be removed has to be stepped back first.
 */
public class NodeOrder<B> {
  private final Map<Node<B>, Link<B>> links = new HashMap<>();
  @Nullable private Link<B> first;
  @Nullable private Link<B> last;

  public static <B> NodeOrder<B> of(Iterable<Node<B>> nodes) {
    NodeOrder<B> order = new NodeOrder<>();
    for (Node<B> node : nodes) {
      order.append(node);
    }
    return order;
  }

  public void append(Node<B> node) {
    checkArgument(!links.containsKey(node), "%s is already ordered", node);
    Link<B> link = new Link<>(node);
    link.previous = last;
    if (last != null) {
      last.next = link;
    } else {
      first = link;
    }
    last = link;
    links.put(node, link);
  }

  /** Inserts {@code node} directly in front of {@code anchor}. */
  public void insertBefore(Node<B> anchor, Node<B> node) {
    checkArgument(!links.containsKey(node), "%s is already ordered", node);
    Link<B> anchorLink = linkOf(anchor);
    Link<B> link = new Link<>(node);
    link.next = anchorLink;
    link.previous = anchorLink.previous;
    if (anchorLink.previous != null) {
      anchorLink.previous.next = link;
    } else {
      first = link;
    }
    anchorLink.previous = link;
    links.put(node, link);
  }

  /** Removes {@code node} if present, returns whether it was. */
  public boolean remove(Node<B> node) {
    Link<B> link = links.remove(node);
    if (link == null) {
      return false;
    }
    if (link.previous != null) {
      link.previous.next = link.next;
    } else {
      first = link.next;
    }
    if (link.next != null) {
      link.next.previous = link.previous;
    } else {
      last = link.previous;
    }
    return true;
  }

  public boolean contains(Node<B> node) {
    return links.containsKey(node);
  }

  @Nullable
  public Node<B> first() {
    return first == null ? null : first.node;
  }

  /** The node after {@code node}, or null at the end of the order. */
  @Nullable
  public Node<B> next(Node<B> node) {
    Link<B> next = linkOf(node).next;
    return next == null ? null : next.node;
  }

  /** The node before {@code node}, or null at the start of the order. */
  @Nullable
  public Node<B> previous(Node<B> node) {
    Link<B> previous = linkOf(node).previous;
    return previous == null ? null : previous.node;
  }

  public int size() {
    return links.size();
  }

  public List<Node<B>> toList() {
    List<Node<B>> ret = new ArrayList<>(links.size());
    for (Link<B> cur = first; cur != null; cur = cur.next) {
      ret.add(cur.node);
    }
    return ret;
  }

  private Link<B> linkOf(Node<B> node) {
    Link<B> link = links.get(node);
    checkArgument(link != null, "%s is not part of the order", node);
    return link;
  }

  @Override
  public String toString() {
    return toList().toString();
  }

  private static class Link<B> {
    final Node<B> node;
    @Nullable Link<B> previous;
    @Nullable Link<B> next;

    Link(Node<B> node) {
      this.node = node;
    }
  }
}
