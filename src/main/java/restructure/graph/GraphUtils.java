package restructure.graph;

import static org.jooq.lambda.tuple.Tuple.tuple;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jooq.lambda.tuple.Tuple2;

public class GraphUtils {

  /**
   * Walks all nodes reachable via {@code next} edges from {@param seed} and calls {@param
   * onDiscover} and {@param onFinish} in preorder resp. postorder.
   *
   * @param seed Seed of the depth-first traversal
   * @param next Either successors or predecessors
   * @param onDiscover Called with reachable nodes in preorder
   * @param onFinish Called with reachable nodes in postorder
   */
  public static <B> void walkDepthFirst(
      Node<B> seed,
      Function<Node<B>, List<Node<B>>> next,
      Consumer<Node<B>> onDiscover,
      Consumer<Node<B>> onFinish) {
    Deque<Tuple2<Node<B>, Integer>> greyStack = new ArrayDeque<>();
    Set<Node<B>> discovered = new HashSet<>();
    greyStack.addFirst(tuple(seed, -1));
    while (!greyStack.isEmpty()) {
      Tuple2<Node<B>, Integer> nextGrey = greyStack.removeFirst();
      Node<B> node = nextGrey.v1;
      int counter = nextGrey.v2;

      if (counter < 0) {
        // we haven't yet discovered this node
        discovered.add(node);
        onDiscover.accept(node);
        // next time only visit neighbours
        greyStack.addFirst(tuple(node, 0));
      } else if (counter < next.apply(node).size()) {
        // we have to visit all children first
        greyStack.addFirst(tuple(node, counter + 1));
        Node<B> child = next.apply(node).get(counter);
        if (!discovered.contains(child)) {
          // mark it right away, it might be pushed again before it is popped
          discovered.add(child);
          greyStack.addFirst(tuple(child, -1));
        }
      } else {
        // All children were visited! we can finish this node
        onFinish.accept(node);
      }
    }
  }

  public static <B> List<Node<B>> postOrder(Node<B> seed) {
    List<Node<B>> ret = new ArrayList<>();
    walkDepthFirst(seed, Node::successors, n -> {}, ret::add);
    return ret;
  }

  /** A topological order of the nodes reachable from {@param seed}, if these form a DAG. */
  public static <B> List<Node<B>> reversePostOrder(Node<B> seed) {
    ArrayDeque<Node<B>> stack = new ArrayDeque<>();
    walkDepthFirst(seed, Node::successors, n -> {}, stack::addFirst);
    return new ArrayList<>(stack);
  }

  /** All nodes reachable from {@param seed} including {@param seed}, in depth-first preorder. */
  public static <B> Set<Node<B>> reachableFrom(Node<B> seed) {
    Set<Node<B>> ret = new LinkedHashSet<>();
    walkDepthFirst(seed, Node::successors, ret::add, n -> {});
    return ret;
  }

  /** All nodes from which {@param seed} can be reached, including {@param seed}. */
  public static <B> Set<Node<B>> reachingTo(Node<B> seed) {
    Set<Node<B>> ret = new LinkedHashSet<>();
    walkDepthFirst(seed, Node::predecessors, ret::add, n -> {});
    return ret;
  }

  /**
   * Collects the nodes reachable from {@param from} without going through {@param to}. Both ends
   * are part of the result, {@param to} only if it was actually reached.
   */
  public static <B> Set<Node<B>> reachableBetween(Node<B> from, Node<B> to) {
    Set<Node<B>> ret = new LinkedHashSet<>();
    Deque<Node<B>> toVisit = new ArrayDeque<>();
    toVisit.add(from);
    ret.add(from);
    while (!toVisit.isEmpty()) {
      Node<B> cur = toVisit.removeFirst();
      if (cur.equals(to)) {
        continue;
      }
      for (Node<B> succ : cur.successors()) {
        if (ret.add(succ)) {
          toVisit.addLast(succ);
        }
      }
    }
    return ret;
  }

  /**
   * Kahn's algorithm over {@param nodes}: the graph is acyclic iff every node can be sorted. Self
   * loops keep their node unsorted as well.
   */
  public static <B> boolean isAcyclic(Iterable<Node<B>> nodes) {
    Map<Node<B>, Integer> inDegree = new HashMap<>();
    for (Node<B> node : nodes) {
      inDegree.put(node, node.predecessorCount());
    }
    Deque<Node<B>> ready = new ArrayDeque<>();
    inDegree.forEach(
        (node, degree) -> {
          if (degree == 0) {
            ready.add(node);
          }
        });
    int sorted = 0;
    while (!ready.isEmpty()) {
      Node<B> node = ready.removeFirst();
      sorted++;
      for (Node<B> succ : node.successors()) {
        int degree = inDegree.merge(succ, -1, Integer::sum);
        if (degree == 0) {
          ready.add(succ);
        }
      }
    }
    return sorted == inDegree.size();
  }
}
