package restructure.comb;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restructure.dominance.DominanceAnalysis;
import restructure.dominance.DominanceOracle;
import restructure.graph.Node;
import restructure.graph.RegionGraph;
import restructure.pipeline.GraphTracer;

/**
 * Gives one branch of a conditional its own copy of the code following the branch merge, if the
 * other branch is cheap compared to that tail. The heuristic only considers conditionals that
 * fully dominate at least one of their branches and whose branches do not share nodes before the
 * immediate post-dominator.
 */
public class Untangler {
  private static final Logger LOGGER = LoggerFactory.getLogger("Untangle");
  private static final String PASS = "untangle";

  private final DominanceAnalysis analysis;
  private final double factor;
  private final GraphTracer tracer;

  public Untangler(DominanceAnalysis analysis, double factor, GraphTracer tracer) {
    checkArgument(factor >= 0, "Negative untangle factor %s", factor);
    this.analysis = analysis;
    this.factor = factor;
    this.tracer = tracer;
  }

  /**
   * Untangles {@code graph} in place.
   *
   * @return the number of performed splits
   */
  public <B> int untangle(RegionGraph<B> graph) {
    checkState(graph.isDAG(), "Region %s is not a DAG", graph.name());

    List<Node<B>> conditionals =
        graph.nodes().stream().filter(Node::isConditional).collect(Collectors.toList());
    List<Node<B>> exits = graph.exitNodes();

    Node<B> sink = graph.addArtificialNode("sink");
    for (Node<B> exit : exits) {
      graph.addEdge(exit, sink);
    }
    trace(graph, "initial-state");

    // popped from the back, so innermost conditionals come first
    Deque<Node<B>> toVisit = new ArrayDeque<>(graph.orderNodes(conditionals, false));
    int splits = 0;
    while (!toVisit.isEmpty()) {
      Node<B> conditional = toVisit.removeLast();
      trace(graph, "debug");
      DominanceOracle<B> dominance = analysis.compute(graph);
      checkState(conditional.isConditional(), "%s lost one of its successors", conditional);
      // earlier splits may have moved it
      Node<B> postDominator =
          dominance
              .immediatePostDominator(conditional)
              .orElseThrow(
                  () -> new IllegalStateException("No post-dominator for " + conditional));

      Node<B> thenChild = thenChild(conditional);
      Node<B> elseChild = elseChild(conditional);

      Set<Node<B>> thenNodes = new HashSet<>(graph.reachableBetween(thenChild, postDominator));
      Set<Node<B>> elseNodes = new HashSet<>(graph.reachableBetween(elseChild, postDominator));
      thenNodes.remove(postDominator);
      elseNodes.remove(postDominator);

      List<Node<B>> notDominatedThen = notDominatedBy(conditional, thenNodes, dominance);
      List<Node<B>> notDominatedElse = notDominatedBy(conditional, elseNodes, dominance);
      if (!notDominatedThen.isEmpty() && !notDominatedElse.isEmpty()) {
        continue;
      }
      if (!Sets.intersection(thenNodes, elseNodes).isEmpty()) {
        continue;
      }

      int thenWeight = weightOf(notDominatedThen);
      int elseWeight = weightOf(notDominatedElse);
      int postDominatorWeight = weightOf(graph.reachableBetween(postDominator, sink));

      int one = thenWeight + elseWeight;
      int two = thenWeight + postDominatorWeight;
      int three = elseWeight + postDominatorWeight;

      if (isGreater(two, three) && isGreater(one, three) && postDominator != sink) {
        LOGGER.debug(
            "{}: splitting {} into the else branch of {} (weights {} {} {})",
            graph.name(),
            postDominator,
            conditional,
            one,
            two,
            three);
        splitAt(graph, conditional, postDominator, elseChild, elseNodes, sink);
        splits++;
      } else if (isGreater(three, two) && isGreater(one, two) && postDominator != sink) {
        LOGGER.debug(
            "{}: splitting {} into the then branch of {} (weights {} {} {})",
            graph.name(),
            postDominator,
            conditional,
            one,
            two,
            three);
        splitAt(graph, conditional, postDominator, thenChild, thenNodes, sink);
        splits++;
      }
    }

    trace(graph, "after-processing");
    graph.purgeVirtualSink(sink);
    trace(graph, "after-sink-removal");
    return splits;
  }

  /**
   * Moves every edge into {@code postDominator} that leaves {@code branchNodes}, the branch of
   * {@code conditional} headed by {@code inlined}, to a private copy of the tail starting at
   * {@code postDominator}. A branch that directly targets the post-dominator contributes the edge
   * of the conditional itself.
   */
  private <B> void splitAt(
      RegionGraph<B> graph,
      Node<B> conditional,
      Node<B> postDominator,
      Node<B> inlined,
      Set<Node<B>> branchNodes,
      Node<B> sink) {
    Node<B> clone = cloneUntilExit(graph, postDominator, sink);
    for (Node<B> pred : new ArrayList<>(postDominator.predecessors())) {
      if (branchNodes.contains(pred) || (pred == conditional && inlined == postDominator)) {
        graph.moveEdgeTarget(pred, postDominator, clone);
      }
    }
    checkState(clone.predecessorCount() > 0, "No edge was moved to %s", clone);
  }

  /** Clones {@code node} and everything reachable from it, sharing only {@code sink}. */
  static <B> Node<B> cloneUntilExit(RegionGraph<B> graph, Node<B> node, Node<B> sink) {
    Map<Node<B>, Node<B>> clones = new HashMap<>();
    Node<B> clone = graph.cloneNode(node);
    clones.put(node, clone);

    Deque<Node<B>> worklist = new ArrayDeque<>();
    worklist.add(node);
    Set<Node<B>> processed = new HashSet<>();
    while (!worklist.isEmpty()) {
      Node<B> current = worklist.removeLast();
      checkState(current != sink, "Cloning reached the sink");
      if (!processed.add(current)) {
        continue;
      }
      Node<B> currentClone = clones.get(current);
      boolean connectSink = false;
      for (Node<B> succ : current.successors()) {
        if (succ == sink) {
          connectSink = true;
          continue;
        }
        Node<B> succClone = clones.computeIfAbsent(succ, graph::cloneNode);
        if (current.isCheck()) {
          if (current.getTrue() == succ) {
            graph.setTrue(currentClone, succClone);
          } else {
            graph.setFalse(currentClone, succClone);
          }
        } else {
          graph.addEdge(currentClone, succClone);
        }
        worklist.add(succ);
      }
      if (connectSink) {
        graph.addEdge(currentClone, sink);
      }
    }
    return clone;
  }

  static <B> Node<B> thenChild(Node<B> conditional) {
    return conditional.isCheck() ? conditional.getTrue() : conditional.successor(0);
  }

  static <B> Node<B> elseChild(Node<B> conditional) {
    return conditional.isCheck() ? conditional.getFalse() : conditional.successor(1);
  }

  private static <B> List<Node<B>> notDominatedBy(
      Node<B> conditional, Set<Node<B>> nodes, DominanceOracle<B> dominance) {
    return nodes.stream()
        .filter(n -> !dominance.dominates(conditional, n))
        .collect(Collectors.toList());
  }

  private static <B> int weightOf(Iterable<Node<B>> nodes) {
    int sum = 0;
    for (Node<B> node : nodes) {
      sum += node.weight();
    }
    return sum;
  }

  private boolean isGreater(int left, int right) {
    return left > factor * right;
  }

  private <B> void trace(RegionGraph<B> graph, String stage) {
    if (tracer.isEnabled()) {
      tracer.traceGraph(graph, PASS, stage);
    }
  }
}
