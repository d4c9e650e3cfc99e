package restructure.comb;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.Sets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.pcollections.HashTreePSet;
import org.pcollections.PSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restructure.dominance.DominanceAnalysis;
import restructure.dominance.DominanceOracle;
import restructure.graph.GraphUtils;
import restructure.graph.Node;
import restructure.graph.NodeOrder;
import restructure.graph.RegionGraph;
import restructure.pipeline.GraphTracer;

/**
 * Removes irreducible branching from an acyclic region. Every conditional whose branches share an
 * exit, or which dominates neither of its branches, gets combed: walking forward in reverse post
 * order from the conditional, each node that can also be entered from outside the walk is either
 * cloned for the outside paths or, if it is the post-dominator of the conditional, shielded by a
 * dummy join node collecting the paths of the walk.
 */
public class Comber {
  private static final Logger LOGGER = LoggerFactory.getLogger("Comb");
  static final String PASS = "inflate";

  private final DominanceAnalysis analysis;
  private final GraphTracer tracer;

  public Comber(DominanceAnalysis analysis, GraphTracer tracer) {
    this.analysis = analysis;
    this.tracer = tracer;
  }

  /** Combs {@code graph} in place. */
  public <B> Statistics comb(RegionGraph<B> graph) {
    checkState(graph.isDAG(), "Region %s is not a DAG", graph.name());
    return new Combing<>(graph).run();
  }

  /** How many nodes combing introduced. */
  public static class Statistics {
    public final int clones;
    public final int dummies;

    Statistics(int clones, int dummies) {
      this.clones = clones;
      this.dummies = dummies;
    }

    public int insertedNodes() {
      return clones + dummies;
    }

    @Override
    public String toString() {
      return clones + " clones, " + dummies + " dummies";
    }
  }

  /** The mutable state of combing a single region. */
  private class Combing<B> {
    private final RegionGraph<B> graph;
    private final Map<Node<B>, Set<Node<B>>> equivalenceClasses = new HashMap<>();
    private final Map<Node<B>, Node<B>> cloneToOriginal = new HashMap<>();
    private final Map<Node<B>, Node<B>> postDominators = new HashMap<>();
    private final Set<Node<B>> allConditionals = new HashSet<>();
    private final Deque<Node<B>> conditionals = new ArrayDeque<>();
    private NodeOrder<B> order;
    private Node<B> sink;
    private int clones;
    private int dummies;

    Combing(RegionGraph<B> graph) {
      this.graph = graph;
    }

    Statistics run() {
      List<Node<B>> exits = graph.exitNodes();
      LOGGER.debug("{}: entry {}, exits {}", graph.name(), graph.entry(), exits);

      Map<Node<B>, PSet<Node<B>>> reachableExits = new HashMap<>();
      for (Node<B> exit : exits) {
        for (Node<B> node : GraphUtils.reachingTo(exit)) {
          reachableExits.merge(node, HashTreePSet.singleton(exit), PSet::plusAll);
        }
      }

      trace("before-sink");
      sink = graph.addArtificialNode("sink");
      for (Node<B> exit : exits) {
        graph.addEdge(exit, sink);
      }
      trace("after-sink");

      DominanceOracle<B> dominance = analysis.compute(graph);
      List<Node<B>> candidates = new ArrayList<>();
      for (Node<B> node : graph.nodes()) {
        checkState(node.successorCount() < 3, "%s has more than two successors", node);
        if (!node.isConditional()) {
          continue;
        }
        PSet<Node<B>> thenExits = exitsOf(reachableExits, node.successor(0));
        PSet<Node<B>> elseExits = exitsOf(reachableExits, node.successor(1));
        boolean thenDominated = thenExits.stream().allMatch(e -> dominance.dominates(node, e));
        boolean elseDominated = elseExits.stream().allMatch(e -> dominance.dominates(node, e));
        if (!Sets.intersection(thenExits, elseExits).isEmpty()
            || !(thenDominated || elseDominated)) {
          candidates.add(node);
          allConditionals.add(node);
        } else {
          LOGGER.debug("Blacklisted conditional {}", node);
        }
      }
      // popped from the back, so innermost conditionals come first
      conditionals.addAll(graph.orderNodes(candidates, false));
      LOGGER.debug("Conditionals to comb: {}", conditionals);

      order = NodeOrder.of(graph.reversePostOrder());
      for (Node<B> node : order.toList()) {
        equivalenceClasses.put(node, new HashSet<>(Collections.singleton(node)));
        cloneToOriginal.put(node, node);
      }

      DominanceOracle<B> fresh = analysis.compute(graph);
      for (Node<B> conditional : conditionals) {
        Node<B> postDominator =
            fresh
                .immediatePostDominator(conditional)
                .orElseThrow(
                    () -> new IllegalStateException("No post-dominator for " + conditional));
        postDominators.put(conditional, postDominator);
      }

      while (!conditionals.isEmpty()) {
        combConditional(conditionals.removeLast());
      }

      graph.purgeDummies();
      separateBranches();
      graph.purgeDummies();
      for (Node<B> sinkCopy :
          equivalenceClasses.getOrDefault(sink, Collections.singleton(sink))) {
        if (graph.contains(sinkCopy)) {
          graph.purgeVirtualSink(sinkCopy);
        }
      }
      trace("after-combing");
      Statistics statistics = new Statistics(clones, dummies);
      LOGGER.debug("{}: {}", graph.name(), statistics);
      return statistics;
    }

    private PSet<Node<B>> exitsOf(Map<Node<B>, PSet<Node<B>>> reachableExits, Node<B> node) {
      return reachableExits.getOrDefault(node, HashTreePSet.empty());
    }

    private void combConditional(Node<B> conditional) {
      LOGGER.debug("Analyzing conditional {}", conditional);
      trace("conditional-" + conditional.name() + "-begin");

      Worklist<Node<B>> worklist = new Worklist<>(conditional.successors());
      Set<Node<B>> visited = new HashSet<>();
      visited.add(conditional);
      checkState(order.contains(conditional), "%s is not part of the walk order", conditional);
      Node<B> cursor = conditional;

      int iteration = 0;
      while (!worklist.isEmpty()) {
        Node<B> postDominator = postDominators.get(conditional);
        Set<Node<B>> postDominatorSet =
            equivalenceClasses.getOrDefault(postDominator, Collections.emptySet());
        boolean isPostDominator = false;

        cursor = order.next(cursor);
        checkState(cursor != null, "Walk from %s ran off the end of the region", conditional);
        if (!worklist.contains(cursor)) {
          continue;
        }
        Node<B> candidate = cursor;

        if (postDominatorSet.contains(candidate)) {
          if (allPredecessorsVisited(candidate, visited)) {
            // all paths merged cleanly
            break;
          }
          isPostDominator = true;
          visited.add(candidate);
          worklist.remove(candidate);
        } else {
          boolean allVisited = allPredecessorsVisited(candidate, visited);
          visited.add(candidate);
          worklist.remove(candidate);
          worklist.enqueueAll(candidate.successors());
          if (allVisited) {
            continue;
          }
        }

        if (candidate.predecessorCount() > 2 && isPostDominator) {
          LOGGER.debug("Inserting a dummy node for {}", candidate);
          Node<B> dummy = graph.addArtificialNode();
          dummies++;
          order.insertBefore(candidate, dummy);
          visited.remove(candidate);
          worklist.enqueue(candidate);
          // the next step of the walk lands on the dummy
          cursor = order.previous(dummy);
          equivalenceClasses.put(dummy, new HashSet<>(Collections.singleton(dummy)));
          // the walk ends as soon as it reaches the dummy
          postDominators.put(conditional, dummy);
          cloneToOriginal.put(dummy, dummy);
          worklist.enqueue(dummy);
          for (Node<B> pred : new ArrayList<>(candidate.predecessors())) {
            if (visited.contains(pred)) {
              graph.moveEdgeTarget(pred, candidate, dummy);
            }
          }
          graph.addEdge(dummy, candidate);
        } else {
          LOGGER.debug("Duplicating {}", candidate);
          duplicate(candidate, visited);
        }

        trace("conditional-" + conditional.name() + "-" + iteration + "-before-purge");
        for (Node<B> removed : graph.purgeDummies()) {
          visited.remove(removed);
          worklist.remove(removed);
          if (removed == cursor) {
            cursor = order.previous(cursor);
          }
          order.remove(removed);
        }
        trace("conditional-" + conditional.name() + "-" + iteration);
        iteration++;
      }
      LOGGER.debug("Finished looking at {}", conditional);
    }

    /** Gives all predecessors of {@code candidate} outside the walk a private copy of it. */
    private void duplicate(Node<B> candidate, Set<Node<B>> visited) {
      Node<B> duplicated = graph.cloneNode(candidate);
      clones++;
      order.insertBefore(candidate, duplicated);

      Node<B> original = cloneToOriginal.get(candidate);
      checkState(original != null, "%s has no known origin", candidate);
      cloneToOriginal.put(duplicated, original);
      equivalenceClasses.get(original).add(duplicated);

      if (allConditionals.contains(candidate)) {
        conditionals.addLast(duplicated);
        allConditionals.add(duplicated);
        postDominators.put(duplicated, postDominators.get(candidate));
      }

      if (candidate.isCheck()) {
        checkState(
            candidate.getTrue() != null && candidate.getFalse() != null,
            "Check %s misses a branch",
            candidate);
        graph.setTrue(duplicated, candidate.getTrue());
        graph.setFalse(duplicated, candidate.getFalse());
      } else {
        for (Node<B> succ : candidate.successors()) {
          graph.addEdge(duplicated, succ);
        }
      }

      for (Node<B> pred : new ArrayList<>(candidate.predecessors())) {
        if (!visited.contains(pred)) {
          graph.moveEdgeTarget(pred, candidate, duplicated);
        }
      }
    }

    /**
     * The walk only clones nodes that can be entered from outside of it, which leaves nodes that
     * both branches of a conditional reach before its post-dominator, such as a join of one branch
     * with a nested conditional of the other. Clones such nodes, one at a time in reverse post
     * order, until the branches of every conditional are disjoint up to its post-dominator and can
     * only be entered through it.
     */
    private void separateBranches() {
      boolean changed = true;
      while (changed) {
        changed = false;
        DominanceOracle<B> dominance = analysis.compute(graph);
        List<Node<B>> rpo = graph.reversePostOrder();
        for (Node<B> conditional : rpo) {
          if (conditional.isConditional() && separateBranchesOf(conditional, rpo, dominance)) {
            changed = true;
            break;
          }
        }
      }
      trace("after-separation");
    }

    /** @return whether a node was cloned */
    private boolean separateBranchesOf(
        Node<B> conditional, List<Node<B>> rpo, DominanceOracle<B> dominance) {
      Node<B> postDominator =
          dominance
              .immediatePostDominator(conditional)
              .orElseThrow(
                  () -> new IllegalStateException("No post-dominator for " + conditional));
      Node<B> thenChild = Untangler.thenChild(conditional);
      Node<B> elseChild = Untangler.elseChild(conditional);
      Set<Node<B>> thenNodes = new HashSet<>(graph.reachableBetween(thenChild, postDominator));
      Set<Node<B>> elseNodes = new HashSet<>(graph.reachableBetween(elseChild, postDominator));
      thenNodes.remove(postDominator);
      elseNodes.remove(postDominator);

      for (Node<B> node : rpo) {
        boolean inThen = thenNodes.contains(node);
        boolean inElse = elseNodes.contains(node);
        List<Node<B>> moved = new ArrayList<>();
        if (inThen && inElse) {
          // the else branch gets its own copy
          for (Node<B> pred : node.predecessors()) {
            if (elseNodes.contains(pred) || (pred == conditional && node == elseChild)) {
              moved.add(pred);
            }
          }
        } else if (inThen || inElse) {
          Set<Node<B>> branch = inThen ? thenNodes : elseNodes;
          for (Node<B> pred : node.predecessors()) {
            if (branch.contains(pred) || pred == conditional) {
              moved.add(pred);
            }
          }
          if (moved.size() == node.predecessorCount()) {
            continue;
          }
        } else {
          continue;
        }
        checkState(
            !moved.isEmpty() && moved.size() < node.predecessorCount(),
            "Cannot separate %s below %s",
            node,
            conditional);
        LOGGER.debug("Separating {} in the branches of {}", node, conditional);
        cloneFor(node, moved);
        return true;
      }
      return false;
    }

    /** Redirects the edges from {@code preds} into {@code node} to a fresh copy of it. */
    private void cloneFor(Node<B> node, List<Node<B>> preds) {
      Node<B> copy = graph.cloneNode(node);
      clones++;
      if (node.isCheck()) {
        graph.setTrue(copy, node.getTrue());
        graph.setFalse(copy, node.getFalse());
      } else {
        for (Node<B> succ : node.successors()) {
          graph.addEdge(copy, succ);
        }
      }
      for (Node<B> pred : preds) {
        graph.moveEdgeTarget(pred, node, copy);
      }
    }

    private boolean allPredecessorsVisited(Node<B> node, Set<Node<B>> visited) {
      return visited.containsAll(node.predecessors());
    }

    private void trace(String stage) {
      if (tracer.isEnabled()) {
        tracer.traceGraph(graph, PASS, stage);
      }
    }
  }
}
