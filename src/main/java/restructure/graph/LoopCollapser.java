package restructure.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static org.jooq.lambda.tuple.Tuple.tuple;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jooq.lambda.tuple.Tuple2;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a single-entry loop of a region by one {@link NodeKind#COLLAPSED} node. The loop body
 * moves into a region of its own where edges back to the head become continue nodes and edges
 * leaving the loop become break nodes. A loop with several exit targets records which one it left
 * through in a state variable, and the collapsed node is followed by checks dispatching on it.
 */
public class LoopCollapser {
  private static final Logger LOGGER = LoggerFactory.getLogger("LoopCollapser");

  /**
   * @param graph the region containing the loop
   * @param head the only node of {@code body} with predecessors outside of it
   * @param body all nodes of the loop, {@code head} included
   * @return the collapsed node now standing for the loop in {@code graph}
   */
  public static <B> Node<B> collapseLoop(RegionGraph<B> graph, Node<B> head, Set<Node<B>> body) {
    checkArgument(body.contains(head), "The loop body must contain its head %s", head);
    // graph order keeps the copies deterministic
    Set<Node<B>> members =
        graph.nodes().stream()
            .filter(body::contains)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    checkArgument(members.size() == body.size(), "Loop body is not part of %s", graph);

    List<Tuple2<Node<B>, Node<B>>> exitEdges = new ArrayList<>();
    Set<Node<B>> exitTargets = new LinkedHashSet<>();
    for (Node<B> member : members) {
      for (Node<B> pred : member.predecessors()) {
        checkArgument(
            member == head || members.contains(pred),
            "Loop of %s is entered at %s from %s",
            head,
            member,
            pred);
      }
      for (Node<B> succ : member.successors()) {
        if (!members.contains(succ)) {
          exitEdges.add(tuple(member, succ));
          exitTargets.add(succ);
        }
      }
    }
    List<Node<B>> targets = new ArrayList<>(exitTargets);
    LOGGER.debug("Collapsing loop {} {} with exits {}", head, members, targets);

    RegionGraph<B> region = new RegionGraph<>(graph.name() + "." + head.name(), graph.weights());
    Map<Node<B>, Node<B>> substitution = region.insertBulkNodes(members, head);
    region.connectContinueNodes();
    region.connectBreakNodes(exitEdges, substitution, targets);

    Node<B> collapsed = graph.addCollapsedNode(region);
    for (Node<B> pred : new ArrayList<>(head.predecessors())) {
      if (!members.contains(pred)) {
        graph.moveEdgeTarget(pred, head, collapsed);
      }
    }
    if (graph.entry() == head) {
      graph.setEntry(collapsed);
    }
    for (Node<B> member : members) {
      graph.removeNode(member);
    }

    if (targets.size() == 1) {
      graph.addEdge(collapsed, targets.get(0));
    } else if (targets.size() > 1) {
      Node<B> previous = collapsed;
      for (int state = 0; state < targets.size() - 1; ++state) {
        Node<B> check = graph.addCheck(state);
        link(graph, previous, check);
        graph.setTrue(check, targets.get(state));
        previous = check;
      }
      link(graph, previous, targets.get(targets.size() - 1));
    }
    return collapsed;
  }

  /** Checks continue on their false edge. */
  private static <B> void link(RegionGraph<B> graph, Node<B> from, Node<B> to) {
    if (from.isCheck()) {
      graph.setFalse(from, to);
    } else {
      graph.addEdge(from, to);
    }
  }
}
