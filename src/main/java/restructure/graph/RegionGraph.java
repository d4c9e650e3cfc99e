package restructure.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.tuple.Tuple2;
import restructure.ast.Ast;

/**
 * A single region of the control-flow graph. The graph exclusively owns its nodes; nodes of
 * nested regions live in the {@link RegionGraph} wrapped by the corresponding {@link
 * NodeKind#COLLAPSED} node.
 *
 * <p>The first node added becomes the entry until {@link #setEntry(Node)} says otherwise.
 */
public class RegionGraph<B> {
  private final String name;
  private final WeightOracle<B> weights;
  private final Set<Node<B>> nodes = new LinkedHashSet<>();
  @Nullable private Node<B> entry;
  @Nullable private Ast<B> ast;
  private int nextId;

  public RegionGraph(String name, WeightOracle<B> weights) {
    this.name = name;
    this.weights = weights;
  }

  public String name() {
    return name;
  }

  public WeightOracle<B> weights() {
    return weights;
  }

  public Node<B> entry() {
    checkState(entry != null, "Region %s has no entry", name);
    return entry;
  }

  public void setEntry(Node<B> node) {
    checkOwned(node);
    entry = node;
  }

  public Set<Node<B>> nodes() {
    return Collections.unmodifiableSet(nodes);
  }

  public int size() {
    return nodes.size();
  }

  public boolean contains(Node<B> node) {
    return nodes.contains(node);
  }

  public List<Node<B>> exitNodes() {
    return nodes.stream().filter(n -> n.successorCount() == 0).collect(Collectors.toList());
  }

  public Optional<Ast<B>> ast() {
    return Optional.ofNullable(ast);
  }

  public void setAst(Ast<B> ast) {
    checkState(this.ast == null, "AST of region %s was already generated", name);
    this.ast = ast;
  }

  public int totalWeight() {
    int sum = 0;
    for (Node<B> node : nodes) {
      sum += node.weight();
    }
    return sum;
  }

  // Node creation

  public Node<B> addCodeNode(B block) {
    return addCodeNode(block, String.valueOf(block));
  }

  public Node<B> addCodeNode(B block, String name) {
    return add(NodeKind.CODE, name, block, null, weights.weightOf(block), -1, null);
  }

  public Node<B> addCollapsedNode(RegionGraph<B> region) {
    return add(NodeKind.COLLAPSED, region.name(), null, region, region.totalWeight(), -1, null);
  }

  public Node<B> addCheck(int state) {
    return add(NodeKind.CHECK, "check " + state, null, null, 0, state, null);
  }

  public Node<B> addSet(int state) {
    return add(NodeKind.SET, "set " + state, null, null, 0, state, null);
  }

  public Node<B> addBreak() {
    return add(NodeKind.BREAK, "break", null, null, 0, -1, null);
  }

  public Node<B> addContinue() {
    return add(NodeKind.CONTINUE, "continue", null, null, 0, -1, null);
  }

  public Node<B> addArtificialNode() {
    return addArtificialNode("dummy");
  }

  public Node<B> addArtificialNode(String name) {
    return add(NodeKind.DUMMY, name, null, null, 0, -1, null);
  }

  /** A fresh node with the kind, payload and weight of {@code node} but no edges. */
  public Node<B> cloneNode(Node<B> node) {
    checkOwned(node);
    return copyOf(node, node.name() + " cloned", node);
  }

  private Node<B> copyOf(Node<B> node, String name, @Nullable Node<B> clonedFrom) {
    return add(
        node.kind(),
        name,
        node.block().orElse(null),
        node.isCollapsed() ? node.collapsedRegion() : null,
        node.weight(),
        node.isCheck() || node.isSet() ? node.stateIndex() : -1,
        clonedFrom);
  }

  private Node<B> add(
      NodeKind kind,
      String name,
      @Nullable B block,
      @Nullable RegionGraph<B> collapsed,
      int weight,
      int stateIndex,
      @Nullable Node<B> clonedFrom) {
    Node<B> node =
        new Node<>(this, nextId++, kind, name, block, collapsed, weight, stateIndex, clonedFrom);
    nodes.add(node);
    if (entry == null) {
      entry = node;
    }
    return node;
  }

  /** Unlinks {@code node} from its neighbours and drops it from the region. */
  public void removeNode(Node<B> node) {
    checkOwned(node);
    checkState(
        node != entry || nodes.size() == 1, "Cannot remove the entry %s of region %s", node, name);
    for (Node<B> pred : new ArrayList<>(node.predecessors)) {
      unlink(pred, node);
    }
    for (Node<B> succ : new ArrayList<>(node.successors)) {
      unlink(node, succ);
    }
    nodes.remove(node);
    if (node == entry) {
      entry = null;
    }
  }

  // Edges

  public void addEdge(Node<B> source, Node<B> target) {
    checkOwned(source);
    checkOwned(target);
    checkArgument(!source.isCheck(), "Edges of check %s are set with setTrue/setFalse", source);
    checkArgument(
        !source.successors.contains(target), "Duplicate edge %s -> %s", source, target);
    checkArgument(source.successors.size() < 2, "%s already has two successors", source);
    checkArgument(
        !source.isCollapsed() || source.successors.isEmpty(),
        "Collapsed node %s has a single exit",
        source);
    source.successors.add(target);
    target.predecessors.add(source);
  }

  public void setTrue(Node<B> check, Node<B> target) {
    setBranch(check, target, true);
  }

  public void setFalse(Node<B> check, Node<B> target) {
    setBranch(check, target, false);
  }

  private void setBranch(Node<B> check, Node<B> target, boolean branch) {
    checkOwned(check);
    checkOwned(target);
    checkArgument(check.isCheck(), "%s is not a check node", check);
    Node<B> previous = branch ? check.trueSuccessor : check.falseSuccessor;
    Node<B> other = branch ? check.falseSuccessor : check.trueSuccessor;
    checkArgument(other != target, "Duplicate edge %s -> %s", check, target);
    if (previous != null) {
      unlink(check, previous);
    }
    if (branch) {
      check.trueSuccessor = target;
    } else {
      check.falseSuccessor = target;
    }
    target.predecessors.add(check);
    syncCheckSuccessors(check);
  }

  /** Successors of a check are kept in true, false order. */
  private static <B> void syncCheckSuccessors(Node<B> check) {
    check.successors.clear();
    if (check.trueSuccessor != null) {
      check.successors.add(check.trueSuccessor);
    }
    if (check.falseSuccessor != null) {
      check.successors.add(check.falseSuccessor);
    }
  }

  /**
   * Repoints the edge {@code source -> target} to {@code newTarget}, keeping its position among the
   * successors of {@code source} and its true/false tag.
   */
  public void moveEdgeTarget(Node<B> source, Node<B> target, Node<B> newTarget) {
    checkOwned(newTarget);
    int index = source.successors.indexOf(target);
    checkState(index >= 0, "There is no edge %s -> %s to move", source, target);
    if (target == newTarget) {
      return;
    }
    checkArgument(
        !source.successors.contains(newTarget), "Duplicate edge %s -> %s", source, newTarget);
    source.successors.set(index, newTarget);
    target.predecessors.remove(source);
    newTarget.predecessors.add(source);
    if (source.trueSuccessor == target) {
      source.trueSuccessor = newTarget;
    } else if (source.falseSuccessor == target) {
      source.falseSuccessor = newTarget;
    }
  }

  public void removeEdge(Node<B> source, Node<B> target) {
    checkState(source.successors.contains(target), "There is no edge %s -> %s", source, target);
    unlink(source, target);
  }

  private static <B> void unlink(Node<B> source, Node<B> target) {
    source.successors.remove(target);
    target.predecessors.remove(source);
    if (source.trueSuccessor == target) {
      source.trueSuccessor = null;
    }
    if (source.falseSuccessor == target) {
      source.falseSuccessor = null;
    }
  }

  // Cleanup

  /**
   * Contracts every dummy with exactly one predecessor and one successor, until there is none
   * left. A dummy whose contraction would duplicate an existing edge stays.
   *
   * @return the removed dummies, in removal order
   */
  public List<Node<B>> purgeDummies() {
    List<Node<B>> removed = new ArrayList<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Node<B> node : nodes) {
        if (!isContractible(node)) {
          continue;
        }
        Node<B> pred = node.predecessor(0);
        Node<B> succ = node.successor(0);
        moveEdgeTarget(pred, node, succ);
        removeNode(node);
        removed.add(node);
        changed = true;
        break;
      }
    }
    return removed;
  }

  private boolean isContractible(Node<B> node) {
    return node.isEmpty()
        && node != entry
        && node.predecessorCount() == 1
        && node.successorCount() == 1
        && !node.predecessor(0).hasSuccessor(node.successor(0));
  }

  /** Removes {@code sink} and every empty node that only led into it. */
  public void purgeVirtualSink(Node<B> sink) {
    checkOwned(sink);
    Set<Node<B>> purge = new LinkedHashSet<>();
    Deque<Node<B>> worklist = new ArrayDeque<>();
    worklist.add(sink);
    while (!worklist.isEmpty()) {
      Node<B> current = worklist.removeFirst();
      if (current.isEmpty() && purge.add(current)) {
        worklist.addAll(current.predecessors);
      }
    }
    for (Node<B> node : purge) {
      removeNode(node);
    }
  }

  /** Iteratively removes non-entry nodes without predecessors. */
  public List<Node<B>> removeNotReachables() {
    List<Node<B>> removed = new ArrayList<>();
    boolean changed = true;
    while (changed) {
      changed = false;
      for (Node<B> node : nodes) {
        if (node != entry && node.predecessorCount() == 0) {
          removeNode(node);
          removed.add(node);
          changed = true;
          break;
        }
      }
    }
    return removed;
  }

  // Queries

  public boolean isDAG() {
    return GraphUtils.isAcyclic(nodes);
  }

  public List<Node<B>> reversePostOrder() {
    return GraphUtils.reversePostOrder(entry());
  }

  /** Sorts {@code toOrder} by reverse post order, or by post order if {@code reverse} is set. */
  public List<Node<B>> orderNodes(Collection<Node<B>> toOrder, boolean reverse) {
    List<Node<B>> rpo = reversePostOrder();
    if (reverse) {
      Collections.reverse(rpo);
    }
    Set<Node<B>> wanted = new LinkedHashSet<>(toOrder);
    List<Node<B>> result =
        rpo.stream().filter(wanted::contains).collect(Collectors.toList());
    checkState(
        result.size() == wanted.size(), "Some of %s are not reachable from the entry", toOrder);
    return result;
  }

  public Set<Node<B>> reachableBetween(Node<B> from, Node<B> to) {
    checkOwned(from);
    return GraphUtils.reachableBetween(from, to);
  }

  /**
   * Same number of nodes, only the entries lack predecessors, and the entries are equivalent in the
   * sense of {@link Node#isEquivalentTo(Node)}.
   */
  public boolean isTopologicallyEquivalent(RegionGraph<B> other) {
    if (size() != other.size()) {
      return false;
    }
    if (!onlyEntryIsRoot() || !other.onlyEntryIsRoot()) {
      return false;
    }
    return entry().isEquivalentTo(other.entry());
  }

  private boolean onlyEntryIsRoot() {
    for (Node<B> node : nodes) {
      if (node != entry && node.predecessorCount() == 0) {
        return false;
      }
    }
    return true;
  }

  // Bulk operations

  /**
   * Copies {@code body} with all edges internal to it into this empty region, making the copy of
   * {@code head} the entry. Copies keep the names and payloads of their sources.
   *
   * @return the substitution from source nodes to their copies
   */
  public Map<Node<B>, Node<B>> insertBulkNodes(Set<Node<B>> body, Node<B> head) {
    checkState(nodes.isEmpty(), "Bulk insertion into non-empty region %s", name);
    checkArgument(body.contains(head), "Head %s is not part of the body", head);
    Map<Node<B>, Node<B>> substitution = copyAll(body);
    entry = substitution.get(head);
    return substitution;
  }

  /**
   * Appends copies of all nodes and edges of {@code other}. An empty region also takes over the
   * entry.
   */
  public Map<Node<B>, Node<B>> copyNodesAndEdgesFrom(RegionGraph<B> other) {
    boolean wasEmpty = nodes.isEmpty();
    Map<Node<B>, Node<B>> substitution = copyAll(other.nodes);
    if (wasEmpty && other.entry != null) {
      entry = substitution.get(other.entry);
    }
    return substitution;
  }

  private Map<Node<B>, Node<B>> copyAll(Collection<Node<B>> sources) {
    Map<Node<B>, Node<B>> substitution = new LinkedHashMap<>();
    for (Node<B> source : sources) {
      substitution.put(source, copyOf(source, source.name(), null));
    }
    for (Node<B> source : sources) {
      Node<B> copy = substitution.get(source);
      if (source.isCheck()) {
        if (source.trueSuccessor != null && substitution.containsKey(source.trueSuccessor)) {
          setTrue(copy, substitution.get(source.trueSuccessor));
        }
        if (source.falseSuccessor != null && substitution.containsKey(source.falseSuccessor)) {
          setFalse(copy, substitution.get(source.falseSuccessor));
        }
        continue;
      }
      for (Node<B> succ : source.successors) {
        Node<B> target = substitution.get(succ);
        if (target != null) {
          addEdge(copy, target);
        }
      }
    }
    return substitution;
  }

  /**
   * Terminates every edge leaving a copied body in a fresh break node. With more than one distinct
   * exit target the break is preceded by a set node recording the index of the target in {@code
   * exitTargets}.
   *
   * @param exitEdges edges of the source region leaving the body
   * @param substitution source to copy mapping returned by {@link #insertBulkNodes}
   * @param exitTargets the distinct targets of {@code exitEdges}
   */
  public void connectBreakNodes(
      List<Tuple2<Node<B>, Node<B>>> exitEdges,
      Map<Node<B>, Node<B>> substitution,
      List<Node<B>> exitTargets) {
    for (Tuple2<Node<B>, Node<B>> edge : exitEdges) {
      Node<B> source = edge.v1;
      Node<B> copy = substitution.get(source);
      checkArgument(copy != null, "%s is not part of the copied body", source);
      Node<B> exit = addBreak();
      if (exitTargets.size() > 1) {
        int state = exitTargets.indexOf(edge.v2);
        checkArgument(state >= 0, "Unknown exit target %s", edge.v2);
        Node<B> set = addSet(state);
        addEdge(set, exit);
        exit = set;
      }
      if (source.isCheck()) {
        checkArgument(
            edge.v2 == source.trueSuccessor || edge.v2 == source.falseSuccessor,
            "%s is not a successor of %s",
            edge.v2,
            source);
        if (edge.v2 == source.trueSuccessor) {
          setTrue(copy, exit);
        } else {
          setFalse(copy, exit);
        }
      } else {
        addEdge(copy, exit);
        // keep the successor order of the source
        if (source.successors.indexOf(edge.v2) == 0 && copy.successors.size() == 2) {
          Collections.swap(copy.successors, 0, 1);
        }
      }
    }
  }

  /** Redirects every edge into the entry to its own continue node. */
  public void connectContinueNodes() {
    Node<B> head = entry();
    for (Node<B> source : new ArrayList<>(head.predecessors)) {
      moveEdgeTarget(source, head, addContinue());
    }
  }

  private void checkOwned(Node<B> node) {
    checkArgument(node.graph() == this && nodes.contains(node), "%s is not part of %s", node, name);
  }

  @Override
  public String toString() {
    return name;
  }
}
