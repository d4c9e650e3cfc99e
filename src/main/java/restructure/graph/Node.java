package restructure.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A vertex of a {@link RegionGraph}. Nodes are owned by exactly one graph and only ever reference
 * each other by identity; all structural mutation goes through the owning graph.
 *
 * <p>Successors are ordered. For a {@link NodeKind#CHECK} node the two successors are additionally
 * designated as the true and the false target.
 */
public class Node<B> {
  private final RegionGraph<B> graph;
  private final int id;
  private final NodeKind kind;
  @Nullable private final B block;
  @Nullable private final RegionGraph<B> collapsed;
  private final int weight;
  private final int stateIndex;
  @Nullable private final Node<B> clonedFrom;
  private String name;

  final List<Node<B>> successors = new ArrayList<>();
  final List<Node<B>> predecessors = new ArrayList<>();
  @Nullable Node<B> trueSuccessor;
  @Nullable Node<B> falseSuccessor;

  Node(
      RegionGraph<B> graph,
      int id,
      NodeKind kind,
      String name,
      @Nullable B block,
      @Nullable RegionGraph<B> collapsed,
      int weight,
      int stateIndex,
      @Nullable Node<B> clonedFrom) {
    checkArgument(weight >= 0, "Negative weight %s for %s", weight, name);
    this.graph = graph;
    this.id = id;
    this.kind = kind;
    this.name = name;
    this.block = block;
    this.collapsed = collapsed;
    this.weight = weight;
    this.stateIndex = stateIndex;
    this.clonedFrom = clonedFrom;
  }

  public RegionGraph<B> graph() {
    return graph;
  }

  public int id() {
    return id;
  }

  public String name() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public NodeKind kind() {
    return kind;
  }

  public int weight() {
    return weight;
  }

  /** The basic block this node wraps, present only for {@link NodeKind#CODE} nodes. */
  public Optional<B> block() {
    return Optional.ofNullable(block);
  }

  /** The nested region of a {@link NodeKind#COLLAPSED} node. */
  public RegionGraph<B> collapsedRegion() {
    checkState(collapsed != null, "%s is not a collapsed node", name);
    return collapsed;
  }

  /** The exit state a {@link NodeKind#CHECK} node tests or a {@link NodeKind#SET} node assigns. */
  public int stateIndex() {
    checkState(isCheck() || isSet(), "%s carries no state index", name);
    return stateIndex;
  }

  /** The node this one was directly copied from. */
  public Optional<Node<B>> clonedFrom() {
    return Optional.ofNullable(clonedFrom);
  }

  /** Follows the chain of clones back to the node that was not produced by cloning. */
  public Node<B> origin() {
    Node<B> current = this;
    while (current.clonedFrom != null) {
      current = current.clonedFrom;
    }
    return current;
  }

  public List<Node<B>> successors() {
    return Collections.unmodifiableList(successors);
  }

  public List<Node<B>> predecessors() {
    return Collections.unmodifiableList(predecessors);
  }

  public int successorCount() {
    return successors.size();
  }

  public int predecessorCount() {
    return predecessors.size();
  }

  public Node<B> successor(int index) {
    return successors.get(index);
  }

  public Node<B> predecessor(int index) {
    return predecessors.get(index);
  }

  public boolean hasSuccessor(Node<B> node) {
    return successors.contains(node);
  }

  public boolean hasPredecessor(Node<B> node) {
    return predecessors.contains(node);
  }

  @Nullable
  public Node<B> getTrue() {
    checkState(isCheck(), "%s is not a check node", name);
    return trueSuccessor;
  }

  @Nullable
  public Node<B> getFalse() {
    checkState(isCheck(), "%s is not a check node", name);
    return falseSuccessor;
  }

  /** Nodes with two successors are the ones that need structuring as an if. */
  public boolean isConditional() {
    return successors.size() == 2;
  }

  public boolean isCode() {
    return kind == NodeKind.CODE;
  }

  public boolean isCollapsed() {
    return kind == NodeKind.COLLAPSED;
  }

  public boolean isCheck() {
    return kind == NodeKind.CHECK;
  }

  public boolean isBreak() {
    return kind == NodeKind.BREAK;
  }

  public boolean isContinue() {
    return kind == NodeKind.CONTINUE;
  }

  public boolean isSet() {
    return kind == NodeKind.SET;
  }

  /** True for placeholders that carry no code at all. */
  public boolean isEmpty() {
    return kind == NodeKind.DUMMY;
  }

  /**
   * Deep comparison of the shape reachable from this node and {@code other}: same kinds, same
   * payloads and pairwise equivalent successors.
   */
  public boolean isEquivalentTo(Node<B> other) {
    return equivalent(this, other, new HashMap<>());
  }

  private static <B> boolean equivalent(Node<B> left, Node<B> right, Map<Node<B>, Node<B>> paired) {
    Node<B> previous = paired.get(left);
    if (previous != null) {
      return previous == right;
    }
    if (left.kind != right.kind
        || !Objects.equals(left.block, right.block)
        || left.stateIndex != right.stateIndex
        || left.successors.size() != right.successors.size()) {
      return false;
    }
    paired.put(left, right);
    if (left.isCheck()) {
      return equivalentTargets(left.trueSuccessor, right.trueSuccessor, paired)
          && equivalentTargets(left.falseSuccessor, right.falseSuccessor, paired);
    }
    for (int i = 0; i < left.successors.size(); ++i) {
      if (!equivalent(left.successors.get(i), right.successors.get(i), paired)) {
        return false;
      }
    }
    return true;
  }

  private static <B> boolean equivalentTargets(
      @Nullable Node<B> left, @Nullable Node<B> right, Map<Node<B>, Node<B>> paired) {
    if (left == null || right == null) {
      return left == right;
    }
    return equivalent(left, right, paired);
  }

  @Override
  public String toString() {
    return name;
  }
}
