package restructure.dominance;

import static org.jooq.lambda.tuple.Tuple.tuple;

import java.util.Optional;
import org.jooq.lambda.Seq;
import restructure.graph.Node;

/**
 * Dominance facts about one snapshot of a region. Any structural mutation of the region
 * invalidates the oracle; passes recompute it through a {@link DominanceAnalysis}.
 */
public interface DominanceOracle<B> {

  boolean dominates(Node<B> dominator, Node<B> dominated);

  boolean postDominates(Node<B> dominator, Node<B> dominated);

  /** Empty for the entry and for nodes not reachable from it. */
  Optional<Node<B>> immediateDominator(Node<B> dominated);

  /**
   * Empty for the exit, for nodes that cannot reach an exit and, when there are several exits, for
   * nodes only post-dominated by the virtual exit joining them.
   */
  Optional<Node<B>> immediatePostDominator(Node<B> dominated);

  DominatorTree<B> dominatorTree();

  default boolean strictlyDominates(Node<B> dominator, Node<B> dominated) {
    return !dominator.equals(dominated) && dominates(dominator, dominated);
  }

  /** The reflexive transitive path of immediate dominators starting from {@param dominated}. */
  default Seq<Node<B>> dominatorPath(Node<B> dominated) {
    return Seq.of(dominated)
        .concat(
            Seq.unfold(
                dominated, n -> immediateDominator(n).map(idom -> tuple(idom, idom))));
  }
}
