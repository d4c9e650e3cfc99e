package restructure.graph;

/**
 * Assigns a cost to the payload of a {@link NodeKind#CODE} node, e.g. its number of instructions.
 * The weight of every other kind of node is derived by the graph itself.
 */
@FunctionalInterface
public interface WeightOracle<B> {

  int weightOf(B block);

  static <B> WeightOracle<B> constant(int weight) {
    return block -> weight;
  }
}
