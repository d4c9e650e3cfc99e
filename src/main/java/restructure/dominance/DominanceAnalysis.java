package restructure.dominance;

import restructure.graph.RegionGraph;

/** Computes a fresh {@link DominanceOracle} for the current shape of a region. */
public interface DominanceAnalysis {
  <B> DominanceOracle<B> compute(RegionGraph<B> graph);
}
