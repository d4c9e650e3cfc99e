package restructure.graph;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import java.util.ArrayList;
import java.util.List;

/**
 * Random single-entry DAGs of code nodes with at most two successors each. Every node is reachable
 * from the entry {@code n0}.
 */
public class RandomDagGenerator extends Generator<GeneratedRegion> {
  private static final int MAX_NODES = 10;
  private static final int MAX_WEIGHT = 4;

  public RandomDagGenerator() {
    super(GeneratedRegion.class);
  }

  @Override
  public GeneratedRegion generate(SourceOfRandomness random, GenerationStatus status) {
    int n = random.nextInt(2, MAX_NODES);
    GraphBuilder builder = GraphBuilder.region("random");
    List<Node<String>> nodes = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      String name = "n" + i;
      builder.code(name, random.nextInt(0, MAX_WEIGHT));
      nodes.add(builder.node(name));
    }
    RegionGraph<String> graph = builder.build();

    // a spanning tree first, node i - 1 has no successors yet when i is connected
    for (int i = 1; i < n; ++i) {
      List<Node<String>> open = new ArrayList<>();
      for (int j = 0; j < i; ++j) {
        if (nodes.get(j).successorCount() < 2) {
          open.add(nodes.get(j));
        }
      }
      graph.addEdge(random.choose(open), nodes.get(i));
    }

    int extraEdges = random.nextInt(0, n);
    for (int k = 0; k < extraEdges; ++k) {
      int from = random.nextInt(0, n - 2);
      int to = random.nextInt(from + 1, n - 1);
      Node<String> source = nodes.get(from);
      Node<String> target = nodes.get(to);
      if (source.successorCount() < 2 && !source.hasSuccessor(target)) {
        graph.addEdge(source, target);
      }
    }
    return new GeneratedRegion(graph, null);
  }
}
