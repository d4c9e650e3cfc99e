package restructure.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** All entry to exit paths of a region, spelled with the names of the original nodes. */
public class RegionPaths {

  public static Set<List<String>> of(RegionGraph<String> graph) {
    Set<List<String>> paths = new HashSet<>();
    collect(graph.entry(), new ArrayList<>(), paths);
    return paths;
  }

  private static void collect(Node<String> node, List<String> prefix, Set<List<String>> paths) {
    List<String> path = new ArrayList<>(prefix);
    if (!node.isEmpty()) {
      path.add(node.origin().name());
    }
    if (node.successorCount() == 0) {
      paths.add(path);
      return;
    }
    for (Node<String> succ : node.successors()) {
      collect(succ, path, paths);
    }
  }
}
