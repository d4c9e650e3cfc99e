package restructure.dominance;

import static org.jooq.lambda.tuple.Tuple.tuple;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jooq.lambda.tuple.Tuple2;
import restructure.graph.Node;
import restructure.graph.RegionGraph;

/**
 * Iterative (post)dominator computation after Cooper, Harvey and Kennedy, "A Simple, Fast
 * Dominance Algorithm". Post-dominators are computed on the reversed graph; a region with several
 * exits gets a virtual exit joining them.
 */
public class Dominance {

  public static final DominanceAnalysis ANALYSIS =
      new DominanceAnalysis() {
        @Override
        public <B> DominanceOracle<B> compute(RegionGraph<B> graph) {
          return Dominance.compute(graph);
        }
      };

  public static <B> DominanceOracle<B> compute(RegionGraph<B> graph) {
    List<Node<B>> nodes = new ArrayList<>(graph.nodes());
    Map<Node<B>, Integer> index = new HashMap<>();
    for (int i = 0; i < nodes.size(); ++i) {
      index.put(nodes.get(i), i);
    }
    int n = nodes.size();
    int[][] successors = new int[n][];
    int[][] predecessors = new int[n][];
    List<Integer> exits = new ArrayList<>();
    for (int i = 0; i < n; ++i) {
      Node<B> node = nodes.get(i);
      successors[i] = node.successors().stream().mapToInt(index::get).toArray();
      predecessors[i] = node.predecessors().stream().mapToInt(index::get).toArray();
      if (successors[i].length == 0) {
        exits.add(i);
      }
    }

    Tree forward = new Tree(index.get(graph.entry()), successors, predecessors);

    Tree backward;
    int virtualExit = -1;
    if (exits.size() == 1) {
      backward = new Tree(exits.get(0), predecessors, successors);
    } else {
      virtualExit = n;
      int[][] reverseSuccessors = Arrays.copyOf(predecessors, n + 1);
      int[][] reversePredecessors = Arrays.copyOf(successors, n + 1);
      reverseSuccessors[n] = exits.stream().mapToInt(Integer::intValue).toArray();
      reversePredecessors[n] = new int[0];
      for (int exit : exits) {
        reversePredecessors[exit] = new int[] {n};
      }
      backward = new Tree(n, reverseSuccessors, reversePredecessors);
    }
    return new Result<>(nodes, index, forward, backward, virtualExit);
  }

  private static class Result<B> implements DominanceOracle<B> {
    private final List<Node<B>> nodes;
    private final Map<Node<B>, Integer> index;
    private final Tree forward;
    private final Tree backward;
    private final int virtualExit;

    Result(
        List<Node<B>> nodes,
        Map<Node<B>, Integer> index,
        Tree forward,
        Tree backward,
        int virtualExit) {
      this.nodes = nodes;
      this.index = index;
      this.forward = forward;
      this.backward = backward;
      this.virtualExit = virtualExit;
    }

    private int indexOf(Node<B> node) {
      Integer i = index.get(node);
      if (i == null) {
        throw new IllegalArgumentException(node + " was not part of the analysed region");
      }
      return i;
    }

    @Override
    public boolean dominates(Node<B> dominator, Node<B> dominated) {
      return forward.dominates(indexOf(dominator), indexOf(dominated));
    }

    @Override
    public boolean postDominates(Node<B> dominator, Node<B> dominated) {
      return backward.dominates(indexOf(dominator), indexOf(dominated));
    }

    @Override
    public Optional<Node<B>> immediateDominator(Node<B> dominated) {
      return lookup(forward.parent(indexOf(dominated)));
    }

    @Override
    public Optional<Node<B>> immediatePostDominator(Node<B> dominated) {
      return lookup(backward.parent(indexOf(dominated)));
    }

    private Optional<Node<B>> lookup(int i) {
      if (i < 0 || i == virtualExit) {
        return Optional.empty();
      }
      return Optional.of(nodes.get(i));
    }

    @Override
    public DominatorTree<B> dominatorTree() {
      return DominatorTree.of(
          nodes.get(forward.root),
          n ->
              forward.children.get(indexOf(n)).stream()
                  .map(nodes::get)
                  .collect(Collectors.toList()));
    }
  }

  /** Dominator tree over nodes numbered {@code 0 .. successors.length - 1}. */
  private static class Tree {
    final int root;
    final int[] idom;
    final List<List<Integer>> children = new ArrayList<>();
    final int[] in;
    final int[] out;

    Tree(int root, int[][] successors, int[][] predecessors) {
      int n = successors.length;
      this.root = root;
      int[] postorderNumber = new int[n];
      Arrays.fill(postorderNumber, -1);
      List<Integer> postorder = postorder(root, successors);
      for (int i = 0; i < postorder.size(); ++i) {
        postorderNumber[postorder.get(i)] = i;
      }

      idom = new int[n];
      Arrays.fill(idom, -1);
      idom[root] = root;
      boolean changed = true;
      while (changed) {
        changed = false;
        for (int i = postorder.size() - 1; i >= 0; --i) {
          int b = postorder.get(i);
          if (b == root) {
            continue;
          }
          int newIdom = -1;
          for (int p : predecessors[b]) {
            if (idom[p] == -1) {
              // not processed yet or not reachable at all
              continue;
            }
            newIdom = newIdom == -1 ? p : intersect(p, newIdom, postorderNumber);
          }
          if (newIdom != -1 && idom[b] != newIdom) {
            idom[b] = newIdom;
            changed = true;
          }
        }
      }

      for (int i = 0; i < n; ++i) {
        children.add(new ArrayList<>());
      }
      // children end up in reverse post order
      for (int i = postorder.size() - 1; i >= 0; --i) {
        int b = postorder.get(i);
        if (b != root) {
          children.get(idom[b]).add(b);
        }
      }

      in = new int[n];
      out = new int[n];
      Arrays.fill(in, -1);
      Arrays.fill(out, -1);
      number();
    }

    private int intersect(int finger1, int finger2, int[] postorderNumber) {
      while (finger1 != finger2) {
        while (postorderNumber[finger1] < postorderNumber[finger2]) {
          finger1 = idom[finger1];
        }
        while (postorderNumber[finger2] < postorderNumber[finger1]) {
          finger2 = idom[finger2];
        }
      }
      return finger1;
    }

    private static List<Integer> postorder(int root, int[][] successors) {
      List<Integer> ret = new ArrayList<>();
      boolean[] discovered = new boolean[successors.length];
      Deque<Tuple2<Integer, Integer>> greyStack = new ArrayDeque<>();
      greyStack.addFirst(tuple(root, 0));
      discovered[root] = true;
      while (!greyStack.isEmpty()) {
        Tuple2<Integer, Integer> top = greyStack.removeFirst();
        int node = top.v1;
        int counter = top.v2;
        if (counter < successors[node].length) {
          greyStack.addFirst(tuple(node, counter + 1));
          int child = successors[node][counter];
          if (!discovered[child]) {
            discovered[child] = true;
            greyStack.addFirst(tuple(child, 0));
          }
        } else {
          ret.add(node);
        }
      }
      return ret;
    }

    /** DFS entry and exit numbers: a dominates b iff b's interval nests in a's. */
    private void number() {
      int counter = 0;
      Deque<Tuple2<Integer, Integer>> greyStack = new ArrayDeque<>();
      greyStack.addFirst(tuple(root, 0));
      in[root] = counter++;
      while (!greyStack.isEmpty()) {
        Tuple2<Integer, Integer> top = greyStack.removeFirst();
        int node = top.v1;
        int next = top.v2;
        List<Integer> nodeChildren = children.get(node);
        if (next < nodeChildren.size()) {
          greyStack.addFirst(tuple(node, next + 1));
          int child = nodeChildren.get(next);
          in[child] = counter++;
          greyStack.addFirst(tuple(child, 0));
        } else {
          out[node] = counter++;
        }
      }
    }

    boolean dominates(int a, int b) {
      if (in[a] < 0 || in[b] < 0) {
        return a == b;
      }
      return in[a] <= in[b] && out[b] <= out[a];
    }

    /** -1 for the root and for unreachable nodes. */
    int parent(int b) {
      return b == root ? -1 : idom[b];
    }
  }
}
