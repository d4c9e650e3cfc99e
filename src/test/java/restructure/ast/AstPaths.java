package restructure.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Executions of an acyclic AST, spelled like {@link restructure.graph.RegionPaths}: an if runs its
 * condition, then one of its branches, then whatever follows it.
 */
public class AstPaths {

  public static Set<List<String>> of(Ast<String> ast) {
    return of(ast.root());
  }

  public static Set<List<String>> of(@Nullable AstNode<String> node) {
    if (node == null) {
      return nothing();
    }
    Set<List<String>> paths;
    if (node instanceof AstNode.Code) {
      AstNode.Code<String> code = (AstNode.Code<String>) node;
      paths =
          code.isEmpty()
              ? nothing()
              : Collections.singleton(Collections.singletonList(code.node.origin().name()));
    } else if (node instanceof AstNode.Sequence) {
      paths = nothing();
      for (AstNode<String> element : ((AstNode.Sequence<String>) node).elements) {
        paths = concat(paths, of(element));
      }
    } else if (node instanceof AstNode.If) {
      AstNode.If<String> ifNode = (AstNode.If<String>) node;
      Set<List<String>> branches = new HashSet<>(of(ifNode.then));
      branches.addAll(of(ifNode.else_));
      paths =
          concat(
              Collections.singleton(Collections.singletonList(ifNode.condition.toString())),
              branches);
    } else {
      throw new IllegalArgumentException("No paths through " + node);
    }
    return concat(paths, of(node.successor().orElse(null)));
  }

  private static Set<List<String>> nothing() {
    return Collections.singleton(Collections.<String>emptyList());
  }

  private static Set<List<String>> concat(Set<List<String>> heads, Set<List<String>> tails) {
    Set<List<String>> paths = new HashSet<>();
    for (List<String> head : heads) {
      for (List<String> tail : tails) {
        List<String> path = new ArrayList<>(head);
        path.addAll(tail);
        paths.add(path);
      }
    }
    return paths;
  }

  /** The code nodes anywhere in the AST below {@code node}, successors included. */
  public static List<AstNode.Code<String>> codeNodes(@Nullable AstNode<String> node) {
    List<AstNode.Code<String>> codes = new ArrayList<>();
    if (node == null) {
      return codes;
    }
    if (node instanceof AstNode.Code) {
      codes.add((AstNode.Code<String>) node);
    } else if (node instanceof AstNode.Sequence) {
      for (AstNode<String> element : ((AstNode.Sequence<String>) node).elements) {
        codes.addAll(codeNodes(element));
      }
    } else if (node instanceof AstNode.If) {
      codes.addAll(codeNodes(((AstNode.If<String>) node).then));
      codes.addAll(codeNodes(((AstNode.If<String>) node).else_));
    } else if (node instanceof AstNode.IfCheck) {
      codes.addAll(codeNodes(((AstNode.IfCheck<String>) node).then));
      codes.addAll(codeNodes(((AstNode.IfCheck<String>) node).else_));
    } else if (node instanceof AstNode.Scs) {
      codes.addAll(codeNodes(((AstNode.Scs<String>) node).body));
    }
    codes.addAll(codeNodes(node.successor().orElse(null)));
    return codes;
  }
}
