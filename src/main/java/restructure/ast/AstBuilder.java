package restructure.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import restructure.RestructureError;
import restructure.dominance.DominanceAnalysis;
import restructure.dominance.DominanceOracle;
import restructure.dominance.DominatorTree;
import restructure.graph.Node;
import restructure.graph.RegionGraph;

/**
 * Builds the raw AST of a structured region bottom-up along its dominator tree: every node is
 * converted after all the nodes it dominates, so the ASTs of its dominator tree children are
 * available as branches and continuation.
 */
public class AstBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger("AstBuilder");

  /** Produces the final AST of the region nested in a collapsed node. */
  public interface NestedRegions {
    <B> Ast<B> generateAst(RegionGraph<B> region);
  }

  private final DominanceAnalysis analysis;
  private final NestedRegions nested;

  public AstBuilder(DominanceAnalysis analysis, NestedRegions nested) {
    this.analysis = analysis;
    this.nested = nested;
  }

  public <B> Ast<B> build(RegionGraph<B> graph) {
    DominanceOracle<B> dominance = analysis.compute(graph);
    DominatorTree<B> tree = dominance.dominatorTree();
    LOGGER.debug("{}: dominator tree {}", graph.name(), tree);
    Ast<B> ast = new Ast<>(graph.name());
    for (Node<B> node : tree.postorder()) {
      ast.put(node, convert(node, tree.children(node), ast, dominance));
    }
    ast.setRoot(ast.astOf(tree.root.node).get());
    return ast;
  }

  private <B> AstNode<B> convert(
      Node<B> node, List<Node<B>> children, Ast<B> ast, DominanceOracle<B> dominance) {
    if (node.isCollapsed()) {
      if (children.size() > 1) {
        throw new RestructureError(
            "Collapsed node " + node + " dominates " + children.size() + " nodes");
      }
      LOGGER.debug("Inspecting collapsed node {}", node);
      Ast<B> body = nested.generateAst(node.collapsedRegion());
      // clones of a collapsed node share its region, each loop owns its body
      return new AstNode.Scs<>(node, AstCopier.copy(body.root()), onlyChild(children, ast));
    }
    if (children.size() > 3) {
      throw new RestructureError(node + " has " + children.size() + " dominator tree children");
    }
    if (node.isConditional() || node.isCheck()) {
      return convertConditional(node, children, ast, dominance);
    }
    if (children.size() > 1) {
      throw new RestructureError(
          node + " has a single successor but dominates " + children.size() + " nodes");
    }
    AstNode<B> successor = onlyChild(children, ast);
    switch (node.kind()) {
      case BREAK:
        return new AstNode.Break<>();
      case CONTINUE:
        return new AstNode.Continue<>();
      case SET:
        return new AstNode.SetState<>(node, successor);
      case CODE:
      case DUMMY:
        return new AstNode.Code<>(node, successor);
      default:
        throw new RestructureError("Unexpected node kind " + node.kind() + " of " + node);
    }
  }

  /**
   * A child is a branch if it is the target of that branch and cannot be entered from anywhere
   * else. What remains is the continuation both branches fall through to, so it has to lie on
   * every path leaving the conditional.
   */
  private <B> AstNode<B> convertConditional(
      Node<B> node, List<Node<B>> children, Ast<B> ast, DominanceOracle<B> dominance) {
    Node<B> thenTarget = node.isCheck() ? node.getTrue() : node.successor(0);
    Node<B> elseTarget = node.isCheck() ? node.getFalse() : node.successor(1);
    AstNode<B> then = null;
    AstNode<B> else_ = null;
    List<Node<B>> rest = new ArrayList<>();
    for (Node<B> child : children) {
      if (child == thenTarget && isBranchOf(child, node)) {
        then = astOf(child, ast);
      } else if (child == elseTarget && isBranchOf(child, node)) {
        else_ = astOf(child, ast);
      } else {
        rest.add(child);
      }
    }
    if (rest.size() > 1) {
      throw new RestructureError("Then and else branches cannot be matched for " + node);
    }
    if (!rest.isEmpty() && !dominance.postDominates(rest.get(0), node)) {
      throw new RestructureError(
          rest.get(0) + " follows " + node + " but is not reached from both of its branches");
    }
    AstNode<B> successor = rest.isEmpty() ? null : astOf(rest.get(0), ast);
    if (node.isCheck()) {
      return new AstNode.IfCheck<>(node, then, else_, successor);
    }
    return new AstNode.If<>(node, new Condition<>(node), then, else_, successor);
  }

  private static <B> boolean isBranchOf(Node<B> child, Node<B> conditional) {
    return child.predecessorCount() == 1 && child.predecessor(0) == conditional;
  }

  @Nullable
  private static <B> AstNode<B> onlyChild(List<Node<B>> children, Ast<B> ast) {
    return children.isEmpty() ? null : astOf(children.get(0), ast);
  }

  private static <B> AstNode<B> astOf(Node<B> node, Ast<B> ast) {
    return ast.astOf(node)
        .orElseThrow(() -> new IllegalStateException("No AST was built for " + node));
  }
}
