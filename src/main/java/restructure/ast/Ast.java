package restructure.ast;

import static com.google.common.base.Preconditions.checkState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import restructure.graph.Node;

/**
 * The AST generated for one region, together with the AST node each graph node was turned into
 * while building it.
 */
public class Ast<B> {
  public final String region;
  private final Map<Node<B>, AstNode<B>> nodes = new LinkedHashMap<>();
  @Nullable private AstNode<B> root;

  public Ast(String region) {
    this.region = region;
  }

  public AstNode<B> root() {
    checkState(root != null, "The AST of %s has no root yet", region);
    return root;
  }

  public void setRoot(AstNode<B> root) {
    this.root = root;
  }

  public void put(Node<B> node, AstNode<B> astNode) {
    nodes.put(node, astNode);
  }

  public Optional<AstNode<B>> astOf(Node<B> node) {
    return Optional.ofNullable(nodes.get(node));
  }

  public Map<Node<B>, AstNode<B>> mapping() {
    return Collections.unmodifiableMap(nodes);
  }

  @Override
  public String toString() {
    return root == null ? region : AstPrinter.print(root).toString();
  }
}
