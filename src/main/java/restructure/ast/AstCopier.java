package restructure.ast;

import java.util.IdentityHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Deep copies an AST. Graph nodes and conditions are shared with the original, AST nodes are not,
 * so the copy can be normalized and re-linked without touching the original.
 */
public class AstCopier<B> implements AstNode.Visitor<B, AstNode<B>> {
  private final Map<AstNode<B>, AstNode<B>> copies = new IdentityHashMap<>();

  public static <B> AstNode<B> copy(AstNode<B> root) {
    return new AstCopier<B>().copyOf(root);
  }

  @Nullable
  private AstNode<B> copyOf(@Nullable AstNode<B> node) {
    if (node == null) {
      return null;
    }
    AstNode<B> copy = copies.get(node);
    if (copy == null) {
      copy = node.acceptVisitor(this);
      copies.put(node, copy);
    }
    return copy;
  }

  @Nullable
  private AstNode<B> successorOf(AstNode<B> node) {
    return copyOf(node.successor().orElse(null));
  }

  @Override
  public AstNode<B> visitCode(AstNode.Code<B> that) {
    return new AstNode.Code<>(that.node, successorOf(that));
  }

  @Override
  public AstNode<B> visitSequence(AstNode.Sequence<B> that) {
    AstNode.Sequence<B> sequence = new AstNode.Sequence<>();
    for (AstNode<B> element : that.elements) {
      sequence.elements.add(copyOf(element));
    }
    return sequence;
  }

  @Override
  public AstNode<B> visitIf(AstNode.If<B> that) {
    return new AstNode.If<>(
        that.node, that.condition, copyOf(that.then), copyOf(that.else_), successorOf(that));
  }

  @Override
  public AstNode<B> visitIfCheck(AstNode.IfCheck<B> that) {
    return new AstNode.IfCheck<>(
        that.node, copyOf(that.then), copyOf(that.else_), successorOf(that));
  }

  @Override
  public AstNode<B> visitScs(AstNode.Scs<B> that) {
    return new AstNode.Scs<>(that.node, copyOf(that.body), successorOf(that));
  }

  @Override
  public AstNode<B> visitSetState(AstNode.SetState<B> that) {
    return new AstNode.SetState<>(that.node, successorOf(that));
  }

  @Override
  public AstNode<B> visitBreak(AstNode.Break<B> that) {
    return new AstNode.Break<>();
  }

  @Override
  public AstNode<B> visitContinue(AstNode.Continue<B> that) {
    return new AstNode.Continue<>();
  }
}
