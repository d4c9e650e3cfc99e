package restructure.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import restructure.graph.Node;

/**
 * A node of the structured output. {@link Code}, {@link If}, {@link IfCheck}, {@link Scs} and
 * {@link SetState} may carry a successor: the node that executes right after them. The successor
 * chains are turned into {@link Sequence}s by {@link AstNormalizer#createSequence}.
 */
public abstract class AstNode<B> {
  @Nullable private AstNode<B> successor;

  AstNode(@Nullable AstNode<B> successor) {
    this.successor = successor;
  }

  public Optional<AstNode<B>> successor() {
    return Optional.ofNullable(successor);
  }

  public void setSuccessor(@Nullable AstNode<B> successor) {
    this.successor = successor;
  }

  /** Nodes standing for nothing but a dummy of the graph. */
  public boolean isEmpty() {
    return false;
  }

  public abstract <T> T acceptVisitor(Visitor<B, T> visitor);

  public static class Code<B> extends AstNode<B> {
    public final Node<B> node;

    public Code(Node<B> node, @Nullable AstNode<B> successor) {
      super(successor);
      this.node = node;
    }

    @Override
    public boolean isEmpty() {
      return node.isEmpty();
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitCode(this);
    }
  }

  public static class Sequence<B> extends AstNode<B> {
    public final List<AstNode<B>> elements = new ArrayList<>();

    public Sequence() {
      super(null);
    }

    @Override
    public boolean isEmpty() {
      return elements.isEmpty();
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitSequence(this);
    }
  }

  public static class If<B> extends AstNode<B> {
    public final Node<B> node;
    public final Condition<B> condition;
    @Nullable public AstNode<B> then;
    @Nullable public AstNode<B> else_;

    public If(
        Node<B> node,
        Condition<B> condition,
        @Nullable AstNode<B> then,
        @Nullable AstNode<B> else_,
        @Nullable AstNode<B> successor) {
      super(successor);
      this.node = node;
      this.condition = condition;
      this.then = then;
      this.else_ = else_;
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** Dispatch on the exit state recorded by a {@link SetState} of a collapsed loop. */
  public static class IfCheck<B> extends AstNode<B> {
    public final Node<B> node;
    public final int state;
    @Nullable public AstNode<B> then;
    @Nullable public AstNode<B> else_;

    public IfCheck(
        Node<B> node,
        @Nullable AstNode<B> then,
        @Nullable AstNode<B> else_,
        @Nullable AstNode<B> successor) {
      super(successor);
      this.node = node;
      this.state = node.stateIndex();
      this.then = then;
      this.else_ = else_;
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitIfCheck(this);
    }
  }

  /** A single-entry single-exit loop, left only through breaks. */
  public static class Scs<B> extends AstNode<B> {
    public final Node<B> node;
    @Nullable public AstNode<B> body;

    public Scs(Node<B> node, @Nullable AstNode<B> body, @Nullable AstNode<B> successor) {
      super(successor);
      this.node = node;
      this.body = body;
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitScs(this);
    }
  }

  public static class SetState<B> extends AstNode<B> {
    public final Node<B> node;
    public final int state;

    public SetState(Node<B> node, @Nullable AstNode<B> successor) {
      super(successor);
      this.node = node;
      this.state = node.stateIndex();
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitSetState(this);
    }
  }

  public static class Break<B> extends AstNode<B> {
    public Break() {
      super(null);
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitBreak(this);
    }
  }

  public static class Continue<B> extends AstNode<B> {
    public Continue() {
      super(null);
    }

    @Override
    public <T> T acceptVisitor(Visitor<B, T> visitor) {
      return visitor.visitContinue(this);
    }
  }

  public interface Visitor<B, T> {

    T visitCode(Code<B> that);

    T visitSequence(Sequence<B> that);

    T visitIf(If<B> that);

    T visitIfCheck(IfCheck<B> that);

    T visitScs(Scs<B> that);

    T visitSetState(SetState<B> that);

    T visitBreak(Break<B> that);

    T visitContinue(Continue<B> that);
  }
}
