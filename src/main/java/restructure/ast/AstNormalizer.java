package restructure.ast;

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Cleans up the raw AST produced by the {@link AstBuilder}: successor chains become explicit
 * sequences, empty placeholders disappear and sequences of at most one element are inlined.
 */
public class AstNormalizer {

  /**
   * Runs all simplifications on {@code ast}. An AST that simplifies to nothing gets an empty
   * sequence as root.
   */
  public static <B> void normalize(Ast<B> ast) {
    AstNode<B> root = createSequence(ast.root());
    simplifyDummies(root);
    root = simplifyAtomicSequence(root);
    ast.setRoot(root != null ? root : new AstNode.Sequence<>());
  }

  /**
   * Flattens the successor chain starting at {@code root} into a {@link AstNode.Sequence}, then
   * does the same for all branches and loop bodies of the elements.
   */
  public static <B> AstNode.Sequence<B> createSequence(AstNode<B> root) {
    AstNode.Sequence<B> sequence = new AstNode.Sequence<>();
    AstNode<B> current = root;
    while (current != null) {
      AstNode<B> next = current.successor().orElse(null);
      current.setSuccessor(null);
      if (current instanceof AstNode.Sequence) {
        sequence.elements.addAll(((AstNode.Sequence<B>) current).elements);
      } else {
        sequence.elements.add(current);
      }
      current = next;
    }

    for (AstNode<B> element : sequence.elements) {
      if (element instanceof AstNode.If) {
        AstNode.If<B> ifNode = (AstNode.If<B>) element;
        ifNode.then = sequenceOrNull(ifNode.then);
        ifNode.else_ = sequenceOrNull(ifNode.else_);
      } else if (element instanceof AstNode.IfCheck) {
        AstNode.IfCheck<B> ifCheck = (AstNode.IfCheck<B>) element;
        ifCheck.then = sequenceOrNull(ifCheck.then);
        ifCheck.else_ = sequenceOrNull(ifCheck.else_);
      } else if (element instanceof AstNode.Scs) {
        AstNode.Scs<B> scs = (AstNode.Scs<B>) element;
        scs.body = sequenceOrNull(scs.body);
      }
    }
    return sequence;
  }

  @Nullable
  private static <B> AstNode<B> sequenceOrNull(@Nullable AstNode<B> node) {
    return node == null ? null : createSequence(node);
  }

  /** Drops empty elements from all sequences reachable from {@code root}. */
  public static <B> void simplifyDummies(@Nullable AstNode<B> root) {
    if (root instanceof AstNode.Sequence) {
      AstNode.Sequence<B> sequence = (AstNode.Sequence<B>) root;
      List<AstNode<B>> kept = new ArrayList<>();
      for (AstNode<B> element : sequence.elements) {
        simplifyDummies(element);
        if (!element.isEmpty()) {
          kept.add(element);
        }
      }
      sequence.elements.clear();
      sequence.elements.addAll(kept);
    } else if (root instanceof AstNode.If) {
      AstNode.If<B> ifNode = (AstNode.If<B>) root;
      simplifyDummies(ifNode.then);
      simplifyDummies(ifNode.else_);
    } else if (root instanceof AstNode.IfCheck) {
      AstNode.IfCheck<B> ifCheck = (AstNode.IfCheck<B>) root;
      simplifyDummies(ifCheck.then);
      simplifyDummies(ifCheck.else_);
    } else if (root instanceof AstNode.Scs) {
      simplifyDummies(((AstNode.Scs<B>) root).body);
    }
  }

  /**
   * Replaces sequences without elements by nothing and sequences of a single element by that
   * element, recursively.
   *
   * @return the simplified node, null if nothing is left
   */
  @Nullable
  public static <B> AstNode<B> simplifyAtomicSequence(@Nullable AstNode<B> root) {
    if (root instanceof AstNode.Sequence) {
      AstNode.Sequence<B> sequence = (AstNode.Sequence<B>) root;
      if (sequence.elements.isEmpty()) {
        return null;
      }
      if (sequence.elements.size() == 1) {
        return simplifyAtomicSequence(sequence.elements.get(0));
      }
      List<AstNode<B>> simplified = new ArrayList<>();
      for (AstNode<B> element : sequence.elements) {
        AstNode<B> replacement = simplifyAtomicSequence(element);
        if (replacement != null) {
          simplified.add(replacement);
        }
      }
      if (simplified.size() < 2) {
        return simplified.isEmpty() ? null : simplified.get(0);
      }
      sequence.elements.clear();
      sequence.elements.addAll(simplified);
    } else if (root instanceof AstNode.If) {
      AstNode.If<B> ifNode = (AstNode.If<B>) root;
      ifNode.then = simplifyAtomicSequence(ifNode.then);
      ifNode.else_ = simplifyAtomicSequence(ifNode.else_);
    } else if (root instanceof AstNode.IfCheck) {
      AstNode.IfCheck<B> ifCheck = (AstNode.IfCheck<B>) root;
      ifCheck.then = simplifyAtomicSequence(ifCheck.then);
      ifCheck.else_ = simplifyAtomicSequence(ifCheck.else_);
    } else if (root instanceof AstNode.Scs) {
      AstNode.Scs<B> scs = (AstNode.Scs<B>) root;
      scs.body = simplifyAtomicSequence(scs.body);
    }
    return root;
  }
}
