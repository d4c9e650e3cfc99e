package restructure.ast;

import com.google.common.base.Strings;
import org.jetbrains.annotations.Nullable;

/**
 * Renders an AST as C-like pseudo code, one statement per line. Code nodes print as the name of
 * the block they stand for, clones under the name of their original.
 *
 * <p>Instances of this class <em>are</em> stateful (the current indentation level), so don't
 * reuse them.
 */
public class AstPrinter<B> implements AstNode.Visitor<B, CharSequence> {
  private static final String NL = System.lineSeparator();

  private int indentLevel = 0;

  public static <B> CharSequence print(Ast<B> ast) {
    return print(ast.root());
  }

  public static <B> CharSequence print(AstNode<B> root) {
    return root.acceptVisitor(new AstPrinter<>());
  }

  private CharSequence indent() {
    return Strings.repeat("  ", indentLevel);
  }

  private StringBuilder line(StringBuilder sb, String text) {
    return sb.append(indent()).append(text).append(NL);
  }

  /** Appends whatever follows {@code that} in its successor chain. */
  private CharSequence withSuccessor(AstNode<B> that, StringBuilder sb) {
    that.successor().ifPresent(s -> sb.append(s.acceptVisitor(this)));
    return sb;
  }

  private void block(StringBuilder sb, @Nullable AstNode<B> body) {
    indentLevel++;
    if (body != null) {
      sb.append(body.acceptVisitor(this));
    }
    indentLevel--;
  }

  @Override
  public CharSequence visitCode(AstNode.Code<B> that) {
    StringBuilder sb = new StringBuilder();
    if (!that.isEmpty()) {
      line(sb, that.node.origin().name() + ";");
    }
    return withSuccessor(that, sb);
  }

  @Override
  public CharSequence visitSequence(AstNode.Sequence<B> that) {
    StringBuilder sb = new StringBuilder();
    for (AstNode<B> element : that.elements) {
      sb.append(element.acceptVisitor(this));
    }
    return withSuccessor(that, sb);
  }

  @Override
  public CharSequence visitIf(AstNode.If<B> that) {
    StringBuilder sb = new StringBuilder();
    conditional(sb, that.condition.toString(), that.then, that.else_);
    return withSuccessor(that, sb);
  }

  @Override
  public CharSequence visitIfCheck(AstNode.IfCheck<B> that) {
    StringBuilder sb = new StringBuilder();
    conditional(sb, "state == " + that.state, that.then, that.else_);
    return withSuccessor(that, sb);
  }

  private void conditional(
      StringBuilder sb, String condition, @Nullable AstNode<B> then, @Nullable AstNode<B> else_) {
    if (then == null && else_ != null) {
      line(sb, "if (!(" + condition + ")) {");
      block(sb, else_);
      line(sb, "}");
      return;
    }
    line(sb, "if (" + condition + ") {");
    block(sb, then);
    if (else_ != null) {
      line(sb, "} else {");
      block(sb, else_);
    }
    line(sb, "}");
  }

  @Override
  public CharSequence visitScs(AstNode.Scs<B> that) {
    StringBuilder sb = new StringBuilder();
    line(sb, "while (true) {");
    block(sb, that.body);
    line(sb, "}");
    return withSuccessor(that, sb);
  }

  @Override
  public CharSequence visitSetState(AstNode.SetState<B> that) {
    StringBuilder sb = new StringBuilder();
    line(sb, "state = " + that.state + ";");
    return withSuccessor(that, sb);
  }

  @Override
  public CharSequence visitBreak(AstNode.Break<B> that) {
    return line(new StringBuilder(), "break;");
  }

  @Override
  public CharSequence visitContinue(AstNode.Continue<B> that) {
    return line(new StringBuilder(), "continue;");
  }
}
