package restructure.pipeline;

import static com.google.common.base.Preconditions.checkArgument;

/** Knobs of the {@link Restructurer}. Instances are immutable, the {@code with*} methods copy. */
public class StructuringOptions {
  public static final StructuringOptions DEFAULT =
      new StructuringOptions(true, 1.0, GraphTracer.NONE);

  /** Whether untangling runs before combing. */
  public final boolean untangle;

  /**
   * Untangling splits a branch merge only if the cost it saves exceeds the cost of the alternative
   * times this factor.
   */
  public final double untangleFactor;

  public final GraphTracer tracer;

  private StructuringOptions(boolean untangle, double untangleFactor, GraphTracer tracer) {
    checkArgument(untangleFactor >= 0, "Negative untangle factor %s", untangleFactor);
    this.untangle = untangle;
    this.untangleFactor = untangleFactor;
    this.tracer = tracer;
  }

  public StructuringOptions withUntangle(boolean untangle) {
    return new StructuringOptions(untangle, untangleFactor, tracer);
  }

  public StructuringOptions withUntangleFactor(double untangleFactor) {
    return new StructuringOptions(untangle, untangleFactor, tracer);
  }

  public StructuringOptions withTracer(GraphTracer tracer) {
    return new StructuringOptions(untangle, untangleFactor, tracer);
  }
}
