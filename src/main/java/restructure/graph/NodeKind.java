package restructure.graph;

public enum NodeKind {
  /** Wraps a single basic block of the input. */
  CODE,
  /** Stands in for a whole nested region, usually a loop body. */
  COLLAPSED,
  /** Synthetic two-way dispatch on the loop exit state. */
  CHECK,
  /** Zero weight placeholder. */
  DUMMY,
  BREAK,
  CONTINUE,
  /** Synthetic assignment of the loop exit state. */
  SET
}
