package restructure.comb;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Nodes still waiting to be reached by a walk. Unlike a queue, elements are picked by the walk
 * itself when it passes them, so only membership matters.
 */
class Worklist<T> {
  /** Also prevents duplicate entries. */
  private final Set<T> pending;

  Worklist(Collection<T> initialWorklist) {
    pending = new LinkedHashSet<>(initialWorklist);
  }

  /** Enqueues the specified element if it's not a duplicate. */
  void enqueue(T element) {
    pending.add(element);
  }

  void enqueueAll(Collection<T> elements) {
    pending.addAll(elements);
  }

  /** Returns true if the element was pending. */
  boolean remove(T element) {
    return pending.remove(element);
  }

  boolean contains(T element) {
    return pending.contains(element);
  }

  /** Returns true if this work list contains no elements. */
  boolean isEmpty() {
    return pending.isEmpty();
  }
}
