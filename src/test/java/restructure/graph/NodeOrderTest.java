package restructure.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

import org.junit.Before;
import org.junit.Test;

public class NodeOrderTest {
  private GraphBuilder b;
  private NodeOrder<String> order;

  @Before
  public void setup() {
    b = GraphBuilder.region("r").code("a", "b", "c", "x");
    order = NodeOrder.of(b.build().nodes());
    order.remove(b.node("x"));
  }

  @Test
  public void insertBefore_first_becomesFirst() {
    order.insertBefore(b.node("a"), b.node("x"));
    assertThat(order.first(), is(sameInstance(b.node("x"))));
    assertThat(order.toList(), contains(b.node("x"), b.node("a"), b.node("b"), b.node("c")));
  }

  @Test
  public void cursorSurvivesInsertionsAndRemovalsAroundIt() {
    Node<String> cursor = b.node("b");
    order.insertBefore(cursor, b.node("x"));
    assertThat(order.previous(cursor), is(sameInstance(b.node("x"))));
    order.remove(b.node("c"));
    assertThat(order.next(cursor), is(nullValue()));
    assertThat(order.previous(b.node("x")), is(sameInstance(b.node("a"))));
  }

  @Test
  public void remove_reportsWhetherTheNodeWasOrdered() {
    assertThat(order.remove(b.node("x")), is(false));
    assertThat(order.remove(b.node("a")), is(true));
    assertThat(order.first(), is(sameInstance(b.node("b"))));
    assertThat(order.previous(b.node("b")), is(nullValue()));
    assertThat(order.size(), is(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void next_ofUnorderedNode_throws() {
    order.next(b.node("x"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void append_twice_throws() {
    order.append(b.node("a"));
  }
}
