package agentworld.logic.runtime;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AppState 的 JSON 形式、深拷贝与大小计算
 */
public class AppStateTest {

  private static final String JSON =
      "{\"per_agent\":{\"alice\":{\"balance\":100,\"tags\":[\"a\"]}},\"shared\":{\"price\":2.5,\"open\":true}}";

  @Test
  public void testJsonRoundTrip() {
    AppState state = AppState.fromJson(JSON);
    assertEquals(JSON, state.toJsonString());
    assertEquals(state, AppState.fromJson(state.toJsonString()));
    assertEquals(Values.number(100), state.getAgent("alice", "balance"));
    assertEquals(Values.string("a"), state.getAgent("alice", "tags[0]"));
    assertEquals(Values.number(2.5), state.getShared("price"));
    assertTrue(state.getAgent("bob", "balance").isNull());
  }

  @Test
  public void testDeepCopyIsIndependent() {
    AppState state = AppState.fromJson(JSON);
    AppState copy = state.deepCopy();

    ((Value.ListValue) copy.getAgent("alice", "tags")).items().add(Values.string("b"));
    copy.shared().entries().put("open", Values.bool(false));
    copy.ensureAgent("bob");

    assertEquals(JSON, state.toJsonString());
    assertFalse(state.hasAgent("bob"));
    assertTrue(copy.hasAgent("bob"));
  }

  @Test
  public void testSerializedSizeCountsUtf8Bytes() {
    AppState state = new AppState();
    state.shared().entries().put("name", Values.string("ü"));
    long expected = state.toJsonString().getBytes(StandardCharsets.UTF_8).length;
    assertEquals(expected, state.serializedSize());
    assertEquals(state.toJsonString().length() + 1, state.serializedSize());
  }

  @Test
  public void testRejectsMalformedState() {
    assertThrows(IllegalArgumentException.class, () -> AppState.fromJson("{\"shared\": []}"));
    assertThrows(IllegalArgumentException.class, () -> AppState.fromJson("{\"per_agent\": {\"a\": 1}}"));
    assertThrows(IllegalArgumentException.class, () -> AppState.fromJson("{oops"));
    assertEquals(new AppState(), AppState.fromJson("{}"));
  }

  @Test
  public void testAgentsView() {
    AppState state = AppState.fromJson(JSON);
    Value.MapValue view = state.agentsView();
    view.entries().remove("alice");
    assertTrue(state.hasAgent("alice"), "视图是浅拷贝，删除不影响状态");
    assertEquals(1, state.agentIds().size());
  }
}
