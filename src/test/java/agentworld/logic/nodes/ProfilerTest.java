package agentworld.logic.nodes;

import agentworld.logic.AppEngine;
import agentworld.logic.AppProgram;
import agentworld.logic.runtime.AppState;
import agentworld.logic.runtime.Builtins;
import agentworld.logic.runtime.SafetyLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * 节点计数器（surefire 中通过系统属性开启）
 */
public class ProfilerTest {

  @BeforeEach
  public void setUp() {
    Profiler.reset();
  }

  @Test
  public void testCountsExecutedNodes() {
    assumeTrue(Profiler.isEnabled(), "agentworld.profiler.enabled 未开启");

    AppProgram program = new AppEngine(Builtins.defaults(), SafetyLimits.DEFAULT).load("""
        {
          "app_id": "counter",
          "name": "Counter",
          "state_schema": [ { "name": "hits", "type": "number", "per_agent": false } ],
          "actions": [ { "name": "hit", "logic": [
            { "type": "update", "target": "shared.hits", "operation": "increment", "value": 1 },
            { "type": "notify", "message": "hit" }
          ] } ]
        }""");
    program.execute("i", "a", "hit", Map.of(), new AppState());
    program.execute("i", "a", "hit", Map.of(), new AppState());

    assertEquals(2L, Profiler.count(Profiler.Kind.ACTION));
    assertEquals(2L, Profiler.count(Profiler.Kind.UPDATE));
    assertEquals(2L, Profiler.count(Profiler.Kind.NOTIFY));
    assertEquals(0L, Profiler.count(Profiler.Kind.LOOP), "未执行的节点不计数");

    Map<String, Long> counters = Profiler.getCounters();
    assertEquals(2L, counters.get("update"));
    assertFalse(counters.containsKey("loop"));
    assertTrue(counters.get(Profiler.TOTAL) >= 6L);

    String dump = Profiler.dump();
    assertTrue(dump.contains("  update: 2"), dump);
    assertTrue(dump.indexOf("statements") < dump.indexOf("expressions"), "语句在表达式之前");
    assertTrue(dump.endsWith(Profiler.TOTAL + ": " + Profiler.total() + "\n"));
  }

  @Test
  public void testKindsAreGrouped() {
    assertTrue(Profiler.Kind.LOOP.isStatement());
    assertFalse(Profiler.Kind.TEMPLATE.isStatement());
    assertEquals("builtin_call", Profiler.Kind.BUILTIN_CALL.label());
  }

  @Test
  public void testReset() {
    Profiler.inc(Profiler.Kind.LITERAL);
    Profiler.reset();
    assertTrue(Profiler.getCounters().isEmpty());
    assertEquals(0L, Profiler.total());
  }
}
