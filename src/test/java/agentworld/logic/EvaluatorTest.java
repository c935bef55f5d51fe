package agentworld.logic;

import agentworld.logic.runtime.AppState;
import agentworld.logic.runtime.Builtins;
import agentworld.logic.runtime.ErrorKind;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicException;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 表达式求值语义测试
 */
public class EvaluatorTest {

  private final AtomicInteger ticks = new AtomicInteger();
  private ExecutionContext ctx;

  @BeforeEach
  public void setUp() {
    ticks.set(0);
    AppState state = AppState.fromJson("""
        {
          "shared": { "counter": 3, "owner": "shared-owner", "inventory": { "apples": 4 } },
          "per_agent": {
            "alice": { "balance": 100, "owner": "alice-owner" },
            "bob": { "balance": 20 }
          }
        }""");
    Value.MapValue params = (Value.MapValue) Values.parseJson("""
        { "amount": 5, "a": { "b": [5, 6] }, "name": "World", "owner": "param-owner" }""");
    Builtins builtins = Builtins.defaults().with("tick", args -> {
      ticks.incrementAndGet();
      return Values.bool(true);
    });
    ctx = ExecutionContext.builder()
        .appInstanceId("inst")
        .agentId("alice")
        .params(params)
        .state(state)
        .config((Value.MapValue) Values.parseJson("{ \"fee\": 0.5 }"))
        .builtins(builtins)
        .build();
  }

  private Value eval(String expression) {
    return Evaluator.evaluate(expression, ctx);
  }

  private ErrorKind failure(String expression) {
    LogicException e = assertThrows(LogicException.class, () -> eval(expression));
    return e.getKind();
  }

  @Test
  public void testPrecedence() {
    assertEquals(Values.number(7), eval("1 + 2 * 3"));
    assertEquals(Values.number(9), eval("(1 + 2) * 3"));
    assertEquals(Values.bool(false), eval("!true && false"));
    assertEquals(Values.bool(true), eval("a.b[0] == 5"));
    assertEquals(Values.bool(true), eval("1 + 1 == 2 && 3 > 2 || false"));
    assertEquals(Values.number(-6), eval("-3 * 2"));
    assertEquals(Values.number(1), eval("10 - 6 - 3"));
    assertEquals(Values.number(2.5), eval("10 / 4"));
  }

  @Test
  public void testShortCircuit() {
    assertEquals(Values.bool(false), eval("false && tick()"));
    assertEquals(Values.bool(true), eval("true || tick()"));
    assertEquals(0, ticks.get(), "右操作数不应被求值");

    assertEquals(Values.bool(true), eval("true && tick()"));
    assertEquals(Values.bool(true), eval("false || tick()"));
    assertEquals(2, ticks.get());
  }

  @Test
  public void testLogicalOperandsMustBeBoolean() {
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("1 && true"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("true || 'yes'"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("!0"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("-'a'"));
  }

  @Test
  public void testAddition() {
    assertEquals(Values.string("n=5"), eval("'n=' + amount"));
    assertEquals(Values.string("5 apples"), eval("amount + ' apples'"));
    assertEquals(Values.string("x"), eval("'x' + null"));
    assertEquals(Values.list(Values.number(1), Values.number(2)), eval("[1] + [2]"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("1 + true"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("[1] + 1"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("'a' * 2"));
  }

  @Test
  public void testDivisionByZero() {
    assertEquals(ErrorKind.DIVISION_BY_ZERO, failure("amount / 0"));
  }

  @Test
  public void testComparison() {
    assertEquals(Values.bool(true), eval("'apple' < 'banana'"));
    assertEquals(Values.bool(true), eval("amount >= 5"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("1 < 'b'"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("null < 1"));
  }

  @Test
  public void testStructuralEquality() {
    assertEquals(Values.bool(false), eval("1 == '1'"));
    assertEquals(Values.bool(true), eval("[1, {k: 2}] == [1, {'k': 2}]"));
    assertEquals(Values.bool(true), eval("null == shared.missing"));
    assertEquals(Values.bool(true), eval("{a: 1, b: 2} != {a: 1}"));
  }

  @Test
  public void testPermissiveReads() {
    assertTrue(eval("shared.nope.deeper").isNull());
    assertTrue(eval("a.b[7]").isNull());
    assertTrue(eval("agents['nobody'].balance").isNull());
    assertEquals(Values.number(20), eval("agents.bob.balance"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("amount.value"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("a.b['x']"));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("a.b[0.5]"));
  }

  @Test
  public void testNameResolutionOrder() {
    assertEquals(Values.string("param-owner"), eval("owner"));
    ctx.pushScope().bind("owner", Values.string("loop-owner"));
    try {
      assertEquals(Values.string("loop-owner"), eval("owner"));
    } finally {
      ctx.popScope();
    }
    assertEquals(Values.number(100), eval("balance"));
    assertEquals(Values.number(3), eval("counter"));
    assertTrue(eval("undefined_thing").isNull());
  }

  @Test
  public void testRoots() {
    assertEquals(Values.string("alice"), eval("agent.id"));
    assertEquals(Values.number(100), eval("agent.balance"));
    assertEquals(Values.number(4), eval("shared.inventory.apples"));
    assertEquals(Values.number(0.5), eval("config.fee"));
    assertEquals(Values.number(5), eval("params.amount"));
    assertFalse(ctx.state().perAgent().get("alice").entries().containsKey("id"), "agent 视图不应写回状态");
  }

  @Test
  public void testFunctions() {
    assertEquals(Values.number(5), eval("len(name)"));
    assertEquals(Values.string("WORLD"), eval("upper(name)"));
    assertEquals(Values.number(6), eval("max(a.b)"));
    assertEquals(Values.string("fallback"), eval("coalesce(shared.none, 'fallback')"));
    assertEquals(ErrorKind.UNKNOWN_FUNCTION, failure("launch_missiles()"));
  }

  @Test
  public void testTemplates() {
    assertEquals(Values.string("Hello, World!"), eval("`Hello, ${name}!`"));
    assertEquals("total: 7 (5 + 2)", Evaluator.interpolate("total: ${amount + 2} (${amount} + 2)", ctx));
    assertEquals("list [1,2]", Evaluator.interpolate("list ${[1, 2]}", ctx));
    assertEquals("nothing: ", Evaluator.interpolate("nothing: ${shared.none}", ctx));
    assertEquals("plain text", Evaluator.interpolate("plain text", ctx));
  }

  @Test
  public void testLiterals() {
    Value map = eval("{a: 1, 'b c': [true, null], }");
    assertEquals(Values.number(1), ((Value.MapValue) map).get("a"));
    assertEquals(2, ((Value.ListValue) ((Value.MapValue) map).get("b c")).items().size());
    assertEquals(Values.string("it's"), eval("'it\\'s'"));
    assertEquals(Values.string("line\nbreak"), eval("\"line\\nbreak\""));
    assertEquals(Values.number(3.25), eval("3.25"));
  }
}
