package agentworld.logic.runtime;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 默认内置函数集
 */
public class BuiltinsTest {

  private final Builtins builtins = Builtins.defaults();

  private Value call(String name, Value... args) {
    return builtins.call(name, List.of(args));
  }

  private ErrorKind failure(String name, Value... args) {
    return assertThrows(EvaluationException.class, () -> call(name, args)).getKind();
  }

  @Test
  public void testLen() {
    assertEquals(Values.number(3), call("len", Values.string("abc")));
    assertEquals(Values.number(2), call("len", Values.list(Values.number(1), Values.number(2))));
    assertEquals(Values.number(0), call("len", Values.nil()));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("len", Values.number(1)));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("len"));
  }

  @Test
  public void testLenCountsCodePoints() {
    assertEquals(Values.number(1), call("len", Values.string("😀")), "补充平面字符算一个字符");
    assertEquals(Values.number(3), call("len", Values.string("a😀b")));
  }

  @Test
  public void testStringOrderingByCodePoint() {
    // U+FFFF 的码元大于代理对，但码点小于 U+1F600
    assertEquals(Values.string("\uFFFF"), call("min", Values.string("😀"), Values.string("\uFFFF")));
    assertEquals(Values.string("😀"), call("max", Values.string("\uFFFF"), Values.string("😀")));
    assertTrue(Operators.compare("<", Values.string("\uFFFF"), Values.string("😀")) < 0, "应按码点比较");
    assertTrue(Operators.compare("<", Values.string("ab"), Values.string("ab😀")) < 0, "前缀更小");
    assertEquals(0, Operators.compare("==", Values.string("😀"), Values.string("😀")));
  }

  @Test
  public void testStrings() {
    assertEquals(Values.string("abc"), call("lower", Values.string("AbC")));
    assertEquals(Values.string("ABC"), call("upper", Values.string("abc")));
    assertEquals(Values.string("x"), call("trim", Values.string("  x \t")));
    assertEquals(Values.bool(true), call("contains", Values.string("hello"), Values.string("ell")));
    assertEquals(Values.bool(false), call("contains", Values.nil(), Values.string("a")));
    assertEquals(Values.string("1.5"), call("str", Values.number(1.5)));
    assertEquals(Values.string("3"), call("str", Values.number(3)));
    assertEquals(Values.string(""), call("str", Values.nil()));
  }

  @Test
  public void testConversions() {
    assertEquals(Values.number(42), call("num", Values.string(" 42 ")));
    assertEquals(Values.number(1), call("num", Values.bool(true)));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("num", Values.string("x")));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("num", Values.string("NaN")), "NaN 不是合法数字");
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("num", Values.string("Infinity")));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("num", Values.string("-Infinity")));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("num", Values.string("1e400")), "溢出为无穷大也拒绝");
    assertEquals(Values.bool(false), call("bool", Values.string("")));
    assertEquals(Values.bool(true), call("bool", Values.list(Values.nil())));
  }

  @Test
  public void testRoundingIsBankers() {
    assertEquals(Values.number(2), call("round", Values.number(2.5)));
    assertEquals(Values.number(4), call("round", Values.number(3.5)));
    assertEquals(Values.number(3.14), call("round", Values.number(3.14159), Values.number(2)));
    assertEquals(Values.number(-1), call("floor", Values.number(-0.5)));
    assertEquals(Values.number(1), call("ceil", Values.number(0.2)));
    assertEquals(Values.number(7), call("abs", Values.number(-7)));
  }

  @Test
  public void testRoundDigitsBounds() {
    assertEquals(Values.number(1200), call("round", Values.number(1234), Values.number(-2)));
    assertEquals(Values.number(0.5), call("round", Values.number(0.5), Values.number(15)));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("round", Values.number(1.5), Values.number(5000000)),
        "位数过大应被拒绝");
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("round", Values.number(1.5), Values.number(-16)));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("round", Values.number(1.5), Values.number(1.5)),
        "位数必须是整数");
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("round", Values.number(1.5), Values.number(Double.NaN)));
    assertEquals(ErrorKind.INVALID_ARGUMENT,
        failure("round", Values.number(1.5), Values.number(Double.POSITIVE_INFINITY)));
  }

  @Test
  public void testRoundNonFinite() {
    Value nan = call("round", Values.number(Double.NaN));
    assertTrue(Double.isNaN(((Value.NumberValue) nan).value()), "NaN 原样返回");
    assertEquals(Values.number(Double.NEGATIVE_INFINITY),
        call("round", Values.number(Double.NEGATIVE_INFINITY), Values.number(2)));
  }

  @Test
  public void testMinMaxSum() {
    assertEquals(Values.number(1), call("min", Values.number(3), Values.number(1), Values.number(2)));
    assertEquals(Values.number(3), call("max", Values.list(Values.number(3), Values.number(1))));
    assertEquals(Values.string("a"), call("min", Values.string("b"), Values.string("a")));
    assertEquals(ErrorKind.INVALID_ARGUMENT, failure("max", Values.list()));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("min", Values.number(1), Values.string("a")));
    assertEquals(Values.number(6), call("sum", Values.list(Values.number(1), Values.number(2), Values.number(3))));
    assertEquals(ErrorKind.TYPE_MISMATCH, failure("sum", Values.list(Values.string("1"))));
  }

  @Test
  public void testMapHelpers() {
    Value.MapValue m = (Value.MapValue) Values.parseJson("{\"a\": 1, \"b\": [2]}");
    assertEquals(Values.list(Values.string("a"), Values.string("b")), call("keys", m));
    assertEquals(2, ((Value.ListValue) call("values", m)).items().size());
    assertEquals(Values.bool(true), call("contains", m, Values.string("b")));
    assertEquals(Values.number(1), call("coalesce", Values.nil(), Values.number(1), Values.number(2)));
  }

  @Test
  public void testHostFunctions() {
    Builtins extended = builtins.with("double", args -> Values.number(((Value.NumberValue) args.get(0)).value() * 2));
    assertEquals(Values.number(8), extended.call("double", List.of(Values.number(4))));
    assertFalse(builtins.has("double"), "with() 不应修改原注册表");
    assertEquals(ErrorKind.UNKNOWN_FUNCTION, failure("double", Values.number(1)));
    assertTrue(Builtins.empty().names().isEmpty());
  }
}
