package agentworld.logic.runtime;

import agentworld.logic.runtime.Value.BoolValue;
import agentworld.logic.runtime.Value.ListValue;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Value.NullValue;
import agentworld.logic.runtime.Value.NumberValue;
import agentworld.logic.runtime.Value.StringValue;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builtins Registry - 表达式可调用的内置函数
 *
 * 注册表按实例显式传入求值器，不存在全局可变状态：
 * - {@link #defaults()}：确定性的默认函数集（不含时间、随机函数）
 * - {@link #with(String, BuiltinFunction)}：返回追加了宿主函数的新注册表
 *
 * 函数按名称在求值时解析，未注册的名称报 UNKNOWN_FUNCTION。
 */
public final class Builtins {

  /**
   * Builtin函数接口
   */
  @FunctionalInterface
  public interface BuiltinFunction {
    Value call(List<Value> args);
  }

  static final int MAX_ROUND_DIGITS = 15;

  private static final Builtins DEFAULTS = createDefaults();

  private final Map<String, BuiltinFunction> registry;

  private Builtins(Map<String, BuiltinFunction> registry) {
    this.registry = Collections.unmodifiableMap(registry);
  }

  public static Builtins defaults() {
    return DEFAULTS;
  }

  public static Builtins empty() {
    return new Builtins(new LinkedHashMap<>());
  }

  /** 返回包含新函数的注册表副本，同名函数被覆盖。 */
  public Builtins with(String name, BuiltinFunction fn) {
    Map<String, BuiltinFunction> copy = new LinkedHashMap<>(registry);
    copy.put(name, fn);
    return new Builtins(copy);
  }

  public boolean has(String name) {
    return registry.containsKey(name);
  }

  public Set<String> names() {
    return registry.keySet();
  }

  public Value call(String name, List<Value> args) {
    BuiltinFunction fn = registry.get(name);
    if (fn == null) {
      throw new EvaluationException(ErrorKind.UNKNOWN_FUNCTION, ErrorMessages.unknownFunction(name));
    }
    return fn.call(args);
  }

  private static Builtins createDefaults() {
    Map<String, BuiltinFunction> r = new LinkedHashMap<>();

    // === Collections & strings ===
    r.put("len", args -> {
      checkArity("len", args, 1);
      Value v = args.get(0);
      if (v instanceof NullValue) return Values.number(0);
      if (v instanceof StringValue s) return Values.number(codePoints(s.value()));
      if (v instanceof ListValue l) return Values.number(l.items().size());
      if (v instanceof MapValue m) return Values.number(m.entries().size());
      throw typeError("len", "string, list or map", v);
    });

    r.put("contains", args -> {
      checkArity("contains", args, 2);
      Value c = args.get(0);
      Value item = args.get(1);
      if (c instanceof NullValue) return BoolValue.FALSE;
      if (c instanceof StringValue s) {
        if (!(item instanceof StringValue sub)) throw typeError("contains", "string needle", item);
        return Values.bool(s.value().contains(sub.value()));
      }
      if (c instanceof ListValue l) return Values.bool(l.items().contains(item));
      if (c instanceof MapValue m) {
        return Values.bool(item instanceof StringValue k && m.entries().containsKey(k.value()));
      }
      throw typeError("contains", "string, list or map", c);
    });

    r.put("lower", args -> {
      checkArity("lower", args, 1);
      return Values.string(text("lower", args.get(0)).toLowerCase(Locale.ROOT));
    });

    r.put("upper", args -> {
      checkArity("upper", args, 1);
      return Values.string(text("upper", args.get(0)).toUpperCase(Locale.ROOT));
    });

    r.put("trim", args -> {
      checkArity("trim", args, 1);
      return Values.string(text("trim", args.get(0)).strip());
    });

    r.put("keys", args -> {
      checkArity("keys", args, 1);
      List<Value> out = new ArrayList<>();
      for (String k : map("keys", args.get(0)).entries().keySet()) {
        out.add(Values.string(k));
      }
      return new ListValue(out);
    });

    r.put("values", args -> {
      checkArity("values", args, 1);
      List<Value> out = new ArrayList<>();
      for (Value v : map("values", args.get(0)).entries().values()) {
        out.add(v.deepCopy());
      }
      return new ListValue(out);
    });

    // === Conversions ===
    r.put("str", args -> {
      checkArity("str", args, 1);
      return Values.string(args.get(0).display());
    });

    r.put("num", args -> {
      checkArity("num", args, 1);
      Value v = args.get(0);
      if (v instanceof NullValue) return Values.number(0);
      if (v instanceof NumberValue) return v;
      if (v instanceof BoolValue b) return Values.number(b.value() ? 1 : 0);
      if (v instanceof StringValue s) {
        double parsed;
        try {
          parsed = Double.parseDouble(s.value().trim());
        } catch (NumberFormatException e) {
          throw EvaluationException.invalidArgument("cannot convert '" + s.value() + "' to number");
        }
        if (!Double.isFinite(parsed)) {
          throw EvaluationException.invalidArgument("cannot convert '" + s.value() + "' to a finite number");
        }
        return Values.number(parsed);
      }
      throw typeError("num", "string, number or bool", v);
    });

    r.put("bool", args -> {
      checkArity("bool", args, 1);
      return Values.bool(truthy(args.get(0)));
    });

    // === Arithmetic ===
    r.put("round", args -> {
      checkArity("round", args, 1, 2);
      double x = number("round", args.get(0));
      int digits = args.size() > 1 ? digits(args.get(1)) : 0;
      if (Double.isInfinite(x) || Double.isNaN(x)) {
        return Values.number(x);
      }
      BigDecimal rounded = new BigDecimal(x).setScale(digits, RoundingMode.HALF_EVEN);
      return Values.number(rounded.doubleValue());
    });

    r.put("floor", args -> {
      checkArity("floor", args, 1);
      return Values.number(Math.floor(number("floor", args.get(0))));
    });

    r.put("ceil", args -> {
      checkArity("ceil", args, 1);
      return Values.number(Math.ceil(number("ceil", args.get(0))));
    });

    r.put("abs", args -> {
      checkArity("abs", args, 1);
      return Values.number(Math.abs(number("abs", args.get(0))));
    });

    r.put("min", args -> extreme("min", args, -1));
    r.put("max", args -> extreme("max", args, 1));

    r.put("sum", args -> {
      checkArity("sum", args, 1);
      double total = 0;
      for (Value v : list("sum", args.get(0)).items()) {
        total += number("sum", v);
      }
      return Values.number(total);
    });

    r.put("coalesce", args -> {
      for (Value v : args) {
        if (!(v instanceof NullValue)) return v;
      }
      return NullValue.INSTANCE;
    });

    return new Builtins(r);
  }

  /** min/max：接受多个参数或单个 list 参数。 */
  private static Value extreme(String name, List<Value> args, int sign) {
    List<Value> candidates = args.size() == 1 && args.get(0) instanceof ListValue l ? l.items() : args;
    if (candidates.isEmpty()) {
      throw EvaluationException.invalidArgument(name + "() requires at least one value");
    }
    Value best = candidates.get(0);
    for (int i = 1; i < candidates.size(); i++) {
      Value v = candidates.get(i);
      if (Integer.signum(Operators.compare(name, v, best)) == sign) {
        best = v;
      }
    }
    if (candidates.size() == 1) {
      Operators.compare(name, best, best);
    }
    return best;
  }

  static boolean truthy(Value v) {
    if (v instanceof BoolValue b) return b.value();
    if (v instanceof NumberValue n) return n.value() != 0;
    if (v instanceof StringValue s) return !s.value().isEmpty();
    if (v instanceof ListValue l) return !l.items().isEmpty();
    if (v instanceof MapValue m) return !m.entries().isEmpty();
    return false;
  }

  private static String text(String fn, Value v) {
    if (v instanceof NullValue) return "";
    if (v instanceof StringValue s) return s.value();
    throw typeError(fn, "string", v);
  }

  /** round 的小数位数：整数，且在 ±MAX_ROUND_DIGITS 以内。 */
  private static int digits(Value v) {
    double d = number("round", v);
    if (d != Math.rint(d) || Math.abs(d) > MAX_ROUND_DIGITS) {
      throw EvaluationException.invalidArgument(
          "round digits must be an integer between -" + MAX_ROUND_DIGITS + " and " + MAX_ROUND_DIGITS
              + ", got " + Values.formatNumber(d));
    }
    return (int) d;
  }

  static int codePoints(String s) {
    return s.codePointCount(0, s.length());
  }

  private static double number(String fn, Value v) {
    if (v instanceof NumberValue n) return n.value();
    throw typeError(fn, "number", v);
  }

  private static MapValue map(String fn, Value v) {
    if (v instanceof MapValue m) return m;
    if (v instanceof NullValue) return new MapValue();
    throw typeError(fn, "map", v);
  }

  private static ListValue list(String fn, Value v) {
    if (v instanceof ListValue l) return l;
    throw typeError(fn, "list", v);
  }

  private static EvaluationException typeError(String fn, String expected, Value actual) {
    return EvaluationException.typeMismatch(ErrorMessages.typeExpected(fn + "()", expected, actual));
  }

  private static void checkArity(String fn, List<Value> args, int expected) {
    if (args.size() != expected) {
      throw EvaluationException.invalidArgument(ErrorMessages.arity(fn, String.valueOf(expected), args.size()));
    }
  }

  private static void checkArity(String fn, List<Value> args, int min, int max) {
    if (args.size() < min || args.size() > max) {
      throw EvaluationException.invalidArgument(ErrorMessages.arity(fn, min + "-" + max, args.size()));
    }
  }
}
