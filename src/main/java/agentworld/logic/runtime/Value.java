package agentworld.logic.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 运行时唯一的值类型：Null | Bool | Number | String | List | Map。
 *
 * <p>List/Map 的相等性为结构（深度）相等，标量为精确相等；不同标签的值永不相等。
 * List 与 Map 的内部容器可变，只在调用的工作副本上修改。</p>
 */
public sealed interface Value
    permits Value.NullValue, Value.BoolValue, Value.NumberValue, Value.StringValue,
        Value.ListValue, Value.MapValue {

  enum Kind { NULL, BOOL, NUMBER, STRING, LIST, MAP }

  Kind kind();

  /** 深拷贝；标量返回自身。 */
  Value deepCopy();

  /** 显示形式，用于插值和字符串拼接。 */
  default String display() {
    return Values.display(this);
  }

  default String typeName() {
    return kind().name().toLowerCase(Locale.ROOT);
  }

  default boolean isNull() {
    return kind() == Kind.NULL;
  }

  final class NullValue implements Value {
    public static final NullValue INSTANCE = new NullValue();

    private NullValue() {}

    @Override public Kind kind() { return Kind.NULL; }
    @Override public Value deepCopy() { return this; }
    @Override public String toString() { return "null"; }
  }

  record BoolValue(boolean value) implements Value {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean b) { return b ? TRUE : FALSE; }

    @Override public Kind kind() { return Kind.BOOL; }
    @Override public Value deepCopy() { return this; }
  }

  record NumberValue(double value) implements Value {
    @Override public Kind kind() { return Kind.NUMBER; }
    @Override public Value deepCopy() { return this; }

    public boolean isIntegral() {
      return !Double.isInfinite(value) && value == Math.rint(value);
    }

    // 0.0 与 -0.0 相等
    @Override
    public boolean equals(Object o) {
      return o instanceof NumberValue other && other.value == value;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value == 0.0 ? 0.0 : value);
    }
  }

  record StringValue(String value) implements Value {
    public StringValue {
      java.util.Objects.requireNonNull(value, "value");
    }

    @Override public Kind kind() { return Kind.STRING; }
    @Override public Value deepCopy() { return this; }
  }

  record ListValue(List<Value> items) implements Value {
    public ListValue() {
      this(new ArrayList<>());
    }

    @Override public Kind kind() { return Kind.LIST; }

    @Override
    public ListValue deepCopy() {
      List<Value> copy = new ArrayList<>(items.size());
      for (Value v : items) {
        copy.add(v.deepCopy());
      }
      return new ListValue(copy);
    }
  }

  record MapValue(Map<String, Value> entries) implements Value {
    public MapValue() {
      this(new LinkedHashMap<>());
    }

    @Override public Kind kind() { return Kind.MAP; }

    @Override
    public MapValue deepCopy() {
      Map<String, Value> copy = new LinkedHashMap<>();
      entries.forEach((k, v) -> copy.put(k, v.deepCopy()));
      return new MapValue(copy);
    }

    public Value get(String key) {
      Value v = entries.get(key);
      return v != null ? v : NullValue.INSTANCE;
    }
  }
}
