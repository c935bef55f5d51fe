package agentworld.logic.runtime;

import agentworld.logic.runtime.Value.BoolValue;
import agentworld.logic.runtime.Value.ListValue;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Value.NullValue;
import agentworld.logic.runtime.Value.NumberValue;
import agentworld.logic.runtime.Value.StringValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Value 工具：构造、JSON/Java 对象互转、宽松读取。
 */
public final class Values {
  static final ObjectMapper JSON = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private Values() {}

  public static NullValue nil() { return NullValue.INSTANCE; }

  public static NumberValue number(double d) { return new NumberValue(d); }

  public static StringValue string(String s) { return new StringValue(s); }

  public static BoolValue bool(boolean b) { return BoolValue.of(b); }

  public static ListValue list(Value... items) {
    List<Value> list = new ArrayList<>(items.length);
    java.util.Collections.addAll(list, items);
    return new ListValue(list);
  }

  public static MapValue map() { return new MapValue(); }

  // ---------------------------------------------------------------- JSON

  public static Value fromJson(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullValue.INSTANCE;
    }
    if (node.isBoolean()) {
      return BoolValue.of(node.booleanValue());
    }
    if (node.isNumber()) {
      return new NumberValue(node.doubleValue());
    }
    if (node.isTextual()) {
      return new StringValue(node.textValue());
    }
    if (node.isArray()) {
      List<Value> items = new ArrayList<>(node.size());
      for (JsonNode item : node) {
        items.add(fromJson(item));
      }
      return new ListValue(items);
    }
    if (node.isObject()) {
      Map<String, Value> entries = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        entries.put(e.getKey(), fromJson(e.getValue()));
      }
      return new MapValue(entries);
    }
    throw new IllegalArgumentException("unsupported JSON node: " + node.getNodeType());
  }

  /** 整数值输出为 long，保证 {@code 5} 不会序列化成 {@code 5.0}。 */
  public static JsonNode toJson(Value value) {
    if (value instanceof BoolValue b) {
      return NODES.booleanNode(b.value());
    }
    if (value instanceof NumberValue n) {
      if (n.isIntegral() && Math.abs(n.value()) < 9.007199254740992E15) {
        return NODES.numberNode((long) n.value());
      }
      return NODES.numberNode(n.value());
    }
    if (value instanceof StringValue s) {
      return NODES.textNode(s.value());
    }
    if (value instanceof ListValue l) {
      ArrayNode arr = NODES.arrayNode();
      for (Value item : l.items()) {
        arr.add(toJson(item));
      }
      return arr;
    }
    if (value instanceof MapValue m) {
      ObjectNode obj = NODES.objectNode();
      m.entries().forEach((k, v) -> obj.set(k, toJson(v)));
      return obj;
    }
    return NODES.nullNode();
  }

  public static String toJsonString(Value value) {
    try {
      return JSON.writeValueAsString(toJson(value));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize value", e);
    }
  }

  public static Value parseJson(String json) {
    try {
      return fromJson(JSON.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  // ---------------------------------------------------------------- Java objects

  /**
   * 从宿主的普通 Java 对象转换：Map、Iterable、Number、CharSequence、Boolean、null、Value、JsonNode。
   */
  public static Value fromJava(Object o) {
    if (o == null) {
      return NullValue.INSTANCE;
    }
    if (o instanceof Value v) {
      return v;
    }
    if (o instanceof JsonNode n) {
      return fromJson(n);
    }
    if (o instanceof Boolean b) {
      return BoolValue.of(b);
    }
    if (o instanceof Number n) {
      return new NumberValue(n.doubleValue());
    }
    if (o instanceof CharSequence s) {
      return new StringValue(s.toString());
    }
    if (o instanceof Map<?, ?> m) {
      Map<String, Value> entries = new LinkedHashMap<>();
      m.forEach((k, v) -> entries.put(String.valueOf(k), fromJava(v)));
      return new MapValue(entries);
    }
    if (o instanceof Iterable<?> it) {
      List<Value> items = new ArrayList<>();
      for (Object item : it) {
        items.add(fromJava(item));
      }
      return new ListValue(items);
    }
    throw new IllegalArgumentException("cannot convert " + o.getClass().getName() + " to a value");
  }

  /** 转换为普通 Java 对象；整数返回 Long，其余数字返回 Double。 */
  public static Object toJava(Value value) {
    if (value instanceof BoolValue b) {
      return b.value();
    }
    if (value instanceof NumberValue n) {
      return n.isIntegral() ? (Object) (long) n.value() : (Object) n.value();
    }
    if (value instanceof StringValue s) {
      return s.value();
    }
    if (value instanceof ListValue l) {
      List<Object> out = new ArrayList<>(l.items().size());
      for (Value item : l.items()) {
        out.add(toJava(item));
      }
      return out;
    }
    if (value instanceof MapValue m) {
      Map<String, Object> out = new LinkedHashMap<>();
      m.entries().forEach((k, v) -> out.put(k, toJava(v)));
      return out;
    }
    return null;
  }

  // ---------------------------------------------------------------- display

  static String display(Value value) {
    if (value instanceof NullValue) {
      return "";
    }
    if (value instanceof StringValue s) {
      return s.value();
    }
    if (value instanceof BoolValue b) {
      return b.value() ? "true" : "false";
    }
    if (value instanceof NumberValue n) {
      return formatNumber(n.value());
    }
    return toJsonString(value);
  }

  public static String formatNumber(double d) {
    if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }

  // ---------------------------------------------------------------- permissive reads

  /**
   * 读取 map 成员；目标为 null 或键不存在时返回 Null，目标为其他标量时类型不匹配。
   */
  public static Value readMember(Value target, String name) {
    if (target instanceof MapValue m) {
      return m.get(name);
    }
    if (target instanceof NullValue) {
      return NullValue.INSTANCE;
    }
    throw EvaluationException.typeMismatch(ErrorMessages.memberOnScalar(name, target));
  }

  /**
   * 按下标读取：list 接受整数下标（越界返回 Null），map 接受字符串键。
   */
  public static Value readIndex(Value target, Value index) {
    if (target instanceof NullValue) {
      return NullValue.INSTANCE;
    }
    if (target instanceof ListValue l && index instanceof NumberValue n && n.isIntegral()) {
      double i = n.value();
      if (i < 0 || i >= l.items().size()) {
        return NullValue.INSTANCE;
      }
      return l.items().get((int) i);
    }
    if (target instanceof MapValue m && index instanceof StringValue s) {
      return m.get(s.value());
    }
    throw EvaluationException.typeMismatch(ErrorMessages.badIndex(target, index));
  }

  /** 条件表达式必须为布尔值。 */
  public static boolean asCondition(Value value, String where) {
    if (value instanceof BoolValue b) {
      return b.value();
    }
    throw EvaluationException.typeMismatch(ErrorMessages.typeExpected(where, "bool", value));
  }
}
