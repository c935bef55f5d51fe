package agentworld.logic.core;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * 参数与状态字段的声明类型。
 */
public enum ValueType {
  STRING(Value.Kind.STRING),
  NUMBER(Value.Kind.NUMBER),
  BOOLEAN(Value.Kind.BOOL),
  ARRAY(Value.Kind.LIST),
  OBJECT(Value.Kind.MAP);

  private final Value.Kind kind;

  ValueType(Value.Kind kind) {
    this.kind = kind;
  }

  public boolean accepts(Value value) {
    return value.kind() == kind;
  }

  /** 未声明默认值时使用的类型默认值。 */
  public Value defaultValue() {
    switch (this) {
      case STRING: return Values.string("");
      case NUMBER: return Values.number(0);
      case BOOLEAN: return Values.bool(false);
      case ARRAY: return Values.list();
      default: return Values.map();
    }
  }

  @JsonValue
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ValueType fromJson(String name) {
    for (ValueType t : values()) {
      if (t.jsonName().equalsIgnoreCase(name)) {
        return t;
      }
    }
    throw new IllegalArgumentException("unknown value type: " + name);
  }
}
