package agentworld.logic.runtime;

import agentworld.logic.core.AppModel;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Value.NullValue;
import agentworld.logic.runtime.Value.NumberValue;
import agentworld.logic.runtime.Value.StringValue;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * 按动作的参数声明校验并绑定调用参数。加载时构建一次，正则预编译。
 *
 * <p>未知参数、缺失的必填参数、类型、数值范围、字符串长度、正则与枚举不符时
 * 抛出 {@link ErrorKind#INVALID_PARAMS}。声明但未提供的参数取默认值，没有默认值时绑定为 Null。</p>
 */
public final class ParamBinder {
  private final Map<String, AppModel.ParamSpec> specs;
  private final Map<String, Pattern> patterns = new HashMap<>();
  private final Map<String, List<Value>> choices = new HashMap<>();

  public ParamBinder(Map<String, AppModel.ParamSpec> specs) {
    this.specs = specs;
    specs.forEach((name, spec) -> {
      if (spec.pattern() != null) {
        patterns.put(name, Pattern.compile(spec.pattern()));
      }
      if (spec.choices() != null) {
        List<Value> values = new ArrayList<>();
        for (JsonNode choice : spec.choices()) {
          values.add(Values.fromJson(choice));
        }
        choices.put(name, values);
      }
    });
  }

  public MapValue bind(Map<String, Value> raw) {
    Map<String, Value> provided = raw == null ? Map.of() : raw;
    TreeSet<String> unknown = new TreeSet<>(provided.keySet());
    unknown.removeAll(specs.keySet());
    if (!unknown.isEmpty()) {
      throw invalid("unknown parameters: " + String.join(", ", unknown));
    }
    MapValue bound = new MapValue();
    for (var e : specs.entrySet()) {
      String name = e.getKey();
      AppModel.ParamSpec spec = e.getValue();
      Value value = provided.get(name);
      if (value == null || value instanceof NullValue) {
        if (spec.defaultValue() != null && !spec.defaultValue().isNull()) {
          bound.entries().put(name, Values.fromJson(spec.defaultValue()));
          continue;
        }
        if (spec.required()) {
          throw invalid("parameter '" + name + "' is required");
        }
        bound.entries().put(name, NullValue.INSTANCE);
        continue;
      }
      check(name, spec, value);
      bound.entries().put(name, value.deepCopy());
    }
    return bound;
  }

  private void check(String name, AppModel.ParamSpec spec, Value value) {
    if (!spec.type().accepts(value)) {
      throw invalid("parameter '" + name + "' must be " + spec.type().jsonName() + ", got " + value.typeName());
    }
    if (value instanceof NumberValue n) {
      if (spec.minValue() != null && n.value() < spec.minValue()) {
        throw invalid("parameter '" + name + "' must be >= " + Values.formatNumber(spec.minValue()));
      }
      if (spec.maxValue() != null && n.value() > spec.maxValue()) {
        throw invalid("parameter '" + name + "' must be <= " + Values.formatNumber(spec.maxValue()));
      }
    }
    if (value instanceof StringValue s) {
      if (spec.minLength() != null && s.value().codePointCount(0, s.value().length()) < spec.minLength()) {
        throw invalid("parameter '" + name + "' must be at least " + spec.minLength() + " characters");
      }
      if (spec.maxLength() != null && s.value().codePointCount(0, s.value().length()) > spec.maxLength()) {
        throw invalid("parameter '" + name + "' must be at most " + spec.maxLength() + " characters");
      }
      Pattern pattern = patterns.get(name);
      if (pattern != null && !pattern.matcher(s.value()).matches()) {
        throw invalid("parameter '" + name + "' must match pattern " + pattern.pattern());
      }
    }
    List<Value> allowed = choices.get(name);
    if (allowed != null && !allowed.contains(value)) {
      List<String> shown = new ArrayList<>();
      for (Value v : allowed) {
        shown.add(Values.toJsonString(v));
      }
      throw invalid("parameter '" + name + "' must be one of " + shown);
    }
  }

  private static LogicException invalid(String message) {
    return new LogicException(ErrorKind.INVALID_PARAMS, message);
  }
}
