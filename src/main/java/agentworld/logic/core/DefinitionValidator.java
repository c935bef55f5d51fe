package agentworld.logic.core;

import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 应用级约束检查：标识、命名唯一性、默认值类型、参数边界、访问/状态组合。
 * 逻辑块内的表达式与引用由 Loader 在构建节点树时检查。
 */
public final class DefinitionValidator {
  /** snake_case，字母开头，2-50 个字符。 */
  public static final Pattern APP_ID_PATTERN = Pattern.compile("^[a-z][a-z0-9_]{1,49}$");

  private DefinitionValidator() {}

  public static void validate(AppModel.AppDefinition def) {
    if (def.appId() == null || !APP_ID_PATTERN.matcher(def.appId()).matches()) {
      throw new DefinitionException("app_id",
          "invalid app_id '" + def.appId() + "': must be snake_case, start with a letter and be 2-50 characters");
    }
    if (def.name() == null || def.name().isBlank()) {
      throw new DefinitionException("name", "app name is required");
    }
    if (def.accessType() == AppModel.AccessType.PER_AGENT && def.stateType() != AppModel.StateType.PER_AGENT) {
      throw new DefinitionException("access_type", "access_type=per_agent requires state_type=per_agent");
    }
    validateStateSchema(def);
    validateConfigSchema(def);
    validateActions(def);
  }

  private static void validateStateSchema(AppModel.AppDefinition def) {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < def.stateSchema().size(); i++) {
      AppModel.StateField f = def.stateSchema().get(i);
      String loc = "state_schema[" + i + "]";
      requireName(f.name(), loc);
      if (!seen.add(f.name())) {
        throw new DefinitionException(loc, "duplicate state field '" + f.name() + "'");
      }
      if (ExecutionContext.ROOT_NAMES.contains(f.name())) {
        throw new DefinitionException(loc, "state field name '" + f.name() + "' is reserved");
      }
      checkDefault(f.defaultValue(), f.type(), loc + ".default");
    }
  }

  private static void validateConfigSchema(AppModel.AppDefinition def) {
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < def.configSchema().size(); i++) {
      AppModel.ConfigField f = def.configSchema().get(i);
      String loc = "config_schema[" + i + "]";
      requireName(f.name(), loc);
      if (!seen.add(f.name())) {
        throw new DefinitionException(loc, "duplicate config field '" + f.name() + "'");
      }
      if (f.min() != null && f.max() != null && f.min() > f.max()) {
        throw new DefinitionException(loc, "min is greater than max");
      }
    }
  }

  private static void validateActions(AppModel.AppDefinition def) {
    if (def.actions().isEmpty()) {
      throw new DefinitionException("actions", "an app must define at least one action");
    }
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < def.actions().size(); i++) {
      AppModel.ActionDefinition a = def.actions().get(i);
      requireName(a.name(), "actions[" + i + "]");
      if (!seen.add(a.name())) {
        throw new DefinitionException("actions[" + i + "]", "duplicate action '" + a.name() + "'");
      }
      for (var e : a.parameters().entrySet()) {
        validateParam(e.getValue(), "actions[" + a.name() + "].parameters." + e.getKey());
      }
    }
  }

  private static void validateParam(AppModel.ParamSpec p, String loc) {
    if (p == null) {
      throw new DefinitionException(loc, "parameter spec is required");
    }
    checkDefault(p.defaultValue(), p.type(), loc + ".default");
    if (p.minValue() != null && p.maxValue() != null && p.minValue() > p.maxValue()) {
      throw new DefinitionException(loc, "min_value is greater than max_value");
    }
    if (p.minLength() != null && p.minLength() < 0) {
      throw new DefinitionException(loc, "min_length must be non-negative");
    }
    if (p.minLength() != null && p.maxLength() != null && p.minLength() > p.maxLength()) {
      throw new DefinitionException(loc, "min_length is greater than max_length");
    }
    if (p.pattern() != null) {
      try {
        Pattern.compile(p.pattern());
      } catch (PatternSyntaxException e) {
        throw new DefinitionException(loc + ".pattern", "invalid regular expression: " + e.getDescription(), e);
      }
    }
    if (p.choices() != null) {
      for (JsonNode choice : p.choices()) {
        checkDefault(choice, p.type(), loc + ".enum");
      }
    }
  }

  private static void checkDefault(JsonNode node, ValueType type, String loc) {
    if (node == null || node.isNull()) {
      return;
    }
    Value v = Values.fromJson(node);
    if (!type.accepts(v)) {
      throw new DefinitionException(loc, "expected " + type.jsonName() + ", got " + v.typeName());
    }
  }

  private static void requireName(String name, String loc) {
    if (name == null || name.isBlank()) {
      throw new DefinitionException(loc, "name is required");
    }
  }
}
