package agentworld.logic.core;

import com.fasterxml.jackson.annotation.*;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.*;

/**
 * 应用定义的 JSON 模型。
 *
 * <p>字段名使用 snake_case，同时接受 camelCase 别名。逻辑块以 {@code "type"} 区分。
 * 表达式保持为字符串，在 Loader 中解析；值字段（update.value、return.value、notify.data）
 * 保留原始 JSON：字符串是表达式，对象/数组的字符串叶子是表达式，其余标量是字面量。</p>
 */
public final class AppModel {
  private AppModel() {}

  private static <T> List<T> listOrEmpty(List<T> list) {
    return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
  }

  // ---------------------------------------------------------------- enums

  public enum Category {
    PAYMENT, SHOPPING, COMMUNICATION, CALENDAR, SOCIAL, CUSTOM;

    @JsonValue public String jsonName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static Category fromJson(String name) { return Enum.valueOf(Category.class, name.toUpperCase(Locale.ROOT)); }
  }

  /** 谁可以访问应用。 */
  public enum AccessType {
    SHARED, ROLE_RESTRICTED, PER_AGENT;

    @JsonValue public String jsonName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static AccessType fromJson(String name) { return Enum.valueOf(AccessType.class, name.toUpperCase(Locale.ROOT)); }
  }

  /** 状态是否在 agent 之间隔离。 */
  public enum StateType {
    SHARED, PER_AGENT;

    @JsonValue public String jsonName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static StateType fromJson(String name) { return Enum.valueOf(StateType.class, name.toUpperCase(Locale.ROOT)); }
  }

  /** 动作是否修改状态，仅用于分析与策略。 */
  public enum ToolType {
    READ, WRITE;

    @JsonValue public String jsonName() { return name().toLowerCase(Locale.ROOT); }

    @JsonCreator
    public static ToolType fromJson(String name) { return Enum.valueOf(ToolType.class, name.toUpperCase(Locale.ROOT)); }
  }

  // ---------------------------------------------------------------- app

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"app_id", "name", "category", "description", "icon", "state_schema", "actions",
      "config_schema", "initial_config", "access_type", "allowed_roles", "allowed_role_tags", "state_type"})
  public record AppDefinition(
      @JsonProperty("app_id") @JsonAlias("appId") String appId,
      @JsonProperty("name") String name,
      @JsonProperty("category") Category category,
      @JsonProperty("description") String description,
      @JsonProperty("icon") String icon,
      @JsonProperty("state_schema") @JsonAlias("stateSchema") List<StateField> stateSchema,
      @JsonProperty("actions") List<ActionDefinition> actions,
      @JsonProperty("config_schema") @JsonAlias("configSchema") List<ConfigField> configSchema,
      @JsonProperty("initial_config") @JsonAlias("initialConfig") Map<String, JsonNode> initialConfig,
      @JsonProperty("access_type") @JsonAlias("accessType") AccessType accessType,
      @JsonProperty("allowed_roles") @JsonAlias("allowedRoles") List<String> allowedRoles,
      @JsonProperty("allowed_role_tags") @JsonAlias("allowedRoleTags") List<String> allowedRoleTags,
      @JsonProperty("state_type") @JsonAlias("stateType") StateType stateType) {

    public AppDefinition {
      category = category == null ? Category.CUSTOM : category;
      description = description == null ? "" : description;
      icon = icon == null ? "" : icon;
      stateSchema = listOrEmpty(stateSchema);
      actions = listOrEmpty(actions);
      configSchema = listOrEmpty(configSchema);
      initialConfig = initialConfig == null
          ? Map.of()
          : Collections.unmodifiableMap(new LinkedHashMap<>(initialConfig));
      accessType = accessType == null ? AccessType.SHARED : accessType;
      allowedRoles = listOrEmpty(allowedRoles);
      allowedRoleTags = listOrEmpty(allowedRoleTags);
      stateType = stateType == null ? StateType.SHARED : stateType;
    }

    public Optional<ActionDefinition> action(String name) {
      for (ActionDefinition a : actions) {
        if (a.name().equals(name)) {
          return Optional.of(a);
        }
      }
      return Optional.empty();
    }

    public Optional<StateField> stateField(String name) {
      for (StateField f : stateSchema) {
        if (f.name().equals(name)) {
          return Optional.of(f);
        }
      }
      return Optional.empty();
    }

    /**
     * shared / per_agent 访问不受限；role_restricted 时匹配主角色或任一角色标签。
     */
    public boolean canAccess(String role, Collection<String> roleTags) {
      if (accessType != AccessType.ROLE_RESTRICTED) {
        return true;
      }
      if (role != null && allowedRoles.contains(role)) {
        return true;
      }
      if (roleTags != null) {
        for (String tag : roleTags) {
          if (allowedRoleTags.contains(tag)) {
            return true;
          }
        }
      }
      return false;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record StateField(
      @JsonProperty("name") String name,
      @JsonProperty("type") ValueType type,
      @JsonProperty("default") JsonNode defaultValue,
      @JsonProperty("per_agent") @JsonAlias("perAgent") Boolean perAgent,
      @JsonProperty("description") String description,
      @JsonProperty("observable") Boolean observable) {

    public StateField {
      type = type == null ? ValueType.STRING : type;
      perAgent = perAgent == null ? Boolean.TRUE : perAgent;
      description = description == null ? "" : description;
      observable = observable == null ? Boolean.TRUE : observable;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ConfigField(
      @JsonProperty("name") String name,
      @JsonProperty("label") String label,
      @JsonProperty("type") String type,
      @JsonProperty("description") String description,
      @JsonProperty("default") JsonNode defaultValue,
      @JsonProperty("required") Boolean required,
      @JsonProperty("min") @JsonAlias("min_value") Double min,
      @JsonProperty("max") @JsonAlias("max_value") Double max,
      @JsonProperty("step") Double step,
      @JsonProperty("options") List<Map<String, String>> options) {

    public ConfigField {
      label = label == null ? name : label;
      type = type == null ? "string" : type;
      description = description == null ? "" : description;
      required = required == null ? Boolean.FALSE : required;
    }
  }

  // ---------------------------------------------------------------- actions

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"name", "description", "parameters", "returns", "logic", "tool_type"})
  public record ActionDefinition(
      @JsonProperty("name") String name,
      @JsonProperty("description") String description,
      @JsonProperty("parameters") @JsonAlias("params") Map<String, ParamSpec> parameters,
      @JsonProperty("returns") JsonNode returns,
      @JsonProperty("logic") List<LogicBlock> logic,
      @JsonProperty("tool_type") @JsonAlias("toolType") ToolType toolType) {

    public ActionDefinition {
      description = description == null ? "" : description;
      parameters = parameters == null
          ? Map.of()
          : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
      logic = listOrEmpty(logic);
      toolType = toolType == null ? ToolType.WRITE : toolType;
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ParamSpec(
      @JsonProperty("type") ValueType type,
      @JsonProperty("description") String description,
      @JsonProperty("required") Boolean required,
      @JsonProperty("default") JsonNode defaultValue,
      @JsonProperty("min_value") @JsonAlias("minValue") Double minValue,
      @JsonProperty("max_value") @JsonAlias("maxValue") Double maxValue,
      @JsonProperty("min_length") @JsonAlias("minLength") Integer minLength,
      @JsonProperty("max_length") @JsonAlias("maxLength") Integer maxLength,
      @JsonProperty("pattern") String pattern,
      @JsonProperty("enum") List<JsonNode> choices) {

    public ParamSpec {
      type = type == null ? ValueType.STRING : type;
      description = description == null ? "" : description;
      required = required == null ? Boolean.FALSE : required;
    }
  }

  // ---------------------------------------------------------------- logic blocks

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
  @JsonSubTypes({
    @JsonSubTypes.Type(value = ValidateBlock.class, name = "validate"),
    @JsonSubTypes.Type(value = UpdateBlock.class, name = "update"),
    @JsonSubTypes.Type(value = NotifyBlock.class, name = "notify"),
    @JsonSubTypes.Type(value = ReturnBlock.class, name = "return"),
    @JsonSubTypes.Type(value = ErrorBlock.class, name = "error"),
    @JsonSubTypes.Type(value = BranchBlock.class, name = "branch"),
    @JsonSubTypes.Type(value = LoopBlock.class, name = "loop")
  })
  public sealed interface LogicBlock
      permits ValidateBlock, UpdateBlock, NotifyBlock, ReturnBlock, ErrorBlock, BranchBlock, LoopBlock {}

  @JsonTypeName("validate")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ValidateBlock(
      @JsonProperty("condition") String condition,
      @JsonProperty("error_message") @JsonAlias("errorMessage") String errorMessage,
      @JsonProperty("error_code") @JsonAlias("errorCode") String errorCode) implements LogicBlock {

    public static final String DEFAULT_CODE = "VALIDATION_FAILED";

    public ValidateBlock {
      errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public String code() {
      return errorCode == null || errorCode.isEmpty() ? DEFAULT_CODE : errorCode;
    }
  }

  @JsonTypeName("update")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record UpdateBlock(
      @JsonProperty("target") String target,
      @JsonProperty("operation") UpdateOperation operation,
      @JsonProperty("value") JsonNode value) implements LogicBlock {

    public UpdateBlock {
      operation = operation == null ? UpdateOperation.SET : operation;
    }
  }

  @JsonTypeName("notify")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record NotifyBlock(
      @JsonProperty("to") String to,
      @JsonProperty("message") String message,
      @JsonProperty("data") JsonNode data) implements LogicBlock {

    public NotifyBlock {
      message = message == null ? "" : message;
    }
  }

  @JsonTypeName("return")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ReturnBlock(@JsonProperty("value") JsonNode value) implements LogicBlock {}

  @JsonTypeName("error")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ErrorBlock(
      @JsonProperty("message") String message,
      @JsonProperty("code") String code) implements LogicBlock {

    public static final String DEFAULT_CODE = "ACTION_ERROR";

    public ErrorBlock {
      message = message == null ? "" : message;
    }

    public String effectiveCode() {
      return code == null || code.isEmpty() ? DEFAULT_CODE : code;
    }
  }

  @JsonTypeName("branch")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record BranchBlock(
      @JsonProperty("condition") String condition,
      @JsonProperty("then") List<LogicBlock> thenBlocks,
      @JsonProperty("else") List<LogicBlock> elseBlocks) implements LogicBlock {

    public BranchBlock {
      thenBlocks = listOrEmpty(thenBlocks);
      elseBlocks = elseBlocks == null ? null : listOrEmpty(elseBlocks);
    }
  }

  @JsonTypeName("loop")
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record LoopBlock(
      @JsonProperty("collection") @JsonAlias("iterable") String collection,
      @JsonProperty("item") @JsonAlias("binding") String item,
      @JsonProperty("body") List<LogicBlock> body) implements LogicBlock {

    public LoopBlock {
      body = listOrEmpty(body);
    }
  }
}
