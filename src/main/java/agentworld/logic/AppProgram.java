package agentworld.logic;

import agentworld.logic.core.AppModel;
import agentworld.logic.runtime.ActionError;
import agentworld.logic.runtime.AppState;
import agentworld.logic.runtime.Builtins;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorKind;
import agentworld.logic.runtime.ErrorMessages;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.LogicException;
import agentworld.logic.runtime.SafetyLimits;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Values;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 已加载的应用：动作节点树、内置函数表、安全上限与合并后的配置。
 *
 * <p>实例不可变，可在线程间共享；每次 {@link #execute} 在传入状态的深拷贝上运行。
 * 调用契约是完整的：任何失败都以 {@link ActionResult} 返回，不会抛给调用方。</p>
 */
public final class AppProgram {
  private static final Logger LOG = Logger.getLogger(AppProgram.class.getName());

  /** 未指定角色时的默认角色 */
  public static final String DEFAULT_ROLE = "peer";

  private final AppModel.AppDefinition definition;
  private final Map<String, ActionProgram> actions;
  private final Builtins builtins;
  private final SafetyLimits limits;
  private final MapValue config;

  AppProgram(AppModel.AppDefinition definition, Map<String, ActionProgram> actions,
             Builtins builtins, SafetyLimits limits, MapValue config) {
    this.definition = definition;
    this.actions = actions;
    this.builtins = builtins;
    this.limits = limits;
    this.config = config;
  }

  public AppModel.AppDefinition definition() {
    return definition;
  }

  public String appId() {
    return definition.appId();
  }

  public Optional<ActionProgram> action(String name) {
    return Optional.ofNullable(actions.get(name));
  }

  public Collection<ActionProgram> actions() {
    return actions.values();
  }

  /** 合并后的配置，返回副本。 */
  public MapValue config() {
    return config.deepCopy();
  }

  public SafetyLimits limits() {
    return limits;
  }

  public boolean canAccess(String role, Collection<String> roleTags) {
    return definition.canAccess(role == null ? DEFAULT_ROLE : role, roleTags);
  }

  /**
   * 以默认角色执行动作。
   *
   * @param currentState 当前状态，不会被修改；null 视为空状态
   */
  public ActionResult execute(String appInstanceId, String agentId, String actionName,
                              Map<String, Value> params, AppState currentState) {
    return execute(appInstanceId, agentId, actionName, params, currentState, DEFAULT_ROLE, List.of());
  }

  /**
   * 执行动作。失败时 newState 为空，通知被丢弃。
   */
  public ActionResult execute(String appInstanceId, String agentId, String actionName,
                              Map<String, Value> params, AppState currentState,
                              String role, Collection<String> roleTags) {
    try {
      ActionProgram action = actions.get(actionName);
      if (action == null) {
        return ActionResult.failure(ActionError.of(ErrorKind.UNKNOWN_ACTION,
            ErrorMessages.unknownAction(actionName, actions.keySet())));
      }
      if (!canAccess(role, roleTags)) {
        return ActionResult.failure(ActionError.of(ErrorKind.ACCESS_DENIED,
            ErrorMessages.accessDenied(definition.appId(), role == null ? DEFAULT_ROLE : role)));
      }
      MapValue bound = action.binder().bind(params);
      AppState working = currentState == null ? new AppState() : currentState.deepCopy();
      seedAgent(working, agentId);

      ExecutionContext ctx = ExecutionContext.builder()
          .appInstanceId(appInstanceId)
          .agentId(agentId)
          .params(bound)
          .state(working)
          .config(config.deepCopy())
          .builtins(builtins)
          .limits(limits)
          .build();
      Completion completion = action.run(ctx);
      if (LogicConfig.DEBUG) {
        System.err.println("DEBUG: " + definition.appId() + "." + actionName + " -> " + completion);
      }
      switch (completion.status()) {
        case RETURNED:
          return ActionResult.success(ActionResult.Outcome.RETURNED, completion.value(), ctx.notifications(), working);
        case NORMAL:
          return ActionResult.success(ActionResult.Outcome.EXHAUSTED, Value.NullValue.INSTANCE, ctx.notifications(), working);
        default:
          LOG.fine(() -> definition.appId() + "." + actionName + " failed: " + completion.error().code());
          return ActionResult.failure(completion.error());
      }
    } catch (LogicException e) {
      return ActionResult.failure(ActionError.from(e));
    } catch (RuntimeException e) {
      LOG.log(Level.SEVERE, "unexpected failure executing " + definition.appId() + "." + actionName, e);
      return ActionResult.failure(ActionError.of(ErrorKind.INTERNAL_ERROR, ErrorMessages.internalError(e)));
    }
  }

  /**
   * 按状态模式构建初始状态：共享字段一份，每个 agent 一份 per_agent 字段。
   * 与字段同名的配置项覆盖默认值。
   */
  public AppState initialState(Collection<String> agentIds, Map<String, Value> configOverrides) {
    MapValue merged = mergeConfig(config, configOverrides);
    AppState state = new AppState();
    for (AppModel.StateField field : definition.stateSchema()) {
      if (!Boolean.TRUE.equals(field.perAgent())) {
        state.shared().entries().put(field.name(), initialValue(field, merged));
      }
    }
    for (String agentId : agentIds) {
      MapValue fields = state.ensureAgent(agentId);
      for (AppModel.StateField field : definition.stateSchema()) {
        if (Boolean.TRUE.equals(field.perAgent())) {
          fields.entries().put(field.name(), initialValue(field, merged));
        }
      }
    }
    LOG.fine(() -> "initialized state for " + definition.appId() + " with " + agentIds.size() + " agent(s)");
    return state;
  }

  /** 返回使用合并配置的新程序，节点树共享。 */
  public AppProgram withConfig(Map<String, Value> overrides) {
    return new AppProgram(definition, actions, builtins, limits, mergeConfig(config, overrides));
  }

  // ---------------------------------------------------------------- helpers

  /** 调用者在工作副本中没有的 per_agent 字段按模式默认值补齐。 */
  private void seedAgent(AppState working, String agentId) {
    MapValue fields = null;
    for (AppModel.StateField field : definition.stateSchema()) {
      if (!Boolean.TRUE.equals(field.perAgent())) {
        continue;
      }
      if (fields == null) {
        fields = working.ensureAgent(agentId);
      }
      if (!fields.entries().containsKey(field.name())) {
        fields.entries().put(field.name(), defaultOf(field));
      }
    }
  }

  private static Value initialValue(AppModel.StateField field, MapValue config) {
    Value override = config.entries().get(field.name());
    return override != null ? override.deepCopy() : defaultOf(field);
  }

  private static Value defaultOf(AppModel.StateField field) {
    JsonNode d = field.defaultValue();
    return d == null || d.isNull() ? field.type().defaultValue() : Values.fromJson(d);
  }

  /** schema 默认值 → initial_config → 覆盖项。 */
  static MapValue baseConfig(AppModel.AppDefinition definition) {
    MapValue config = new MapValue();
    for (AppModel.ConfigField field : definition.configSchema()) {
      if (field.defaultValue() != null && !field.defaultValue().isNull()) {
        config.entries().put(field.name(), Values.fromJson(field.defaultValue()));
      }
    }
    definition.initialConfig().forEach((k, v) -> config.entries().put(k, Values.fromJson(v)));
    return config;
  }

  private static MapValue mergeConfig(MapValue base, Map<String, Value> overrides) {
    MapValue merged = new MapValue(new LinkedHashMap<>(base.deepCopy().entries()));
    if (overrides != null) {
      overrides.forEach((k, v) -> merged.entries().put(k, v == null ? Value.NullValue.INSTANCE : v.deepCopy()));
    }
    return merged;
  }
}
