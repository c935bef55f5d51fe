package agentworld.logic.runtime;

import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Value.NullValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * 单次动作调用的可变上下文：状态工作副本、参数、调用者、配置、内置函数、
 * 循环绑定作用域、通知与安全计数器。每次调用新建，调用结束即丢弃。
 *
 * <p>作为 CallTarget 的唯一参数传入节点树。</p>
 */
public final class ExecutionContext {
  /** 表达式中的根名称。 */
  public static final Set<String> ROOT_NAMES = Set.of("params", "agent", "agents", "shared", "config");

  private final String appInstanceId;
  private final String agentId;
  private final MapValue params;
  private final AppState state;
  private final MapValue config;
  private final Builtins builtins;
  private final SafetyGovernor governor;
  private final List<Notification> notifications = new ArrayList<>();
  private Scope scope = new Scope();

  private ExecutionContext(Builder b) {
    this.appInstanceId = b.appInstanceId;
    this.agentId = b.agentId;
    this.params = b.params;
    this.state = b.state;
    this.config = b.config;
    this.builtins = b.builtins;
    this.governor = new SafetyGovernor(b.limits);
  }

  public static Builder builder() {
    return new Builder();
  }

  public String appInstanceId() { return appInstanceId; }

  public String agentId() { return agentId; }

  public MapValue params() { return params; }

  /** 工作副本，节点直接在其上修改。 */
  public AppState state() { return state; }

  public MapValue config() { return config; }

  public Builtins builtins() { return builtins; }

  public SafetyGovernor governor() { return governor; }

  public List<Notification> notifications() {
    return Collections.unmodifiableList(notifications);
  }

  public void notify(Notification notification) {
    notifications.add(notification);
  }

  // ---------------------------------------------------------------- scopes

  public Scope scope() { return scope; }

  /** 进入子作用域并返回它，调用方负责 {@link #popScope()}。 */
  public Scope pushScope() {
    scope = scope.createChild();
    return scope;
  }

  public void popScope() {
    if (scope.parent() != null) {
      scope = scope.parent();
    }
  }

  // ---------------------------------------------------------------- names

  /** 调用者的字段 map（工作副本中的实体，可写）。 */
  public MapValue agentFields() {
    return state.ensureAgent(agentId);
  }

  /** 根名称的值；不是根名称时返回 null。 */
  public Value root(String name) {
    switch (name) {
      case "params":
        return params;
      case "agent": {
        MapValue fields = state.perAgent().get(agentId);
        MapValue view = fields != null ? new MapValue(new LinkedHashMap<>(fields.entries())) : new MapValue();
        view.entries().put("id", Values.string(agentId));
        return view;
      }
      case "agents":
        return state.agentsView();
      case "shared":
        return state.shared();
      case "config":
        return config;
      default:
        return null;
    }
  }

  /**
   * 裸标识符解析：循环绑定 → 根名称 → 参数 → 调用者字段 → 共享字段 → Null。
   */
  public Value resolve(String name) {
    Value bound = scope.lookup(name);
    if (bound != null) {
      return bound;
    }
    Value root = root(name);
    if (root != null) {
      return root;
    }
    if (params.entries().containsKey(name)) {
      return params.entries().get(name);
    }
    MapValue fields = state.perAgent().get(agentId);
    if (fields != null && fields.entries().containsKey(name)) {
      return fields.entries().get(name);
    }
    if (state.shared().entries().containsKey(name)) {
      return state.shared().entries().get(name);
    }
    return NullValue.INSTANCE;
  }

  public static final class Builder {
    private String appInstanceId = "";
    private String agentId = "";
    private MapValue params = new MapValue();
    private AppState state = new AppState();
    private MapValue config = new MapValue();
    private Builtins builtins = Builtins.defaults();
    private SafetyLimits limits = SafetyLimits.DEFAULT;

    private Builder() {}

    public Builder appInstanceId(String id) { this.appInstanceId = id; return this; }
    public Builder agentId(String id) { this.agentId = id; return this; }
    public Builder params(MapValue params) { this.params = params; return this; }
    /** 传入的状态被直接使用，调用方需自行提供副本。 */
    public Builder state(AppState state) { this.state = state; return this; }
    public Builder config(MapValue config) { this.config = config; return this; }
    public Builder builtins(Builtins builtins) { this.builtins = builtins; return this; }
    public Builder limits(SafetyLimits limits) { this.limits = limits; return this; }

    public ExecutionContext build() {
      return new ExecutionContext(this);
    }
  }
}
