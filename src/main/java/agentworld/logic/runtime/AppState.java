package agentworld.logic.runtime;

import agentworld.logic.runtime.Value.MapValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 应用实例状态：{@code shared} 分区与按 agent id 划分的 {@code per_agent} 分区。
 *
 * <p>JSON 形式为 {@code {"per_agent": {...}, "shared": {...}}}。实例可变，解释器只在
 * 自己的深拷贝上修改，宿主传入的对象不会被触碰。</p>
 */
public final class AppState {
  private final MapValue shared;
  private final Map<String, MapValue> perAgent;

  public AppState() {
    this(new MapValue(), new LinkedHashMap<>());
  }

  public AppState(MapValue shared, Map<String, MapValue> perAgent) {
    this.shared = shared;
    this.perAgent = perAgent;
  }

  public MapValue shared() {
    return shared;
  }

  /** 所有 agent 的字段 map（可变视图）。 */
  public Map<String, MapValue> perAgent() {
    return perAgent;
  }

  public Set<String> agentIds() {
    return Collections.unmodifiableSet(perAgent.keySet());
  }

  /** 返回 agent 的字段 map，不存在时创建空 map。 */
  public MapValue ensureAgent(String agentId) {
    return perAgent.computeIfAbsent(agentId, k -> new MapValue());
  }

  public boolean hasAgent(String agentId) {
    return perAgent.containsKey(agentId);
  }

  public AppState deepCopy() {
    Map<String, MapValue> copy = new LinkedHashMap<>();
    perAgent.forEach((id, fields) -> copy.put(id, fields.deepCopy()));
    return new AppState(shared.deepCopy(), copy);
  }

  /** 宽松读取共享字段，例如 {@code getShared("inventory.apples")}。 */
  public Value getShared(String path) {
    return ValuePath.parse(path).read(shared);
  }

  /** 宽松读取 agent 字段，agent 不存在时返回 Null。 */
  public Value getAgent(String agentId, String path) {
    MapValue fields = perAgent.get(agentId);
    if (fields == null) {
      return Value.NullValue.INSTANCE;
    }
    return ValuePath.parse(path).read(fields);
  }

  /** {@code agents} 根名称对应的值：agent id → 字段 map。 */
  public MapValue agentsView() {
    return new MapValue(new LinkedHashMap<>(perAgent));
  }

  // ---------------------------------------------------------------- JSON

  public JsonNode toJson() {
    ObjectNode root = Values.JSON.createObjectNode();
    ObjectNode agents = root.putObject("per_agent");
    perAgent.forEach((id, fields) -> agents.set(id, Values.toJson(fields)));
    root.set("shared", Values.toJson(shared));
    return root;
  }

  public String toJsonString() {
    try {
      return Values.JSON.writeValueAsString(toJson());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize app state", e);
    }
  }

  public static AppState fromJson(JsonNode node) {
    AppState state = new AppState();
    if (node == null || node.isNull()) {
      return state;
    }
    JsonNode shared = node.get("shared");
    if (shared != null && !shared.isNull()) {
      Value v = Values.fromJson(shared);
      if (!(v instanceof MapValue m)) {
        throw new IllegalArgumentException("'shared' must be an object");
      }
      state.shared.entries().putAll(m.entries());
    }
    JsonNode agents = node.get("per_agent");
    if (agents != null && !agents.isNull()) {
      if (!agents.isObject()) {
        throw new IllegalArgumentException("'per_agent' must be an object");
      }
      agents.fields().forEachRemaining(e -> {
        Value v = Values.fromJson(e.getValue());
        if (!(v instanceof MapValue m)) {
          throw new IllegalArgumentException("per_agent." + e.getKey() + " must be an object");
        }
        state.perAgent.put(e.getKey(), m);
      });
    }
    return state;
  }

  public static AppState fromJson(String json) {
    try {
      return fromJson(Values.JSON.readTree(json));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("invalid app state JSON: " + e.getOriginalMessage(), e);
    }
  }

  /** 序列化后的 UTF-8 字节数，用于状态大小上限检查。 */
  public long serializedSize() {
    return toJsonString().getBytes(StandardCharsets.UTF_8).length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof AppState other && shared.equals(other.shared) && perAgent.equals(other.perAgent);
  }

  @Override
  public int hashCode() {
    return 31 * shared.hashCode() + perAgent.hashCode();
  }

  @Override
  public String toString() {
    return toJsonString();
  }
}
