package agentworld.logic;

import agentworld.logic.runtime.ActionError;
import agentworld.logic.runtime.AppState;
import agentworld.logic.runtime.Notification;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 一次动作调用的结果。
 *
 * <p>成功时携带返回值、按顺序收集的通知与新状态；失败时只有错误，
 * 工作副本与通知一并丢弃。</p>
 */
public final class ActionResult {

  public enum Outcome {
    /** 执行到 Return 块 */
    RETURNED,
    /** 所有块执行完毕，没有 Return */
    EXHAUSTED,
    ERRORED
  }

  private final Outcome outcome;
  private final Value value;
  private final ActionError error;
  private final List<Notification> notifications;
  private final AppState newState;

  private ActionResult(Outcome outcome, Value value, ActionError error,
                       List<Notification> notifications, AppState newState) {
    this.outcome = outcome;
    this.value = value;
    this.error = error;
    this.notifications = notifications;
    this.newState = newState;
  }

  static ActionResult success(Outcome outcome, Value value, List<Notification> notifications, AppState newState) {
    return new ActionResult(outcome, value, null, List.copyOf(notifications), newState);
  }

  static ActionResult failure(ActionError error) {
    return new ActionResult(Outcome.ERRORED, Value.NullValue.INSTANCE, error, List.of(), null);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Outcome outcome() {
    return outcome;
  }

  public Value value() {
    return value;
  }

  public Optional<ActionError> error() {
    return Optional.ofNullable(error);
  }

  public List<Notification> notifications() {
    return notifications;
  }

  /** 仅成功时存在。 */
  public Optional<AppState> newState() {
    return Optional.ofNullable(newState);
  }

  public JsonNode toJson() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("success", isSuccess());
    node.put("outcome", outcome.name().toLowerCase(Locale.ROOT));
    node.set("value", Values.toJson(value));
    if (error != null) {
      ObjectNode err = node.putObject("error");
      err.put("code", error.code());
      err.put("message", error.message());
    }
    ArrayNode list = node.putArray("notifications");
    for (Notification n : notifications) {
      ObjectNode item = list.addObject();
      if (n.isBroadcast()) {
        item.putNull("to");
      } else {
        item.put("to", n.target());
      }
      item.put("message", n.message());
      item.set("data", Values.toJson(n.data()));
    }
    if (newState != null) {
      node.set("new_state", newState.toJson());
    }
    return node;
  }

  @Override
  public String toString() {
    return isSuccess()
        ? "ActionResult{" + outcome + ", value=" + value.display() + "}"
        : "ActionResult{" + error.code() + ": " + error.message() + "}";
  }
}
