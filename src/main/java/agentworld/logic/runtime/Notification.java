package agentworld.logic.runtime;

import java.util.Optional;

/**
 * Notify 块产生的通知，按调用内的产生顺序返回，投递由宿主负责。
 *
 * @param target 目标 agent id；为 null 表示广播
 * @param message 插值后的消息
 * @param data 附带数据，没有时为 Null
 */
public record Notification(String target, String message, Value data) {

  public static Notification broadcast(String message, Value data) {
    return new Notification(null, message, data);
  }

  public static Notification to(String agentId, String message, Value data) {
    return new Notification(agentId, message, data);
  }

  public boolean isBroadcast() {
    return target == null;
  }

  public Optional<String> targetAgent() {
    return Optional.ofNullable(target);
  }
}
