package agentworld.logic.runtime;

import java.util.Objects;

/**
 * 失败结果中的错误：机器可读的 code 加可读的 message。
 *
 * @param code 错误码，Validate/Error 块可自定义
 * @param message 面向 agent 的描述
 * @param category 错误分类
 */
public record ActionError(String code, String message, ErrorKind.Category category) {

  public ActionError {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(category, "category");
  }

  public static ActionError of(ErrorKind kind, String message) {
    return new ActionError(kind.name(), message, kind.category());
  }

  public static ActionError from(LogicException e) {
    return of(e.getKind(), e.getMessage());
  }
}
