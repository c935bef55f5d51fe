package agentworld.logic.runtime;

/**
 * 调用期异常基类。节点树内部抛出，由 ActionRootNode 转换为失败结果，
 * 不会越过调用边界。
 */
public class LogicException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  public LogicException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public LogicException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getCode() {
    return kind.name();
  }
}
