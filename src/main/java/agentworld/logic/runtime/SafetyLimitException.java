package agentworld.logic.runtime;

/**
 * 安全上限触发（循环次数、嵌套深度、状态大小），终止整个调用。
 */
public final class SafetyLimitException extends LogicException {
  private static final long serialVersionUID = 1L;

  private final long limit;

  public SafetyLimitException(ErrorKind kind, String message, long limit) {
    super(kind, message);
    this.limit = limit;
  }

  public long getLimit() {
    return limit;
  }
}
