package agentworld.logic.runtime;

/**
 * 求值错误：类型不匹配、除零、未知函数、写路径无法创建、非法参数。
 */
public final class EvaluationException extends LogicException {
  private static final long serialVersionUID = 1L;

  public EvaluationException(ErrorKind kind, String message) {
    super(kind, message);
  }

  public static EvaluationException typeMismatch(String message) {
    return new EvaluationException(ErrorKind.TYPE_MISMATCH, message);
  }

  public static EvaluationException invalidArgument(String message) {
    return new EvaluationException(ErrorKind.INVALID_ARGUMENT, message);
  }
}
