package agentworld.logic.runtime;

/**
 * 调用期错误分类。{@link #name()} 即对外的机器可读错误码。
 */
public enum ErrorKind {
  TYPE_MISMATCH(Category.EVALUATION),
  DIVISION_BY_ZERO(Category.EVALUATION),
  UNKNOWN_FUNCTION(Category.EVALUATION),
  PATH_NOT_FOUND(Category.EVALUATION),
  INVALID_ARGUMENT(Category.EVALUATION),

  LOOP_LIMIT_EXCEEDED(Category.SAFETY),
  NESTING_LIMIT_EXCEEDED(Category.SAFETY),
  STATE_SIZE_EXCEEDED(Category.SAFETY),

  VALIDATION_FAILED(Category.VALIDATION),
  ACTION_ERROR(Category.VALIDATION),

  UNKNOWN_ACTION(Category.INVOCATION),
  INVALID_PARAMS(Category.INVOCATION),
  ACCESS_DENIED(Category.INVOCATION),
  INTERNAL_ERROR(Category.INVOCATION);

  public enum Category {
    /** 表达式求值或状态写入失败 */
    EVALUATION,
    /** 安全上限触发 */
    SAFETY,
    /** Validate/Error 块触发，属于正常的业务结果 */
    VALIDATION,
    /** 调用入口校验失败（动作、参数、权限）或内部错误 */
    INVOCATION
  }

  private final Category category;

  ErrorKind(Category category) {
    this.category = category;
  }

  public Category category() {
    return category;
  }
}
