package agentworld.logic.runtime;

/**
 * 单次调用的安全计数器。在可能越界的位置检查，越界立即抛出，绝不截断。
 */
public final class SafetyGovernor {
  private final SafetyLimits limits;
  private int loopIterations;
  private int depth;

  public SafetyGovernor(SafetyLimits limits) {
    this.limits = limits;
  }

  public SafetyLimits limits() {
    return limits;
  }

  /** 每次执行循环体前调用；第 max+1 次执行被拒绝。 */
  public void tickLoop() {
    if (loopIterations >= limits.maxLoopIterations()) {
      throw new SafetyLimitException(ErrorKind.LOOP_LIMIT_EXCEEDED,
          ErrorMessages.loopLimit(limits.maxLoopIterations()), limits.maxLoopIterations());
    }
    loopIterations++;
  }

  /** 进入 Branch/Loop 体。 */
  public void enter() {
    if (depth + 1 > limits.maxNestingDepth()) {
      throw new SafetyLimitException(ErrorKind.NESTING_LIMIT_EXCEEDED,
          ErrorMessages.nestingLimit(limits.maxNestingDepth()), limits.maxNestingDepth());
    }
    depth++;
  }

  public void exit() {
    depth--;
  }

  /** Update 之后检查状态大小。 */
  public void checkStateSize(AppState state) {
    long size = state.serializedSize();
    if (size > limits.maxStateBytes()) {
      throw new SafetyLimitException(ErrorKind.STATE_SIZE_EXCEEDED,
          ErrorMessages.stateSize(size, limits.maxStateBytes()), limits.maxStateBytes());
    }
  }

  public int loopIterations() {
    return loopIterations;
  }

  public int depth() {
    return depth;
  }
}
