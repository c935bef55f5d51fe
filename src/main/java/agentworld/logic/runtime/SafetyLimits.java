package agentworld.logic.runtime;

/**
 * 单次调用的三项安全上限。
 *
 * @param maxLoopIterations 所有循环共享的循环体执行次数上限
 * @param maxNestingDepth Branch/Loop 体的嵌套深度上限
 * @param maxStateBytes 状态序列化后的字节数上限
 */
public record SafetyLimits(int maxLoopIterations, int maxNestingDepth, long maxStateBytes) {

  public static final SafetyLimits DEFAULT = new SafetyLimits(1000, 10, 1_048_576L);

  public SafetyLimits {
    if (maxLoopIterations <= 0 || maxNestingDepth <= 0 || maxStateBytes <= 0) {
      throw new IllegalArgumentException("safety limits must be positive");
    }
  }

  /** 从 {@link LogicConfig} 读取的环境变量配置。 */
  public static SafetyLimits fromEnvironment() {
    return new SafetyLimits(LogicConfig.MAX_LOOP_ITERATIONS, LogicConfig.MAX_NESTING_DEPTH, LogicConfig.MAX_STATE_BYTES);
  }

  public SafetyLimits withMaxStateBytes(long bytes) {
    return new SafetyLimits(maxLoopIterations, maxNestingDepth, bytes);
  }
}
