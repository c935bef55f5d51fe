package agentworld.logic.runtime;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import java.util.logging.Logger;

/**
 * 逻辑引擎运行时配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次，避免热路径中的 System.getenv 调用。
 * 使用 @CompilationFinal 标记，Truffle 可以将这些字段视为编译时常量进行优化。
 */
public final class LogicConfig {
  private static final Logger LOG = Logger.getLogger(LogicConfig.class.getName());

  private LogicConfig() {}

  /**
   * 调试模式开关
   * 环境变量：AGENTWORLD_LOGIC_DEBUG
   * 启用时会在各个执行节点打印调试信息
   */
  @CompilationFinal
  public static final boolean DEBUG = System.getenv("AGENTWORLD_LOGIC_DEBUG") != null;

  /**
   * 单次调用内所有循环体执行次数之和的上限
   * 环境变量：AGENTWORLD_LOGIC_MAX_LOOP_ITERATIONS
   */
  @CompilationFinal
  public static final int MAX_LOOP_ITERATIONS = getIntOrDefault("AGENTWORLD_LOGIC_MAX_LOOP_ITERATIONS", 1000);

  /**
   * Branch/Loop 嵌套深度上限
   * 环境变量：AGENTWORLD_LOGIC_MAX_NESTING_DEPTH
   */
  @CompilationFinal
  public static final int MAX_NESTING_DEPTH = getIntOrDefault("AGENTWORLD_LOGIC_MAX_NESTING_DEPTH", 10);

  /**
   * 状态序列化字节数上限，默认 1 MiB
   * 环境变量：AGENTWORLD_LOGIC_MAX_STATE_BYTES
   */
  @CompilationFinal
  public static final long MAX_STATE_BYTES = getIntOrDefault("AGENTWORLD_LOGIC_MAX_STATE_BYTES", 1_048_576);

  /**
   * 辅助方法：读取整数环境变量，非法或非正数时回退到默认值
   */
  private static int getIntOrDefault(String key, int defaultValue) {
    String value = System.getenv(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed > 0) {
        return parsed;
      }
      LOG.warning(key + " must be positive, using default " + defaultValue);
    } catch (NumberFormatException e) {
      LOG.warning(key + "=" + value + " is not an integer, using default " + defaultValue);
    }
    return defaultValue;
  }
}
