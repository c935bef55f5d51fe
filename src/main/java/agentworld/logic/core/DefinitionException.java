package agentworld.logic.core;

/**
 * 定义加载错误：JSON 结构、约束或引用无法解析。加载失败的应用不会运行任何动作。
 */
public final class DefinitionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String location;

  public DefinitionException(String location, String message) {
    super(location == null || location.isEmpty() ? message : location + ": " + message);
    this.location = location;
  }

  public DefinitionException(String location, String message, Throwable cause) {
    super(location == null || location.isEmpty() ? message : location + ": " + message, cause);
    this.location = location;
  }

  /** 出错位置，例如 {@code actions[transfer].logic[1].target}。 */
  public String getLocation() {
    return location;
  }
}
