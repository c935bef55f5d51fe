package agentworld.logic.runtime;

import java.util.Collection;

/**
 * 错误消息统一生成工具。
 *
 * <p>消息面向调用动作的 agent，使用英文并附带恢复提示。测试依赖消息中的关键字，
 * 修改措辞时保持首句不变。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 为消息附加恢复提示。
   *
   * @param message 主体消息
   * @param hint 提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hint) {
    return message + " (hint: " + hint + ")";
  }

  public static String divisionByZero() {
    return withHint("division by zero", "check the divisor and ensure it is non-zero");
  }

  /**
   * 二元运算符两侧类型不支持。
   */
  public static String operandTypes(String operator, Value left, Value right) {
    return withHint(
        "operator '" + operator + "' not supported for " + left.typeName() + " and " + right.typeName(),
        "values are never converted implicitly; use num() or str()");
  }

  /**
   * 运算或语句期望特定类型。
   */
  public static String typeExpected(String where, String expected, Value actual) {
    return where + " expects " + expected + ", got " + actual.typeName();
  }

  public static String unknownFunction(String name) {
    return withHint("unknown function '" + name + "'", "only registered builtin functions can be called");
  }

  public static String arity(String function, String expected, int actual) {
    return "function '" + function + "' expects " + expected + " argument(s), got " + actual;
  }

  public static String memberOnScalar(String member, Value target) {
    return "cannot read member '" + member + "' of " + target.typeName();
  }

  public static String badIndex(Value target, Value index) {
    return withHint(
        "cannot index " + target.typeName() + " with " + index.typeName(),
        "lists take integral numbers, maps take strings");
  }

  public static String pathNotFound(String path, String reason) {
    return "path '" + path + "' not found: " + reason;
  }

  public static String pathThroughScalar(String path, Value scalar) {
    return "path '" + path + "' traverses a " + scalar.typeName();
  }

  public static String loopLimit(long limit) {
    return withHint("loop iteration limit of " + limit + " exceeded",
        "reduce the size of the iterated collection");
  }

  public static String nestingLimit(int limit) {
    return withHint("block nesting depth limit of " + limit + " exceeded",
        "flatten nested branch/loop blocks");
  }

  public static String stateSize(long size, long limit) {
    return withHint("state size " + size + " bytes exceeds limit of " + limit + " bytes",
        "remove data from the app state before adding more");
  }

  public static String unknownAction(String action, Collection<String> available) {
    return withHint("unknown action '" + action + "'", "available actions: " + String.join(", ", available));
  }

  public static String accessDenied(String appId, String role) {
    return "role '" + role + "' may not access app '" + appId + "'";
  }

  public static String internalError(Throwable t) {
    return "internal error: " + t.getClass().getSimpleName()
        + (t.getMessage() != null ? ": " + t.getMessage() : "");
  }
}
