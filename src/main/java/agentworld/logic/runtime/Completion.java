package agentworld.logic.runtime;

/**
 * 语句执行的结果。Return、Error 与 Validate 失败都是普通数据，不使用异常控制流。
 */
public final class Completion {

  public enum Status { NORMAL, RETURNED, FAILED }

  public static final Completion NORMAL = new Completion(Status.NORMAL, Value.NullValue.INSTANCE, null);

  private final Status status;
  private final Value value;
  private final ActionError error;

  private Completion(Status status, Value value, ActionError error) {
    this.status = status;
    this.value = value;
    this.error = error;
  }

  public static Completion returned(Value value) {
    return new Completion(Status.RETURNED, value, null);
  }

  public static Completion failed(ActionError error) {
    return new Completion(Status.FAILED, Value.NullValue.INSTANCE, error);
  }

  public Status status() { return status; }

  public Value value() { return value; }

  /** 仅在 {@link Status#FAILED} 时非 null。 */
  public ActionError error() { return error; }

  public boolean isNormal() { return status == Status.NORMAL; }

  @Override
  public String toString() {
    switch (status) {
      case RETURNED: return "Completion[RETURNED " + value + "]";
      case FAILED: return "Completion[FAILED " + error.code() + "]";
      default: return "Completion[NORMAL]";
    }
  }
}
