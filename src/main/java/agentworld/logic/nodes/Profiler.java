package agentworld.logic.nodes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * 节点执行计数器，按 {@link Kind} 计数。系统属性 {@code agentworld.profiler.enabled=true} 时启用，
 * 关闭时 {@link #inc(Kind)} 不做任何事。
 */
public final class Profiler {

  /** 被计数的节点种类；{@link #label()} 是输出中的键。 */
  public enum Kind {
    // 语句
    /** 动作入口，每次调用一次 */
    ACTION("action", true),
    VALIDATE("validate", true),
    UPDATE("update", true),
    NOTIFY("notify", true),
    RETURN("return", true),
    ERROR("error", true),
    BRANCH("branch", true),
    /** 每次执行循环块计一次，不按迭代 */
    LOOP("loop", true),

    // 表达式
    LITERAL("literal", false),
    NAME("name", false),
    MEMBER("member", false),
    INDEX("index", false),
    /** 内置函数调用，含未知函数 */
    BUILTIN_CALL("builtin_call", false),
    NOT("not", false),
    NEGATE("negate", false),
    AND("and", false),
    OR("or", false),
    EQUALITY("equality", false),
    COMPARE("compare", false),
    /** + - * / */
    ARITH("arith", false),
    LIST_LITERAL("list_literal", false),
    MAP_LITERAL("map_literal", false),
    TEMPLATE("template", false);

    private final String label;
    private final boolean statement;

    Kind(String label, boolean statement) {
      this.label = label;
      this.statement = statement;
    }

    public String label() { return label; }

    public boolean isStatement() { return statement; }
  }

  /** 全部种类之和的键 */
  public static final String TOTAL = "total";

  private static final Kind[] KINDS = Kind.values();
  private static final AtomicLongArray COUNTS = new AtomicLongArray(KINDS.length);
  private static final AtomicLong TOTAL_COUNT = new AtomicLong();
  private static final boolean ENABLED = Boolean.getBoolean("agentworld.profiler.enabled");

  private Profiler() {}

  public static boolean isEnabled() {
    return ENABLED;
  }

  public static void inc(Kind kind) {
    if (!ENABLED) {
      return;
    }
    COUNTS.incrementAndGet(kind.ordinal());
    TOTAL_COUNT.incrementAndGet();
  }

  public static long count(Kind kind) {
    return COUNTS.get(kind.ordinal());
  }

  public static long total() {
    return TOTAL_COUNT.get();
  }

  /**
   * 非零计数，语句在前、表达式在后，最后是 {@value #TOTAL}。
   */
  public static String dump() {
    StringBuilder sb = new StringBuilder("Logic profile (counts):\n");
    appendSection(sb, "statements", true);
    appendSection(sb, "expressions", false);
    sb.append(TOTAL).append(": ").append(total()).append('\n');
    return sb.toString();
  }

  private static void appendSection(StringBuilder sb, String title, boolean statements) {
    StringBuilder section = new StringBuilder();
    for (Kind kind : KINDS) {
      long n = count(kind);
      if (kind.isStatement() == statements && n > 0) {
        section.append("  ").append(kind.label()).append(": ").append(n).append('\n');
      }
    }
    if (section.length() > 0) {
      sb.append(title).append('\n').append(section);
    }
  }

  /**
   * 非零计数的快照，键为 {@link Kind#label()}，按声明顺序；有计数时附带 {@value #TOTAL}。
   */
  public static Map<String, Long> getCounters() {
    Map<String, Long> snapshot = new LinkedHashMap<>();
    for (Kind kind : KINDS) {
      long n = count(kind);
      if (n > 0) {
        snapshot.put(kind.label(), n);
      }
    }
    if (!snapshot.isEmpty()) {
      snapshot.put(TOTAL, total());
    }
    return snapshot;
  }

  /** 测试隔离用。 */
  public static void reset() {
    for (int i = 0; i < KINDS.length; i++) {
      COUNTS.set(i, 0);
    }
    TOTAL_COUNT.set(0);
  }
}
