package agentworld.logic.runtime;

import java.util.HashMap;
import java.util.Map;

/**
 * 循环绑定作用域。读取可向父作用域回溯，每次循环迭代创建新的子作用域。
 */
public final class Scope {
  private final Scope parent;
  private final Map<String, Value> vars = new HashMap<>();

  public Scope() {
    this(null);
  }

  private Scope(Scope parent) {
    this.parent = parent;
  }

  public Scope createChild() { return new Scope(this); }

  public Scope parent() { return parent; }

  /** 未绑定时返回 null（Java null，而非 Null 值）。 */
  public Value lookup(String name) {
    Value v = vars.get(name);
    if (v != null) {
      return v;
    }
    return parent != null ? parent.lookup(name) : null;
  }

  public void bind(String name, Value value) {
    vars.put(name, value);
  }

  public boolean contains(String name) {
    if (vars.containsKey(name)) return true;
    return parent != null && parent.contains(name);
  }
}
