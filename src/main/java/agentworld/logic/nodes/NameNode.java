package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 标识符读取节点：循环绑定 → 根名称 → 参数 → 调用者字段 → 共享字段 → Null。
 */
public final class NameNode extends ExprNode {
  @CompilationFinal private final String name;

  public NameNode(String name) {
    this.name = name;
  }

  public String name() {
    return name;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.NAME);
    return context(frame).resolve(name);
  }

  @Override
  public String toString() { return "NameNode(" + name + ")"; }
}
