package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 标量字面量节点。list/map 字面量由 {@link ListLiteralNode}/{@link MapLiteralNode} 构造，
 * 每次求值得到新容器。
 */
public final class LiteralNode extends ExprNode {
  @CompilationFinal private final Value value;

  public LiteralNode(Value value) {
    this.value = value;
  }

  public Value value() {
    return value;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.LITERAL);
    return value;
  }

  @Override
  public String toString() { return "LiteralNode(" + value + ")"; }
}
