package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.ArrayList;
import java.util.List;

/**
 * 内置函数调用。函数在求值时从调用上下文携带的注册表中按名称解析，
 * 未注册的名称报 UNKNOWN_FUNCTION。
 */
public final class BuiltinCallNode extends ExprNode {
  @CompilationFinal private final String builtinName;
  @Children private final ExprNode[] argNodes;

  public BuiltinCallNode(String builtinName, ExprNode[] argNodes) {
    this.builtinName = builtinName;
    this.argNodes = argNodes;
  }

  @Override
  @ExplodeLoop
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.BUILTIN_CALL);
    List<Value> args = new ArrayList<>(argNodes.length);
    for (int i = 0; i < argNodes.length; i++) {
      args.add(argNodes[i].execute(frame));
    }
    return context(frame).builtins().call(builtinName, args);
  }

  @Override
  public String toString() { return "BuiltinCallNode(" + builtinName + ")"; }
}
