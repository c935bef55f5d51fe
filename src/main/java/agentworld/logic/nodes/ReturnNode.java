package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 以结果值结束调用。返回值深拷贝，与新状态互不共享容器。
 */
public final class ReturnNode extends StatementNode {
  @Child private ExprNode value;

  /** @param value 为 null 时返回 Null */
  public ReturnNode(ExprNode value) {
    this.value = value;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.RETURN);
    Value v = value != null ? value.execute(frame).deepCopy() : Value.NullValue.INSTANCE;
    return Completion.returned(v);
  }

  @Override public String toString() { return "ReturnNode"; }
}
