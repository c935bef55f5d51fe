package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * {@code target[index]} 读取：list 用整数下标，map 用字符串键。
 */
public final class IndexNode extends ExprNode {
  @Child private ExprNode target;
  @Child private ExprNode index;

  public IndexNode(ExprNode target, ExprNode index) {
    this.target = target;
    this.index = index;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.INDEX);
    Value container = target.execute(frame);
    return Values.readIndex(container, index.execute(frame));
  }
}
