package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 短路 {@code ||}：左侧为 true 时不求值右侧。
 */
public final class OrNode extends ExprNode {
  @Child private ExprNode left;
  @Child private ExprNode right;

  public OrNode(ExprNode left, ExprNode right) {
    this.left = left;
    this.right = right;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.OR);
    if (Values.asCondition(left.execute(frame), "operator '||'")) {
      return Values.bool(true);
    }
    return Values.bool(Values.asCondition(right.execute(frame), "operator '||'"));
  }
}
