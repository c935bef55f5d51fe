package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 短路 {@code &&}：左侧为 false 时不求值右侧。
 */
public final class AndNode extends ExprNode {
  @Child private ExprNode left;
  @Child private ExprNode right;

  public AndNode(ExprNode left, ExprNode right) {
    this.left = left;
    this.right = right;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.AND);
    if (!Values.asCondition(left.execute(frame), "operator '&&'")) {
      return Values.bool(false);
    }
    return Values.bool(Values.asCondition(right.execute(frame), "operator '&&'"));
  }
}
