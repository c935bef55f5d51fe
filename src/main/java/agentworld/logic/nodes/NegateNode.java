package agentworld.logic.nodes;

import agentworld.logic.runtime.Operators;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.frame.VirtualFrame;

public final class NegateNode extends ExprNode {
  @Child private ExprNode operand;

  public NegateNode(ExprNode operand) {
    this.operand = operand;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.NEGATE);
    return Operators.negate(operand.execute(frame));
  }
}
