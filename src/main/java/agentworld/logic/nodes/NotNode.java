package agentworld.logic.nodes;

import agentworld.logic.runtime.Operators;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.frame.VirtualFrame;

public final class NotNode extends ExprNode {
  @Child private ExprNode operand;

  public NotNode(ExprNode operand) {
    this.operand = operand;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.NOT);
    return Operators.not(operand.execute(frame));
  }
}
