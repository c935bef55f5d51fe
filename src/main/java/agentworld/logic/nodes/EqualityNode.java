package agentworld.logic.nodes;

import agentworld.logic.runtime.Operators;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * {@code == !=}：结构相等，任意两值均可比较。
 */
public final class EqualityNode extends ExprNode {
  @CompilationFinal private final boolean negated;
  @Child private ExprNode left;
  @Child private ExprNode right;

  public EqualityNode(boolean negated, ExprNode left, ExprNode right) {
    this.negated = negated;
    this.left = left;
    this.right = right;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.EQUALITY);
    boolean eq = Operators.equal(left.execute(frame), right.execute(frame));
    return Values.bool(eq != negated);
  }
}
