package agentworld.logic.nodes;

import agentworld.logic.parser.Expr.BinaryOp;
import agentworld.logic.runtime.Operators;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * {@code < > <= >=}：两侧同为数字或同为字符串。
 */
public final class ComparisonNode extends ExprNode {
  @CompilationFinal private final BinaryOp op;
  @Child private ExprNode left;
  @Child private ExprNode right;

  public ComparisonNode(BinaryOp op, ExprNode left, ExprNode right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.COMPARE);
    int c = Operators.compare(op.symbol, left.execute(frame), right.execute(frame));
    switch (op) {
      case LT: return Values.bool(c < 0);
      case GT: return Values.bool(c > 0);
      case LE: return Values.bool(c <= 0);
      case GE: return Values.bool(c >= 0);
      default: throw new IllegalStateException("not a comparison operator: " + op);
    }
  }
}
