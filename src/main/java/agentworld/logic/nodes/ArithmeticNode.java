package agentworld.logic.nodes;

import agentworld.logic.parser.Expr.BinaryOp;
import agentworld.logic.runtime.Operators;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * {@code + - * /}。{@code +} 兼做字符串与 list 拼接，其余仅限数字。
 */
public final class ArithmeticNode extends ExprNode {
  @CompilationFinal private final BinaryOp op;
  @Child private ExprNode left;
  @Child private ExprNode right;

  public ArithmeticNode(BinaryOp op, ExprNode left, ExprNode right) {
    if (op != BinaryOp.ADD && op != BinaryOp.SUB && op != BinaryOp.MUL && op != BinaryOp.DIV) {
      throw new IllegalArgumentException("not an arithmetic operator: " + op);
    }
    this.op = op;
    this.left = left;
    this.right = right;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.ARITH);
    Value l = left.execute(frame);
    Value r = right.execute(frame);
    switch (op) {
      case ADD: return Operators.add(l, r);
      case SUB: return Operators.subtract(l, r);
      case MUL: return Operators.multiply(l, r);
      default: return Operators.divide(l, r);
    }
  }
}
