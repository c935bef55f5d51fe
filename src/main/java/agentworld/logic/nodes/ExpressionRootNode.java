package agentworld.logic.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.RootNode;

/**
 * 独立表达式入口，供 {@code Evaluator} 使用。求值失败以 LogicException 抛给调用方。
 */
public final class ExpressionRootNode extends RootNode {
  @Child private ExprNode body;

  public ExpressionRootNode(ExprNode body) {
    super(null);
    this.body = body;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    return body.execute(frame);
  }
}
