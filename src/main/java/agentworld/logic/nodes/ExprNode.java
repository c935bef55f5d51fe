package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 表达式节点的抽象基类
 *
 * 求值失败时抛出 {@link agentworld.logic.runtime.EvaluationException}，由根节点转换为失败结果。
 */
public abstract class ExprNode extends LogicNode {

  /**
   * 执行此节点并返回结果
   *
   * @param frame 当前执行帧
   * @return 求值结果，不会是 Java null
   */
  public abstract Value execute(VirtualFrame frame);
}
