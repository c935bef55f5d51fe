package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 逻辑块节点的抽象基类。Return、Error 与 Validate 失败以 {@link Completion} 返回。
 */
public abstract class StatementNode extends LogicNode {

  public abstract Completion execute(VirtualFrame frame);
}
