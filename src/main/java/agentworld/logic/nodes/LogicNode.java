package agentworld.logic.nodes;

import agentworld.logic.runtime.ExecutionContext;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.Node;

/**
 * 所有逻辑节点的基类。调用上下文是 CallTarget 的唯一参数。
 */
public abstract class LogicNode extends Node {

  protected static ExecutionContext context(VirtualFrame frame) {
    return (ExecutionContext) frame.getArguments()[0];
  }
}
