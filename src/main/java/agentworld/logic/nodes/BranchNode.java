package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.SafetyGovernor;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 条件分支节点 - 条件只求值一次，恰好执行 then/else 之一；进入分支体计一层嵌套。
 */
public final class BranchNode extends StatementNode {
  @Child private ExprNode condition;
  @Child private BlockNode thenNode;
  @Child private BlockNode elseNode;

  /** @param elseNode 为 null 表示没有 else 分支 */
  public BranchNode(ExprNode condition, BlockNode thenNode, BlockNode elseNode) {
    this.condition = condition;
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.BRANCH);
    boolean cond = Values.asCondition(condition.execute(frame), "branch condition");
    if (LogicConfig.DEBUG) {
      System.err.println("DEBUG: branch condition=" + cond
          + ", elseNode=" + (elseNode != null ? "BlockNode" : "null"));
    }
    BlockNode target = cond ? thenNode : elseNode;
    if (target == null) {
      return Completion.NORMAL;
    }
    ExecutionContext ctx = context(frame);
    SafetyGovernor governor = ctx.governor();
    governor.enter();
    try {
      return target.execute(frame);
    } finally {
      governor.exit();
    }
  }
}
