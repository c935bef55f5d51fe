package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.LogicConfig;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * 语句块节点 - 按声明顺序执行子语句，遇到第一个非正常完成立即向外传播。
 */
public final class BlockNode extends StatementNode {
  @Children private final StatementNode[] statements;

  public BlockNode(java.util.List<StatementNode> statements) {
    this.statements = statements.toArray(new StatementNode[0]);
  }

  public int size() {
    return statements.length;
  }

  @Override
  @ExplodeLoop
  public Completion execute(VirtualFrame frame) {
    if (LogicConfig.DEBUG) {
      System.err.println("DEBUG: block size=" + statements.length);
    }
    for (int i = 0; i < statements.length; i++) {
      StatementNode stmt = statements[i];
      if (LogicConfig.DEBUG) {
        System.err.println("DEBUG: stmt[" + i + "]=" + stmt.getClass().getSimpleName());
      }
      Completion c = stmt.execute(frame);
      if (!c.isNormal()) {
        return c;
      }
    }
    return Completion.NORMAL;
  }
}
