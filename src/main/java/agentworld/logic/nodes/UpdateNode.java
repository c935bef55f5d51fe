package agentworld.logic.nodes;

import agentworld.logic.core.UpdateOperation;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 状态写入：先求值，再写入工作副本，最后检查状态大小。
 */
public final class UpdateNode extends StatementNode {
  @Child private WritePathNode target;
  @CompilationFinal private final UpdateOperation operation;
  @Child private ExprNode value;

  public UpdateNode(WritePathNode target, UpdateOperation operation, ExprNode value) {
    this.target = target;
    this.operation = operation;
    this.value = value;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.UPDATE);
    Value operand = value.execute(frame);
    if (LogicConfig.DEBUG) {
      System.err.println("DEBUG: update " + target.text() + " " + operation.jsonName() + " " + operand.display());
    }
    target.apply(frame, operation, operand);
    ExecutionContext ctx = context(frame);
    ctx.governor().checkStateSize(ctx.state());
    return Completion.NORMAL;
  }
}
