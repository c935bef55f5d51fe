package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorMessages;
import agentworld.logic.runtime.EvaluationException;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.SafetyGovernor;
import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import java.util.List;

/**
 * 有界循环：集合只求值一次并取快照；每次执行循环体消耗一次全调用共享的循环额度，
 * 循环体计一层嵌套，绑定变量位于每次迭代新建的子作用域。
 */
public final class LoopNode extends StatementNode {
  @Child private ExprNode collection;
  @CompilationFinal private final String binding;
  @Child private BlockNode body;

  public LoopNode(ExprNode collection, String binding, BlockNode body) {
    this.collection = collection;
    this.binding = binding;
    this.body = body;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.LOOP);
    Value iterable = collection.execute(frame);
    if (!(iterable instanceof Value.ListValue list)) {
      throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("loop collection", "list", iterable));
    }
    List<Value> snapshot = list.deepCopy().items();
    if (snapshot.isEmpty()) {
      return Completion.NORMAL;
    }
    ExecutionContext ctx = context(frame);
    SafetyGovernor governor = ctx.governor();
    governor.enter();
    try {
      for (Value item : snapshot) {
        governor.tickLoop();
        if (LogicConfig.DEBUG) {
          System.err.println("DEBUG: loop " + binding + " iteration=" + governor.loopIterations());
        }
        ctx.pushScope().bind(binding, item);
        try {
          Completion c = body.execute(frame);
          if (!c.isNormal()) {
            return c;
          }
        } finally {
          ctx.popScope();
        }
      }
      return Completion.NORMAL;
    } finally {
      governor.exit();
    }
  }
}
