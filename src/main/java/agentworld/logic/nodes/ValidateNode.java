package agentworld.logic.nodes;

import agentworld.logic.runtime.ActionError;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorKind;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 条件为 false 时以配置的错误码和插值消息终止调用，等同于内联的 Error 块。
 */
public final class ValidateNode extends StatementNode {
  @Child private ExprNode condition;
  @Child private TemplateNode message;
  @CompilationFinal private final String code;

  public ValidateNode(ExprNode condition, TemplateNode message, String code) {
    this.condition = condition;
    this.message = message;
    this.code = code;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.VALIDATE);
    if (Values.asCondition(condition.execute(frame), "validate condition")) {
      return Completion.NORMAL;
    }
    return Completion.failed(new ActionError(code, message.render(frame), ErrorKind.Category.VALIDATION));
  }
}
