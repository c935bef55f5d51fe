package agentworld.logic.nodes;

import agentworld.logic.runtime.ActionError;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorKind;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

public final class ErrorNode extends StatementNode {
  @Child private TemplateNode message;
  @CompilationFinal private final String code;

  public ErrorNode(TemplateNode message, String code) {
    this.message = message;
    this.code = code;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.ERROR);
    return Completion.failed(new ActionError(code, message.render(frame), ErrorKind.Category.VALIDATION));
  }
}
