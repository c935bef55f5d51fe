package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;

/**
 * 插值模板：按顺序拼接各片段的显示形式。
 */
public final class TemplateNode extends ExprNode {
  @Children private final ExprNode[] parts;

  public TemplateNode(ExprNode[] parts) {
    this.parts = parts;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.TEMPLATE);
    return Values.string(render(frame));
  }

  @ExplodeLoop
  public String render(VirtualFrame frame) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      sb.append(parts[i].execute(frame).display());
    }
    return sb.toString();
  }
}
