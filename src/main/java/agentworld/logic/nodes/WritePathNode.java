package agentworld.logic.nodes;

import agentworld.logic.core.UpdateOperation;
import agentworld.logic.runtime.ErrorMessages;
import agentworld.logic.runtime.EvaluationException;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.PathSegment;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.ValuePath;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.ArrayList;
import java.util.List;

/**
 * 已解析的写入目标：分区根加路径段。静态段是字符串字面量节点，动态段在写入时求值。
 */
public final class WritePathNode extends LogicNode {

  public enum Root {
    /** 调用者自身的字段 */
    AGENT,
    /** {@code agents[id]} 指定 agent 的字段 */
    AGENTS,
    SHARED
  }

  @CompilationFinal private final Root root;
  @Child private ExprNode agentId;
  @Children private final ExprNode[] segments;
  @CompilationFinal private final String text;

  /**
   * @param agentId 仅 {@link Root#AGENTS} 使用
   * @param text 目标原文，用于错误消息
   */
  public WritePathNode(Root root, ExprNode agentId, ExprNode[] segments, String text) {
    this.root = root;
    this.agentId = agentId;
    this.segments = segments;
    this.text = text;
  }

  public Root root() {
    return root;
  }

  public String text() {
    return text;
  }

  public void apply(VirtualFrame frame, UpdateOperation op, Value operand) {
    ExecutionContext ctx = context(frame);
    MapValue container = container(frame, ctx);
    path(frame).apply(container, op, operand);
  }

  private MapValue container(VirtualFrame frame, ExecutionContext ctx) {
    switch (root) {
      case AGENT:
        return ctx.agentFields();
      case AGENTS: {
        Value id = agentId.execute(frame);
        if (!(id instanceof Value.StringValue s)) {
          throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("agent id in '" + text + "'", "string", id));
        }
        return ctx.state().ensureAgent(s.value());
      }
      case SHARED:
        return ctx.state().shared();
      default:
        throw new IllegalStateException("unknown write root " + root);
    }
  }

  @ExplodeLoop
  private ValuePath path(VirtualFrame frame) {
    List<PathSegment> resolved = new ArrayList<>(segments.length);
    for (int i = 0; i < segments.length; i++) {
      resolved.add(PathSegment.of(segments[i].execute(frame)));
    }
    return ValuePath.of(resolved);
  }

  @Override
  public String toString() {
    return "WritePath(" + text + ")";
  }
}
