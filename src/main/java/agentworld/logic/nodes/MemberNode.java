package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * {@code target.name} 读取，缺失键或 null 目标得到 Null。
 */
public final class MemberNode extends ExprNode {
  @Child private ExprNode target;
  @CompilationFinal private final String member;

  public MemberNode(ExprNode target, String member) {
    this.target = target;
    this.member = member;
  }

  @Override
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.MEMBER);
    return Values.readMember(target.execute(frame), member);
  }
}
