package agentworld.logic.nodes;

import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorMessages;
import agentworld.logic.runtime.EvaluationException;
import agentworld.logic.runtime.Notification;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Value.MapValue;
import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 记录一条通知。没有接收者表达式时为广播；data 不是 map 时包装为 {@code {"value": data}}。
 */
public final class NotifyNode extends StatementNode {
  @Child private ExprNode to;
  @Child private TemplateNode message;
  @Child private ExprNode data;

  public NotifyNode(ExprNode to, TemplateNode message, ExprNode data) {
    this.to = to;
    this.message = message;
    this.data = data;
  }

  @Override
  public Completion execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.NOTIFY);
    String target = null;
    if (to != null) {
      Value recipient = to.execute(frame);
      if (!(recipient instanceof Value.StringValue s)) {
        throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("notify recipient", "string", recipient));
      }
      target = s.value();
    }
    String text = message.render(frame);
    MapValue payload;
    if (data == null) {
      payload = new MapValue();
    } else {
      Value v = data.execute(frame).deepCopy();
      if (v instanceof MapValue m) {
        payload = m;
      } else {
        payload = new MapValue();
        payload.entries().put("value", v);
      }
    }
    context(frame).notify(new Notification(target, text, payload));
    return Completion.NORMAL;
  }
}
