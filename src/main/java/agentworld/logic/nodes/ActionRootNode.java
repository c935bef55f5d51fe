package agentworld.logic.nodes;

import agentworld.logic.runtime.ActionError;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ErrorKind;
import agentworld.logic.runtime.ErrorMessages;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.LogicException;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.RootNode;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 动作入口。执行逻辑块序列并把所有失败折叠为 {@link Completion}，调用方不会收到异常。
 */
public final class ActionRootNode extends RootNode {
  private static final Logger LOG = Logger.getLogger(ActionRootNode.class.getName());

  @Child private BlockNode body;
  private final String actionName;

  public ActionRootNode(String actionName, BlockNode body) {
    super(null);
    this.actionName = actionName;
    this.body = body;
  }

  /**
   * 参数 0 为 {@link agentworld.logic.runtime.ExecutionContext}。
   */
  @Override
  public Object execute(VirtualFrame frame) {
    if (LogicConfig.DEBUG) {
      System.err.println("DEBUG: action " + actionName + " start");
    }
    Profiler.inc(Profiler.Kind.ACTION);
    try {
      return body.execute(frame);
    } catch (LogicException e) {
      if (LogicConfig.DEBUG) {
        System.err.println("DEBUG: action " + actionName + " failed: " + e.getCode() + " " + e.getMessage());
      }
      return Completion.failed(ActionError.from(e));
    } catch (RuntimeException | StackOverflowError e) {
      LOG.log(Level.SEVERE, "unexpected failure in action '" + actionName + "'", e);
      return Completion.failed(ActionError.of(ErrorKind.INTERNAL_ERROR, ErrorMessages.internalError(e)));
    }
  }

  public String actionName() {
    return actionName;
  }

  @Override
  public String getName() {
    return actionName;
  }

  @Override
  public String toString() {
    return "action " + actionName;
  }
}
