package agentworld.logic;

import agentworld.logic.core.AppModel;
import agentworld.logic.nodes.ActionRootNode;
import agentworld.logic.runtime.Completion;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.ParamBinder;
import com.oracle.truffle.api.RootCallTarget;

/**
 * 单个动作的已构建形态：参数绑定器加入口 CallTarget。不可变，可跨线程共享。
 */
public final class ActionProgram {
  private final AppModel.ActionDefinition definition;
  private final ParamBinder binder;
  private final RootCallTarget callTarget;

  ActionProgram(AppModel.ActionDefinition definition, ActionRootNode root) {
    this.definition = definition;
    this.binder = new ParamBinder(definition.parameters());
    this.callTarget = root.getCallTarget();
  }

  public String name() {
    return definition.name();
  }

  public AppModel.ActionDefinition definition() {
    return definition;
  }

  public ParamBinder binder() {
    return binder;
  }

  /**
   * 在给定上下文中执行逻辑块。上下文的状态就是工作副本，执行后可从中读取修改。
   */
  public Completion run(ExecutionContext ctx) {
    return (Completion) callTarget.call(ctx);
  }
}
