package agentworld.logic;

import agentworld.logic.nodes.ExpressionRootNode;
import agentworld.logic.parser.ExprParser;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.Value;

/**
 * 在给定上下文中求值独立表达式或模板。
 *
 * <p>与动作执行不同，求值错误以 {@link agentworld.logic.runtime.LogicException} 抛出，
 * 语法错误以 {@link agentworld.logic.parser.ParseException} 抛出。</p>
 */
public final class Evaluator {

  private Evaluator() {}

  public static Value evaluate(String expression, ExecutionContext ctx) {
    ExpressionRootNode root = new ExpressionRootNode(Loader.buildExpression(ExprParser.parse(expression)));
    return (Value) root.getCallTarget().call(ctx);
  }

  /** 模板插值，返回拼接后的文本。 */
  public static String interpolate(String template, ExecutionContext ctx) {
    ExpressionRootNode root = new ExpressionRootNode(Loader.buildExpression(ExprParser.parseTemplate(template)));
    return ((Value) root.getCallTarget().call(ctx)).display();
  }
}
