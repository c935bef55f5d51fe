package agentworld.logic;

import agentworld.logic.core.AppModel;
import agentworld.logic.core.DefinitionException;
import agentworld.logic.nodes.*;
import agentworld.logic.parser.Expr;
import agentworld.logic.parser.ExprParser;
import agentworld.logic.parser.ParseException;
import agentworld.logic.runtime.ExecutionContext;
import agentworld.logic.runtime.LogicConfig;
import agentworld.logic.runtime.Value;
import agentworld.logic.runtime.Values;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 把 AppDefinition 构建为节点树。
 *
 * <p>所有表达式在这里解析一次；名称引用、写入目标与循环绑定在构建时检查，
 * 出错位置形如 {@code actions[transfer].logic[1].condition}。</p>
 */
public final class Loader {
  private final AppModel.AppDefinition definition;
  private final Map<String, AppModel.StateField> stateFields = new LinkedHashMap<>();
  /** config_schema 字段名与 initial_config 键 */
  private final Set<String> configNames = new HashSet<>();

  /** 当前构建中的动作参数名 */
  private Set<String> paramNames = Set.of();

  public Loader(AppModel.AppDefinition definition) {
    this.definition = definition;
    for (AppModel.StateField f : definition.stateSchema()) {
      stateFields.put(f.name(), f);
    }
    for (AppModel.ConfigField f : definition.configSchema()) {
      configNames.add(f.name());
    }
    configNames.addAll(definition.initialConfig().keySet());
  }

  /** 为每个动作构建入口节点，保持声明顺序。 */
  public Map<String, ActionProgram> buildActions() {
    Map<String, ActionProgram> actions = new LinkedHashMap<>();
    for (AppModel.ActionDefinition action : definition.actions()) {
      actions.put(action.name(), buildAction(action));
    }
    return Collections.unmodifiableMap(actions);
  }

  ActionProgram buildAction(AppModel.ActionDefinition action) {
    this.paramNames = action.parameters().keySet();
    String loc = "actions[" + action.name() + "].logic";
    BlockNode body = buildBlocks(action.logic(), loc, Set.of());
    if (LogicConfig.DEBUG) {
      System.err.println("DEBUG: built action " + action.name() + " with " + body.size() + " block(s)");
    }
    return new ActionProgram(action, new ActionRootNode(action.name(), body));
  }

  /**
   * 不做引用检查地构建独立表达式，供 {@link Evaluator} 使用。
   */
  public static ExprNode buildExpression(Expr expr) {
    return toNode(expr);
  }

  // ---------------------------------------------------------------- blocks

  private BlockNode buildBlocks(List<AppModel.LogicBlock> blocks, String loc, Set<String> bindings) {
    List<StatementNode> statements = new ArrayList<>(blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      statements.add(buildBlock(blocks.get(i), loc + "[" + i + "]", bindings));
    }
    return new BlockNode(statements);
  }

  private StatementNode buildBlock(AppModel.LogicBlock block, String loc, Set<String> bindings) {
    if (block == null) {
      throw new DefinitionException(loc, "logic block is null");
    }
    if (block instanceof AppModel.ValidateBlock v) {
      return new ValidateNode(
          expression(require(v.condition(), loc, "condition"), loc + ".condition", bindings),
          template(v.errorMessage(), loc + ".error_message", bindings),
          v.code());
    }
    if (block instanceof AppModel.UpdateBlock u) {
      if (u.value() == null || u.value().isMissingNode()) {
        throw new DefinitionException(loc + ".value", "update value is required");
      }
      return new UpdateNode(
          target(require(u.target(), loc, "target"), loc + ".target", bindings),
          u.operation(),
          value(u.value(), loc + ".value", bindings));
    }
    if (block instanceof AppModel.NotifyBlock n) {
      ExprNode to = n.to() == null || n.to().isBlank() ? null : expression(n.to(), loc + ".to", bindings);
      ExprNode data = n.data() == null || n.data().isNull() ? null : value(n.data(), loc + ".data", bindings);
      return new NotifyNode(to, template(n.message(), loc + ".message", bindings), data);
    }
    if (block instanceof AppModel.ReturnBlock r) {
      ExprNode value = r.value() == null || r.value().isNull() ? null : value(r.value(), loc + ".value", bindings);
      return new ReturnNode(value);
    }
    if (block instanceof AppModel.ErrorBlock e) {
      return new ErrorNode(template(e.message(), loc + ".message", bindings), e.effectiveCode());
    }
    if (block instanceof AppModel.BranchBlock b) {
      ExprNode condition = expression(require(b.condition(), loc, "condition"), loc + ".condition", bindings);
      BlockNode thenNode = buildBlocks(b.thenBlocks(), loc + ".then", bindings);
      BlockNode elseNode = b.elseBlocks() == null ? null : buildBlocks(b.elseBlocks(), loc + ".else", bindings);
      return new BranchNode(condition, thenNode, elseNode);
    }
    if (block instanceof AppModel.LoopBlock l) {
      ExprNode collection = expression(require(l.collection(), loc, "collection"), loc + ".collection", bindings);
      String item = require(l.item(), loc, "item");
      if (!isIdentifier(item)) {
        throw new DefinitionException(loc + ".item", "loop binding '" + item + "' is not an identifier");
      }
      if (ExecutionContext.ROOT_NAMES.contains(item)) {
        throw new DefinitionException(loc + ".item", "loop binding '" + item + "' shadows a reserved root name");
      }
      Set<String> inner = new HashSet<>(bindings);
      inner.add(item);
      return new LoopNode(collection, item, buildBlocks(l.body(), loc + ".body", inner));
    }
    throw new DefinitionException(loc, "unsupported logic block " + block.getClass().getSimpleName());
  }

  private static String require(String value, String loc, String field) {
    if (value == null || value.isBlank()) {
      throw new DefinitionException(loc + "." + field, field + " is required");
    }
    return value;
  }

  // ---------------------------------------------------------------- expressions

  private ExprNode expression(String text, String loc, Set<String> bindings) {
    Expr expr;
    try {
      expr = ExprParser.parse(text);
    } catch (ParseException e) {
      throw e.at(loc);
    }
    checkReferences(expr, loc, bindings);
    return toNode(expr);
  }

  private TemplateNode template(String text, String loc, Set<String> bindings) {
    Expr expr;
    try {
      expr = ExprParser.parseTemplate(text);
    } catch (ParseException e) {
      throw e.at(loc);
    }
    checkReferences(expr, loc, bindings);
    return (TemplateNode) toNode(expr);
  }

  /**
   * 值字段：字符串是表达式，对象/数组递归构建，其余标量为字面量。
   */
  private ExprNode value(JsonNode node, String loc, Set<String> bindings) {
    if (node.isTextual()) {
      return expression(node.textValue(), loc, bindings);
    }
    if (node.isObject()) {
      List<String> keys = new ArrayList<>();
      List<ExprNode> values = new ArrayList<>();
      Iterator<Map.Entry<String, JsonNode>> it = node.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        keys.add(e.getKey());
        values.add(value(e.getValue(), loc + "." + e.getKey(), bindings));
      }
      return new MapLiteralNode(keys.toArray(new String[0]), values.toArray(new ExprNode[0]));
    }
    if (node.isArray()) {
      ExprNode[] items = new ExprNode[node.size()];
      for (int i = 0; i < node.size(); i++) {
        items[i] = value(node.get(i), loc + "[" + i + "]", bindings);
      }
      return new ListLiteralNode(items);
    }
    return new LiteralNode(Values.fromJson(node));
  }

  /**
   * 名称必须是根名称、动作参数、状态字段或作用域内的循环绑定；
   * 根名称后的第一个字段见 {@link #checkField}。
   */
  private void checkReferences(Expr expr, String loc, Set<String> bindings) {
    if (expr instanceof Expr.Name n) {
      String name = n.name();
      if (!bindings.contains(name) && !ExecutionContext.ROOT_NAMES.contains(name)
          && !paramNames.contains(name) && !stateFields.containsKey(name)) {
        throw new DefinitionException(loc, "unknown name '" + name + "' at offset " + n.offset());
      }
    } else if (expr instanceof Expr.Member m) {
      checkField(m.target(), m.name(), loc);
      checkReferences(m.target(), loc, bindings);
    } else if (expr instanceof Expr.Index i) {
      if (i.index() instanceof Expr.Literal l && l.value() instanceof Value.StringValue key) {
        checkField(i.target(), key.value(), loc);
      }
      checkReferences(i.target(), loc, bindings);
      checkReferences(i.index(), loc, bindings);
    } else if (expr instanceof Expr.Call c) {
      for (Expr arg : c.args()) {
        checkReferences(arg, loc, bindings);
      }
    } else if (expr instanceof Expr.Unary u) {
      checkReferences(u.operand(), loc, bindings);
    } else if (expr instanceof Expr.Binary b) {
      checkReferences(b.left(), loc, bindings);
      checkReferences(b.right(), loc, bindings);
    } else if (expr instanceof Expr.ListLiteral l) {
      for (Expr item : l.items()) {
        checkReferences(item, loc, bindings);
      }
    } else if (expr instanceof Expr.MapLiteral m) {
      for (Expr.MapEntry e : m.entries()) {
        checkReferences(e.value(), loc, bindings);
      }
    } else if (expr instanceof Expr.Template t) {
      for (Expr part : t.parts()) {
        checkReferences(part, loc, bindings);
      }
    }
  }

  /**
   * 根名称后的第一个字段：
   * <ul>
   *   <li>{@code params.x}：已声明参数</li>
   *   <li>{@code agent.x}：{@code id} 或 per_agent 状态字段</li>
   *   <li>{@code agents[..].x}：per_agent 状态字段</li>
   *   <li>{@code shared.x}：共享状态字段</li>
   *   <li>{@code config.x}：config_schema 或 initial_config 中的键</li>
   * </ul>
   * 更深的路径不检查。
   */
  private void checkField(Expr owner, String field, String loc) {
    if (owner instanceof Expr.Name root) {
      switch (root.name()) {
        case "params":
          if (!paramNames.contains(field)) {
            throw new DefinitionException(loc, "undeclared parameter 'params." + field + "'");
          }
          return;
        case "agent":
          if (!field.equals("id")) {
            requireStateField(field, true, "agent." + field, loc);
          }
          return;
        case "shared":
          requireStateField(field, false, "shared." + field, loc);
          return;
        case "config":
          if (!configNames.contains(field)) {
            throw new DefinitionException(loc, "undeclared config field 'config." + field + "'");
          }
          return;
        default:
          return;
      }
    }
    if (isAgentsEntry(owner)) {
      requireStateField(field, true, "agents[...]." + field, loc);
    }
  }

  /** {@code agents[expr]} 或 {@code agents.id} */
  private static boolean isAgentsEntry(Expr expr) {
    Expr target = expr instanceof Expr.Index i ? i.target()
        : expr instanceof Expr.Member m ? m.target()
        : null;
    return target instanceof Expr.Name n && n.name().equals("agents");
  }

  private void requireStateField(String field, boolean perAgent, String display, String loc) {
    AppModel.StateField declared = stateFields.get(field);
    if (declared == null) {
      throw new DefinitionException(loc, "unknown state field '" + display + "'");
    }
    if (Boolean.TRUE.equals(declared.perAgent()) != perAgent) {
      throw new DefinitionException(loc, "state field '" + field + "' is "
          + (perAgent ? "shared" : "per-agent") + " and cannot be used as '" + display + "'");
    }
  }

  // ---------------------------------------------------------------- targets

  /**
   * 写入目标按表达式语法解析，再拆成根与路径段：
   * {@code agent.F}、{@code agents[expr].F}、{@code agents.id.F}、{@code shared.F} 或已声明的状态字段名。
   */
  private WritePathNode target(String text, String loc, Set<String> bindings) {
    Expr expr;
    try {
      expr = ExprParser.parse(text);
    } catch (ParseException e) {
      throw e.at(loc);
    }
    List<Expr> segments = new ArrayList<>();
    Expr cursor = expr;
    while (!(cursor instanceof Expr.Name)) {
      if (cursor instanceof Expr.Member m) {
        segments.add(0, new Expr.Literal(Values.string(m.name()), m.offset()));
        cursor = m.target();
      } else if (cursor instanceof Expr.Index i) {
        checkReferences(i.index(), loc, bindings);
        segments.add(0, i.index());
        cursor = i.target();
      } else {
        throw new DefinitionException(loc, "invalid update target '" + text + "'");
      }
    }
    String root = ((Expr.Name) cursor).name();
    switch (root) {
      case "agent":
        requireField(segments, 1, text, loc);
        checkTargetField(segments.get(0), true, "agent.", loc);
        return writePath(WritePathNode.Root.AGENT, null, segments, text);
      case "agents": {
        requireField(segments, 2, text, loc);
        checkTargetField(segments.get(1), true, "agents[...].", loc);
        ExprNode agentId = toNode(segments.get(0));
        return writePath(WritePathNode.Root.AGENTS, agentId, segments.subList(1, segments.size()), text);
      }
      case "shared":
        requireField(segments, 1, text, loc);
        checkTargetField(segments.get(0), false, "shared.", loc);
        return writePath(WritePathNode.Root.SHARED, null, segments, text);
      default:
        break;
    }
    AppModel.StateField field = stateFields.get(root);
    if (field == null || bindings.contains(root)) {
      throw new DefinitionException(loc,
          "update target '" + text + "' must start with agent, agents[...], shared or a declared state field");
    }
    segments.add(0, new Expr.Literal(Values.string(root), cursor.offset()));
    WritePathNode.Root partition = Boolean.TRUE.equals(field.perAgent())
        ? WritePathNode.Root.AGENT
        : WritePathNode.Root.SHARED;
    return writePath(partition, null, segments, text);
  }

  /** 写入目标的第一个字段段是字符串常量时，必须是对应分区的状态字段；id 不可写。 */
  private void checkTargetField(Expr segment, boolean perAgent, String prefix, String loc) {
    if (segment instanceof Expr.Literal l && l.value() instanceof Value.StringValue key) {
      requireStateField(key.value(), perAgent, prefix + key.value(), loc);
    }
  }

  private static void requireField(List<Expr> segments, int min, String text, String loc) {
    if (segments.size() < min) {
      throw new DefinitionException(loc, "update target '" + text + "' does not name a field");
    }
  }

  private static WritePathNode writePath(WritePathNode.Root root, ExprNode agentId, List<Expr> segments, String text) {
    ExprNode[] nodes = new ExprNode[segments.size()];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = toNode(segments.get(i));
    }
    return new WritePathNode(root, agentId, nodes, text);
  }

  // ---------------------------------------------------------------- Expr -> Node

  private static ExprNode toNode(Expr expr) {
    if (expr instanceof Expr.Literal l) {
      return new LiteralNode(l.value());
    }
    if (expr instanceof Expr.Name n) {
      return new NameNode(n.name());
    }
    if (expr instanceof Expr.Member m) {
      return new MemberNode(toNode(m.target()), m.name());
    }
    if (expr instanceof Expr.Index i) {
      return new IndexNode(toNode(i.target()), toNode(i.index()));
    }
    if (expr instanceof Expr.Call c) {
      return new BuiltinCallNode(c.function(), toNodes(c.args()));
    }
    if (expr instanceof Expr.Unary u) {
      ExprNode operand = toNode(u.operand());
      return u.op() == Expr.UnaryOp.NOT ? new NotNode(operand) : new NegateNode(operand);
    }
    if (expr instanceof Expr.Binary b) {
      ExprNode left = toNode(b.left());
      ExprNode right = toNode(b.right());
      switch (b.op()) {
        case AND:
          return new AndNode(left, right);
        case OR:
          return new OrNode(left, right);
        case EQ:
          return new EqualityNode(false, left, right);
        case NE:
          return new EqualityNode(true, left, right);
        case LT:
        case GT:
        case LE:
        case GE:
          return new ComparisonNode(b.op(), left, right);
        default:
          return new ArithmeticNode(b.op(), left, right);
      }
    }
    if (expr instanceof Expr.ListLiteral l) {
      return new ListLiteralNode(toNodes(l.items()));
    }
    if (expr instanceof Expr.MapLiteral m) {
      String[] keys = new String[m.entries().size()];
      ExprNode[] values = new ExprNode[keys.length];
      for (int i = 0; i < keys.length; i++) {
        keys[i] = m.entries().get(i).key();
        values[i] = toNode(m.entries().get(i).value());
      }
      return new MapLiteralNode(keys, values);
    }
    if (expr instanceof Expr.Template t) {
      return new TemplateNode(toNodes(t.parts()));
    }
    throw new IllegalStateException("unsupported expression " + expr);
  }

  private static ExprNode[] toNodes(List<Expr> exprs) {
    ExprNode[] nodes = new ExprNode[exprs.size()];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = toNode(exprs.get(i));
    }
    return nodes;
  }

  private static boolean isIdentifier(String s) {
    if (s.isEmpty() || !(Character.isLetter(s.charAt(0)) || s.charAt(0) == '_')) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!(Character.isLetterOrDigit(c) || c == '_')) {
        return false;
      }
    }
    return true;
  }
}
