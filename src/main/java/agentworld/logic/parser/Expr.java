package agentworld.logic.parser;

import agentworld.logic.runtime.Value;
import java.util.List;

/**
 * 表达式语法树。与执行上下文无关，加载时解析一次，由 Loader 转换为节点树。
 *
 * <p>每个节点携带其在源文本中的起始偏移（从 0 开始）。</p>
 */
public sealed interface Expr
    permits Expr.Literal, Expr.Name, Expr.Member, Expr.Index, Expr.Call, Expr.Unary,
        Expr.Binary, Expr.ListLiteral, Expr.MapLiteral, Expr.Template {

  int offset();

  enum UnaryOp {
    NOT("!"), NEGATE("-");

    public final String symbol;

    UnaryOp(String symbol) { this.symbol = symbol; }
  }

  enum BinaryOp {
    MUL("*"), DIV("/"), ADD("+"), SUB("-"),
    LT("<"), GT(">"), LE("<="), GE(">="),
    EQ("=="), NE("!="),
    AND("&&"), OR("||");

    public final String symbol;

    BinaryOp(String symbol) { this.symbol = symbol; }
  }

  record Literal(Value value, int offset) implements Expr {}

  record Name(String name, int offset) implements Expr {}

  record Member(Expr target, String name, int offset) implements Expr {}

  record Index(Expr target, Expr index, int offset) implements Expr {}

  record Call(String function, List<Expr> args, int offset) implements Expr {
    public Call {
      args = List.copyOf(args);
    }
  }

  record Unary(UnaryOp op, Expr operand, int offset) implements Expr {}

  record Binary(BinaryOp op, Expr left, Expr right, int offset) implements Expr {}

  record ListLiteral(List<Expr> items, int offset) implements Expr {
    public ListLiteral {
      items = List.copyOf(items);
    }
  }

  record MapEntry(String key, Expr value) {}

  record MapLiteral(List<MapEntry> entries, int offset) implements Expr {
    public MapLiteral {
      entries = List.copyOf(entries);
    }
  }

  /** 插值模板：文本片段为字符串字面量，其余片段按显示形式拼接。 */
  record Template(List<Expr> parts, int offset) implements Expr {
    public Template {
      parts = List.copyOf(parts);
    }
  }
}
