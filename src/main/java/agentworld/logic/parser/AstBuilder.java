package agentworld.logic.parser;

import agentworld.logic.runtime.Value.NullValue;
import agentworld.logic.runtime.Values;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;

/**
 * ANTLR 语法树 → {@link Expr}。偏移均换算为完整源文本中的位置。
 */
final class AstBuilder extends ExpressionBaseVisitor<Expr> {
  /** 语法树最大嵌套层数；括号每层约占两层。 */
  static final int MAX_DEPTH = 256;

  private final String source;
  private final int baseOffset;
  private int depth;

  AstBuilder(String source, int baseOffset) {
    this.source = source;
    this.baseOffset = baseOffset;
  }

  private int at(Token token) {
    return baseOffset + token.getStartIndex();
  }

  @Override
  public Expr visit(ParseTree tree) {
    if (++depth > MAX_DEPTH) {
      int offset = tree instanceof ParserRuleContext ctx ? at(ctx.getStart()) : baseOffset;
      throw new ParseException("expression is nested too deeply", source, offset);
    }
    try {
      return super.visit(tree);
    } finally {
      depth--;
    }
  }

  @Override
  public Expr visitRoot(ExpressionParser.RootContext ctx) {
    return visit(ctx.expr());
  }

  @Override
  public Expr visitPrimaryExpr(ExpressionParser.PrimaryExprContext ctx) {
    return visit(ctx.primary());
  }

  @Override
  public Expr visitMemberExpr(ExpressionParser.MemberExprContext ctx) {
    return new Expr.Member(visit(ctx.expr()), ctx.IDENT().getText(), at(ctx.DOT().getSymbol()));
  }

  @Override
  public Expr visitIndexExpr(ExpressionParser.IndexExprContext ctx) {
    return new Expr.Index(visit(ctx.expr(0)), visit(ctx.expr(1)), at(ctx.LBRACK().getSymbol()));
  }

  @Override
  public Expr visitUnaryExpr(ExpressionParser.UnaryExprContext ctx) {
    Expr.UnaryOp op = ctx.op.getType() == ExpressionParser.BANG ? Expr.UnaryOp.NOT : Expr.UnaryOp.NEGATE;
    return new Expr.Unary(op, visit(ctx.expr()), at(ctx.op));
  }

  @Override
  public Expr visitMultiplicativeExpr(ExpressionParser.MultiplicativeExprContext ctx) {
    Expr.BinaryOp op = ctx.op.getType() == ExpressionParser.STAR ? Expr.BinaryOp.MUL : Expr.BinaryOp.DIV;
    return binary(op, ctx.expr(0), ctx.expr(1), ctx.op);
  }

  @Override
  public Expr visitAdditiveExpr(ExpressionParser.AdditiveExprContext ctx) {
    Expr.BinaryOp op = ctx.op.getType() == ExpressionParser.PLUS ? Expr.BinaryOp.ADD : Expr.BinaryOp.SUB;
    return binary(op, ctx.expr(0), ctx.expr(1), ctx.op);
  }

  @Override
  public Expr visitComparisonExpr(ExpressionParser.ComparisonExprContext ctx) {
    Expr.BinaryOp op;
    switch (ctx.op.getType()) {
      case ExpressionParser.LT: op = Expr.BinaryOp.LT; break;
      case ExpressionParser.GT: op = Expr.BinaryOp.GT; break;
      case ExpressionParser.LE: op = Expr.BinaryOp.LE; break;
      default: op = Expr.BinaryOp.GE; break;
    }
    return binary(op, ctx.expr(0), ctx.expr(1), ctx.op);
  }

  @Override
  public Expr visitEqualityExpr(ExpressionParser.EqualityExprContext ctx) {
    Expr.BinaryOp op = ctx.op.getType() == ExpressionParser.EQ ? Expr.BinaryOp.EQ : Expr.BinaryOp.NE;
    return binary(op, ctx.expr(0), ctx.expr(1), ctx.op);
  }

  @Override
  public Expr visitAndExpr(ExpressionParser.AndExprContext ctx) {
    return binary(Expr.BinaryOp.AND, ctx.expr(0), ctx.expr(1), ctx.AND().getSymbol());
  }

  @Override
  public Expr visitOrExpr(ExpressionParser.OrExprContext ctx) {
    return binary(Expr.BinaryOp.OR, ctx.expr(0), ctx.expr(1), ctx.OR().getSymbol());
  }

  private Expr binary(Expr.BinaryOp op, ExpressionParser.ExprContext left, ExpressionParser.ExprContext right, Token opToken) {
    return new Expr.Binary(op, visit(left), visit(right), at(opToken));
  }

  // ---------------------------------------------------------------- primaries

  @Override
  public Expr visitNumberLiteral(ExpressionParser.NumberLiteralContext ctx) {
    Token t = ctx.NUMBER().getSymbol();
    return new Expr.Literal(Values.number(Double.parseDouble(t.getText())), at(t));
  }

  @Override
  public Expr visitStringLiteral(ExpressionParser.StringLiteralContext ctx) {
    Token t = ctx.STRING().getSymbol();
    return new Expr.Literal(Values.string(unquote(t.getText())), at(t));
  }

  @Override
  public Expr visitTemplateLiteral(ExpressionParser.TemplateLiteralContext ctx) {
    Token t = ctx.TEMPLATE().getSymbol();
    String raw = t.getText();
    String body = raw.substring(1, raw.length() - 1);
    return ExprParser.buildTemplate(body, source, at(t) + 1, true, at(t));
  }

  @Override
  public Expr visitBoolLiteral(ExpressionParser.BoolLiteralContext ctx) {
    return new Expr.Literal(Values.bool(ctx.value.getType() == ExpressionParser.TRUE), at(ctx.value));
  }

  @Override
  public Expr visitNullLiteral(ExpressionParser.NullLiteralContext ctx) {
    return new Expr.Literal(NullValue.INSTANCE, at(ctx.NULL().getSymbol()));
  }

  @Override
  public Expr visitCallExpr(ExpressionParser.CallExprContext ctx) {
    List<Expr> args = new ArrayList<>();
    if (ctx.arguments() != null) {
      for (ExpressionParser.ExprContext arg : ctx.arguments().expr()) {
        args.add(visit(arg));
      }
    }
    return new Expr.Call(ctx.IDENT().getText(), args, at(ctx.IDENT().getSymbol()));
  }

  @Override
  public Expr visitNameExpr(ExpressionParser.NameExprContext ctx) {
    return new Expr.Name(ctx.IDENT().getText(), at(ctx.IDENT().getSymbol()));
  }

  @Override
  public Expr visitParenExpr(ExpressionParser.ParenExprContext ctx) {
    return visit(ctx.expr());
  }

  @Override
  public Expr visitListLiteral(ExpressionParser.ListLiteralContext ctx) {
    List<Expr> items = new ArrayList<>();
    for (ExpressionParser.ExprContext item : ctx.expr()) {
      items.add(visit(item));
    }
    return new Expr.ListLiteral(items, at(ctx.LBRACK().getSymbol()));
  }

  @Override
  public Expr visitMapLiteral(ExpressionParser.MapLiteralContext ctx) {
    List<Expr.MapEntry> entries = new ArrayList<>();
    for (ExpressionParser.MapEntryContext entry : ctx.mapEntry()) {
      String key = entry.key.getType() == ExpressionParser.STRING
          ? unquote(entry.key.getText())
          : entry.key.getText();
      entries.add(new Expr.MapEntry(key, visit(entry.expr())));
    }
    return new Expr.MapLiteral(entries, at(ctx.LBRACE().getSymbol()));
  }

  /** 去掉引号并处理 \n \t \r \\ 及引号转义。 */
  static String unquote(String quoted) {
    String body = quoted.substring(1, quoted.length() - 1);
    if (body.indexOf('\\') < 0) {
      return body;
    }
    StringBuilder sb = new StringBuilder(body.length());
    for (int i = 0; i < body.length(); i++) {
      char c = body.charAt(i);
      if (c == '\\' && i + 1 < body.length()) {
        sb.append(TemplateSplitter.unescapeChar(body.charAt(++i)));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
