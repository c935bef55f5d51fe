package agentworld.logic.parser;

import agentworld.logic.runtime.Values;
import java.util.ArrayList;
import java.util.List;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;

/**
 * 表达式解析入口。结果与执行上下文无关，可缓存复用。
 */
public final class ExprParser {

  private ExprParser() {}

  /**
   * 解析一个完整表达式。
   *
   * @throws ParseException 语法错误，携带出错 token 的偏移
   */
  public static Expr parse(String source) {
    if (source == null || source.isBlank()) {
      throw new ParseException("empty expression", source == null ? "" : source, 0);
    }
    return parse(source, source, 0);
  }

  /**
   * 解析消息模板：普通文本加 {@code ${expr}} 占位符，不处理反斜杠转义。
   */
  public static Expr parseTemplate(String template) {
    String text = template == null ? "" : template;
    return buildTemplate(text, text, 0, false, 0);
  }

  static Expr parse(String text, String source, int baseOffset) {
    ThrowingErrorListener listener = new ThrowingErrorListener(text, source, baseOffset);
    ExpressionLexer lexer = new ExpressionLexer(CharStreams.fromString(text));
    lexer.removeErrorListeners();
    lexer.addErrorListener(listener);
    ExpressionParser parser = new ExpressionParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(listener);
    try {
      ExpressionParser.RootContext root = parser.root();
      return new AstBuilder(source, baseOffset).visit(root);
    } catch (StackOverflowError e) {
      // 生成的解析器对括号、一元运算符递归下降
      throw new ParseException("expression is nested too deeply", source, baseOffset, e);
    }
  }

  static Expr buildTemplate(String body, String source, int bodyOffset, boolean unescape, int templateOffset) {
    List<Expr> parts = new ArrayList<>();
    for (TemplateSplitter.Segment seg : TemplateSplitter.split(body, source, bodyOffset, unescape)) {
      if (seg.expression()) {
        parts.add(parse(seg.text(), source, seg.offset()));
      } else {
        parts.add(new Expr.Literal(Values.string(seg.text()), seg.offset()));
      }
    }
    return new Expr.Template(parts, templateOffset);
  }
}
