package agentworld.logic.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * 将模板文本切分为文本片段与 {@code ${...}} 表达式片段。
 *
 * <p>占位符内部允许嵌套花括号（map 字面量）和带引号的字符串。</p>
 */
final class TemplateSplitter {

  record Segment(boolean expression, String text, int offset) {}

  private TemplateSplitter() {}

  /**
   * @param text 模板正文（不含反引号）
   * @param source 报错时使用的完整源文本
   * @param baseOffset text 在 source 中的起始位置
   * @param unescape 文本片段是否处理反斜杠转义（反引号模板为 true，消息字段为 false）
   */
  static List<Segment> split(String text, String source, int baseOffset, boolean unescape) {
    List<Segment> segments = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int literalStart = 0;
    int i = 0;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (unescape && c == '\\' && i + 1 < text.length()) {
        literal.append(unescapeChar(text.charAt(i + 1)));
        i += 2;
        continue;
      }
      if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
        int close = findClose(text, i + 2);
        if (close < 0) {
          throw new ParseException("unterminated interpolation '${'", source, baseOffset + i);
        }
        if (literal.length() > 0) {
          segments.add(new Segment(false, literal.toString(), baseOffset + literalStart));
          literal.setLength(0);
        }
        String inner = text.substring(i + 2, close);
        if (inner.isBlank()) {
          throw new ParseException("empty interpolation '${}'", source, baseOffset + i);
        }
        segments.add(new Segment(true, inner, baseOffset + i + 2));
        i = close + 1;
        literalStart = i;
        continue;
      }
      literal.append(c);
      i++;
    }
    if (literal.length() > 0) {
      segments.add(new Segment(false, literal.toString(), baseOffset + literalStart));
    }
    return segments;
  }

  private static int findClose(String text, int from) {
    int depth = 0;
    char quote = 0;
    for (int i = from; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quote = 0;
        }
        continue;
      }
      if (c == '"' || c == '\'') {
        quote = c;
      } else if (c == '{') {
        depth++;
      } else if (c == '}') {
        if (depth == 0) {
          return i;
        }
        depth--;
      }
    }
    return -1;
  }

  static char unescapeChar(char c) {
    switch (c) {
      case 'n': return '\n';
      case 't': return '\t';
      case 'r': return '\r';
      default: return c;
    }
  }
}
