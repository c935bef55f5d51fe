package agentworld.logic.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * 将 ANTLR 的词法/语法错误转换为 {@link ParseException}，不向控制台输出。
 */
final class ThrowingErrorListener extends BaseErrorListener {
  private final String text;
  private final String source;
  private final int baseOffset;

  /**
   * @param text 实际交给词法分析器的文本
   * @param source 完整的表达式源文本（模板内嵌表达式时为外层文本）
   * @param baseOffset text 在 source 中的起始位置
   */
  ThrowingErrorListener(String text, String source, int baseOffset) {
    this.text = text;
    this.source = source;
    this.baseOffset = baseOffset;
  }

  @Override
  public void syntaxError(
      Recognizer<?, ?> recognizer,
      Object offendingSymbol,
      int line,
      int charPositionInLine,
      String msg,
      RecognitionException e) {
    int offset;
    if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0) {
      offset = token.getStartIndex();
    } else if (e instanceof LexerNoViableAltException lex) {
      offset = lex.getStartIndex();
    } else {
      offset = offsetOf(line, charPositionInLine);
    }
    throw new ParseException(msg, source, baseOffset + offset);
  }

  private int offsetOf(int line, int column) {
    int offset = 0;
    int currentLine = 1;
    while (currentLine < line && offset < text.length()) {
      if (text.charAt(offset) == '\n') {
        currentLine++;
      }
      offset++;
    }
    return Math.min(offset + column, text.length());
  }
}
