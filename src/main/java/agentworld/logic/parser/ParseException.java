package agentworld.logic.parser;

/**
 * 表达式语法错误，携带出错 token 的字符偏移。
 *
 * <p>加载阶段抛出；{@link #at(String)} 为异常补充定义中的位置（例如
 * {@code actions[transfer].logic[0].condition}）。</p>
 */
public final class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String detail;
  private final String source;
  private final int offset;
  private final String location;

  public ParseException(String detail, String source, int offset) {
    this(detail, source, offset, null, null);
  }

  ParseException(String detail, String source, int offset, Throwable cause) {
    this(detail, source, offset, null, cause);
  }

  private ParseException(String detail, String source, int offset, String location, Throwable cause) {
    super(format(detail, offset, location), cause);
    this.detail = detail;
    this.source = source;
    this.offset = offset;
    this.location = location;
  }

  /** 出错 token 在源文本中的起始偏移（从 0 开始）。 */
  public int getOffset() { return offset; }

  public String getDetail() { return detail; }

  public String getSource() { return source; }

  public String getLocation() { return location; }

  /** 返回带有定义位置的新异常，原异常作为 cause。 */
  public ParseException at(String location) {
    return new ParseException(detail, source, offset, location, this);
  }

  private static String format(String detail, int offset, String location) {
    String base = detail + " at offset " + offset;
    return location == null ? base : base + " (" + location + ")";
  }
}
