package agentworld.logic.runtime;

/**
 * 路径中的一段：map 键或 list 下标。
 */
public sealed interface PathSegment permits PathSegment.Key, PathSegment.Index {

  record Key(String name) implements PathSegment {
    @Override
    public String toString() {
      return "." + name;
    }
  }

  record Index(int position) implements PathSegment {
    @Override
    public String toString() {
      return "[" + position + "]";
    }
  }

  static PathSegment key(String name) {
    return new Key(name);
  }

  static PathSegment index(int position) {
    return new Index(position);
  }

  /**
   * 动态段：字符串作为键，整数作为下标。
   */
  static PathSegment of(Value value) {
    if (value instanceof Value.StringValue s) {
      return new Key(s.value());
    }
    if (value instanceof Value.NumberValue n && n.isIntegral()) {
      return new Index((int) n.value());
    }
    throw EvaluationException.typeMismatch(
        ErrorMessages.typeExpected("path segment", "string or integral number", value));
  }
}
