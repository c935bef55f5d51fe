package agentworld.logic.runtime;

import agentworld.logic.core.UpdateOperation;
import agentworld.logic.runtime.Value.ListValue;
import agentworld.logic.runtime.Value.MapValue;
import agentworld.logic.runtime.Value.NullValue;
import agentworld.logic.runtime.Value.NumberValue;
import java.util.ArrayList;
import java.util.List;

/**
 * 点号/方括号路径，例如 {@code balances.alice}、{@code items[0].price}。
 *
 * <p>读取宽松：缺失键、越界下标、null 父节点均返回 Null。写入严格：缺失的中间
 * map 会被创建，但穿过标量、对 list 使用键、对 map 使用下标、list 下标越界都会失败。</p>
 */
public final class ValuePath {
  private final List<PathSegment> segments;

  private ValuePath(List<PathSegment> segments) {
    this.segments = List.copyOf(segments);
  }

  public static ValuePath of(List<PathSegment> segments) {
    return new ValuePath(segments);
  }

  /**
   * 解析静态路径。方括号内只接受非负整数或带引号的键。
   */
  public static ValuePath parse(String path) {
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("empty path");
    }
    List<PathSegment> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int i = 0;
    while (i < path.length()) {
      char c = path.charAt(i);
      if (c == '.') {
        if (current.length() > 0 || i == 0 || path.charAt(i - 1) != ']') {
          flush(current, segments, path);
        }
        i++;
      } else if (c == '[') {
        if (current.length() > 0) {
          flush(current, segments, path);
        }
        int close = path.indexOf(']', i);
        if (close < 0) {
          throw new IllegalArgumentException("unclosed '[' in path: " + path);
        }
        segments.add(bracketSegment(path.substring(i + 1, close).trim(), path));
        i = close + 1;
      } else {
        current.append(c);
        i++;
      }
    }
    if (current.length() > 0) {
      flush(current, segments, path);
    }
    return new ValuePath(segments);
  }

  private static void flush(StringBuilder current, List<PathSegment> segments, String path) {
    if (current.length() == 0) {
      throw new IllegalArgumentException("empty segment in path: " + path);
    }
    segments.add(PathSegment.key(current.toString()));
    current.setLength(0);
  }

  private static PathSegment bracketSegment(String inner, String path) {
    if (inner.length() >= 2 && (inner.startsWith("\"") || inner.startsWith("'"))) {
      return PathSegment.key(inner.substring(1, inner.length() - 1));
    }
    try {
      int index = Integer.parseInt(inner);
      if (index < 0) {
        throw new IllegalArgumentException("negative index in path: " + path);
      }
      return PathSegment.index(index);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid index '" + inner + "' in path: " + path, e);
    }
  }

  public List<PathSegment> segments() {
    return segments;
  }

  public boolean isEmpty() {
    return segments.isEmpty();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    for (PathSegment seg : segments) {
      sb.append(seg);
    }
    return sb.length() > 0 && sb.charAt(0) == '.' ? sb.substring(1) : sb.toString();
  }

  // ---------------------------------------------------------------- read

  /** 宽松读取。 */
  public Value read(Value root) {
    Value current = root;
    for (PathSegment seg : segments) {
      if (current instanceof NullValue) {
        return current;
      }
      if (seg instanceof PathSegment.Key key) {
        current = Values.readMember(current, key.name());
      } else {
        current = Values.readIndex(current, Values.number(((PathSegment.Index) seg).position()));
      }
    }
    return current;
  }

  // ---------------------------------------------------------------- write

  /**
   * 在 root 上执行写操作，原地修改。
   *
   * @param root 写入的起点（状态分区或 agent 的字段 map）
   * @param op 写操作
   * @param operand 操作数，写入前深拷贝
   */
  public void apply(MapValue root, UpdateOperation op, Value operand) {
    if (segments.isEmpty()) {
      throw new EvaluationException(ErrorKind.PATH_NOT_FOUND, ErrorMessages.pathNotFound("", "empty path"));
    }
    Value container = root;
    for (int i = 0; i < segments.size() - 1; i++) {
      container = descend(container, segments.get(i), i);
    }
    PathSegment last = segments.get(segments.size() - 1);
    Value current = get(container, last);
    store(container, last, compute(op, current, operand));
  }

  private Value descend(Value container, PathSegment seg, int depth) {
    Value child = get(container, seg);
    if (child instanceof MapValue || child instanceof ListValue) {
      return child;
    }
    if (child instanceof NullValue) {
      MapValue created = new MapValue();
      store(container, seg, created);
      return created;
    }
    throw EvaluationException.typeMismatch(ErrorMessages.pathThroughScalar(prefix(depth + 1), child));
  }

  private Value get(Value container, PathSegment seg) {
    if (container instanceof MapValue m && seg instanceof PathSegment.Key key) {
      return m.get(key.name());
    }
    if (container instanceof ListValue l && seg instanceof PathSegment.Index idx) {
      if (idx.position() < 0 || idx.position() >= l.items().size()) {
        throw new EvaluationException(ErrorKind.PATH_NOT_FOUND,
            ErrorMessages.pathNotFound(toString(), "index " + idx.position() + " out of range (size=" + l.items().size() + ")"));
      }
      return l.items().get(idx.position());
    }
    throw EvaluationException.typeMismatch(
        ErrorMessages.pathNotFound(toString(), "cannot address " + container.typeName() + " with " + describe(seg)));
  }

  private void store(Value container, PathSegment seg, Value value) {
    if (container instanceof MapValue m && seg instanceof PathSegment.Key key) {
      m.entries().put(key.name(), value);
    } else if (container instanceof ListValue l && seg instanceof PathSegment.Index idx) {
      l.items().set(idx.position(), value);
    } else {
      throw EvaluationException.typeMismatch(
          ErrorMessages.pathNotFound(toString(), "cannot address " + container.typeName() + " with " + describe(seg)));
    }
  }

  private static String describe(PathSegment seg) {
    return seg instanceof PathSegment.Key ? "a key" : "an index";
  }

  private String prefix(int count) {
    return ValuePath.of(segments.subList(0, count)).toString();
  }

  static Value compute(UpdateOperation op, Value current, Value operand) {
    switch (op) {
      case SET:
        return operand.deepCopy();
      case INCREMENT:
        return Values.number(numeric(op, current) + numericOperand(op, operand));
      case DECREMENT:
        return Values.number(numeric(op, current) - numericOperand(op, operand));
      case APPEND: {
        if (current instanceof NullValue) {
          return Values.list(operand.deepCopy());
        }
        if (current instanceof ListValue l) {
          l.items().add(operand.deepCopy());
          return l;
        }
        throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("append", "list", current));
      }
      case REMOVE: {
        if (current instanceof ListValue l) {
          l.items().remove(operand);
          return l;
        }
        throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("remove", "list", current));
      }
      case MERGE: {
        if (!(operand instanceof MapValue incoming)) {
          throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("merge operand", "map", operand));
        }
        if (current instanceof NullValue) {
          return incoming.deepCopy();
        }
        if (current instanceof MapValue m) {
          incoming.entries().forEach((k, v) -> m.entries().put(k, v.deepCopy()));
          return m;
        }
        throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("merge", "map", current));
      }
      default:
        throw new IllegalStateException("unhandled operation " + op);
    }
  }

  private static double numeric(UpdateOperation op, Value current) {
    if (current instanceof NullValue) {
      return 0.0;
    }
    if (current instanceof NumberValue n) {
      return n.value();
    }
    throw EvaluationException.typeMismatch(ErrorMessages.typeExpected(op.jsonName() + " target", "number", current));
  }

  private static double numericOperand(UpdateOperation op, Value operand) {
    if (operand instanceof NumberValue n) {
      return n.value();
    }
    throw EvaluationException.typeMismatch(ErrorMessages.typeExpected(op.jsonName() + " operand", "number", operand));
  }
}
