package agentworld.logic.runtime;

import agentworld.logic.runtime.Value.ListValue;
import agentworld.logic.runtime.Value.NumberValue;
import agentworld.logic.runtime.Value.StringValue;
import java.util.ArrayList;
import java.util.List;

/**
 * 运算符语义。除 {@code +} 的字符串拼接外不做任何隐式转换。
 */
public final class Operators {

  private Operators() {}

  public static Value add(Value left, Value right) {
    if (left instanceof NumberValue a && right instanceof NumberValue b) {
      return Values.number(a.value() + b.value());
    }
    if (left instanceof StringValue || right instanceof StringValue) {
      return Values.string(left.display() + right.display());
    }
    if (left instanceof ListValue a && right instanceof ListValue b) {
      List<Value> items = new ArrayList<>(a.items().size() + b.items().size());
      for (Value v : a.items()) {
        items.add(v.deepCopy());
      }
      for (Value v : b.items()) {
        items.add(v.deepCopy());
      }
      return new ListValue(items);
    }
    throw EvaluationException.typeMismatch(ErrorMessages.operandTypes("+", left, right));
  }

  public static Value subtract(Value left, Value right) {
    return Values.number(number("-", left, right, left) - number("-", left, right, right));
  }

  public static Value multiply(Value left, Value right) {
    return Values.number(number("*", left, right, left) * number("*", left, right, right));
  }

  public static Value divide(Value left, Value right) {
    double dividend = number("/", left, right, left);
    double divisor = number("/", left, right, right);
    if (divisor == 0.0) {
      throw new EvaluationException(ErrorKind.DIVISION_BY_ZERO, ErrorMessages.divisionByZero());
    }
    return Values.number(dividend / divisor);
  }

  /**
   * 比较两个数字或两个字符串（按 Unicode 码点的字典序）。
   *
   * @return 负数、0 或正数
   */
  public static int compare(String operator, Value left, Value right) {
    if (left instanceof NumberValue a && right instanceof NumberValue b) {
      return Double.compare(a.value(), b.value());
    }
    if (left instanceof StringValue a && right instanceof StringValue b) {
      return compareCodePoints(a.value(), b.value());
    }
    throw EvaluationException.typeMismatch(ErrorMessages.operandTypes(operator, left, right));
  }

  /** String.compareTo 比较 UTF-16 码元，代理对会排在 U+E000..U+FFFF 之前；这里按码点比较。 */
  static int compareCodePoints(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) {
        return Integer.compare(ca, cb);
      }
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Boolean.compare(i < a.length(), j < b.length());
  }

  /** 结构相等；不同标签的值不相等，不报错。 */
  public static boolean equal(Value left, Value right) {
    return left.equals(right);
  }

  public static Value not(Value operand) {
    return Values.bool(!Values.asCondition(operand, "operator '!'"));
  }

  public static Value negate(Value operand) {
    if (operand instanceof NumberValue n) {
      return Values.number(-n.value());
    }
    throw EvaluationException.typeMismatch(ErrorMessages.typeExpected("unary '-'", "number", operand));
  }

  private static double number(String operator, Value left, Value right, Value operand) {
    if (operand instanceof NumberValue n) {
      return n.value();
    }
    throw EvaluationException.typeMismatch(ErrorMessages.operandTypes(operator, left, right));
  }
}
