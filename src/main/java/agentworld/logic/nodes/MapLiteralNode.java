package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * map 字面量，键固定、按声明顺序，值深拷贝。重复键以后者为准。
 */
public final class MapLiteralNode extends ExprNode {
  @CompilationFinal(dimensions = 1) private final String[] keys;
  @Children private final ExprNode[] values;

  public MapLiteralNode(String[] keys, ExprNode[] values) {
    if (keys.length != values.length) {
      throw new IllegalArgumentException("keys and values differ in length");
    }
    this.keys = keys;
    this.values = values;
  }

  @Override
  @ExplodeLoop
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.MAP_LITERAL);
    Map<String, Value> entries = new LinkedHashMap<>();
    for (int i = 0; i < keys.length; i++) {
      entries.put(keys[i], values[i].execute(frame).deepCopy());
    }
    return new Value.MapValue(entries);
  }
}
