package agentworld.logic.nodes;

import agentworld.logic.runtime.Value;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import java.util.ArrayList;
import java.util.List;

/**
 * list 字面量，元素深拷贝，避免与状态工作副本共享容器。
 */
public final class ListLiteralNode extends ExprNode {
  @Children private final ExprNode[] items;

  public ListLiteralNode(ExprNode[] items) {
    this.items = items;
  }

  @Override
  @ExplodeLoop
  public Value execute(VirtualFrame frame) {
    Profiler.inc(Profiler.Kind.LIST_LITERAL);
    List<Value> values = new ArrayList<>(items.length);
    for (int i = 0; i < items.length; i++) {
      values.add(items[i].execute(frame).deepCopy());
    }
    return new Value.ListValue(values);
  }
}
