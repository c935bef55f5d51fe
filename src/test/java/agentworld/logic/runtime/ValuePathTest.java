package agentworld.logic.runtime;

import agentworld.logic.core.UpdateOperation;
import agentworld.logic.runtime.Value.MapValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 路径解析、宽松读取与严格写入
 */
public class ValuePathTest {

  private static MapValue root(String json) {
    return (MapValue) Values.parseJson(json);
  }

  @Test
  public void testParse() {
    ValuePath path = ValuePath.parse("items[0].price");
    assertEquals(List.of(PathSegment.key("items"), PathSegment.index(0), PathSegment.key("price")), path.segments());
    assertEquals("items[0].price", path.toString());

    assertEquals(List.of(PathSegment.key("m"), PathSegment.key("a b")), ValuePath.parse("m['a b']").segments());
    assertThrows(IllegalArgumentException.class, () -> ValuePath.parse("a..b"));
    assertThrows(IllegalArgumentException.class, () -> ValuePath.parse("a[-1]"));
    assertThrows(IllegalArgumentException.class, () -> ValuePath.parse("a[x]"));
    assertThrows(IllegalArgumentException.class, () -> ValuePath.parse("a[0"));
  }

  @Test
  public void testPermissiveRead() {
    MapValue data = root("{\"items\": [{\"price\": 3}], \"n\": 1}");
    assertEquals(Values.number(3), ValuePath.parse("items[0].price").read(data));
    assertTrue(ValuePath.parse("items[4].price").read(data).isNull());
    assertTrue(ValuePath.parse("missing.deeper").read(data).isNull());
    assertThrows(EvaluationException.class, () -> ValuePath.parse("n.x").read(data));
  }

  @Test
  public void testWriteCreatesIntermediateMaps() {
    MapValue data = new MapValue();
    ValuePath.parse("a.b.c").apply(data, UpdateOperation.SET, Values.number(1));
    assertEquals(Values.number(1), ValuePath.parse("a.b.c").read(data));
  }

  @Test
  public void testWriteIsStrict() {
    MapValue data = root("{\"n\": 1, \"list\": [1, 2], \"map\": {}}");

    EvaluationException through = assertThrows(EvaluationException.class,
        () -> ValuePath.parse("n.x").apply(data, UpdateOperation.SET, Values.number(1)));
    assertEquals(ErrorKind.TYPE_MISMATCH, through.getKind());

    EvaluationException keyOnList = assertThrows(EvaluationException.class,
        () -> ValuePath.parse("list.x").apply(data, UpdateOperation.SET, Values.number(1)));
    assertEquals(ErrorKind.TYPE_MISMATCH, keyOnList.getKind());

    EvaluationException indexOnMap = assertThrows(EvaluationException.class,
        () -> ValuePath.parse("map[0]").apply(data, UpdateOperation.SET, Values.number(1)));
    assertEquals(ErrorKind.TYPE_MISMATCH, indexOnMap.getKind());

    EvaluationException outOfRange = assertThrows(EvaluationException.class,
        () -> ValuePath.parse("list[2]").apply(data, UpdateOperation.SET, Values.number(1)));
    assertEquals(ErrorKind.PATH_NOT_FOUND, outOfRange.getKind());

    ValuePath.parse("list[1]").apply(data, UpdateOperation.INCREMENT, Values.number(40));
    assertEquals(Values.number(42), ValuePath.parse("list[1]").read(data));
  }

  @Test
  public void testOperations() {
    assertEquals(Values.number(5), ValuePath.compute(UpdateOperation.INCREMENT, Values.nil(), Values.number(5)));
    assertEquals(Values.number(-2), ValuePath.compute(UpdateOperation.DECREMENT, Values.number(1), Values.number(3)));
    assertThrows(EvaluationException.class,
        () -> ValuePath.compute(UpdateOperation.INCREMENT, Values.number(1), Values.string("1")));

    assertEquals(Values.list(Values.string("a")),
        ValuePath.compute(UpdateOperation.APPEND, Values.nil(), Values.string("a")));
    assertThrows(EvaluationException.class,
        () -> ValuePath.compute(UpdateOperation.APPEND, Values.number(1), Values.string("a")));

    Value list = Values.list(Values.number(1), Values.number(2), Values.number(1));
    assertEquals(Values.list(Values.number(2), Values.number(1)),
        ValuePath.compute(UpdateOperation.REMOVE, list, Values.number(1)));
    assertThrows(EvaluationException.class,
        () -> ValuePath.compute(UpdateOperation.REMOVE, Values.nil(), Values.number(1)));

    MapValue merged = (MapValue) ValuePath.compute(UpdateOperation.MERGE,
        root("{\"a\": 1, \"b\": 2}"), root("{\"b\": 3, \"c\": 4}"));
    assertEquals(root("{\"a\": 1, \"b\": 3, \"c\": 4}"), merged);
    assertThrows(EvaluationException.class,
        () -> ValuePath.compute(UpdateOperation.MERGE, Values.nil(), Values.list()));
  }

  @Test
  public void testSetStoresCopy() {
    MapValue data = new MapValue();
    Value.ListValue operand = Values.list(Values.number(1));
    ValuePath.parse("xs").apply(data, UpdateOperation.SET, operand);
    operand.items().add(Values.number(2));
    assertEquals(Values.list(Values.number(1)), data.get("xs"));
  }

  @Test
  public void testDynamicSegment() {
    assertEquals(PathSegment.key("k"), PathSegment.of(Values.string("k")));
    assertEquals(PathSegment.index(3), PathSegment.of(Values.number(3)));
    assertThrows(EvaluationException.class, () -> PathSegment.of(Values.number(1.5)));
    assertThrows(EvaluationException.class, () -> PathSegment.of(Values.bool(true)));
  }
}
