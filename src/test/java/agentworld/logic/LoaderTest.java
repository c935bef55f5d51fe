package agentworld.logic;

import agentworld.logic.core.DefinitionException;
import agentworld.logic.parser.ParseException;
import agentworld.logic.runtime.AppState;
import agentworld.logic.runtime.Builtins;
import agentworld.logic.runtime.SafetyLimits;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 加载期检查：名称引用、写入目标、循环绑定与出错位置。
 */
public class LoaderTest {

  private final AppEngine engine = new AppEngine(Builtins.defaults(), SafetyLimits.DEFAULT);

  private static String app(String logic) {
    return """
        {
          "app_id": "loader_app",
          "name": "Loader",
          "state_schema": [
            { "name": "balance", "type": "number", "default": 0 },
            { "name": "pot", "type": "number", "default": 0, "per_agent": false }
          ],
          "config_schema": [ { "name": "limit", "type": "number", "default": 10 } ],
          "initial_config": { "fee": 1 },
          "actions": [{
            "name": "act",
            "parameters": { "amount": { "type": "number" }, "items": { "type": "array" } },
            "logic": %s
          }]
        }""".formatted(logic);
  }

  private DefinitionException rejected(String logic) {
    return assertThrows(DefinitionException.class, () -> engine.load(app(logic)));
  }

  @Test
  public void testValidReferencesLoad() {
    AppProgram program = engine.load(app("""
        [
          { "type": "validate", "condition": "amount > 0 && params.amount < balance + pot", "error_message": "bad ${amount}" },
          { "type": "loop", "collection": "params.items", "item": "it", "body": [
            { "type": "update", "target": "agents[it].balance", "operation": "increment", "value": "amount" }
          ] },
          { "type": "update", "target": "pot", "operation": "increment", "value": 1 },
          { "type": "update", "target": "shared['pot']", "operation": "increment", "value": "config.fee" },
          { "type": "return", "value": { "seen": "len(items)", "fixed": 3, "flags": [true, "agent.id"],
            "limit": "config.limit", "mine": "agent.balance", "theirs": "agents.bob.balance" } }
        ]"""));
    assertTrue(program.action("act").isPresent());
    assertEquals(1, program.actions().size());
  }

  @Test
  public void testUnknownNameReportsLocation() {
    DefinitionException e = rejected("""
        [ { "type": "validate", "condition": "amout > 0" } ]""");
    assertEquals("actions[act].logic[0].condition", e.getLocation());
    assertTrue(e.getMessage().contains("unknown name 'amout'"), e.getMessage());
  }

  @Test
  public void testUndeclaredParameter() {
    DefinitionException e = rejected("""
        [ { "type": "return", "value": { "x": "params.missing" } } ]""");
    assertEquals("actions[act].logic[0].value.x", e.getLocation());
    assertTrue(e.getMessage().contains("params.missing"));
  }

  @Test
  public void testUnknownStateFieldsInReads() {
    DefinitionException typo = rejected("""
        [ { "type": "validate", "condition": "agent.balanse > 0" } ]""");
    assertEquals("actions[act].logic[0].condition", typo.getLocation());
    assertTrue(typo.getMessage().contains("unknown state field 'agent.balanse'"), typo.getMessage());

    assertTrue(rejected("""
        [ { "type": "return", "value": "shared.typo_field" } ]""")
        .getMessage().contains("shared.typo_field"));
    assertTrue(rejected("""
        [ { "type": "return", "value": "agents[agent.id].nope" } ]""")
        .getMessage().contains("unknown state field"));
    assertTrue(rejected("""
        [ { "type": "return", "value": "shared['typo']" } ]""")
        .getMessage().contains("unknown state field"), "字符串常量下标同样检查");
    assertTrue(rejected("""
        [ { "type": "error", "message": "left: ${agent.nope}" } ]""")
        .getMessage().contains("agent.nope"));
  }

  @Test
  public void testStatePartitionIsChecked() {
    assertTrue(rejected("""
        [ { "type": "return", "value": "agent.pot" } ]""")
        .getMessage().contains("is shared"));
    assertTrue(rejected("""
        [ { "type": "return", "value": "shared.balance" } ]""")
        .getMessage().contains("is per-agent"));
  }

  @Test
  public void testUndeclaredConfigField() {
    DefinitionException e = rejected("""
        [ { "type": "validate", "condition": "amount < config.limt" } ]""");
    assertEquals("actions[act].logic[0].condition", e.getLocation());
    assertTrue(e.getMessage().contains("undeclared config field 'config.limt'"), e.getMessage());
  }

  @Test
  public void testUnknownStateFieldsInTargets() {
    DefinitionException agentTypo = rejected("""
        [ { "type": "update", "target": "agent.balanse", "value": 1 } ]""");
    assertEquals("actions[act].logic[0].target", agentTypo.getLocation());
    assertTrue(agentTypo.getMessage().contains("agent.balanse"));

    assertTrue(rejected("""
        [ { "type": "update", "target": "shared.typo_field", "value": 1 } ]""")
        .getMessage().contains("shared.typo_field"));
    assertTrue(rejected("""
        [ { "type": "update", "target": "agents[params.amount].nope", "value": 1 } ]""")
        .getMessage().contains("agents[...].nope"));
    assertTrue(rejected("""
        [ { "type": "update", "target": "agent.pot", "value": 1 } ]""")
        .getMessage().contains("is shared"), "共享字段不能经 agent 写入");
    assertTrue(rejected("""
        [ { "type": "update", "target": "agent.id", "value": "x" } ]""")
        .getMessage().contains("unknown state field 'agent.id'"), "id 不可写");
  }

  @Test
  public void testDeeplyNestedExpressionIsRejected() {
    String deep = "(".repeat(20000) + "1" + ")".repeat(20000);
    ParseException e = assertThrows(ParseException.class, () -> engine.load(app("""
        [ { "type": "return", "value": "%s" } ]""".formatted(deep))));
    assertEquals("actions[act].logic[0].value", e.getLocation());
  }

  @Test
  public void testNamesInsideTemplatesAreChecked() {
    DefinitionException e = rejected("""
        [ { "type": "error", "message": "no ${nope}" } ]""");
    assertEquals("actions[act].logic[0].message", e.getLocation());
  }

  @Test
  public void testNestedLocation() {
    DefinitionException e = rejected("""
        [ { "type": "branch", "condition": "true",
            "then": [ { "type": "return" } ],
            "else": [ { "type": "return" }, { "type": "update", "target": "shared.pot", "value": "ghost" } ] } ]""");
    assertEquals("actions[act].logic[0].else[1].value", e.getLocation());
  }

  @Test
  public void testLoopBindingScope() {
    DefinitionException after = rejected("""
        [ { "type": "loop", "collection": "items", "item": "it", "body": [] },
          { "type": "return", "value": "it" } ]""");
    assertEquals("actions[act].logic[1].value", after.getLocation());

    DefinitionException reserved = rejected("""
        [ { "type": "loop", "collection": "items", "item": "shared", "body": [] } ]""");
    assertEquals("actions[act].logic[0].item", reserved.getLocation());
    assertTrue(reserved.getMessage().contains("reserved root name"));

    DefinitionException invalid = rejected("""
        [ { "type": "loop", "collection": "items", "item": "1x", "body": [] } ]""");
    assertTrue(invalid.getMessage().contains("not an identifier"));
  }

  @Test
  public void testInvalidTargets() {
    assertTrue(rejected("""
        [ { "type": "update", "target": "config.limit", "value": 1 } ]""")
        .getMessage().contains("must start with agent"));
    assertTrue(rejected("""
        [ { "type": "update", "target": "agent", "value": 1 } ]""")
        .getMessage().contains("does not name a field"));
    assertTrue(rejected("""
        [ { "type": "update", "target": "agents['bob']", "value": 1 } ]""")
        .getMessage().contains("does not name a field"));
    assertTrue(rejected("""
        [ { "type": "update", "target": "len(x).y", "value": 1 } ]""")
        .getMessage().contains("invalid update target"));
    assertEquals("actions[act].logic[0].target", rejected("""
        [ { "type": "update", "target": "agents[ghost].balance", "value": 1 } ]""").getLocation());
  }

  @Test
  public void testRequiredFields() {
    DefinitionException condition = rejected("""
        [ { "type": "branch", "then": [] } ]""");
    assertEquals("actions[act].logic[0].condition", condition.getLocation());

    DefinitionException value = rejected("""
        [ { "type": "update", "target": "shared.pot" } ]""");
    assertEquals("actions[act].logic[0].value", value.getLocation());
  }

  @Test
  public void testSyntaxErrorCarriesLocation() {
    ParseException e = assertThrows(ParseException.class, () -> engine.load(app("""
        [ { "type": "validate", "condition": "amount >" } ]""")));
    assertEquals("actions[act].logic[0].condition", e.getLocation());
  }

  @Test
  public void testUnknownFunctionIsRuntimeError() {
    AppProgram program = engine.load(app("""
        [ { "type": "return", "value": "launch(amount)" } ]"""));
    ActionResult result = program.execute("i", "a", "act", Map.of(), new AppState());
    assertEquals("UNKNOWN_FUNCTION", result.error().orElseThrow().code());
  }
}
