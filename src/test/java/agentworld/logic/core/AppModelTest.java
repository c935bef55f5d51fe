package agentworld.logic.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 应用定义的 JSON 读写
 */
public class AppModelTest {

  private static String fixture(String name) throws IOException {
    try (InputStream in = AppModelTest.class.getResourceAsStream("/apps/" + name)) {
      assertNotNull(in, "fixture 缺失: " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Test
  public void testReadFixture() throws IOException {
    AppModel.AppDefinition def = DefinitionCodec.read(fixture("paypal.json"));
    assertEquals("paypal", def.appId());
    assertEquals(AppModel.Category.PAYMENT, def.category());
    assertEquals(AppModel.StateType.PER_AGENT, def.stateType());
    assertEquals(3, def.stateSchema().size());
    assertFalse(def.stateField("total_volume").orElseThrow().perAgent());

    AppModel.ActionDefinition transfer = def.action("transfer").orElseThrow();
    AppModel.ParamSpec amount = transfer.parameters().get("amount");
    assertEquals(ValueType.NUMBER, amount.type());
    assertEquals(0.01, amount.minValue());
    assertInstanceOf(AppModel.ValidateBlock.class, transfer.logic().get(0));
    assertEquals(AppModel.ToolType.READ, def.action("check_balance").orElseThrow().toolType());
  }

  @Test
  public void testWriteThenReadIsStable() throws IOException {
    AppModel.AppDefinition def = DefinitionCodec.read(fixture("paypal.json"));
    String written = DefinitionCodec.write(def);
    assertEquals(def, DefinitionCodec.read(written));
    assertTrue(written.contains("\"app_id\""), "输出使用 snake_case 字段名");
  }

  @Test
  public void testDefaultsAndAliases() {
    AppModel.AppDefinition def = DefinitionCodec.read("""
        {
          "appId": "tiny_app",
          "name": "Tiny",
          "stateSchema": [ { "name": "count" } ],
          "actions": [ { "name": "go", "logic": [
            { "type": "update", "target": "count", "value": 1 },
            { "type": "error" },
            { "type": "validate", "condition": "true" }
          ] } ]
        }""");
    assertEquals("tiny_app", def.appId());
    assertEquals(AppModel.Category.CUSTOM, def.category());
    assertEquals(AppModel.AccessType.SHARED, def.accessType());
    assertEquals(ValueType.STRING, def.stateSchema().get(0).type());
    assertTrue(def.stateSchema().get(0).perAgent());

    AppModel.ActionDefinition go = def.actions().get(0);
    assertEquals(AppModel.ToolType.WRITE, go.toolType());
    assertEquals(UpdateOperation.SET, ((AppModel.UpdateBlock) go.logic().get(0)).operation());
    assertEquals(AppModel.ErrorBlock.DEFAULT_CODE, ((AppModel.ErrorBlock) go.logic().get(1)).effectiveCode());
    assertEquals(AppModel.ValidateBlock.DEFAULT_CODE, ((AppModel.ValidateBlock) go.logic().get(2)).code());
  }

  @Test
  public void testMalformedDefinition() {
    DefinitionException badType = assertThrows(DefinitionException.class, () -> DefinitionCodec.read("""
        { "app_id": "x_app", "name": "X", "actions": [ { "name": "a", "logic": [ { "type": "teleport" } ] } ] }"""));
    assertTrue(badType.getMessage().contains("invalid app definition"));
    assertThrows(DefinitionException.class, () -> DefinitionCodec.read("{ not json"));
  }

  @Test
  public void testRoleRestrictedAccess() {
    AppModel.AppDefinition def = DefinitionCodec.read("""
        { "app_id": "vault", "name": "Vault", "access_type": "role_restricted",
          "allowed_roles": ["banker"], "allowed_role_tags": ["auditor"],
          "actions": [ { "name": "open", "logic": [] } ] }""");
    assertTrue(def.canAccess("banker", null));
    assertTrue(def.canAccess("peer", java.util.List.of("auditor")));
    assertFalse(def.canAccess("peer", java.util.List.of("guest")));
    assertFalse(def.canAccess(null, null));
  }
}
