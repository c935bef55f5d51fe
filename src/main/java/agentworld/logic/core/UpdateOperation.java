package agentworld.logic.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Update 块的写操作。JSON 中为小写名称，{@code add}/{@code subtract} 为旧名称别名。
 */
public enum UpdateOperation {
  SET,
  INCREMENT,
  DECREMENT,
  APPEND,
  REMOVE,
  MERGE;

  @JsonValue
  public String jsonName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static UpdateOperation fromJson(String name) {
    if (name == null) {
      return SET;
    }
    switch (name.toLowerCase(Locale.ROOT)) {
      case "add": return INCREMENT;
      case "subtract": return DECREMENT;
      default:
        for (UpdateOperation op : values()) {
          if (op.jsonName().equalsIgnoreCase(name)) {
            return op;
          }
        }
        throw new IllegalArgumentException("unknown update operation: " + name);
    }
  }
}
