package agentworld.logic.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;

/**
 * AppDefinition 与 JSON 文本之间的转换。
 */
public final class DefinitionCodec {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private DefinitionCodec() {}

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static AppModel.AppDefinition read(String json) {
    try {
      return MAPPER.readValue(json, AppModel.AppDefinition.class);
    } catch (JsonProcessingException e) {
      throw new DefinitionException(pathOf(e), "invalid app definition: " + e.getOriginalMessage(), e);
    }
  }

  public static AppModel.AppDefinition read(File file) throws IOException {
    try {
      return MAPPER.readValue(file, AppModel.AppDefinition.class);
    } catch (JsonProcessingException e) {
      throw new DefinitionException(pathOf(e), "invalid app definition in " + file.getName() + ": " + e.getOriginalMessage(), e);
    }
  }

  public static String write(AppModel.AppDefinition definition) {
    try {
      return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize app definition", e);
    }
  }

  private static String pathOf(JsonProcessingException e) {
    if (e instanceof JsonMappingException m && !m.getPath().isEmpty()) {
      StringBuilder sb = new StringBuilder();
      for (JsonMappingException.Reference ref : m.getPath()) {
        if (ref.getFieldName() != null) {
          if (sb.length() > 0) sb.append('.');
          sb.append(ref.getFieldName());
        } else if (ref.getIndex() >= 0) {
          sb.append('[').append(ref.getIndex()).append(']');
        }
      }
      return sb.toString();
    }
    return "";
  }
}
