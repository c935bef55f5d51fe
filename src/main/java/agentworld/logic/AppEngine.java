package agentworld.logic;

import agentworld.logic.core.AppModel;
import agentworld.logic.core.DefinitionCodec;
import agentworld.logic.core.DefinitionValidator;
import agentworld.logic.runtime.Builtins;
import agentworld.logic.runtime.SafetyLimits;
import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 应用加载入口。持有内置函数表与安全上限，加载出的程序共享它们。
 *
 * <p>加载失败抛出 {@link agentworld.logic.core.DefinitionException} 或
 * {@link agentworld.logic.parser.ParseException}，失败的应用不会产生任何程序。</p>
 */
public final class AppEngine {
  private static final Logger LOG = Logger.getLogger(AppEngine.class.getName());

  private final Builtins builtins;
  private final SafetyLimits limits;

  /** 默认内置函数，安全上限取自环境变量。 */
  public AppEngine() {
    this(Builtins.defaults(), SafetyLimits.fromEnvironment());
  }

  public AppEngine(Builtins builtins, SafetyLimits limits) {
    this.builtins = builtins;
    this.limits = limits;
  }

  public Builtins builtins() {
    return builtins;
  }

  public SafetyLimits limits() {
    return limits;
  }

  public AppProgram load(String json) {
    return load(DefinitionCodec.read(json));
  }

  public AppProgram load(File file) throws IOException {
    return load(DefinitionCodec.read(file));
  }

  public AppProgram load(AppModel.AppDefinition definition) {
    DefinitionValidator.validate(definition);
    Map<String, ActionProgram> actions = new Loader(definition).buildActions();
    LOG.info(() -> "loaded app '" + definition.appId() + "' with " + actions.size() + " action(s)");
    return new AppProgram(definition, actions, builtins, limits, AppProgram.baseConfig(definition));
  }
}
