package ca.gc.cra.parley.application.events.rules;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Facade that loads and compiles classification rules from YAML sources.
 *
 * <p>Operator rule files are placed ahead of the built-in table, so within a category an operator
 * rule takes priority over a built-in one.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class ClassificationRuleSetProvider {
  /** Classpath location of the built-in rule table. */
  public static final String DEFAULT_RULES = "parley/default-rules.yaml";

  private final RuleSetCompiler compiler = new RuleSetCompiler();

  /**
   * Loads the built-in rule table.
   *
   * @return compiled rule set
   * @throws IOException when the bundled resource cannot be read
   */
  public CompiledRuleSet loadDefaults() throws IOException {
    return load(List.of(), true);
  }

  /**
   * Loads and compiles rules from the supplied YAML files.
   *
   * @param sources ordered list of rule files
   * @param includeDefaults whether the built-in table follows the supplied files
   * @return compiled rule set
   * @throws IOException when any source cannot be read
   */
  public CompiledRuleSet load(List<Path> sources, boolean includeDefaults) throws IOException {
    Objects.requireNonNull(sources, "sources");
    RuleSetLoader loader = new RuleSetLoader();
    loader.addFiles(sources);
    if (includeDefaults) {
      loader.addResource(DEFAULT_RULES);
    }
    return compiler.compile(loader.rules());
  }
}
