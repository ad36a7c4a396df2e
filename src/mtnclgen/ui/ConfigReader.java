package mtnclgen.ui;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import mtnclgen.GenerationOptions;
import mtnclgen.drc.Constraints;
import mtnclgen.gatelib.GateCatalog;
import mtnclgen.gatelib.GateLibraryException;
import mtnclgen.gatelib.GateLibraryReader;
import mtnclgen.gatelib.StandardGates;
import mtnclgen.rank.Optimization;
import mtnclgen.synth.GatePreferences;
import mtnclgen.synth.PolymorphicOptions;
import mtnclgen.synth.SearchBudget;
import mtnclgen.synth.SynthesisOptions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/** Loads {@link MTNCLGenConfig} from YAML and converts it into the immutable run options. */
public class ConfigReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static Yaml yaml() { return new Yaml(new Constructor(MTNCLGenConfig.class, new LoaderOptions())); }

  public static MTNCLGenConfig read(File file) throws ConfigException {
    try (InputStream in = new FileInputStream(file)) {
      MTNCLGenConfig cfg = yaml().load(in);
      logger.debug("Read configuration {}", file);
      return cfg != null ? cfg : new MTNCLGenConfig();
    } catch (IOException e) {
      throw new ConfigException("Configuration " + file + " could not be opened", e);
    } catch (YAMLException e) {
      throw new ConfigException("Configuration " + file + " is invalid: " + e.getMessage(), e);
    }
  }

  public static MTNCLGenConfig read(String yamlText) throws ConfigException {
    try {
      MTNCLGenConfig cfg = yaml().load(new StringReader(yamlText));
      return cfg != null ? cfg : new MTNCLGenConfig();
    } catch (YAMLException e) {
      throw new ConfigException("Configuration is invalid: " + e.getMessage(), e);
    }
  }

  public static GenerationOptions toOptions(MTNCLGenConfig cfg) throws ConfigException {
    if (cfg.constraints == null || cfg.optimization == null || cfg.optimization.weights == null || cfg.gates == null ||
        cfg.polymorphic == null || cfg.search == null || cfg.output == null)
      throw new ConfigException("Invalid configuration: sections must not be empty");
    if (cfg.gates.preferred == null || cfg.gates.avoid == null || cfg.polymorphic.required_gates == null ||
        cfg.polymorphic.alternative_gates == null)
      throw new ConfigException("Invalid configuration: gate lists must not be empty, use []");
    try {
      Constraints constraints = new Constraints(cfg.constraints.min_gates, cfg.constraints.max_gates, cfg.constraints.max_fanout,
                                                cfg.constraints.max_depth);
      Optimization optimization =
          new Optimization(Optimization.Target.fromString(cfg.optimization.target), cfg.optimization.weights.area,
                           cfg.optimization.weights.delay, cfg.optimization.weights.power);
      GatePreferences preferences = new GatePreferences(cfg.gates.preferred, cfg.gates.avoid);
      PolymorphicOptions polymorphic =
          new PolymorphicOptions(cfg.polymorphic.use_direct_mapping, cfg.polymorphic.use_alternative_mapping,
                                 cfg.polymorphic.required_gates, cfg.polymorphic.alternative_gates);
      SearchBudget budget = new SearchBudget(cfg.search.max_branches, cfg.search.time_limit_ms);
      return new GenerationOptions(cfg.num_circuits, constraints, optimization, new SynthesisOptions(preferences, polymorphic, budget));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
    }
  }

  /** The gate libraries named in the configuration, or the built-in library if none is named. */
  public static GateCatalog loadCatalog(MTNCLGenConfig cfg) throws ConfigException {
    if (cfg.gate_libraries == null || cfg.gate_libraries.isEmpty())
      return StandardGates.catalog();
    GateLibraryReader reader = new GateLibraryReader();
    List<GateCatalog> catalogs = new ArrayList<>();
    for (String path : cfg.gate_libraries) {
      try {
        catalogs.add(reader.read(new File(path)));
      } catch (GateLibraryException e) {
        throw new ConfigException(e.getMessage(), e);
      }
    }
    GateCatalog catalog = GateCatalog.merge(catalogs);
    for (String name : cfg.gates.preferred)
      if (!catalog.contains(name))
        logger.warn("Preferred gate {} is not in the gate catalog", name);
    return catalog;
  }
}
