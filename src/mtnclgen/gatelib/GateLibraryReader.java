package mtnclgen.gatelib;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads gate templates from YAML gate library files.
 *
 * <pre>
 * gates:
 *   - name: TH23w2
 *     inputs: 3
 *     threshold: 2
 *     weights: [2, 1, 1]     # default: all 1
 *     area: 12               # optional area, delay, power
 *   - name: THXOR
 *     inputs: 2
 *     minterms: [1, 2]
 *   - name: TH12m_TH22m
 *     inputs: 2
 *     reset: true
 *     hvdd: {threshold: 1, delay: 0.8}
 *     lvdd: {threshold: 2, delay: 1.6}
 * </pre>
 * A file may also hold the list of gates directly at top level.
 */
public class GateLibraryReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Reads one library file. */
  public GateCatalog read(File file) throws GateLibraryException {
    try (InputStream in = new FileInputStream(file)) {
      return new GateCatalog(parse(new Yaml().load(in), file.getName()));
    } catch (IOException e) {
      throw new GateLibraryException("Gate library " + file + " could not be opened", e);
    } catch (YAMLException e) {
      throw new GateLibraryException("Gate library " + file + " is not valid YAML: " + e.getMessage(), e);
    }
  }

  /** Reads a library from YAML text. */
  public GateCatalog read(String yamlText) throws GateLibraryException {
    try {
      return new GateCatalog(parse(new Yaml().load(new StringReader(yamlText)), "<text>"));
    } catch (YAMLException e) {
      throw new GateLibraryException("Gate library is not valid YAML: " + e.getMessage(), e);
    }
  }

  private List<GateTemplate> parse(Object root, String source) throws GateLibraryException {
    Object gateList = root;
    if (root instanceof Map)
      gateList = ((Map<?, ?>)root).get("gates");
    if (!(gateList instanceof List))
      throw new GateLibraryException(source + ": expected a list of gates");
    List<GateTemplate> out = new ArrayList<>();
    for (Object entry : (List<?>)gateList) {
      if (!(entry instanceof Map))
        throw new GateLibraryException(source + ": gate entry is not a mapping: " + entry);
      GateTemplate template = parseGate((Map<?, ?>)entry, source);
      logger.debug("Read gate {} from {}", template, source);
      out.add(template);
    }
    logger.info("Read {} gates from {}", out.size(), source);
    return out;
  }

  private GateTemplate parseGate(Map<?, ?> entry, String source) throws GateLibraryException {
    Object nameVal = entry.get("name");
    if (nameVal == null)
      throw new GateLibraryException(source + ": gate entry without name");
    String name = nameVal.toString();
    int inputs = asInt(entry.get("inputs"), name, "inputs");
    if (inputs < GateTemplate.MIN_ARITY || inputs > GateTemplate.MAX_ARITY)
      throw new GateLibraryException(String.format("%s: gate %s has %d inputs, supported are %d..%d", source, name, inputs,
                                                   GateTemplate.MIN_ARITY, GateTemplate.MAX_ARITY));
    GateAttributes common = parseAttributes(entry, name);
    boolean reset = Boolean.TRUE.equals(entry.get("reset"));

    Object hvdd = entry.get(Domain.HVDD.serialName);
    Object lvdd = entry.get(Domain.LVDD.serialName);
    if (hvdd == null && lvdd == null) {
      if (reset)
        logger.warn("{}: reset is only modeled for polymorphic gates; ignored on {}", source, name);
      return GateTemplate.plain(name, parseFunction(entry, inputs, name), common);
    }
    if (!(hvdd instanceof Map) || !(lvdd instanceof Map))
      throw new GateLibraryException(source + ": polymorphic gate " + name + " needs both hvdd and lvdd mappings");
    Map<?, ?> hvddMap = (Map<?, ?>)hvdd;
    Map<?, ?> lvddMap = (Map<?, ?>)lvdd;
    return GateTemplate.polymorphic(name, parseFunction(hvddMap, inputs, name + "." + Domain.HVDD.serialName),
                                    parseFunction(lvddMap, inputs, name + "." + Domain.LVDD.serialName), reset,
                                    parseAttributes(hvddMap, name).withDefaults(common),
                                    parseAttributes(lvddMap, name).withDefaults(common));
  }

  private TruthTable parseFunction(Map<?, ?> entry, int inputs, String what) throws GateLibraryException {
    Object threshold = entry.get("threshold");
    Object minterms = entry.get("minterms");
    if (threshold != null && minterms != null)
      throw new GateLibraryException(what + ": threshold and minterms are mutually exclusive");
    if (threshold != null) {
      int[] weights = new int[inputs];
      Object weightsVal = entry.get("weights");
      if (weightsVal == null) {
        Arrays.fill(weights, 1);
      } else {
        if (!(weightsVal instanceof List) || ((List<?>)weightsVal).size() != inputs)
          throw new GateLibraryException(what + ": weights must list one value per input");
        List<?> weightList = (List<?>)weightsVal;
        for (int i = 0; i < inputs; ++i)
          weights[i] = asInt(weightList.get(i), what, "weights");
      }
      return TruthTable.threshold(asInt(threshold, what, "threshold"), weights);
    }
    if (minterms instanceof List) {
      List<Integer> rows = new ArrayList<>();
      for (Object row : (List<?>)minterms)
        rows.add(asInt(row, what, "minterms"));
      try {
        return TruthTable.fromMinterms(inputs, rows);
      } catch (IllegalArgumentException e) {
        throw new GateLibraryException(what + ": " + e.getMessage(), e);
      }
    }
    throw new GateLibraryException(what + ": needs either threshold or minterms");
  }

  private GateAttributes parseAttributes(Map<?, ?> entry, String what) throws GateLibraryException {
    return new GateAttributes(asDouble(entry.get("area"), what, "area"), asDouble(entry.get("delay"), what, "delay"),
                              asDouble(entry.get("power"), what, "power"));
  }

  private static int asInt(Object value, String what, String key) throws GateLibraryException {
    if (!(value instanceof Integer))
      throw new GateLibraryException(what + ": " + key + " must be an integer, got " + value);
    return (Integer)value;
  }
  private static Double asDouble(Object value, String what, String key) throws GateLibraryException {
    if (value == null)
      return null;
    if (!(value instanceof Number))
      throw new GateLibraryException(what + ": " + key + " must be a number, got " + value);
    return ((Number)value).doubleValue();
  }
}
