package mtnclgen.synth;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import mtnclgen.gatelib.GateCatalog;
import mtnclgen.gatelib.GateTemplate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Selects the polymorphic gates a polymorphic search may use. */
public final class PolymorphicOptions {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final PolymorphicOptions DEFAULT = new PolymorphicOptions(true, true, List.of(), List.of());

  private final boolean useDirectMapping;
  private final boolean useAlternativeMapping;
  private final List<String> requiredGates;
  private final List<String> alternativeGates;

  public PolymorphicOptions(boolean useDirectMapping, boolean useAlternativeMapping, List<String> requiredGates,
                            List<String> alternativeGates) {
    this.useDirectMapping = useDirectMapping;
    this.useAlternativeMapping = useAlternativeMapping;
    this.requiredGates = List.copyOf(requiredGates);
    this.alternativeGates = List.copyOf(alternativeGates);
  }

  public boolean isUseDirectMapping() { return useDirectMapping; }
  public boolean isUseAlternativeMapping() { return useAlternativeMapping; }
  public List<String> getRequiredGates() { return requiredGates; }
  public List<String> getAlternativeGates() { return alternativeGates; }

  /**
   * Required gates (if direct mapping is on) followed by alternative gates (if alternative mapping is on).
   * Falls back to every polymorphic gate of the catalog when that selection is empty.
   * Names that are unknown or not polymorphic are skipped with a warning.
   */
  public List<GateTemplate> pool(GateCatalog catalog) {
    Set<String> names = new LinkedHashSet<>();
    if (useDirectMapping)
      names.addAll(requiredGates);
    if (useAlternativeMapping)
      names.addAll(alternativeGates);
    List<GateTemplate> out = new ArrayList<>();
    for (String name : names) {
      GateTemplate template = catalog.get(name).orElse(null);
      if (template == null)
        logger.warn("Polymorphic gate {} is not in the gate catalog", name);
      else if (!template.isPolymorphic())
        logger.warn("Gate {} is not polymorphic and cannot be used in polymorphic mode", name);
      else
        out.add(template);
    }
    if (out.isEmpty())
      return catalog.getPolymorphic();
    return out;
  }
}
