package mtnclgen.synth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import mtnclgen.gatelib.GateTemplate;

/** Preferred gates are tried first, in the given order; avoided gates are never used. */
public final class GatePreferences {
  public static final GatePreferences NONE = new GatePreferences(List.of(), List.of());

  private final List<String> preferred;
  private final Set<String> avoid;

  public GatePreferences(List<String> preferred, Collection<String> avoid) {
    this.preferred = List.copyOf(new LinkedHashSet<>(preferred));
    this.avoid = Set.copyOf(avoid);
  }

  public List<String> getPreferred() { return preferred; }
  public Set<String> getAvoid() { return avoid; }
  public boolean isAvoided(String gate) { return avoid.contains(gate); }

  /**
   * Orders the candidate templates: preferred ones in configured order, then the rest in the given order.
   * Avoided templates are dropped.
   */
  public List<GateTemplate> order(Collection<GateTemplate> templates) {
    List<GateTemplate> out = new ArrayList<>();
    for (String name : preferred)
      for (GateTemplate template : templates)
        if (template.getName().equals(name) && !avoid.contains(name))
          out.add(template);
    for (GateTemplate template : templates)
      if (!preferred.contains(template.getName()) && !avoid.contains(template.getName()))
        out.add(template);
    return out;
  }
}
