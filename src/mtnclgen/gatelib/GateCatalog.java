package mtnclgen.gatelib;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Read-only set of gate templates, keyed by name. Safe to share between concurrent searches once built.
 */
public class GateCatalog {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final TreeMap<String, GateTemplate> gates = new TreeMap<>();

  public GateCatalog(Collection<GateTemplate> templates) {
    for (GateTemplate template : templates) {
      GateTemplate previous = gates.put(template.getName(), template);
      if (previous != null && !previous.equals(template))
        logger.warn("Gate {} is defined twice with different functions; using {}", template.getName(), template);
    }
  }

  /** Combines catalogs; later catalogs override gates of the same name. */
  public static GateCatalog merge(List<GateCatalog> catalogs) {
    List<GateTemplate> all = new ArrayList<>();
    catalogs.forEach(catalog -> all.addAll(catalog.gates.values()));
    return new GateCatalog(all);
  }

  public Optional<GateTemplate> get(String name) { return Optional.ofNullable(gates.get(name)); }
  public boolean contains(String name) { return gates.containsKey(name); }
  public int size() { return gates.size(); }

  /** All templates in name order. */
  public Collection<GateTemplate> getAll() { return Collections.unmodifiableCollection(gates.values()); }
  public List<GateTemplate> getPlain() { return filter(template -> !template.isPolymorphic()); }
  public List<GateTemplate> getPolymorphic() { return filter(GateTemplate::isPolymorphic); }
  private List<GateTemplate> filter(Predicate<GateTemplate> pred) {
    return gates.values().stream().filter(pred).collect(Collectors.toList());
  }

  /**
   * Finds all templates realizing the requested function(s) up to input order.
   * @param required one table to query plain gates, or the HVDD and LVDD tables to query polymorphic gates
   * @return matches in gate name order, each with the lexicographically first working pin assignment
   */
  public List<GateMatch> match(List<TruthTable> required) { return match(required, gates.values()); }

  /**
   * Like {@link #match(List)}, restricted to the given candidate templates, in the given order.
   */
  public static List<GateMatch> match(List<TruthTable> required, Collection<GateTemplate> candidates) {
    if (required.isEmpty() || required.size() > 2)
      throw new IllegalArgumentException("Expected one (plain) or two (polymorphic) functions, got " + required.size());
    boolean polymorphic = required.size() == 2;
    int arity = required.get(0).getArity();
    List<GateMatch> out = new ArrayList<>();
    for (GateTemplate template : candidates) {
      if (template.isPolymorphic() != polymorphic || template.getArity() != arity)
        continue;
      findPermutation(template, required).ifPresent(perm -> out.add(new GateMatch(template, perm)));
    }
    return out;
  }

  private static Optional<int[]> findPermutation(GateTemplate template, List<TruthTable> required) {
    List<TruthTable> functions = template.getFunctions();
    int[] perm = new int[template.getArity()];
    for (int i = 0; i < perm.length; ++i)
      perm[i] = i;
    do {
      boolean all = true;
      for (int i = 0; i < functions.size() && all; ++i)
        all = functions.get(i).permute(perm).equals(required.get(i));
      if (all)
        return Optional.of(perm.clone());
    } while (nextPermutation(perm));
    return Optional.empty();
  }

  /** Advances to the next permutation in lexicographic order; false after the last one. */
  static boolean nextPermutation(int[] perm) {
    int i = perm.length - 2;
    while (i >= 0 && perm[i] >= perm[i + 1])
      --i;
    if (i < 0)
      return false;
    int j = perm.length - 1;
    while (perm[j] <= perm[i])
      --j;
    int tmp = perm[i];
    perm[i] = perm[j];
    perm[j] = tmp;
    for (int a = i + 1, b = perm.length - 1; a < b; ++a, --b) {
      tmp = perm[a];
      perm[a] = perm[b];
      perm[b] = tmp;
    }
    return true;
  }

  @Override
  public String toString() {
    return "GateCatalog" + gates.keySet();
  }
}
