package mtnclgen.synth;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.circuit.CircuitGraphBuilder;
import mtnclgen.frontend.AlignedPair;
import mtnclgen.frontend.Expression;
import mtnclgen.frontend.ExpressionRewriter;
import mtnclgen.gatelib.GateCatalog;
import mtnclgen.gatelib.GateMatch;
import mtnclgen.gatelib.GateTemplate;
import mtnclgen.gatelib.TruthTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Technology mapper: covers expression trees with gate templates and hands every complete cover to a {@link CandidateSink}.
 *
 * <p>The search runs over the regrouping variants of the expression (original first). Within a variant, each operator node is
 * covered by a cut, the node's operand frontier optionally expanded into deeper operator nodes, whose 2 to 4 distinct leaf
 * signals feed one gate. Leaves that name the same variable share one gate input. Operator leaves of a cut are covered
 * recursively. Cuts are tried smallest first, and per cut the gates in candidate order.
 *
 * <p>In polymorphic mode each search position holds an HVDD and an LVDD expression of the same shape, and a cut is matched
 * against both domain functions at once.
 */
public class Synthesizer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int VARIANT_LIMIT = 4096;
  /** Cut leaves before merging repeated variables. */
  private static final int MAX_CUT_LEAVES = 2 * GateTemplate.MAX_ARITY;

  private final GateCatalog catalog;
  private final SynthesisOptions options;

  public Synthesizer(GateCatalog catalog, SynthesisOptions options) {
    this.catalog = catalog;
    this.options = options;
  }

  /** Maps a single expression onto plain gates. */
  public SynthesisReport synthesize(Expression expr, CandidateSink sink) {
    return synthesize(expr, sink, options.getBudget().deadlineFrom(System.currentTimeMillis()));
  }

  /**
   * Maps a single expression onto plain gates.
   * @param deadline wall clock time at which the search, variant enumeration included, stops
   */
  public SynthesisReport synthesize(Expression expr, CandidateSink sink, long deadline) {
    List<List<Expression>> variants = new ArrayList<>();
    for (Expression variant : new ExpressionRewriter(false, VARIANT_LIMIT, deadline).variants(expr))
      variants.add(List.of(variant));
    List<GateTemplate> candidates = options.getPreferences().order(catalog.getPlain());
    logger.debug("Mapping {} with {} plain gates over {} variants", expr, candidates.size(), variants.size());
    return run(variants, candidates, false, sink, deadline);
  }

  /** Maps an aligned HVDD/LVDD pair onto polymorphic gates. */
  public SynthesisReport synthesizePolymorphic(AlignedPair pair, CandidateSink sink) {
    return synthesizePolymorphic(pair, sink, options.getBudget().deadlineFrom(System.currentTimeMillis()));
  }

  /**
   * Maps an aligned HVDD/LVDD pair onto polymorphic gates.
   * @param deadline wall clock time at which the search, variant enumeration included, stops
   */
  public SynthesisReport synthesizePolymorphic(AlignedPair pair, CandidateSink sink, long deadline) {
    ExpressionRewriter rewriter = new ExpressionRewriter(false, VARIANT_LIMIT, deadline);
    Map<String, Expression> lvddByShape = new LinkedHashMap<>();
    for (Expression variant : rewriter.variants(pair.getLvdd()))
      lvddByShape.putIfAbsent(variant.shape(), variant);
    List<List<Expression>> variants = new ArrayList<>();
    for (Expression hvdd : rewriter.variants(pair.getHvdd())) {
      Expression lvdd = lvddByShape.get(hvdd.shape());
      if (lvdd != null)
        variants.add(List.of(hvdd, lvdd));
    }
    List<GateTemplate> candidates = options.getPolymorphic()
                                        .pool(catalog)
                                        .stream()
                                        .filter(template -> !options.getPreferences().isAvoided(template.getName()))
                                        .collect(Collectors.toList());
    logger.debug("Mapping {} with polymorphic gates {} over {} variants", pair,
                 candidates.stream().map(GateTemplate::getName).collect(Collectors.toList()), variants.size());
    return run(variants, candidates, true, sink, deadline);
  }

  private SynthesisReport run(List<List<Expression>> variants, List<GateTemplate> candidates, boolean polymorphic, CandidateSink sink,
                              long deadline) {
    Run state = new Run(candidates, polymorphic, sink, deadline);
    List<NoGateAvailableException> failures = new ArrayList<>();
    int searched = 0;
    for (List<Expression> variant : variants) {
      ++searched;
      int before = state.branches;
      state.uncoverable = null;
      boolean more;
      if (variant.get(0).isVariable())
        more = state.emitWire(variant);
      else
        more = new VariantSearch(state, variant).search();
      if (!more)
        break;
      if (state.branches == before) {
        NoGateAvailableException failure = state.lastFailure(variant);
        logger.debug("Variant {} failed: {}", variant.get(0), failure.getMessage());
        failures.add(failure);
      }
    }
    SynthesisReport report = new SynthesisReport(searched, state.branches, state.truncated, state.stopped, failures);
    logger.debug("Synthesis finished: {}", report);
    return report;
  }

  /** Counters and limits shared by all variants of one run. */
  private class Run {
    final List<GateTemplate> candidates;
    final boolean polymorphic;
    final CandidateSink sink;
    final long deadline;
    int branches = 0;
    boolean truncated = false;
    boolean stopped = false;
    List<Expression> uncoverable = null;

    Run(List<GateTemplate> candidates, boolean polymorphic, CandidateSink sink, long deadline) {
      this.candidates = candidates;
      this.polymorphic = polymorphic;
      this.sink = sink;
      this.deadline = deadline;
    }

    boolean outOfTime() {
      if (System.currentTimeMillis() < deadline)
        return false;
      if (!truncated)
        logger.info("Search time limit of {} ms reached", options.getBudget().getTimeLimitMs());
      truncated = true;
      return true;
    }

    boolean emit(CircuitGraph graph) {
      ++branches;
      logger.trace("Cover {}: {}", branches, graph.structuralKey());
      if (!sink.accept(graph)) {
        stopped = true;
        return false;
      }
      if (branches >= options.getBudget().getMaxBranches()) {
        logger.info("Search budget of {} covers reached", options.getBudget().getMaxBranches());
        truncated = true;
        return false;
      }
      return !outOfTime();
    }

    /** A bare variable needs no gate: the output is the input net. */
    boolean emitWire(List<Expression> roots) {
      CircuitGraphBuilder builder = new CircuitGraphBuilder(variables(roots), polymorphic);
      return emit(builder.setOutput(builder.inputNet(roots.get(0).getName())).build());
    }

    NoGateAvailableException lastFailure(List<Expression> variant) {
      List<Expression> site = uncoverable != null ? uncoverable : variant;
      if (polymorphic)
        return new NoPolymorphicGateAvailableException(String.format("No polymorphic gate realizes hvdd %s / lvdd %s (in %s / %s)",
                                                                     site.get(0), site.get(1), variant.get(0), variant.get(1)));
      return new NoGateAvailableException(String.format("No gate realizes %s (in %s)", site.get(0), variant.get(0)));
    }
  }

  /** A subtree position: one expression per domain, all of the same shape. */
  private static final class Site {
    final String path;
    final List<Expression> exprs;

    Site(String path, List<Expression> exprs) {
      this.path = path;
      this.exprs = exprs;
    }

    boolean isVariable() { return exprs.get(0).isVariable(); }

    List<Site> operands() {
      List<Site> out = new ArrayList<>();
      for (int i = 0; i < exprs.get(0).arity(); ++i) {
        final int idx = i;
        out.add(new Site(path + "/" + i, exprs.stream().map(e -> e.getOperands().get(idx)).collect(Collectors.toList())));
      }
      return out;
    }
  }

  /** A gate that covers a site, with the sites that drive its signals. */
  private static final class Choice {
    final GateMatch match;
    final List<Site> signals;

    Choice(GateMatch match, List<Site> signals) {
      this.match = match;
      this.signals = signals;
    }
  }

  private class VariantSearch {
    final Run run;
    final List<Expression> roots;
    final Map<String, List<Choice>> choiceCache = new HashMap<>();

    VariantSearch(Run run, List<Expression> roots) {
      this.run = run;
      this.roots = roots;
    }

    /** @return false if the run must stop */
    boolean search() {
      return cover(new Site("", roots), node -> run.emit(toGraph(node)));
    }

    /** Enumerates all covers of the site, passing each to k; returns false as soon as k does. */
    boolean cover(Site site, Predicate<MappingNode> k) {
      if (run.outOfTime())
        return false;
      List<Choice> choices = choices(site);
      if (choices.isEmpty()) {
        if (run.uncoverable == null)
          run.uncoverable = site.exprs;
        return true;
      }
      for (Choice choice : choices)
        if (!coverSignals(choice, 0, new ArrayList<>(), inputs -> k.test(new MappingNode(choice.match, inputs))))
          return false;
      return true;
    }

    boolean coverSignals(Choice choice, int idx, List<MappingNode.Input> done, Predicate<List<MappingNode.Input>> k) {
      if (idx == choice.signals.size())
        return k.test(done);
      Site signal = choice.signals.get(idx);
      if (signal.isVariable())
        return coverSignals(choice, idx + 1, append(done, MappingNode.Input.variable(signal.exprs.get(0).getName())), k);
      return cover(signal, child -> coverSignals(choice, idx + 1, append(done, MappingNode.Input.gate(child)), k));
    }

    List<Choice> choices(Site site) {
      List<Choice> cached = choiceCache.get(site.path);
      if (cached != null)
        return cached;
      List<Choice> out = new ArrayList<>();
      for (List<Site> leaves : cuts(site)) {
        List<Site> signals = distinctSignals(leaves);
        List<TruthTable> functions = new ArrayList<>();
        for (int domain = 0; domain < site.exprs.size(); ++domain)
          functions.add(cutFunction(site, domain, leaves, signals));
        for (GateMatch match : GateCatalog.match(functions, run.candidates))
          out.add(new Choice(match, signals));
      }
      logger.trace("{} choices for {}", out.size(), site.exprs);
      choiceCache.put(site.path, out);
      return out;
    }

    /** All cuts of an operator site with 2..4 distinct signals, fewest signals first. */
    List<List<Site>> cuts(Site site) {
      List<List<Site>> out = new ArrayList<>();
      enumerateCuts(site.operands(), new ArrayList<>(), out);
      return out.stream()
          .filter(leaves -> {
            int n = distinctSignals(leaves).size();
            return n >= GateTemplate.MIN_ARITY && n <= GateTemplate.MAX_ARITY;
          })
          .sorted(Comparator.comparingInt(leaves -> distinctSignals(leaves).size()))
          .collect(Collectors.toList());
    }

    void enumerateCuts(List<Site> pending, List<Site> done, List<List<Site>> out) {
      if (done.size() + pending.size() > MAX_CUT_LEAVES)
        return;
      if (pending.isEmpty()) {
        out.add(done);
        return;
      }
      Site first = pending.get(0);
      List<Site> rest = pending.subList(1, pending.size());
      enumerateCuts(rest, append(done, first), out);
      if (!first.isVariable()) {
        List<Site> expanded = new ArrayList<>(first.operands());
        expanded.addAll(rest);
        enumerateCuts(expanded, done, out);
      }
    }

    TruthTable cutFunction(Site site, int domain, List<Site> leaves, List<Site> signals) {
      Map<String, Integer> signalOfLeaf = new HashMap<>();
      for (Site leaf : leaves)
        signalOfLeaf.put(leaf.path, signalIndex(signals, leaf));
      return TruthTable.of(signals.size(), row -> evaluateCut(site.exprs.get(domain), site.path, signalOfLeaf, row));
    }

    boolean evaluateCut(Expression expr, String path, Map<String, Integer> signalOfLeaf, int row) {
      Integer signal = signalOfLeaf.get(path);
      if (signal != null)
        return ((row >> signal) & 1) != 0;
      List<Expression> operands = expr.getOperands();
      boolean[] values = new boolean[operands.size()];
      for (int i = 0; i < values.length; ++i)
        values[i] = evaluateCut(operands.get(i), path + "/" + i, signalOfLeaf, row);
      return expr.getKind().apply(values);
    }

    CircuitGraph toGraph(MappingNode root) {
      CircuitGraphBuilder builder = new CircuitGraphBuilder(variables(roots), run.polymorphic);
      return builder.setOutput(place(builder, root)).build();
    }

    int place(CircuitGraphBuilder builder, MappingNode node) {
      List<MappingNode.Input> inputs = node.getInputs();
      int[] signalNets = new int[inputs.size()];
      for (int i = 0; i < signalNets.length; ++i) {
        MappingNode.Input in = inputs.get(i);
        signalNets[i] = in.isVariable() ? builder.inputNet(in.getVariable()) : place(builder, in.getGate());
      }
      GateMatch match = node.getMatch();
      int[] pins = new int[signalNets.length];
      for (int pin = 0; pin < pins.length; ++pin)
        pins[pin] = signalNets[match.getSignalForPin(pin)];
      return builder.addNode(match.getTemplate(), pins);
    }
  }

  /** Leaves in order, with repeated variables collapsed onto their first occurrence. */
  private static List<Site> distinctSignals(List<Site> leaves) {
    List<Site> out = new ArrayList<>();
    for (Site leaf : leaves)
      if (signalIndex(out, leaf) < 0)
        out.add(leaf);
    return out;
  }

  private static int signalIndex(List<Site> signals, Site leaf) {
    for (int i = 0; i < signals.size(); ++i) {
      Site signal = signals.get(i);
      if (signal == leaf || signal.path.equals(leaf.path))
        return i;
      if (signal.isVariable() && leaf.isVariable() && signal.exprs.get(0).getName().equals(leaf.exprs.get(0).getName()))
        return i;
    }
    return -1;
  }

  private static List<String> variables(Collection<Expression> roots) {
    TreeSet<String> vars = new TreeSet<>();
    roots.forEach(root -> vars.addAll(root.variables()));
    return new ArrayList<>(vars);
  }

  private static <T> List<T> append(List<T> list, T item) {
    List<T> out = new ArrayList<>(list);
    out.add(item);
    return out;
  }
}
