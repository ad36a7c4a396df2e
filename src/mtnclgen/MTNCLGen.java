package mtnclgen;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import mtnclgen.circuit.CircuitGraph;
import mtnclgen.drc.ConstraintValidator;
import mtnclgen.drc.ConstraintViolation;
import mtnclgen.frontend.AlignedPair;
import mtnclgen.frontend.AlignmentException;
import mtnclgen.frontend.EquationAligner;
import mtnclgen.frontend.EquationParser;
import mtnclgen.frontend.EquationSyntaxException;
import mtnclgen.frontend.Expression;
import mtnclgen.gatelib.Domain;
import mtnclgen.gatelib.GateCatalog;
import mtnclgen.rank.CandidateResult;
import mtnclgen.rank.CostEvaluator;
import mtnclgen.rank.Ranker;
import mtnclgen.synth.InternalSynthesisError;
import mtnclgen.synth.SynthesisReport;
import mtnclgen.synth.Synthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Generation run: parse, align (polymorphic mode), synthesize, validate, rank and select.
 * The search stops as soon as the requested number of distinct accepted circuits exists.
 */
public class MTNCLGen {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final GateCatalog catalog;
  private final GenerationOptions options;

  public MTNCLGen(GateCatalog catalog, GenerationOptions options) {
    this.catalog = catalog;
    this.options = options;
  }

  public GateCatalog getCatalog() { return catalog; }
  public GenerationOptions getOptions() { return options; }

  /** Generates circuits of plain gates for one equation. */
  public GenerationResult generate(String equation) throws EquationSyntaxException {
    long deadline = options.getSynthesis().getBudget().deadlineFrom(System.currentTimeMillis());
    Expression expr = EquationParser.parse(equation);
    logger.info("Generating {} circuit(s) for {}", options.getNumCircuits(), expr);
    Collector collector = new Collector(List.of(expr), false);
    SynthesisReport report = new Synthesizer(catalog, options.getSynthesis()).synthesize(expr, collector::accept, deadline);
    return collector.finish(List.of(expr.toString()), report);
  }

  /** Generates circuits of polymorphic gates that realize hvdd at high supply voltage and lvdd at low supply voltage. */
  public GenerationResult generatePolymorphic(String hvdd, String lvdd) throws EquationSyntaxException, AlignmentException {
    long deadline = options.getSynthesis().getBudget().deadlineFrom(System.currentTimeMillis());
    Expression hvddExpr = EquationParser.parse(hvdd);
    Expression lvddExpr = EquationParser.parse(lvdd);
    AlignedPair pair = new EquationAligner(EquationAligner.DEFAULT_VARIANT_LIMIT, deadline).align(hvddExpr, lvddExpr);
    if (pair.isRewritten())
      logger.info("Aligned equations to hvdd {} / lvdd {}", pair.getHvdd(), pair.getLvdd());
    logger.info("Generating {} polymorphic circuit(s) for hvdd {} / lvdd {}", options.getNumCircuits(), hvddExpr, lvddExpr);
    Collector collector = new Collector(List.of(pair.getHvdd(), pair.getLvdd()), true);
    SynthesisReport report = new Synthesizer(catalog, options.getSynthesis()).synthesizePolymorphic(pair, collector::accept, deadline);
    return collector.finish(List.of(pair.getHvdd().toString(), pair.getLvdd().toString()), report);
  }

  /** Validates candidates as the search yields them. */
  private class Collector {
    private final List<Expression> expected;
    private final boolean polymorphic;
    private final ConstraintValidator validator = new ConstraintValidator(options.getConstraints());
    private final CostEvaluator evaluator = new CostEvaluator(options.getOptimization());
    private final Set<String> seen = new HashSet<>();
    private final List<CandidateResult> accepted = new ArrayList<>();
    private final List<CandidateResult> rejected = new ArrayList<>();

    Collector(List<Expression> expected, boolean polymorphic) {
      this.expected = expected;
      this.polymorphic = polymorphic;
    }

    boolean accept(CircuitGraph graph) {
      if (!seen.add(graph.structuralKey()))
        return true;
      List<ConstraintViolation> violations = validator.validate(graph);
      checkFunction(graph);
      CandidateResult result = evaluator.evaluate(graph, violations);
      if (result.isValid())
        accepted.add(result);
      else
        rejected.add(result);
      return accepted.size() < options.getNumCircuits();
    }

    /** Each domain of the circuit must compute its equation on every input assignment. */
    private void checkFunction(CircuitGraph graph) {
      List<Domain> domains = polymorphic ? List.of(Domain.HVDD, Domain.LVDD) : List.of(Domain.HVDD);
      List<String> vars = graph.getPrimaryInputs();
      for (int row = 0; row < (1 << vars.size()); ++row) {
        Map<String, Boolean> assignment = Expression.assignmentForRow(vars, row);
        for (int i = 0; i < domains.size(); ++i)
          if (graph.evaluate(domains.get(i), assignment) != expected.get(i).evaluate(assignment))
            throw new InternalSynthesisError("Candidate " + graph.structuralKey() + " does not realize " + expected.get(i) + " in " +
                                             domains.get(i).serialName + " for " + assignment);
      }
    }

    GenerationResult finish(List<String> equations, SynthesisReport report) {
      Ranker ranker = new Ranker();
      List<CandidateResult> selected = ranker.select(ranker.rank(accepted), options.getNumCircuits());
      if (accepted.size() < options.getNumCircuits())
        logger.warn("Found {} of {} requested circuits{}", accepted.size(), options.getNumCircuits(),
                    report.isTruncated() ? " (search budget exhausted)" : "");
      else
        logger.info("Found {} circuits", accepted.size());
      if (!rejected.isEmpty())
        logger.info("{} candidates violated constraints", rejected.size());
      return new GenerationResult(equations, polymorphic, selected, rejected, report, options.getNumCircuits(), accepted.size());
    }
  }
}
