package mtnclgen.frontend;

import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds a common tree shape for the HVDD and LVDD equations of a polymorphic circuit.
 * Operators may differ at each position, the arity and the variables at the leaves may not.
 */
public class EquationAligner {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_VARIANT_LIMIT = 4096;

  private final int variantLimit;
  private final long deadline;

  public EquationAligner() { this(DEFAULT_VARIANT_LIMIT); }
  public EquationAligner(int variantLimit) { this(variantLimit, Long.MAX_VALUE); }

  /** @param deadline wall clock time after which the variant enumeration stops */
  public EquationAligner(int variantLimit, long deadline) {
    this.variantLimit = variantLimit;
    this.deadline = deadline;
  }

  /**
   * Aligns two equations.
   * @param hvdd the function realized at high supply voltage
   * @param lvdd the function realized at low supply voltage
   * @return the aligned pair, rewritten if the original shapes differ
   * @throws AlignmentException if no operand reordering or re-bracketing of either tree yields equal shapes
   */
  public AlignedPair align(Expression hvdd, Expression lvdd) throws AlignmentException {
    if (hvdd.shape().equals(lvdd.shape())) {
      logger.debug("Equations {} and {} are aligned as given", hvdd, lvdd);
      return new AlignedPair(hvdd, lvdd, false);
    }
    if (!hvdd.variables().equals(lvdd.variables()))
      throw new AlignmentException("no common structure: HVDD uses " + hvdd.variables() + ", LVDD uses " + lvdd.variables());

    ExpressionRewriter rewriter = new ExpressionRewriter(true, variantLimit, deadline);
    // first LVDD variant per shape, in enumeration order (original first)
    LinkedHashMap<String, Expression> lvddByShape = new LinkedHashMap<>();
    for (Expression variant : rewriter.variants(lvdd))
      lvddByShape.putIfAbsent(variant.shape(), variant);

    List<Expression> hvddVariants = rewriter.variants(hvdd);
    for (Expression hvddVariant : hvddVariants) {
      Expression lvddVariant = lvddByShape.get(hvddVariant.shape());
      if (lvddVariant != null) {
        logger.info("Aligned equations by rewriting: HVDD {} / LVDD {}", hvddVariant, lvddVariant);
        return new AlignedPair(hvddVariant, lvddVariant, true);
      }
    }
    logger.debug("Tried {} HVDD and {} LVDD shapes without a match", hvddVariants.size(), lvddByShape.size());
    if (rewriter.isExpired())
      throw new AlignmentException("no common structure found within the time limit");
    throw new AlignmentException("no common structure");
  }
}
