package mtnclgen.frontend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import mtnclgen.frontend.Expression.Kind;

/**
 * Meaning-preserving rewrites of expression trees.
 * Same-operator chains are flattened and re-bracketed into nodes of arity 2..{@link Kind#maxArity()};
 * optionally the chain operands are also reordered (AND, OR and XOR are commutative).
 */
public class ExpressionRewriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Chains longer than this are only rewritten in their original operand order. */
  private static final int MAX_PERMUTED_CHAIN = 5;

  private final boolean reorder;
  private final int limit;
  private final long deadline;
  private boolean expired = false;

  /**
   * @param reorder whether to also enumerate operand orders
   * @param limit maximum number of variants returned per expression
   */
  public ExpressionRewriter(boolean reorder, int limit) { this(reorder, limit, Long.MAX_VALUE); }

  /**
   * @param deadline wall clock time ({@link System#currentTimeMillis()}) after which enumeration stops early
   */
  public ExpressionRewriter(boolean reorder, int limit, long deadline) {
    if (limit < 1)
      throw new IllegalArgumentException("limit must be positive");
    this.reorder = reorder;
    this.limit = limit;
    this.deadline = deadline;
  }

  /** Whether an enumeration of this rewriter was cut short by the deadline. */
  public boolean isExpired() { return expired; }

  /**
   * Enumerates rewrites of an expression. The expression itself is always the first element; no element repeats.
   * @param expr the expression to rewrite
   * @return at most {@code limit} distinct expressions, all equivalent to expr
   */
  public List<Expression> variants(Expression expr) {
    LinkedHashSet<Expression> out = new LinkedHashSet<>();
    out.add(expr);
    collectVariants(expr, out);
    if (out.size() >= limit)
      logger.debug("Rewrite enumeration of {} stopped at {} variants", expr, limit);
    else if (expired)
      logger.info("Rewrite enumeration of {} stopped by the time limit after {} variants", expr, out.size());
    return new ArrayList<>(out);
  }

  private void collectVariants(Expression expr, LinkedHashSet<Expression> out) {
    if (expr.isVariable()) {
      out.add(expr);
      return;
    }
    List<Expression> items = new ArrayList<>();
    flattenChain(expr, expr.getKind(), items);
    List<List<Expression>> itemVariants = new ArrayList<>(items.size());
    for (Expression item : items)
      itemVariants.add(variants(item));

    for (int[] order : orders(items.size())) {
      List<List<Expression>> ordered = new ArrayList<>(order.length);
      for (int index : order)
        ordered.add(itemVariants.get(index));
      if (!combine(expr.getKind(), ordered, 0, new ArrayList<>(), out))
        return;
    }
  }

  /** Walks the cartesian product of item variants; returns false once the limit is reached. */
  private boolean combine(Kind kind, List<List<Expression>> ordered, int index, List<Expression> chosen, LinkedHashSet<Expression> out) {
    if (index == ordered.size()) {
      for (Expression bracketing : bracketings(kind, chosen, limit - out.size() + 1, deadline)) {
        out.add(bracketing);
        if (out.size() >= limit)
          return false;
      }
      if (System.currentTimeMillis() >= deadline) {
        expired = true;
        return false;
      }
      return true;
    }
    for (Expression choice : ordered.get(index)) {
      chosen.add(choice);
      boolean goOn = combine(kind, ordered, index + 1, chosen, out);
      chosen.remove(chosen.size() - 1);
      if (!goOn)
        return false;
    }
    return true;
  }

  private List<int[]> orders(int size) {
    List<int[]> out = new ArrayList<>();
    int[] identity = new int[size];
    for (int i = 0; i < size; ++i)
      identity[i] = i;
    if (!reorder || size > MAX_PERMUTED_CHAIN) {
      out.add(identity);
      return out;
    }
    permute(identity, 0, out);
    return out;
  }

  private static void permute(int[] values, int from, List<int[]> out) {
    if (from == values.length) {
      out.add(values.clone());
      return;
    }
    for (int i = from; i < values.length; ++i) {
      swap(values, from, i);
      permute(values, from + 1, out);
      swap(values, from, i);
    }
  }
  private static void swap(int[] values, int a, int b) {
    int tmp = values[a];
    values[a] = values[b];
    values[b] = tmp;
  }

  /** Collects the operands of the maximal same-operator chain rooted at expr. */
  static void flattenChain(Expression expr, Kind kind, List<Expression> out) {
    if (expr.getKind() != kind) {
      out.add(expr);
      return;
    }
    for (Expression operand : expr.getOperands())
      flattenChain(operand, kind, out);
  }

  /**
   * Enumerates every bracketing of an ordered operand list into nested kind-nodes of arity 2..kind.maxArity().
   * Left-leaning groupings come first.
   */
  static List<Expression> bracketings(Kind kind, List<Expression> items) { return bracketings(kind, items, Integer.MAX_VALUE, Long.MAX_VALUE); }

  /** The first {@code cap} bracketings, in the same order; fewer if the deadline passes. */
  static List<Expression> bracketings(Kind kind, List<Expression> items, int cap, long deadline) {
    return new Bracketing(kind, items, cap, deadline).range(0, items.size());
  }

  /** Bracketings of the sub-ranges of one operand list, each capped and computed once. */
  private static final class Bracketing {
    final Kind kind;
    final List<Expression> items;
    final int cap;
    final long deadline;
    final Map<Integer, List<Expression>> ranges = new HashMap<>();
    boolean expired = false;

    Bracketing(Kind kind, List<Expression> items, int cap, long deadline) {
      this.kind = kind;
      this.items = items;
      this.cap = cap;
      this.deadline = deadline;
    }

    List<Expression> range(int start, int end) {
      int key = start * (items.size() + 1) + end;
      List<Expression> out = ranges.get(key);
      if (out != null)
        return out;
      out = new ArrayList<>();
      if (end - start == 1) {
        out.add(items.get(start));
      } else {
        for (int groups = Math.min(kind.maxArity(), end - start); groups >= 2 && !full(out); --groups)
          splitInto(start, end, groups, new ArrayList<>(), out);
      }
      ranges.put(key, out);
      return out;
    }

    boolean full(List<Expression> out) {
      if (!expired && System.currentTimeMillis() >= deadline)
        expired = true;
      return expired || out.size() >= cap;
    }

    void splitInto(int start, int end, int groups, List<List<Expression>> parts, List<Expression> out) {
      if (groups == 1) {
        parts.add(range(start, end));
        combineParts(parts, 0, new ArrayList<>(), out);
        parts.remove(parts.size() - 1);
        return;
      }
      // Longest first group first, which puts left-nested chains ahead of right-nested ones.
      for (int split = end - (groups - 1); split > start && !full(out); --split) {
        parts.add(range(start, split));
        splitInto(split, end, groups - 1, parts, out);
        parts.remove(parts.size() - 1);
      }
    }

    void combineParts(List<List<Expression>> parts, int index, List<Expression> chosen, List<Expression> out) {
      if (index == parts.size()) {
        out.add(Expression.operation(kind, chosen));
        return;
      }
      for (Expression part : parts.get(index)) {
        if (full(out))
          return;
        chosen.add(part);
        combineParts(parts, index + 1, chosen, out);
        chosen.remove(chosen.size() - 1);
      }
    }
  }
}
