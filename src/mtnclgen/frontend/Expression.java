package mtnclgen.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable boolean expression over named single-bit variables.
 * An expression is either a variable or an AND/OR node with 2 or 3 operands, or a binary XOR node.
 */
public final class Expression {

  public enum Kind {
    VARIABLE(""),
    AND("&"),
    OR("+"),
    XOR("^");

    public final String symbol;
    Kind(String symbol) { this.symbol = symbol; }

    public boolean isOperator() { return this != VARIABLE; }
    /** Maximum operand count accepted for this operator. */
    public int maxArity() { return this == XOR ? 2 : 3; }
    /** Applies the operator to the given operand values. */
    public boolean apply(boolean[] values) {
      switch (this) {
      case AND:
        for (boolean value : values)
          if (!value)
            return false;
        return true;
      case OR:
        for (boolean value : values)
          if (value)
            return true;
        return false;
      case XOR:
        boolean result = false;
        for (boolean value : values)
          result ^= value;
        return result;
      default:
        throw new UnsupportedOperationException("A variable is not an operator");
      }
    }
  }

  private final Kind kind;
  private final String name;
  private final List<Expression> operands;
  private final int hash;

  private Expression(Kind kind, String name, List<Expression> operands) {
    this.kind = kind;
    this.name = name;
    this.operands = operands;
    this.hash = Objects.hash(kind, name, operands);
  }

  public static Expression variable(String name) {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Variable name must not be empty");
    return new Expression(Kind.VARIABLE, name, List.of());
  }
  public static Expression and(Expression... operands) { return operation(Kind.AND, List.of(operands)); }
  public static Expression or(Expression... operands) { return operation(Kind.OR, List.of(operands)); }
  public static Expression xor(Expression left, Expression right) { return operation(Kind.XOR, List.of(left, right)); }

  /**
   * Creates an operator node.
   * @param kind AND, OR or XOR
   * @param operands 2..{@link Kind#maxArity()} operands
   * @return the new node
   */
  public static Expression operation(Kind kind, List<Expression> operands) {
    if (!kind.isOperator())
      throw new IllegalArgumentException("Use Expression.variable for variables");
    if (operands.size() < 2 || operands.size() > kind.maxArity())
      throw new IllegalArgumentException(String.format("%s takes 2 to %d operands, got %d", kind, kind.maxArity(), operands.size()));
    return new Expression(kind, null, List.copyOf(operands));
  }

  public Kind getKind() { return kind; }
  public boolean isVariable() { return kind == Kind.VARIABLE; }
  /** The variable name; only valid for variables. */
  public String getName() {
    if (kind != Kind.VARIABLE)
      throw new UnsupportedOperationException("Not a variable: " + this);
    return name;
  }
  public List<Expression> getOperands() { return operands; }
  public int arity() { return operands.size(); }

  /** Returns the sorted set of variable names used in this expression. */
  public SortedSet<String> variables() {
    TreeSet<String> out = new TreeSet<>();
    collectVariables(out);
    return Collections.unmodifiableSortedSet(out);
  }
  private void collectVariables(TreeSet<String> out) {
    if (isVariable())
      out.add(name);
    else
      operands.forEach(operand -> operand.collectVariables(out));
  }

  /** Number of operator nodes in this expression. */
  public int operatorCount() {
    if (isVariable())
      return 0;
    return 1 + operands.stream().mapToInt(Expression::operatorCount).sum();
  }

  /**
   * Evaluates the expression.
   * @param assignment value for every variable of this expression
   * @return the expression value
   */
  public boolean evaluate(Map<String, Boolean> assignment) {
    if (isVariable()) {
      Boolean value = assignment.get(name);
      if (value == null)
        throw new IllegalArgumentException("No value assigned to variable " + name);
      return value;
    }
    boolean[] values = new boolean[operands.size()];
    for (int i = 0; i < values.length; ++i)
      values[i] = operands.get(i).evaluate(assignment);
    return kind.apply(values);
  }

  /**
   * Computes the full truth table over the given variable order.
   * Row r assigns variable i the value of bit i of r.
   */
  public boolean[] truthTable(List<String> variableOrder) {
    int rows = 1 << variableOrder.size();
    boolean[] out = new boolean[rows];
    for (int row = 0; row < rows; ++row)
      out[row] = evaluate(assignmentForRow(variableOrder, row));
    return out;
  }

  public static Map<String, Boolean> assignmentForRow(List<String> variableOrder, int row) {
    HashMap<String, Boolean> assignment = new HashMap<>();
    for (int i = 0; i < variableOrder.size(); ++i)
      assignment.put(variableOrder.get(i), ((row >> i) & 1) != 0);
    return assignment;
  }

  /** Shape string with operators erased, e.g. "(A,(B,C))"; equal shapes can be mapped position by position. */
  public String shape() {
    if (isVariable())
      return name;
    List<String> parts = new ArrayList<>(operands.size());
    operands.forEach(operand -> parts.add(operand.shape()));
    return "(" + String.join(",", parts) + ")";
  }

  @Override
  public int hashCode() {
    return hash;
  }
  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Expression other = (Expression)obj;
    return hash == other.hash && kind == other.kind && Objects.equals(name, other.name) && operands.equals(other.operands);
  }
  @Override
  public String toString() {
    if (isVariable())
      return name;
    List<String> parts = new ArrayList<>(operands.size());
    for (Expression operand : operands)
      parts.add(operand.isVariable() ? operand.toString() : "(" + operand + ")");
    return String.join(" " + kind.symbol + " ", parts);
  }
}
