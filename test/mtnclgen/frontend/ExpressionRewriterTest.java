package mtnclgen.frontend;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ExpressionRewriterTest {

  private static void assertEquivalent(Expression expected, Expression actual) {
    List<String> vars = List.copyOf(expected.variables());
    Assertions.assertEquals(expected.variables(), actual.variables());
    for (int row = 0; row < (1 << vars.size()); ++row) {
      Map<String, Boolean> assignment = Expression.assignmentForRow(vars, row);
      Assertions.assertEquals(expected.evaluate(assignment), actual.evaluate(assignment), actual + " differs from " + expected);
    }
  }

  @Test
  void testRegroupingKeepsOrder() throws EquationSyntaxException {
    Expression expr = EquationParser.parse("A + B + C");
    List<Expression> variants = new ExpressionRewriter(false, 100).variants(expr);
    Assertions.assertEquals(List.of(expr, EquationParser.parse("(A + B) + C"), EquationParser.parse("A + (B + C)")), variants);
  }

  @Test
  void testReorderingVariants() throws EquationSyntaxException {
    Expression expr = EquationParser.parse("A & (B + C)");
    List<Expression> variants = new ExpressionRewriter(true, 4096).variants(expr);
    Assertions.assertEquals(expr, variants.get(0));
    Assertions.assertEquals(variants.size(), new HashSet<>(variants).size());
    Assertions.assertTrue(variants.contains(EquationParser.parse("(C + B) & A")));
    variants.forEach(variant -> assertEquivalent(expr, variant));
  }

  @Test
  void testFlattenedChainIsRebracketed() throws EquationSyntaxException {
    Expression expr = EquationParser.parse("(A & B) & (C & D)");
    List<Expression> variants = new ExpressionRewriter(false, 4096).variants(expr);
    Assertions.assertTrue(variants.contains(EquationParser.parse("(A & B & C) & D")));
    Assertions.assertTrue(variants.contains(EquationParser.parse("A & (B & C) & D")));
    variants.forEach(variant -> assertEquivalent(expr, variant));
  }

  @Test
  void testLimit() throws EquationSyntaxException {
    Expression expr = EquationParser.parse("(A + B + C) & (D + E + F) & (G + H)");
    List<Expression> variants = new ExpressionRewriter(true, 10).variants(expr);
    Assertions.assertEquals(10, variants.size());
    Assertions.assertEquals(expr, variants.get(0));
  }

  @Test
  void testBracketings() {
    Expression a = Expression.variable("A");
    Expression b = Expression.variable("B");
    Expression c = Expression.variable("C");
    Expression d = Expression.variable("D");
    List<Expression> out = ExpressionRewriter.bracketings(Expression.Kind.XOR, List.of(a, b, c));
    Assertions.assertEquals(List.of(Expression.xor(Expression.xor(a, b), c), Expression.xor(a, Expression.xor(b, c))), out);
    // 4 operands of a ternary operator: 3 groupings into 3 nodes, 5 binary trees, and ternary/binary mixes
    List<Expression> four = ExpressionRewriter.bracketings(Expression.Kind.AND, List.of(a, b, c, d));
    Assertions.assertEquals(four.size(), new HashSet<>(four).size());
    Assertions.assertTrue(four.contains(Expression.and(Expression.and(a, b), Expression.and(c, d))));
    Assertions.assertTrue(four.contains(Expression.and(Expression.and(a, b, c), d)));
    four.forEach(expr -> Assertions.assertTrue(expr.arity() <= 3));
  }

  static final String LONG_CHAIN = "((A+B+C)+(D+E+F)+(G+H+I))+((J+K+L)+(M+N+O)+(P+Q+R))";

  @Test
  void testLongChainStopsAtLimit() throws EquationSyntaxException {
    Expression expr = EquationParser.parse(LONG_CHAIN);
    List<Expression> variants =
        Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20), () -> new ExpressionRewriter(false, 4096).variants(expr));
    Assertions.assertEquals(4096, variants.size());
    Assertions.assertEquals(expr, variants.get(0));
    assertEquivalent(expr, variants.get(4095));
  }

  @Test
  void testDeadline() throws EquationSyntaxException {
    Expression expr = EquationParser.parse(LONG_CHAIN);
    ExpressionRewriter rewriter = new ExpressionRewriter(false, Integer.MAX_VALUE, System.currentTimeMillis() + 200);
    List<Expression> variants = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(20), () -> rewriter.variants(expr));
    Assertions.assertTrue(rewriter.isExpired());
    Assertions.assertEquals(expr, variants.get(0));
    Assertions.assertFalse(new ExpressionRewriter(false, Integer.MAX_VALUE, System.currentTimeMillis() + 60000).isExpired());
  }

  @Test
  void testCappedBracketingsArePrefix() {
    List<Expression> items = List.of(Expression.variable("A"), Expression.variable("B"), Expression.variable("C"),
                                     Expression.variable("D"), Expression.variable("E"));
    List<Expression> all = ExpressionRewriter.bracketings(Expression.Kind.OR, items);
    List<Expression> capped = ExpressionRewriter.bracketings(Expression.Kind.OR, items, 7, Long.MAX_VALUE);
    Assertions.assertEquals(all.subList(0, 7), capped);
  }
}
