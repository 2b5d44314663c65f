package com.quantori.ceb.core.balancer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.ceb.api.exception.AmbiguousSolutionException;
import com.quantori.ceb.api.exception.AtomMismatchException;
import com.quantori.ceb.api.exception.FormulaParseException;
import com.quantori.ceb.api.exception.NoSolutionException;
import com.quantori.ceb.api.exception.NonIntegerResultException;
import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.BalancedEquation;
import com.quantori.ceb.core.counter.TreeAtomCounter;
import com.quantori.ceb.core.parser.RecursiveDescentFormulaParser;
import com.quantori.ceb.core.solver.GaussianNullspaceSolver;
import com.quantori.ceb.core.system.DefaultEquationSystemBuilder;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class DefaultEquationBalancerTest {

  private final RecursiveDescentFormulaParser parser = new RecursiveDescentFormulaParser();
  private final TreeAtomCounter counter = new TreeAtomCounter();
  private final DefaultEquationBalancer balancer = new DefaultEquationBalancer(parser, counter,
      new DefaultEquationSystemBuilder(), new GaussianNullspaceSolver());

  private static Stream<Arguments> equations() {
    return Stream.of(
        Arguments.of(List.of("P4O10", "H2O"), List.of("H3PO4"), List.of(1, 6), List.of(4)),
        Arguments.of(List.of("N2", "H2"), List.of("NH3"), List.of(1, 3), List.of(2)),
        Arguments.of(List.of("CH4", "Cl2"), List.of("CCl4", "H2"), List.of(1, 2), List.of(1, 2)),
        Arguments.of(List.of("CH3CH2OH", "O2"), List.of("CO2", "H2O"), List.of(1, 3), List.of(2, 3)),
        Arguments.of(List.of("KOH", "Co3(PO4)2"), List.of("K3PO4", "Co(OH)2"), List.of(6, 1), List.of(2, 3)),
        Arguments.of(List.of("C6H12O6", "O2"), List.of("CO2", "H2O"), List.of(1, 6), List.of(6, 6)),
        Arguments.of(List.of("Fe", "O2"), List.of("Fe2O3"), List.of(4, 3), List.of(2)),
        Arguments.of(List.of("K4Fe(CN)6", "KMnO4", "H2SO4"),
            List.of("KHSO4", "Fe2(SO4)3", "MnSO4", "HNO3", "CO2", "H2O"),
            List.of(10, 122, 299), List.of(162, 5, 122, 60, 60, 188))
    );
  }

  @ParameterizedTest
  @MethodSource("equations")
  void testBalance(List<String> inputs, List<String> outputs, List<Integer> expectedInputs,
                   List<Integer> expectedOutputs) {
    var balanced = balancer.balance(inputs, outputs);
    assertThat(balanced.inputCoefficients()).containsExactlyElementsOf(expectedInputs);
    assertThat(balanced.outputCoefficients()).containsExactlyElementsOf(expectedOutputs);
  }

  @ParameterizedTest
  @MethodSource("equations")
  void testBalancedEquationConservesAtoms(List<String> inputs, List<String> outputs) {
    var balanced = balancer.balance(inputs, outputs);
    List<AtomCount> inputCounts = counts(inputs);
    List<AtomCount> outputCounts = counts(outputs);

    Set<String> atoms = new TreeSet<>();
    inputCounts.forEach(count -> atoms.addAll(count.atoms()));
    for (String atom : atoms) {
      assertThat(total(atom, inputCounts, balanced.inputCoefficients()))
          .as("atom %s", atom)
          .isEqualTo(total(atom, outputCounts, balanced.outputCoefficients()));
    }
  }

  @ParameterizedTest
  @MethodSource("equations")
  void testCoefficientsArePositiveAndMinimal(List<String> inputs, List<String> outputs) {
    var balanced = balancer.balance(inputs, outputs);
    List<Integer> all = new ArrayList<>(balanced.inputCoefficients());
    all.addAll(balanced.outputCoefficients());

    assertThat(all).allMatch(coefficient -> coefficient > 0);
    BigInteger gcd = all.stream().map(BigInteger::valueOf).reduce(BigInteger.ZERO, BigInteger::gcd);
    assertThat(gcd).isEqualTo(BigInteger.ONE);
  }

  @ParameterizedTest
  @MethodSource("equations")
  void testBalanceIsIdempotent(List<String> inputs, List<String> outputs) {
    BalancedEquation first = balancer.balance(inputs, outputs);
    BalancedEquation second = balancer.balance(inputs, outputs);
    assertThat(second).isEqualTo(first);
  }

  @Test
  void testWhitespaceDoesNotChangeResult() {
    assertThat(balancer.balance(List.of("KOH", "Co3 (P O4) 2"), List.of("K3 P O4", "Co (O H)2")))
        .isEqualTo(balancer.balance(List.of("KOH", "Co3(PO4)2"), List.of("K3PO4", "Co(OH)2")));
  }

  @Test
  void testAtomMismatchIsPropagated() {
    assertThatThrownBy(() -> balancer.balance(List.of("Na"), List.of("Cl2")))
        .isInstanceOfSatisfying(AtomMismatchException.class, e -> {
          assertThat(e.getMissingFromLeft()).containsExactly("Cl");
          assertThat(e.getMissingFromRight()).containsExactly("Na");
        });
  }

  @Test
  void testParseErrorIsPropagated() {
    assertThatThrownBy(() -> balancer.balance(List.of("H2", "O2"), List.of("H2O)")))
        .isInstanceOf(FormulaParseException.class);
  }

  @Test
  void testUnbalanceableEquation() {
    assertThatThrownBy(() -> balancer.balance(List.of("H2O"), List.of("H2O2")))
        .isInstanceOf(NoSolutionException.class);
  }

  @Test
  void testAmbiguousEquation() {
    assertThatThrownBy(() -> balancer.balance(List.of("H2", "O2"), List.of("H2O", "H2O2")))
        .isInstanceOfSatisfying(AmbiguousSolutionException.class, e -> assertThat(e.getBasisSize()).isEqualTo(2));
  }

  @Test
  void testCountsBeyondLongRange() {
    var balanced = balancer.balance(List.of("(H9999999999)9999999999"), List.of("H99999999980000000001"));
    assertThat(balanced.inputCoefficients()).containsExactly(1);
    assertThat(balanced.outputCoefficients()).containsExactly(1);
  }

  @Test
  void testHugeCountsFailInsideTaxonomy() {
    // H count is odd, so the minimal solution is [2, count], far beyond an int
    assertThatThrownBy(() -> balancer.balance(List.of("(H9999999999)9999999999"), List.of("H2")))
        .isInstanceOf(NonIntegerResultException.class);
  }

  @Test
  void testDeeplyNestedFormula() {
    String formula = "(".repeat(65) + "H2" + ")1".repeat(65);
    var balanced = balancer.balance(List.of(formula), List.of("H2"));
    assertThat(balanced.inputCoefficients()).containsExactly(1);
    assertThat(balanced.outputCoefficients()).containsExactly(1);
  }

  @Test
  void testFormulaLongerThanThousandCharacters() {
    // C400H800O + O2 --> CO2 + H2O
    String fuel = "CH2".repeat(400) + "O";
    var balanced = balancer.balance(List.of(fuel, "O2"), List.of("CO2", "H2O"));
    assertThat(balanced.inputCoefficients()).containsExactly(2, 1199);
    assertThat(balanced.outputCoefficients()).containsExactly(800, 800);
  }

  @Test
  void testEmptySidesRejected() {
    assertThatThrownBy(() -> balancer.balance(List.of(), List.of("H2O")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> balancer.balance(List.of("H2O"), List.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> balancer.balance(null, List.of("H2O")))
        .isInstanceOf(NullPointerException.class);
  }

  private List<AtomCount> counts(List<String> formulas) {
    List<AtomCount> counts = new ArrayList<>();
    for (String formula : formulas) {
      counts.add(counter.countAtoms(parser.parse(formula)));
    }
    return counts;
  }

  private static BigInteger total(String atom, List<AtomCount> counts, List<Integer> coefficients) {
    var total = BigInteger.ZERO;
    for (int i = 0; i < counts.size(); i++) {
      total = total.add(counts.get(i).get(atom).multiply(BigInteger.valueOf(coefficients.get(i))));
    }
    return total;
  }
}
