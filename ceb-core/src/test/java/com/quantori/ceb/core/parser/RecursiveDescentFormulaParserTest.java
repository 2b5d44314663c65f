package com.quantori.ceb.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantori.ceb.api.exception.FormulaParseException;
import com.quantori.ceb.api.model.Group;
import com.quantori.ceb.api.model.Molecule;
import com.quantori.ceb.api.model.RepeatedAtom;
import com.quantori.ceb.api.model.SingleAtom;
import java.math.BigInteger;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class RecursiveDescentFormulaParserTest {

  private final RecursiveDescentFormulaParser parser = new RecursiveDescentFormulaParser();

  @Test
  void testParseSimpleMolecule() {
    assertThat(parser.parse("H2O")).isEqualTo(
        new Molecule(List.of(new RepeatedAtom("H", 2), new SingleAtom("O"))));
  }

  @Test
  void testParseTwoLetterSymbols() {
    assertThat(parser.parse("NaCl")).isEqualTo(
        new Molecule(List.of(new SingleAtom("Na"), new SingleAtom("Cl"))));
  }

  @Test
  void testParseGroup() {
    assertThat(parser.parse("Mg(OH)2")).isEqualTo(
        new Molecule(List.of(
            new SingleAtom("Mg"),
            new Group(List.of(new SingleAtom("O"), new SingleAtom("H")), 2))));
  }

  @Test
  void testParseNestedGroups() {
    assertThat(parser.parse("Co3(Fe(CN)6)2")).isEqualTo(
        new Molecule(List.of(
            new RepeatedAtom("Co", 3),
            new Group(List.of(
                new SingleAtom("Fe"),
                new Group(List.of(new SingleAtom("C"), new SingleAtom("N")), 6)), 2))));
  }

  @Test
  void testWhitespaceBetweenTokensIsIgnored() {
    assertThat(parser.parse(" Mg ( O H ) 2 ")).isEqualTo(parser.parse("Mg(OH)2"));
    assertThat(parser.parse("H 2\tO")).isEqualTo(parser.parse("H2O"));
  }

  @Test
  void testMultiDigitCounts() {
    assertThat(parser.parse("C13H18O2")).isEqualTo(
        new Molecule(List.of(new RepeatedAtom("C", 13), new RepeatedAtom("H", 18), new RepeatedAtom("O", 2))));
  }

  private static Stream<Arguments> malformedFormulas() {
    return Stream.of(
        Arguments.of("", 0),
        Arguments.of("   ", 3),
        Arguments.of("h2o", 0),
        Arguments.of("N a", 2),
        Arguments.of("H2O+", 3),
        Arguments.of("Mg(OH", 2),
        Arguments.of("Mg(OH)", 6),
        Arguments.of("Mg(OH)x", 6),
        Arguments.of("H2O)", 3),
        Arguments.of("()2", 1),
        Arguments.of("(2)3", 1),
        Arguments.of("2H", 0),
        Arguments.of("H2 3", 3),
        Arguments.of("H0", 1),
        Arguments.of("(OH)0", 4)
    );
  }

  @ParameterizedTest
  @MethodSource("malformedFormulas")
  void testMalformedFormulaReportsPosition(String formula, int position) {
    assertThatThrownBy(() -> parser.parse(formula))
        .isInstanceOfSatisfying(FormulaParseException.class, e -> {
          assertThat(e.getFormula()).isEqualTo(formula);
          assertThat(e.getPosition()).isEqualTo(position);
        });
  }

  @Test
  void testErrorMessages() {
    assertThatThrownBy(() -> parser.parse("Mg(OH)")).hasMessageContaining("missing group multiplier");
    assertThatThrownBy(() -> parser.parse("Mg(OH")).hasMessageContaining("unmatched '('");
    assertThatThrownBy(() -> parser.parse("H2O)")).hasMessageContaining("unmatched ')'");
    assertThatThrownBy(() -> parser.parse("()2")).hasMessageContaining("empty group");
  }

  @Test
  void testCountsOfAnySize() {
    assertThat(parser.parse("H99999999999999999999")).isEqualTo(
        new Molecule(List.of(new RepeatedAtom("H", new BigInteger("99999999999999999999")))));
  }

  @Test
  void testDeepNestingParsesWithoutLimit() {
    String formula = "(".repeat(200) + "H" + ")2".repeat(200);
    var molecule = parser.parse(formula);
    assertThat(molecule.children()).hasSize(1).first().isInstanceOf(Group.class);
  }

  @Test
  void testLongFormulaParsesWithoutLimit() {
    String formula = "CH2".repeat(400) + "O";
    assertThat(formula).hasSizeGreaterThan(1024);
    assertThat(parser.parse(formula).children()).hasSize(801);
  }

  @Test
  void testNegativeLimitsRejected() {
    assertThatThrownBy(() -> new RecursiveDescentFormulaParser(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new RecursiveDescentFormulaParser(0, -1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testFormulaLengthLimit() {
    var limited = new RecursiveDescentFormulaParser(5, RecursiveDescentFormulaParser.UNLIMITED);
    assertThat(limited.parse("NaCl")).isNotNull();
    assertThatThrownBy(() -> limited.parse("C6H12O6"))
        .isInstanceOfSatisfying(FormulaParseException.class, e -> assertThat(e.getPosition()).isEqualTo(5));
  }

  @Test
  void testGroupDepthLimit() {
    var limited = new RecursiveDescentFormulaParser(RecursiveDescentFormulaParser.UNLIMITED, 2);
    assertThat(limited.parse("((H)2)2")).isNotNull();
    assertThatThrownBy(() -> limited.parse("(((H)2)2)2"))
        .isInstanceOfSatisfying(FormulaParseException.class, e -> assertThat(e.getPosition()).isEqualTo(2));
  }

  @Test
  void testNullFormulaRejected() {
    assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(NullPointerException.class);
  }
}
