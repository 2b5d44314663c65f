package com.quantori.ceb.core.format;

import com.quantori.ceb.api.model.BalancedEquation;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.experimental.UtilityClass;
import org.apache.commons.lang3.Validate;

/**
 * Renders balanced equations as {@code 2H2 + O2 --> 2H2O}. A coefficient of one is not printed.
 */
@UtilityClass
public class EquationFormatter {

  public static final String ARROW = " --> ";
  public static final String PLUS = " + ";

  public static String format(List<String> inputFormulas, List<String> outputFormulas, BalancedEquation balanced) {
    Objects.requireNonNull(balanced);
    return format(inputFormulas, balanced.inputCoefficients(), outputFormulas, balanced.outputCoefficients());
  }

  public static String format(List<String> inputFormulas, List<Integer> inputCoefficients,
                              List<String> outputFormulas, List<Integer> outputCoefficients) {
    return side(inputFormulas, inputCoefficients) + ARROW + side(outputFormulas, outputCoefficients);
  }

  /**
   * Renders one side of an equation.
   *
   * @param formulas     molecule formulas
   * @param coefficients one coefficient per formula
   * @return terms joined by {@value #PLUS}
   */
  public static String side(List<String> formulas, List<Integer> coefficients) {
    Objects.requireNonNull(formulas);
    Objects.requireNonNull(coefficients);
    Validate.isTrue(formulas.size() == coefficients.size(), "%d formulas but %d coefficients", formulas.size(),
        coefficients.size());
    return IntStream.range(0, formulas.size())
        .mapToObj(i -> term(coefficients.get(i), formulas.get(i)))
        .collect(Collectors.joining(PLUS));
  }

  private static String term(int coefficient, String formula) {
    return coefficient == 1 ? formula : coefficient + formula;
  }
}
