package com.quantori.ceb.core.balancer;

import com.quantori.ceb.api.exception.BalancingException;
import com.quantori.ceb.api.model.AtomCount;
import com.quantori.ceb.api.model.BalancedEquation;
import com.quantori.ceb.api.model.CoefficientVector;
import com.quantori.ceb.api.model.EquationSystem;
import com.quantori.ceb.api.service.AtomCounter;
import com.quantori.ceb.api.service.EquationBalancer;
import com.quantori.ceb.api.service.EquationSystemBuilder;
import com.quantori.ceb.api.service.FormulaParser;
import com.quantori.ceb.api.service.NullspaceSolver;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Balances an equation by running the parsing, counting, system building and solving stages in order.
 * Errors of every stage reach the caller unchanged.
 */
@Slf4j
public class DefaultEquationBalancer implements EquationBalancer {

  private final FormulaParser parser;
  private final AtomCounter counter;
  private final EquationSystemBuilder systemBuilder;
  private final NullspaceSolver solver;

  public DefaultEquationBalancer(FormulaParser parser, AtomCounter counter, EquationSystemBuilder systemBuilder,
                                 NullspaceSolver solver) {
    this.parser = Objects.requireNonNull(parser);
    this.counter = Objects.requireNonNull(counter);
    this.systemBuilder = Objects.requireNonNull(systemBuilder);
    this.solver = Objects.requireNonNull(solver);
  }

  @Override
  public BalancedEquation balance(List<String> inputFormulas, List<String> outputFormulas) {
    Validate.notEmpty(inputFormulas, "At least one reactant is required");
    Validate.notEmpty(outputFormulas, "At least one product is required");
    try {
      List<AtomCount> inputCounts = count(inputFormulas);
      List<AtomCount> outputCounts = count(outputFormulas);
      EquationSystem system = systemBuilder.buildSystem(inputCounts, outputCounts);
      CoefficientVector coefficients = solver.solve(system.matrix());
      if (coefficients.size() != inputFormulas.size() + outputFormulas.size()) {
        throw new IllegalStateException("Solver returned " + coefficients.size() + " coefficients for "
            + (inputFormulas.size() + outputFormulas.size()) + " molecules");
      }
      BalancedEquation balanced = coefficients.split(inputFormulas.size());
      log.debug("Balanced {} -> {} with {}", inputFormulas, outputFormulas, balanced);
      return balanced;
    } catch (BalancingException e) {
      log.debug("Cannot balance {} -> {}: {}", inputFormulas, outputFormulas, e.getMessage());
      throw e;
    }
  }

  private List<AtomCount> count(List<String> formulas) {
    return formulas.stream()
        .map(parser::parse)
        .map(counter::countAtoms)
        .collect(Collectors.toList());
  }
}
