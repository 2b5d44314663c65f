package com.quantori.ceb.core.configuration;

import com.quantori.ceb.api.service.EquationBalancer;
import com.quantori.ceb.core.balancer.DefaultEquationBalancer;
import com.quantori.ceb.core.counter.TreeAtomCounter;
import com.quantori.ceb.core.parser.RecursiveDescentFormulaParser;
import com.quantori.ceb.core.solver.GaussianNullspaceSolver;
import com.quantori.ceb.core.system.DefaultEquationSystemBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads balancer settings from the {@code balancer} section of the Typesafe configuration and wires the default
 * stage implementations. Defaults live in {@code reference.conf}, an {@code application.conf} or system properties
 * such as {@code -Dbalancer.parser.max-formula-length=4096} override them.
 */
@Slf4j
@UtilityClass
public class BalancerConfiguration {

  public static final String ROOT_PATH = "balancer";

  public static BalancerProperties loadProperties() {
    return loadProperties(ConfigFactory.load());
  }

  public static BalancerProperties loadProperties(Config config) {
    Config balancer = config.getConfig(ROOT_PATH);
    var properties = BalancerProperties.builder()
        .maxFormulaLength(balancer.getInt("parser.max-formula-length"))
        .maxGroupDepth(balancer.getInt("parser.max-group-depth"))
        .build();
    log.debug("Loaded balancer properties {}", properties);
    return properties;
  }

  public static EquationBalancer equationBalancer() {
    return equationBalancer(loadProperties());
  }

  public static EquationBalancer equationBalancer(BalancerProperties properties) {
    return new DefaultEquationBalancer(
        new RecursiveDescentFormulaParser(properties.getMaxFormulaLength(), properties.getMaxGroupDepth()),
        new TreeAtomCounter(),
        new DefaultEquationSystemBuilder(),
        new GaussianNullspaceSolver());
  }
}
