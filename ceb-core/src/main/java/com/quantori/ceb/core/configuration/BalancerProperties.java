package com.quantori.ceb.core.configuration;

import lombok.Builder;
import lombok.Data;

@Builder
@Data
public class BalancerProperties {
  int maxFormulaLength;
  int maxGroupDepth;
}
