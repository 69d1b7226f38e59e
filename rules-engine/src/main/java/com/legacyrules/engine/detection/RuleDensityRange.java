package com.legacyrules.engine.detection;

public record RuleDensityRange(int expectedMin, int expectedMax) {

  public RuleDensityRange {
    expectedMin = Math.max(0, expectedMin);
    expectedMax = Math.max(expectedMin, expectedMax);
  }
}
