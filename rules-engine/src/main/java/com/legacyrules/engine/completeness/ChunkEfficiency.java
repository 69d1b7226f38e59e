package com.legacyrules.engine.completeness;

public record ChunkEfficiency(String chunkId, int extracted, int expected, double efficiency) {

  static final double GOOD_EFFICIENCY = 0.8d;

  public boolean isGood() {
    return efficiency >= GOOD_EFFICIENCY;
  }
}
