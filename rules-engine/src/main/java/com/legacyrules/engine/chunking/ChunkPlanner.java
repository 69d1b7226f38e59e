package com.legacyrules.engine.chunking;

import java.util.List;

interface ChunkPlanner {

  List<ChunkRange> plan(ChunkingContext context);
}
