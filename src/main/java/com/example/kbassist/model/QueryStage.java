package com.example.kbassist.model;

/** States a single query moves through. */
public enum QueryStage {
  EMBEDDING,
  RETRIEVING,
  GENERATING,
  GROUNDING,
  CITING,
  UNKNOWN_EXIT,
  FAILED,
  PERSISTING,
  DONE
}
