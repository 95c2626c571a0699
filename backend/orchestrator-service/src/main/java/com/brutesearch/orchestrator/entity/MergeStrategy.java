package com.brutesearch.orchestrator.entity;

/**
 * How per-source result lists are folded into one response.
 */
public enum MergeStrategy {
    APPEND,      // per-source lists kept as-is, no cross-source dedup
    DEDUP,       // first-seen URL wins
    RANKED,      // dedup, remembering every source that produced the URL
    INTERLEAVE   // round-robin by position across sources, dedup
}
