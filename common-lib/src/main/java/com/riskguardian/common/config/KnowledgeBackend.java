package com.riskguardian.common.config;

/** Primary backend of the historical knowledge store. */
public enum KnowledgeBackend {
    /** Pattern-matching queries over the scenario fact graph, table fallback on failure. */
    GRAPH,
    /** Direct table lookups only. */
    TABLE
}
