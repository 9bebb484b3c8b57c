package com.nexus.resolution.core.model;

/**
 * Independent similarity signals combined into an aggregate score.
 */
public enum SignalType {
    STRING,
    PHONETIC,
    ALIAS,
    EMBEDDING
}
