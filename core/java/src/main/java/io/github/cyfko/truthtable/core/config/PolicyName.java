package io.github.cyfko.truthtable.core.config;

/**
 * Names of the preset policies, reported in limit violation messages.
 */
public enum PolicyName {
    DEFAULT_POLICY,
    STRICT_POLICY,
    RELAXED_POLICY,
    CUSTOM_POLICY
}
