package dev.shedqueue.api;

/**
 * Importance tiers, declared from least to most important so that the natural enum order
 * is the shedding order: a {@code SHEDDABLE} item gives up its slot before a {@code CRITICAL} one.
 */
public enum Criticality {
    /** Background or prefetch work; shed first. */
    SHEDDABLE,
    SHEDDABLE_PLUS,
    /** Default tier for user-facing requests. */
    CRITICAL,
    CRITICAL_PLUS
}
