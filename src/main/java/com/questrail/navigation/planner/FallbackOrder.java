package com.questrail.navigation.planner;

/**
 * Order of the two reversing candidates once both forward candidates are
 * blocked.
 */
public enum FallbackOrder
{
    /**
     * primary, secondary, reverse-secondary, reverse-primary.
     * <p>Turning sideways is tried before heading directly away from the goal.
     * This is the default.</p>
     */
    REVERSE_SECONDARY_FIRST,

    /**
     * primary, secondary, reverse-primary, reverse-secondary.
     */
    REVERSE_PRIMARY_FIRST
}
