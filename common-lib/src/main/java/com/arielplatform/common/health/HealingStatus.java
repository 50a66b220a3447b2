package com.arielplatform.common.health;

/**
 * <ul>
 *   <li>{@link #HEALTHY}: nothing diagnosed, nothing done</li>
 *   <li>{@link #HEALING_PERFORMED}: at least one strategy ran</li>
 *   <li>{@link #NO_SUITABLE_HEALING_STRATEGY}: issues existed but none matched a strategy</li>
 * </ul>
 */
public enum HealingStatus {
    HEALTHY,
    HEALING_PERFORMED,
    NO_SUITABLE_HEALING_STRATEGY
}
