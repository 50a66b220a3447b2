package com.arielplatform.common.incentive;

public enum IncentiveKind {
    REWARD,
    PENALTY
}
