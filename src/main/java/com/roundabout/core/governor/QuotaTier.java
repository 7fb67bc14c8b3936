package com.roundabout.core.governor;

public enum QuotaTier {
    FREE,
    PREMIUM,
    ENTERPRISE
}
