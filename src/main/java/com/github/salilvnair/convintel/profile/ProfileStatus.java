package com.github.salilvnair.convintel.profile;

public enum ProfileStatus {
    ACTIVE,
    /** Folded into another profile by a merge; kept for audit, never returned by lookups. */
    RETIRED
}
