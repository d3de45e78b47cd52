package com.profile.matching.llm;

/**
 * Which stage of the chain produced a reason.
 */
public enum ReasonSource {
    PRIMARY,
    SECONDARY,
    FALLBACK
}
