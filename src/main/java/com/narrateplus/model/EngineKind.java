package com.narrateplus.model;

/**
 * Speech generator families a tier can be rendered with.
 */
public enum EngineKind
{
    /**
     * Fast voice built into the host or bridge. Lowest quality, near-instant.
     */
    SYSTEM,

    KOKORO,

    PIPER
}
