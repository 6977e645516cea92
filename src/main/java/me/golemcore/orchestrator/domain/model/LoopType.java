package me.golemcore.orchestrator.domain.model;

/**
 * Unproductive action pattern found in the trailing window of the action log.
 */
public enum LoopType {

    /**
     * Same action three times in a row.
     */
    REPETITION,

    /**
     * Two distinct actions cycling A-B-A-B-A.
     */
    ALTERNATION,

    /**
     * Same file-reading tool on the same path three times, varying only an
     * offset-like parameter.
     */
    PARAMETER_SIMILARITY,

    NONE
}
