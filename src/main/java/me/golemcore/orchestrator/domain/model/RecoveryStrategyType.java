package me.golemcore.orchestrator.domain.model;

/**
 * Category of alternative action recommended after a failure.
 */
public enum RecoveryStrategyType {
    RETRY, SEARCH_FIRST, BROADEN_SEARCH, ASK_USER, SKIP, ABORT
}
