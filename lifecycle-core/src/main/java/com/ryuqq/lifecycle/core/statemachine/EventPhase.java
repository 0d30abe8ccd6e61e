package com.ryuqq.lifecycle.core.statemachine;

/**
 * Event 콜백 단계.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum EventPhase {

    /**
     * 상태 콜백(before_exit, before_enter) 이후, 상태 적용 이전.
     */
    BEFORE,

    /**
     * 상태 콜백(after_exit, after_enter) 이후, 커밋 이전.
     */
    AFTER
}
