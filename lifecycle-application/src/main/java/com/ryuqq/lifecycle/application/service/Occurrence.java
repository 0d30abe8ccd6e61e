package com.ryuqq.lifecycle.application.service;

/**
 * 이력에서 같은 상태 진입이 여러 번 있을 때 고를 항목.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Occurrence {

    /** 가장 이른 진입 */
    FIRST,

    /** 가장 최근 진입 */
    LAST
}
