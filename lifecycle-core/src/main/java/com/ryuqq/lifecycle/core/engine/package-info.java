/**
 * 이벤트 발생 엔진 패키지.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.core.engine;
