package com.ryuqq.status.support;

import org.slf4j.event.Level;

/**
 * StatusChecks 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>warnLevel: warnNotOk가 사용하는 로그 레벨 (기본 WARN)</li>
 *   <li>checkFailurePrefix: checkOk 실패 시 메시지 접두어 (기본 "Bad status")</li>
 * </ul>
 *
 * @author Status Team
 * @since 1.0.0
 * @param warnLevel warnNotOk 로그 레벨
 * @param checkFailurePrefix checkOk 실패 메시지 접두어 (비어있으면 안 됨)
 */
public record StatusLoggingConfig(Level warnLevel, String checkFailurePrefix) {

    /**
     * checkOk 기본 접두어.
     */
    public static final String DEFAULT_CHECK_FAILURE_PREFIX = "Bad status";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: warnLevel=WARN, checkFailurePrefix="Bad status"</p>
     */
    public StatusLoggingConfig() {
        this(Level.WARN, DEFAULT_CHECK_FAILURE_PREFIX);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StatusLoggingConfig {
        if (warnLevel == null) {
            throw new IllegalArgumentException("warnLevel cannot be null");
        }
        if (checkFailurePrefix == null || checkFailurePrefix.isBlank()) {
            throw new IllegalArgumentException("checkFailurePrefix cannot be null or blank");
        }
    }

    /**
     * warnLevel만 변경한 새 인스턴스 생성.
     *
     * @param warnLevel 새로운 로그 레벨
     * @return 새 StatusLoggingConfig 인스턴스
     */
    public StatusLoggingConfig withWarnLevel(Level warnLevel) {
        return new StatusLoggingConfig(warnLevel, this.checkFailurePrefix);
    }

    /**
     * checkFailurePrefix만 변경한 새 인스턴스 생성.
     *
     * @param checkFailurePrefix 새로운 접두어
     * @return 새 StatusLoggingConfig 인스턴스
     */
    public StatusLoggingConfig withCheckFailurePrefix(String checkFailurePrefix) {
        return new StatusLoggingConfig(this.warnLevel, checkFailurePrefix);
    }
}
