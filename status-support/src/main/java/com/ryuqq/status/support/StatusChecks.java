package com.ryuqq.status.support;

import com.ryuqq.status.core.Status;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * 실패 Status를 로그로 남기는 호출부 헬퍼.
 *
 * <p><strong>제공 관례:</strong></p>
 * <ul>
 *   <li>warnNotOk: 실패면 경고 로그 후 계속 진행</li>
 *   <li>logAndReturn: 지정 레벨로 로그 후 그대로 반환</li>
 *   <li>checkOk: 실패면 ERROR 로그 후 {@link StatusException} (프로세스 중단 대신)</li>
 * </ul>
 *
 * <p>Status 자체는 로그를 남기지 않으므로 로깅 결정은 모두 이 클래스를 거칩니다.</p>
 *
 * @author Status Team
 * @since 1.0.0
 */
public final class StatusChecks {

    private static final Logger log = LoggerFactory.getLogger(StatusChecks.class);
    private static final StatusChecks DEFAULT = new StatusChecks(log, new StatusLoggingConfig());

    private final Logger logger;
    private final StatusLoggingConfig config;

    /**
     * 생성자.
     *
     * @param logger 로그를 남길 Logger (호출 클래스의 Logger 권장)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StatusChecks(Logger logger, StatusLoggingConfig config) {
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.logger = logger;
        this.config = config;
    }

    /**
     * 기본 Logger와 기본 설정을 사용하는 인스턴스.
     *
     * @return 공유 StatusChecks
     */
    public static StatusChecks defaults() {
        return DEFAULT;
    }

    /**
     * 실패면 {@code prefix + ": " + status}를 경고 레벨로 기록.
     *
     * @param status 검사할 Status
     * @param prefix 로그 접두어
     * @return status (그대로)
     */
    public Status warnNotOk(Status status, String prefix) {
        requireStatus(status);
        if (!status.isOk()) {
            write(config.warnLevel(), prefix + ": " + status);
        }
        return status;
    }

    /**
     * Status를 지정 레벨로 기록하고 그대로 반환.
     *
     * @param level 로그 레벨
     * @param status 기록할 Status
     * @return status (그대로)
     */
    public Status logAndReturn(Level level, Status status) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        requireStatus(status);
        write(level, status.toString());
        return status;
    }

    /**
     * Status가 반드시 성공이어야 하는 지점의 검사.
     *
     * @param status 검사할 Status
     * @throws StatusException 실패인 경우
     */
    public void checkOk(Status status) {
        checkOkPrepend(status, config.checkFailurePrefix());
    }

    /**
     * 접두어를 지정한 {@link #checkOk(Status)}.
     *
     * @param status 검사할 Status
     * @param message 실패 메시지 접두어
     * @throws StatusException 실패인 경우
     */
    public void checkOkPrepend(Status status, String message) {
        requireStatus(status);
        if (status.isOk()) {
            return;
        }
        String text = message + ": " + status;
        logger.error(text);
        throw new StatusException(text, status);
    }

    // atLevel()은 default 메서드라 mock Logger에서 null을 반환하므로 레벨별 메서드를 직접 호출
    private void write(Level level, String text) {
        switch (level) {
            case ERROR -> logger.error(text);
            case WARN -> logger.warn(text);
            case INFO -> logger.info(text);
            case DEBUG -> logger.debug(text);
            case TRACE -> logger.trace(text);
        }
    }

    private static void requireStatus(Status status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }
}
