package com.ryuqq.status.support;

import com.ryuqq.status.core.Status;

/**
 * 반드시 성공해야 하는 Status가 실패했을 때 던지는 예외.
 *
 * <p>{@link StatusChecks#checkOk(Status)} 계열에서만 사용됩니다.
 * 실패 Status를 그대로 보관하므로 호출자가 코드별로 분기할 수 있습니다.</p>
 *
 * @author Status Team
 * @since 1.0.0
 */
public class StatusException extends RuntimeException {

    private final transient Status status;

    /**
     * 생성자.
     *
     * @param message 예외 메시지
     * @param status 실패 Status
     * @throws IllegalArgumentException status가 null이거나 성공인 경우
     */
    public StatusException(String message, Status status) {
        super(message);
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status.isOk()) {
            throw new IllegalArgumentException("status cannot be OK");
        }
        this.status = status;
    }

    /**
     * 실패 Status 조회.
     *
     * @return 실패 Status
     */
    public Status getStatus() {
        return status;
    }
}
