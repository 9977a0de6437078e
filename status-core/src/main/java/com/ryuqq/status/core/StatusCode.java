package com.ryuqq.status.core;

/**
 * Status의 실패 분류 코드.
 *
 * <p>{@link #OK}는 성공 표시이며 {@link Failure} 페이로드로 만들어지지 않습니다.
 * 나머지 상수는 닫힌 실패 분류입니다.</p>
 *
 * <p><strong>Wire 번호:</strong></p>
 * <ul>
 *   <li>각 상수의 {@link #number()}는 네트워크 프로토콜에서 전송되는 정수 코드입니다</li>
 *   <li>번호는 고정이며 재배치 불가 (새 코드는 끝에만 추가)</li>
 *   <li>프로토콜 정의 쪽 번호와 반드시 동기화해야 합니다</li>
 * </ul>
 *
 * @author Status Team
 * @since 1.0.0
 */
public enum StatusCode {

    /**
     * 성공.
     */
    OK(0, "OK"),

    NOT_FOUND(1, "Not found"),
    CORRUPTION(2, "Corruption"),
    NOT_SUPPORTED(3, "Not implemented"),
    INVALID_ARGUMENT(4, "Invalid argument"),
    IO_ERROR(5, "IO error"),
    ALREADY_PRESENT(6, "Already present"),
    RUNTIME_ERROR(7, "Runtime error"),
    NETWORK_ERROR(8, "Network error"),
    ILLEGAL_STATE(9, "Illegal state"),
    NOT_AUTHORIZED(10, "Not authorized"),
    ABORTED(11, "Aborted"),
    REMOTE_ERROR(12, "Remote error"),
    SERVICE_UNAVAILABLE(13, "Service unavailable"),
    TIMED_OUT(14, "Timed out"),
    UNINITIALIZED(15, "Uninitialized"),
    CONFIGURATION_ERROR(16, "Configuration error");

    private static final StatusCode[] BY_NUMBER = new StatusCode[values().length];

    static {
        for (StatusCode code : values()) {
            BY_NUMBER[code.number] = code;
        }
    }

    private final int number;
    private final String displayName;

    StatusCode(int number, String displayName) {
        this.number = number;
        this.displayName = displayName;
    }

    /**
     * Wire 번호 조회.
     *
     * @return 고정 정수 코드 (OK = 0)
     */
    public int number() {
        return number;
    }

    /**
     * 사람이 읽을 수 있는 코드 이름.
     *
     * <p>{@link Status#toString()}의 앞부분으로 사용됩니다 (예: "Not found").</p>
     *
     * @return 표시 이름
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 성공 코드인지 확인.
     *
     * @return OK인 경우 true
     */
    public boolean isOk() {
        return this == OK;
    }

    /**
     * Wire 번호로 코드 조회.
     *
     * @param number wire 번호
     * @return 해당 StatusCode
     * @throws IllegalArgumentException 알 수 없는 번호인 경우
     */
    public static StatusCode forNumber(int number) {
        if (number < 0 || number >= BY_NUMBER.length) {
            throw new IllegalArgumentException("Unknown status code number: " + number);
        }
        return BY_NUMBER[number];
    }
}
