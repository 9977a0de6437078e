package com.ryuqq.status.core;

/**
 * 실패 Status.
 *
 * <p>코드, 결합된 메시지, 선택적 POSIX 코드를 하나의 불변 객체로 소유합니다.
 * 생성 시점에 메시지를 복사하므로 호출자의 버퍼는 호출 이후 유지될 필요가 없습니다.</p>
 *
 * <p><strong>동등성:</strong> record 기본 규칙 (code, message, posixCode 모두 일치).</p>
 *
 * @param code 실패 코드 (OK 불가)
 * @param message 결합된 메시지 (null이면 빈 문자열)
 * @param posixCode POSIX 오류 번호, 없으면 {@link Status#NO_POSIX_CODE}
 *
 * @author Status Team
 * @since 1.0.0
 */
public record Failure(
    StatusCode code,
    String message,
    int posixCode
) implements Status {

    static final String DELIMITER = ": ";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 OK인 경우
     */
    public Failure {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (code.isOk()) {
            throw new IllegalArgumentException("code cannot be OK for a Failure");
        }
        if (message == null) {
            message = "";
        }
    }

    /**
     * 메시지와 보조 메시지를 결합하여 Failure 생성.
     *
     * @param code 실패 코드
     * @param message 메시지 (null 허용)
     * @param secondaryMessage 보조 메시지 (null 허용)
     * @param posixCode POSIX 코드
     * @return Failure 인스턴스
     * @throws IllegalArgumentException code가 null이거나 OK인 경우
     */
    public static Failure of(StatusCode code, CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return new Failure(code, join(message, secondaryMessage), posixCode);
    }

    @Override
    public boolean isOk() {
        return false;
    }

    @Override
    public Status cloneAndPrepend(CharSequence extra) {
        return new Failure(code, join(extra, message), posixCode);
    }

    @Override
    public Status cloneAndAppend(CharSequence extra) {
        return new Failure(code, join(message, extra), posixCode);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(code.displayName().length() + DELIMITER.length() + message.length() + 16);
        sb.append(code.displayName()).append(DELIMITER).append(message);
        if (posixCode != NO_POSIX_CODE) {
            sb.append(" (error ").append(posixCode).append(')');
        }
        return sb.toString();
    }

    static String join(CharSequence first, CharSequence second) {
        boolean hasFirst = first != null && first.length() > 0;
        boolean hasSecond = second != null && second.length() > 0;
        if (hasFirst && hasSecond) {
            return new StringBuilder(first.length() + DELIMITER.length() + second.length())
                .append(first)
                .append(DELIMITER)
                .append(second)
                .toString();
        }
        if (hasFirst) {
            return first.toString();
        }
        return hasSecond ? second.toString() : "";
    }
}
