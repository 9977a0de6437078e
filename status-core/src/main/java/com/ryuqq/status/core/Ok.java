package com.ryuqq.status.core;

/**
 * 성공 Status.
 *
 * <p>페이로드가 없으며 인스턴스는 하나만 존재합니다 ({@link Status#ok()}).
 * 생성, 복사, 확인 모두 할당이 발생하지 않습니다.</p>
 *
 * @author Status Team
 * @since 1.0.0
 */
public final class Ok implements Status {

    static final Ok INSTANCE = new Ok();

    private Ok() {
    }

    @Override
    public boolean isOk() {
        return true;
    }

    @Override
    public StatusCode code() {
        return StatusCode.OK;
    }

    @Override
    public String message() {
        return "";
    }

    @Override
    public int posixCode() {
        return NO_POSIX_CODE;
    }

    /**
     * 성공 Status에는 덧붙일 메시지가 없습니다.
     *
     * @throws IllegalStateException 항상
     */
    @Override
    public Status cloneAndPrepend(CharSequence extra) {
        throw new IllegalStateException("cannot prepend a message to an OK status");
    }

    /**
     * 성공 Status에는 덧붙일 메시지가 없습니다.
     *
     * @throws IllegalStateException 항상
     */
    @Override
    public Status cloneAndAppend(CharSequence extra) {
        throw new IllegalStateException("cannot append a message to an OK status");
    }

    @Override
    public String toString() {
        return StatusCode.OK.displayName();
    }
}
