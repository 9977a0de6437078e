package com.ryuqq.status.testkit;

import com.ryuqq.status.core.Status;
import com.ryuqq.status.core.StatusCode;
import org.assertj.core.api.AbstractAssert;

/**
 * Status용 AssertJ Assertion.
 *
 * <p>실패 메시지에 {@link Status#toString()}을 그대로 포함하여 원인을 바로 확인할 수 있습니다.</p>
 *
 * @author Status Team
 * @since 1.0.0
 */
public class StatusAssert extends AbstractAssert<StatusAssert, Status> {

    /**
     * 생성자.
     *
     * @param actual 검증 대상 Status
     */
    public StatusAssert(Status actual) {
        super(actual, StatusAssert.class);
    }

    /**
     * 성공 Status인지 검증.
     *
     * @return this
     */
    public StatusAssert isOk() {
        isNotNull();
        if (!actual.isOk()) {
            failWithMessage("Expected status to be OK but was <%s>", actual);
        }
        return this;
    }

    /**
     * 실패 Status인지 검증.
     *
     * @return this
     */
    public StatusAssert isNotOk() {
        isNotNull();
        if (actual.isOk()) {
            failWithMessage("Expected status not to be OK");
        }
        return this;
    }

    /**
     * 코드 검증.
     *
     * @param expected 기대 코드
     * @return this
     */
    public StatusAssert hasCode(StatusCode expected) {
        isNotNull();
        if (actual.code() != expected) {
            failWithMessage("Expected status code <%s> but was <%s> (%s)", expected, actual.code(), actual);
        }
        return this;
    }

    /**
     * 메시지 부분 검증 (코드 이름, POSIX 코드 제외).
     *
     * @param expected 기대 메시지
     * @return this
     */
    public StatusAssert hasMessage(String expected) {
        isNotNull();
        if (!actual.message().equals(expected)) {
            failWithMessage("Expected status message <%s> but was <%s>", expected, actual.message());
        }
        return this;
    }

    public StatusAssert hasMessageContaining(String fragment) {
        isNotNull();
        if (!actual.message().contains(fragment)) {
            failWithMessage("Expected status message <%s> to contain <%s>", actual.message(), fragment);
        }
        return this;
    }

    /**
     * POSIX 코드 검증.
     *
     * @param expected 기대 POSIX 코드
     * @return this
     */
    public StatusAssert hasPosixCode(int expected) {
        isNotNull();
        if (actual.posixCode() != expected) {
            failWithMessage("Expected posix code <%s> but was <%s>", expected, actual.posixCode());
        }
        return this;
    }

    public StatusAssert hasNoPosixCode() {
        return hasPosixCode(Status.NO_POSIX_CODE);
    }
}
