package com.ryuqq.status.testkit;

import com.ryuqq.status.core.Status;

/**
 * StatusAssert 진입점.
 *
 * <pre>
 * import static com.ryuqq.status.testkit.StatusAssertions.assertThat;
 *
 * assertThat(store.open(path)).isNotOk().hasCode(StatusCode.NOT_FOUND);
 * </pre>
 *
 * @author Status Team
 * @since 1.0.0
 */
public final class StatusAssertions {

    private StatusAssertions() {
    }

    /**
     * Status Assertion 생성.
     *
     * @param actual 검증 대상
     * @return StatusAssert
     */
    public static StatusAssert assertThat(Status actual) {
        return new StatusAssert(actual);
    }
}
