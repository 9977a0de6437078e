package com.ryuqq.status.testkit;

import com.ryuqq.status.core.Status;
import com.ryuqq.status.core.StatusCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.ryuqq.status.testkit.StatusAssertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StatusAssert 유닛 테스트.
 *
 * @author Status Team
 * @since 1.0.0
 */
@DisplayName("StatusAssert 테스트")
class StatusAssertTest {

    @Test
    @DisplayName("성공 Status는 isOk() 검증을 통과한다")
    void isOk_성공_통과() {
        assertThat(Status.ok()).isOk().hasCode(StatusCode.OK).hasMessage("").hasNoPosixCode();
    }

    @Test
    @DisplayName("실패 Status는 코드, 메시지, POSIX 코드 검증을 통과한다")
    void 실패_전체_필드_검증_통과() {
        // given
        Status status = Status.ioError("write failed", "/data/wal", 28);

        // then
        assertThat(status)
            .isNotOk()
            .hasCode(StatusCode.IO_ERROR)
            .hasMessage("write failed: /data/wal")
            .hasMessageContaining("/data/wal")
            .hasPosixCode(28);
    }

    @Test
    @DisplayName("실패 Status에 isOk()를 쓰면 toString이 포함된 메시지로 실패한다")
    void isOk_실패_Status면_AssertionError() {
        assertThatThrownBy(() -> assertThat(Status.notFound("key k1")).isOk())
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("Not found: key k1");
    }

    @Test
    @DisplayName("코드가 다르면 실패한다")
    void hasCode_불일치_AssertionError() {
        assertThatThrownBy(() -> assertThat(Status.aborted("stop")).hasCode(StatusCode.TIMED_OUT))
            .isInstanceOf(AssertionError.class)
            .hasMessageContaining("TIMED_OUT");
    }

    @Test
    @DisplayName("성공 Status에 isNotOk()를 쓰면 실패한다")
    void isNotOk_성공_Status면_AssertionError() {
        assertThatThrownBy(() -> assertThat(Status.ok()).isNotOk())
            .isInstanceOf(AssertionError.class);
    }

    @Test
    @DisplayName("null Status는 실패한다")
    void null_Status_AssertionError() {
        assertThatThrownBy(() -> assertThat((Status) null).isOk())
            .isInstanceOf(AssertionError.class);
    }
}
