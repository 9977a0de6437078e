package com.ryuqq.status.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StatusCode Enum 테스트.
 *
 * @author Status Team
 * @since 1.0.0
 */
class StatusCodeTest {

    @Test
    void number_WireNumbersAreFixed() {
        // Then
        assertThat(StatusCode.OK.number()).isZero();
        assertThat(StatusCode.NOT_FOUND.number()).isEqualTo(1);
        assertThat(StatusCode.IO_ERROR.number()).isEqualTo(5);
        assertThat(StatusCode.NOT_AUTHORIZED.number()).isEqualTo(10);
        assertThat(StatusCode.CONFIGURATION_ERROR.number()).isEqualTo(16);
    }

    @Test
    void number_MatchesDeclarationOrder() {
        // 번호 = 선언 순서, 중간 삽입 시 wire 호환성이 깨짐
        for (StatusCode code : StatusCode.values()) {
            assertThat(code.number()).isEqualTo(code.ordinal());
        }
    }

    @Test
    void forNumber_EveryCode_RoundTrips() {
        for (StatusCode code : StatusCode.values()) {
            assertThat(StatusCode.forNumber(code.number())).isSameAs(code);
        }
    }

    @Test
    void forNumber_Unknown_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> StatusCode.forNumber(17))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("17");
        assertThatThrownBy(() -> StatusCode.forNumber(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void displayName_ReturnsHumanReadableName() {
        // Then
        assertThat(StatusCode.NOT_SUPPORTED.displayName()).isEqualTo("Not implemented");
        assertThat(StatusCode.IO_ERROR.displayName()).isEqualTo("IO error");
        assertThat(StatusCode.SERVICE_UNAVAILABLE.displayName()).isEqualTo("Service unavailable");
    }

    @Test
    void isOk_OnlyOkCode() {
        for (StatusCode code : StatusCode.values()) {
            assertThat(code.isOk()).isEqualTo(code == StatusCode.OK);
        }
    }

    @Test
    void values_ContainsAllCodes() {
        // Then
        assertThat(StatusCode.values()).hasSize(17);
    }
}
