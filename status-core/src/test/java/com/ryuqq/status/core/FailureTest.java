package com.ryuqq.status.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Failure Record 테스트.
 *
 * @author Status Team
 * @since 1.0.0
 */
class FailureTest {

    @Test
    void constructor_ValidValues_CreatesFailure() {
        // When
        Failure failure = new Failure(StatusCode.CORRUPTION, "bad magic", Status.NO_POSIX_CODE);

        // Then
        assertEquals(StatusCode.CORRUPTION, failure.code());
        assertEquals("bad magic", failure.message());
        assertEquals(Status.NO_POSIX_CODE, failure.posixCode());
    }

    @Test
    void constructor_NullMessage_NormalizedToEmpty() {
        // When
        Failure failure = new Failure(StatusCode.ABORTED, null, 4);

        // Then
        assertEquals("", failure.message());
    }

    @Test
    void constructor_NullCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Failure(null, "message", Status.NO_POSIX_CODE)
        );
        assertTrue(exception.getMessage().contains("code cannot be null"));
    }

    @Test
    void constructor_OkCode_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new Failure(StatusCode.OK, "message", Status.NO_POSIX_CODE));
    }

    @Test
    void join_DelimiterOnlyWhenBothPresent() {
        // Then
        assertEquals("a: b", Failure.join("a", "b"));
        assertEquals("a", Failure.join("a", ""));
        assertEquals("b", Failure.join(null, "b"));
        assertEquals("", Failure.join("", null));
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        // Given
        Status first = Status.timedOut("scan", "", 110);
        Status second = Status.timedOut("scan", "", 110);

        // When & Then
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void equals_DifferentPosixCode_ReturnsFalse() {
        // Given
        Status first = Status.timedOut("scan", "", 110);
        Status second = Status.timedOut("scan");

        // When & Then
        assertNotEquals(first, second);
    }
}
