package com.ryuqq.status.core;

/**
 * Operation 실행 결과 값.
 *
 * <p>Status는 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Ok}: 무조건적 성공 (페이로드 없음, 공유 인스턴스)</li>
 *   <li>{@link Failure}: 분류된 실패 (코드, 메시지, 선택적 POSIX 코드)</li>
 * </ul>
 *
 * <p>예외 대신 반환값으로 실패를 전파하기 위한 타입입니다.
 * Status 자체는 예외를 던지거나 로그를 남기지 않습니다.</p>
 *
 * <p><strong>메시지 결합 규칙:</strong></p>
 * <ul>
 *   <li>message와 secondaryMessage가 모두 비어있지 않으면 {@code ": "}로 결합</li>
 *   <li>한쪽만 비어있지 않으면 그 쪽만 사용</li>
 *   <li>null은 빈 문자열로 취급</li>
 * </ul>
 *
 * <p><strong>불변성 / 스레드 안전성:</strong></p>
 * <ul>
 *   <li>모든 구현은 불변이므로 참조 복사가 곧 깊은 복사와 동일합니다</li>
 *   <li>여러 스레드가 같은 인스턴스를 동기화 없이 읽을 수 있습니다</li>
 *   <li>Status를 담은 필드를 교체하는 쪽은 호출자가 동기화해야 합니다</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Status s = store.open(path);
 * if (!s.isOk()) {
 *     return s.cloneAndPrepend("open " + path);
 * }
 * </pre>
 *
 * @author Status Team
 * @since 1.0.0
 */
public sealed interface Status permits Ok, Failure {

    /**
     * POSIX 코드가 없음을 나타내는 값.
     */
    int NO_POSIX_CODE = -1;

    /**
     * 성공 Status.
     *
     * <p>항상 동일한 공유 인스턴스를 반환하며 할당이 발생하지 않습니다.</p>
     *
     * @return Ok 인스턴스
     */
    static Status ok() {
        return Ok.INSTANCE;
    }

    /**
     * 임의 코드의 실패 Status 생성.
     *
     * @param code 실패 코드 (OK 불가)
     * @param message 메시지 (null 허용)
     * @param secondaryMessage 보조 메시지 (null 허용)
     * @param posixCode POSIX 코드 ({@link #NO_POSIX_CODE}이면 없음)
     * @return Failure 인스턴스
     * @throws IllegalArgumentException code가 null이거나 OK인 경우
     */
    static Status of(StatusCode code, CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(code, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#NOT_FOUND} 실패 생성.
     *
     * @param message 메시지
     * @return Failure 인스턴스
     */
    static Status notFound(CharSequence message) {
        return Failure.of(StatusCode.NOT_FOUND, message, null, NO_POSIX_CODE);
    }

    /**
     * {@link StatusCode#NOT_FOUND} 실패 생성 (보조 메시지 포함).
     *
     * @param message 메시지
     * @param secondaryMessage 보조 메시지, {@code ": "} 뒤에 결합됨
     * @return Failure 인스턴스
     */
    static Status notFound(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.NOT_FOUND, message, secondaryMessage, NO_POSIX_CODE);
    }

    /**
     * {@link StatusCode#NOT_FOUND} 실패 생성 (보조 메시지, POSIX 코드 포함).
     *
     * @param message 메시지
     * @param secondaryMessage 보조 메시지
     * @param posixCode POSIX 오류 번호 (예: errno)
     * @return Failure 인스턴스
     */
    static Status notFound(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.NOT_FOUND, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#CORRUPTION} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status corruption(CharSequence message) {
        return Failure.of(StatusCode.CORRUPTION, message, null, NO_POSIX_CODE);
    }

    static Status corruption(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.CORRUPTION, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status corruption(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.CORRUPTION, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#NOT_SUPPORTED} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status notSupported(CharSequence message) {
        return Failure.of(StatusCode.NOT_SUPPORTED, message, null, NO_POSIX_CODE);
    }

    static Status notSupported(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.NOT_SUPPORTED, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status notSupported(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.NOT_SUPPORTED, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#INVALID_ARGUMENT} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status invalidArgument(CharSequence message) {
        return Failure.of(StatusCode.INVALID_ARGUMENT, message, null, NO_POSIX_CODE);
    }

    static Status invalidArgument(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.INVALID_ARGUMENT, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status invalidArgument(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.INVALID_ARGUMENT, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#IO_ERROR} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status ioError(CharSequence message) {
        return Failure.of(StatusCode.IO_ERROR, message, null, NO_POSIX_CODE);
    }

    static Status ioError(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.IO_ERROR, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status ioError(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.IO_ERROR, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#ALREADY_PRESENT} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status alreadyPresent(CharSequence message) {
        return Failure.of(StatusCode.ALREADY_PRESENT, message, null, NO_POSIX_CODE);
    }

    static Status alreadyPresent(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.ALREADY_PRESENT, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status alreadyPresent(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.ALREADY_PRESENT, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#RUNTIME_ERROR} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status runtimeError(CharSequence message) {
        return Failure.of(StatusCode.RUNTIME_ERROR, message, null, NO_POSIX_CODE);
    }

    static Status runtimeError(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.RUNTIME_ERROR, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status runtimeError(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.RUNTIME_ERROR, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#NETWORK_ERROR} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status networkError(CharSequence message) {
        return Failure.of(StatusCode.NETWORK_ERROR, message, null, NO_POSIX_CODE);
    }

    static Status networkError(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.NETWORK_ERROR, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status networkError(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.NETWORK_ERROR, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#ILLEGAL_STATE} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status illegalState(CharSequence message) {
        return Failure.of(StatusCode.ILLEGAL_STATE, message, null, NO_POSIX_CODE);
    }

    static Status illegalState(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.ILLEGAL_STATE, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status illegalState(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.ILLEGAL_STATE, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#NOT_AUTHORIZED} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status notAuthorized(CharSequence message) {
        return Failure.of(StatusCode.NOT_AUTHORIZED, message, null, NO_POSIX_CODE);
    }

    static Status notAuthorized(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.NOT_AUTHORIZED, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status notAuthorized(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.NOT_AUTHORIZED, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#ABORTED} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status aborted(CharSequence message) {
        return Failure.of(StatusCode.ABORTED, message, null, NO_POSIX_CODE);
    }

    static Status aborted(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.ABORTED, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status aborted(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.ABORTED, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#REMOTE_ERROR} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status remoteError(CharSequence message) {
        return Failure.of(StatusCode.REMOTE_ERROR, message, null, NO_POSIX_CODE);
    }

    static Status remoteError(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.REMOTE_ERROR, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status remoteError(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.REMOTE_ERROR, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#SERVICE_UNAVAILABLE} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status serviceUnavailable(CharSequence message) {
        return Failure.of(StatusCode.SERVICE_UNAVAILABLE, message, null, NO_POSIX_CODE);
    }

    static Status serviceUnavailable(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.SERVICE_UNAVAILABLE, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status serviceUnavailable(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.SERVICE_UNAVAILABLE, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#TIMED_OUT} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status timedOut(CharSequence message) {
        return Failure.of(StatusCode.TIMED_OUT, message, null, NO_POSIX_CODE);
    }

    static Status timedOut(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.TIMED_OUT, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status timedOut(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.TIMED_OUT, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#UNINITIALIZED} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status uninitialized(CharSequence message) {
        return Failure.of(StatusCode.UNINITIALIZED, message, null, NO_POSIX_CODE);
    }

    static Status uninitialized(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.UNINITIALIZED, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status uninitialized(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.UNINITIALIZED, message, secondaryMessage, posixCode);
    }

    /**
     * {@link StatusCode#CONFIGURATION_ERROR} 실패 생성.
     *
     * @see #notFound(CharSequence, CharSequence, int)
     */
    static Status configurationError(CharSequence message) {
        return Failure.of(StatusCode.CONFIGURATION_ERROR, message, null, NO_POSIX_CODE);
    }

    static Status configurationError(CharSequence message, CharSequence secondaryMessage) {
        return Failure.of(StatusCode.CONFIGURATION_ERROR, message, secondaryMessage, NO_POSIX_CODE);
    }

    static Status configurationError(CharSequence message, CharSequence secondaryMessage, int posixCode) {
        return Failure.of(StatusCode.CONFIGURATION_ERROR, message, secondaryMessage, posixCode);
    }

    /**
     * 성공 여부 확인.
     *
     * @return 페이로드가 없으면 true
     */
    boolean isOk();

    /**
     * 분류 코드 조회.
     *
     * @return 성공이면 {@link StatusCode#OK}
     */
    StatusCode code();

    /**
     * 메시지 부분만 조회.
     *
     * <p>코드 이름이나 POSIX 코드는 포함하지 않습니다.</p>
     *
     * @return 결합된 메시지 (성공이면 빈 문자열)
     */
    String message();

    /**
     * POSIX 오류 번호 조회.
     *
     * @return 저장된 코드, 없거나 성공이면 {@link #NO_POSIX_CODE}
     */
    int posixCode();

    /**
     * POSIX 코드 존재 여부.
     *
     * @return posixCode가 {@link #NO_POSIX_CODE}가 아니면 true
     */
    default boolean hasPosixCode() {
        return posixCode() != NO_POSIX_CODE;
    }

    /**
     * 코드 표시 이름만 반환 (메시지, POSIX 코드 제외).
     *
     * @return 예: "OK", "Not found"
     */
    default String codeAsString() {
        return code().displayName();
    }

    /**
     * 같은 코드와 POSIX 코드를 유지하고 메시지 앞에 문맥을 덧붙인 새 Status 생성.
     *
     * <p>결과 메시지: {@code extra + ": " + message()}</p>
     *
     * <p><strong>전제 조건:</strong> 실패 Status에서만 호출해야 합니다.
     * 호출 전에 {@link #isOk()}로 확인하세요.</p>
     *
     * @param extra 앞에 붙일 메시지
     * @return 새 Failure 인스턴스
     * @throws IllegalStateException 성공 Status에서 호출한 경우
     */
    Status cloneAndPrepend(CharSequence extra);

    /**
     * 같은 코드와 POSIX 코드를 유지하고 메시지 뒤에 내용을 덧붙인 새 Status 생성.
     *
     * <p>결과 메시지: {@code message() + ": " + extra}</p>
     *
     * @param extra 뒤에 붙일 메시지
     * @return 새 Failure 인스턴스
     * @throws IllegalStateException 성공 Status에서 호출한 경우
     */
    Status cloneAndAppend(CharSequence extra);

    /**
     * 진단용 문자열 표현.
     *
     * <p>성공이면 {@code "OK"}, 실패면 {@code "<코드 이름>: <메시지>"}이며
     * POSIX 코드가 있으면 {@code " (error <code>)"}가 붙습니다.</p>
     *
     * @return 문자열 표현
     */
    @Override
    String toString();

    /**
     * {@link StatusCode#NOT_FOUND} 실패인지 확인.
     *
     * <p>아래 is* 메서드는 모두 같은 규칙입니다: 성공이면 항상 false.</p>
     *
     * @return 코드가 일치하면 true
     */
    default boolean isNotFound() {
        return code() == StatusCode.NOT_FOUND;
    }

    default boolean isCorruption() {
        return code() == StatusCode.CORRUPTION;
    }

    default boolean isNotSupported() {
        return code() == StatusCode.NOT_SUPPORTED;
    }

    default boolean isInvalidArgument() {
        return code() == StatusCode.INVALID_ARGUMENT;
    }

    default boolean isIoError() {
        return code() == StatusCode.IO_ERROR;
    }

    default boolean isAlreadyPresent() {
        return code() == StatusCode.ALREADY_PRESENT;
    }

    default boolean isRuntimeError() {
        return code() == StatusCode.RUNTIME_ERROR;
    }

    default boolean isNetworkError() {
        return code() == StatusCode.NETWORK_ERROR;
    }

    default boolean isIllegalState() {
        return code() == StatusCode.ILLEGAL_STATE;
    }

    default boolean isNotAuthorized() {
        return code() == StatusCode.NOT_AUTHORIZED;
    }

    default boolean isAborted() {
        return code() == StatusCode.ABORTED;
    }

    default boolean isRemoteError() {
        return code() == StatusCode.REMOTE_ERROR;
    }

    default boolean isServiceUnavailable() {
        return code() == StatusCode.SERVICE_UNAVAILABLE;
    }

    default boolean isTimedOut() {
        return code() == StatusCode.TIMED_OUT;
    }

    default boolean isUninitialized() {
        return code() == StatusCode.UNINITIALIZED;
    }

    default boolean isConfigurationError() {
        return code() == StatusCode.CONFIGURATION_ERROR;
    }
}
