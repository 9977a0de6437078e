package com.ryuqq.status.support;

import com.ryuqq.status.core.Status;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 실패 Status 조기 반환(early return) 헬퍼.
 *
 * <p>Status 값 위에 얹는 호출부 관례이며 로그를 남기지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Status openAll() {
 *     return StatusPropagation.returnNotOk(
 *         () -&gt; openWal(),
 *         () -&gt; StatusPropagation.prependIfNotOk(openMetadata(), "metadata"),
 *         () -&gt; replay()
 *     );
 * }
 * </pre>
 *
 * @author Status Team
 * @since 1.0.0
 */
public final class StatusPropagation {

    private StatusPropagation() {
    }

    /**
     * 단계를 순서대로 실행하고 첫 실패를 반환.
     *
     * <p>실패가 나오면 이후 단계는 실행하지 않습니다.</p>
     *
     * @param steps 실행할 단계들
     * @return 첫 실패 Status, 모두 성공이면 OK
     * @throws IllegalArgumentException 단계 또는 단계의 결과가 null인 경우
     */
    @SafeVarargs
    public static Status returnNotOk(Supplier<Status>... steps) {
        if (steps == null) {
            throw new IllegalArgumentException("steps cannot be null");
        }
        for (Supplier<Status> step : steps) {
            Status status = evaluate(step);
            if (!status.isOk()) {
                return status;
            }
        }
        return Status.ok();
    }

    /**
     * 첫 Status가 성공일 때만 다음 단계를 실행.
     *
     * @param first 이전 결과
     * @param next 다음 단계
     * @return first가 실패면 first, 아니면 next의 결과
     */
    public static Status andThen(Status first, Supplier<Status> next) {
        requireStatus(first);
        if (!first.isOk()) {
            return first;
        }
        return evaluate(next);
    }

    /**
     * 실패 Status에 문맥 메시지를 앞에 붙여 반환.
     *
     * <p>성공 Status는 그대로 통과합니다.</p>
     *
     * @param status 검사할 Status
     * @param context 앞에 붙일 메시지
     * @return status가 성공이면 status, 아니면 {@code status.cloneAndPrepend(context)}
     */
    public static Status prependIfNotOk(Status status, CharSequence context) {
        requireStatus(status);
        return status.isOk() ? status : status.cloneAndPrepend(context);
    }

    /**
     * 실패 Status를 다른 반환값으로 변환.
     *
     * <p>empty는 성공만을 의미하므로 실패를 null로 변환할 수 없습니다.</p>
     *
     * @param status 검사할 Status
     * @param mapper 실패 Status를 받아 반환값을 만드는 함수
     * @param <T> 반환값 타입
     * @return 실패면 변환값, 성공이면 empty
     * @throws IllegalArgumentException 실패 Status에 대해 mapper가 null을 반환한 경우
     */
    public static <T> Optional<T> mapFailure(Status status, Function<? super Status, ? extends T> mapper) {
        requireStatus(status);
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (status.isOk()) {
            return Optional.empty();
        }
        T mapped = mapper.apply(status);
        if (mapped == null) {
            throw new IllegalArgumentException("mapper returned null for " + status);
        }
        return Optional.of(mapped);
    }

    private static Status evaluate(Supplier<Status> step) {
        if (step == null) {
            throw new IllegalArgumentException("step cannot be null");
        }
        Status status = step.get();
        if (status == null) {
            throw new IllegalArgumentException("step returned null status");
        }
        return status;
    }

    private static void requireStatus(Status status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
    }
}
