package com.ryuqq.status.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Status 동시 읽기 테스트.
 *
 * <p>같은 인스턴스를 여러 스레드가 동기화 없이 읽어도 항상 같은 값을 관찰해야 합니다.</p>
 *
 * @author Status Team
 * @since 1.0.0
 */
class StatusConcurrencyTest {

    private static final int THREADS = 8;
    private static final int READS_PER_THREAD = 10_000;

    @Test
    void 여러_스레드가_같은_Failure를_읽으면_모두_같은_값() throws Exception {
        // given
        Status shared = Status.ioError("write failed", "/data/wal", 28);
        String expectedString = "IO error: write failed: /data/wal (error 28)";
        ExecutorService executorService = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < THREADS; t++) {
            futures.add(executorService.submit(() -> {
                start.await();
                int mismatches = 0;
                for (int i = 0; i < READS_PER_THREAD; i++) {
                    if (!expectedString.equals(shared.toString())
                        || !"write failed: /data/wal".equals(shared.message())
                        || shared.posixCode() != 28
                        || !shared.isIoError()) {
                        mismatches++;
                    }
                }
                return mismatches;
            }));
        }
        start.countDown();

        // then
        for (Future<Integer> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS)).isZero();
        }
        executorService.shutdown();
        assertThat(executorService.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void 여러_스레드의_ok_호출은_항상_같은_인스턴스() throws Exception {
        // given
        ExecutorService executorService = Executors.newFixedThreadPool(THREADS);
        List<Future<Status>> futures = new ArrayList<>();

        // when
        for (int t = 0; t < THREADS; t++) {
            futures.add(executorService.submit(() -> Status.ok()));
        }

        // then
        for (Future<Status> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(Status.ok());
        }
        executorService.shutdown();
    }
}
