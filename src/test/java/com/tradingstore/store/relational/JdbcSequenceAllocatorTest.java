package com.tradingstore.store.relational;

import com.tradingstore.store.sequence.SequenceAllocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class JdbcSequenceAllocatorTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcSequenceAllocator allocator;

    @BeforeEach
    void setUp() {
        jdbcTemplate = H2TestDatabase.create();
        jdbcTemplate.execute(RelationalSchema.COUNTERS);
        allocator = H2TestDatabase.allocator(jdbcTemplate);
    }

    @Nested
    @DisplayName("單執行緒")
    class SingleThread {

        @Test
        @DisplayName("計數器不存在 → 自動建立，從 1 開始")
        void missingCounter_startsAtOne() {
            assertThat(allocator.next(SequenceAllocator.AI_MODELS)).isEqualTo(1);
            assertThat(allocator.next(SequenceAllocator.AI_MODELS)).isEqualTo(2);
            assertThat(allocator.next(SequenceAllocator.AI_MODELS)).isEqualTo(3);
        }

        @Test
        @DisplayName("不同族群各自計數")
        void familiesAreIndependent() {
            allocator.next(SequenceAllocator.AI_MODELS);
            allocator.next(SequenceAllocator.AI_MODELS);

            assertThat(allocator.next(SequenceAllocator.EXCHANGES)).isEqualTo(1);
            assertThat(allocator.next(SequenceAllocator.AI_MODELS)).isEqualTo(3);
        }

        @Test
        @DisplayName("重建 allocator（模擬重啟）→ 不重發已分配的值")
        void restart_neverReissues() {
            allocator.next(SequenceAllocator.EXCHANGES);
            allocator.next(SequenceAllocator.EXCHANGES);

            JdbcSequenceAllocator restarted = H2TestDatabase.allocator(jdbcTemplate);

            assertThat(restarted.next(SequenceAllocator.EXCHANGES)).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("並發")
    class Concurrent {

        @Test
        @DisplayName("8 執行緒各取 25 個 → 200 個值互不重複且連續")
        void concurrentCallers_getDistinctContiguousValues() throws Exception {
            int threads = 8;
            int perThread = 25;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            Set<Integer> issued = ConcurrentHashMap.newKeySet();
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        assertThat(issued.add(allocator.next(SequenceAllocator.AI_MODELS))).isTrue();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            Set<Integer> expected = IntStream.rangeClosed(1, threads * perThread).boxed().collect(Collectors.toSet());
            assertThat(issued).isEqualTo(expected);
        }
    }
}
