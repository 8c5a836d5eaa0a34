package com.tradingstore.store.relational;

import com.tradingstore.shared.exception.ConcurrencyConflictException;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;

/**
 * counters 表上的原子遞增
 *
 * UPDATE ... SET seq = seq + 1 取得行鎖後，在同一交易內讀回新值。
 * 計數器不存在時先插入 (name, 0)，並發插入的唯一鍵衝突直接忽略。
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcSequenceAllocator implements SequenceAllocator {

    private static final int MAX_ATTEMPTS = 10;
    private static final long BACKOFF_MS = 20;

    /** H2 的並發更新錯誤碼 */
    private static final int H2_CONCURRENT_UPDATE = 90131;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    @Override
    public int next(String family) {
        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                Integer value = transactionTemplate.execute(status -> incrementAndGet(family));
                if (value != null) {
                    return value;
                }
                createCounter(family);
            } catch (DataAccessException e) {
                if (!isRetryable(e)) {
                    throw e;
                }
                lastFailure = e;
                log.warn("序號分配競爭 family={}, 第 {} 次重試: {}", family, attempt, e.getMessage());
                backoff(attempt, family);
            }
        }
        throw new ConcurrencyConflictException(
                "序號分配失敗: family=" + family + "，重試 " + MAX_ATTEMPTS + " 次後仍衝突", lastFailure);
    }

    private Integer incrementAndGet(String family) {
        int updated = jdbcTemplate.update("UPDATE counters SET seq = seq + 1 WHERE name = ?", family);
        if (updated == 0) {
            return null;
        }
        return jdbcTemplate.queryForObject("SELECT seq FROM counters WHERE name = ?", Integer.class, family);
    }

    private void createCounter(String family) {
        try {
            jdbcTemplate.update("INSERT INTO counters (name, seq) VALUES (?, 0)", family);
            log.info("建立序號計數器: {}", family);
        } catch (DuplicateKeyException e) {
            log.debug("序號計數器 {} 已由其他執行緒建立", family);
        }
    }

    private static boolean isRetryable(DataAccessException e) {
        if (e instanceof ConcurrencyFailureException || e instanceof TransientDataAccessException) {
            return true;
        }
        Throwable cause = e.getMostSpecificCause();
        return cause instanceof SQLException && ((SQLException) cause).getErrorCode() == H2_CONCURRENT_UPDATE;
    }

    private static void backoff(int attempt, String family) {
        try {
            Thread.sleep(BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException("序號分配被中斷: family=" + family, e);
        }
    }
}
