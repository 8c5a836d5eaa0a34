package com.tradingstore.shared.exception;

import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessException;

/**
 * 把 Spring {@link DataAccessException} 轉成存儲層自己的例外類型
 */
public final class StoreErrors {

    private StoreErrors() {
    }

    public static StoreException translate(String operation, DataAccessException e) {
        if (e instanceof DuplicateKeyException) {
            return new DuplicateException(operation + " 失敗: 唯一鍵已存在", e);
        }
        if (e instanceof PessimisticLockingFailureException) {
            return new ConcurrencyConflictException(operation + " 失敗: 鎖競爭", e);
        }
        if (e instanceof TransientDataAccessException
                || e instanceof DataAccessResourceFailureException) {
            return new TransientStoreException(operation + " 失敗: 後端暫時不可用或逾時", e);
        }
        return new StoreException(operation + " 失敗: " + e.getMessage(), e);
    }
}
