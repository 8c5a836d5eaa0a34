package com.tradingstore.store.document;

import com.tradingstore.shared.exception.ConcurrencyConflictException;
import com.tradingstore.store.sequence.SequenceAllocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * counters 集合上的 findAndModify($inc, upsert, returnNew)
 *
 * 兩個程序同時以 upsert 建立同一計數器時，落敗的一方會收到唯一鍵衝突，重試即可。
 */
@Slf4j
@RequiredArgsConstructor
public class MongoSequenceAllocator implements SequenceAllocator {

    private static final int MAX_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;

    @Override
    public int next(String family) {
        DuplicateKeyException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                Document counter = mongoTemplate.findAndModify(
                        Query.query(Criteria.where("_id").is(family)),
                        new Update().inc("seq", 1),
                        FindAndModifyOptions.options().upsert(true).returnNew(true),
                        Document.class,
                        StoreDocuments.COUNTERS);
                if (counter == null || !(counter.get("seq") instanceof Number)) {
                    throw new ConcurrencyConflictException("序號分配失敗: family=" + family + " 沒有回傳計數值", null);
                }
                return ((Number) counter.get("seq")).intValue();
            } catch (DuplicateKeyException e) {
                lastFailure = e;
                log.warn("序號計數器 {} 並發建立，第 {} 次重試", family, attempt);
            }
        }
        throw new ConcurrencyConflictException(
                "序號分配失敗: family=" + family + "，重試 " + MAX_ATTEMPTS + " 次後仍衝突", lastFailure);
    }
}
