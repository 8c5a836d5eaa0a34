package com.tradingstore.store.sequence;

/**
 * 每個記錄族群各自遞增的整數序號
 *
 * 保證：同一族群嚴格遞增、並發呼叫不重複、分配後立即崩潰也不會在重啟後重發同一值。
 * 實作必須使用後端原生的原子遞增，不得以「先讀再寫」拼湊。
 */
public interface SequenceAllocator {

    String AI_MODELS = "ai_models";
    String EXCHANGES = "exchanges";

    /**
     * @throws com.tradingstore.shared.exception.ConcurrencyConflictException 多次重試後仍競爭失敗
     */
    int next(String family);
}
