package com.tradingstore.store.seed;

/**
 * 預設資料初始化
 *
 * 每次啟動都可呼叫：依唯一業務鍵判斷是否存在，只插入缺少的記錄，
 * 既有記錄（包括用戶修改過的）一律不覆蓋。
 */
public interface DefaultDataSeeder {

    void seedDefaults();
}
