package com.tradingstore.store.schema;

import com.tradingstore.store.CatalogDefaults;

import java.util.HashMap;
import java.util.Map;

/**
 * 遷移時的舊鍵 → 新 id 對照表
 *
 * 先以 (userId, 舊鍵) 查找，找不到時退回預設擁有者的同名記錄。
 * 舊 ai_models 的字串主鍵全域唯一，可再退回任何用戶的同名記錄；
 * 舊 exchanges 主鍵含 user_id，不可跨用戶對照。
 */
public class KeyMapping {

    /** 對照不到時寫入的外鍵值，序號從 1 開始，0 必定是孤兒 */
    public static final int UNMAPPED = 0;

    private final Map<String, Integer> byOwner = new HashMap<>();
    private final Map<String, Integer> byKey = new HashMap<>();
    private final boolean globalKeys;

    private KeyMapping(boolean globalKeys) {
        this.globalKeys = globalKeys;
    }

    /** 舊鍵全域唯一（ai_models） */
    public static KeyMapping global() {
        return new KeyMapping(true);
    }

    /** 舊鍵僅在同一用戶下唯一（exchanges） */
    public static KeyMapping perUser() {
        return new KeyMapping(false);
    }

    public void put(String userId, String legacyKey, int newId) {
        byOwner.put(ownerKey(userId, legacyKey), newId);
        byKey.putIfAbsent(legacyKey, newId);
    }

    public int resolve(String userId, String legacyKey) {
        if (legacyKey == null || legacyKey.isEmpty()) {
            return UNMAPPED;
        }
        Integer id = byOwner.get(ownerKey(userId, legacyKey));
        if (id == null) {
            id = byOwner.get(ownerKey(CatalogDefaults.DEFAULT_OWNER, legacyKey));
        }
        if (id == null && globalKeys) {
            id = byKey.get(legacyKey);
        }
        return id != null ? id : UNMAPPED;
    }

    public int size() {
        return byOwner.size();
    }

    private static String ownerKey(String userId, String legacyKey) {
        return userId + '\u0000' + legacyKey;
    }
}
