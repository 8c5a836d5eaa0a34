package com.tradingstore.store.schema;

/**
 * Schema 世代
 *
 * <ul>
 *   <li>1：ai_models / exchanges 以字串自然鍵為主鍵，traders 外鍵為字串</li>
 *   <li>2：兩者改用序號分配的整數 id，舊鍵保留在 model_id / exchange_id，traders 外鍵為整數</li>
 * </ul>
 */
public final class SchemaGeneration {

    public static final int LEGACY = 1;
    public static final int CURRENT = 2;

    /** 未寫入標記 */
    public static final int UNKNOWN = 0;

    /** 標記記錄的名稱 */
    public static final String MARKER_NAME = "config_store";

    public static final String STEP_REKEY_AI_MODELS = "rekey_ai_models";
    public static final String STEP_REKEY_EXCHANGES = "rekey_exchanges";
    public static final String STEP_REMAP_TRADER_REFS = "remap_trader_refs";

    private SchemaGeneration() {
    }
}
