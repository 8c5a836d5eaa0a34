package com.tradingstore.store;

import com.tradingstore.store.dto.AiModelUpdate;
import com.tradingstore.store.dto.BetaCodeStats;
import com.tradingstore.store.dto.ExchangeUpdate;
import com.tradingstore.store.dto.TraderFullConfig;
import com.tradingstore.store.entity.AIModelConfig;
import com.tradingstore.store.entity.BetaCode;
import com.tradingstore.store.entity.ExchangeConfig;
import com.tradingstore.store.entity.TraderRecord;
import com.tradingstore.store.entity.User;
import com.tradingstore.store.entity.UserSignalSource;
import com.tradingstore.vault.CredentialVault;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 配置存儲契約
 *
 * 交易引擎與管理 API 只透過這個介面存取配置。關聯式與文件式兩種實作
 * 在啟動時二選一，對外行為一致：
 * <ul>
 *   <li>AI 模型 / 交易所的機密欄位寫入前加密、讀取後解密</li>
 *   <li>更新時空字串的機密欄位代表「保持不變」</li>
 *   <li>更新找不到既有記錄時自動建立（upsert）</li>
 *   <li>交易員讀取時補上後加欄位的預設值</li>
 * </ul>
 *
 * 所有方法可被多執行緒同時呼叫，原子性僅保證到單筆記錄。
 * 查無資料的查詢回傳 {@link Optional#empty()}；針對不存在記錄的修改拋出
 * {@link com.tradingstore.shared.exception.NotFoundException}。
 */
public interface RecordStore extends AutoCloseable {

    /**
     * 在 open 之後注入 vault；未注入時機密欄位以明文存取
     */
    void setCredentialVault(CredentialVault vault);

    /**
     * 確認後端可連線
     *
     * @throws com.tradingstore.shared.exception.ConnectionException 無法連線
     */
    void ping();

    /**
     * 確保保留的 admin 用戶存在
     */
    void ensureAdminUser();

    // ==================== users ====================

    void createUser(User user);

    Optional<User> getUserByEmail(String email);

    Optional<User> getUserById(String userId);

    List<String> listUserIds();

    void setUserOtpVerified(String userId, boolean verified);

    void updateUserPassword(String userId, String passwordHash);

    // ==================== ai_models ====================

    List<AIModelConfig> listAiModels(String userId);

    void upsertAiModel(String userId, String modelKey, AiModelUpdate update);

    /**
     * @throws com.tradingstore.shared.exception.DuplicateException (modelId, userId) 已存在
     */
    AIModelConfig createAiModel(AIModelConfig model);

    // ==================== exchanges ====================

    List<ExchangeConfig> listExchanges(String userId);

    void upsertExchange(String userId, String exchangeKey, ExchangeUpdate update);

    /**
     * @throws com.tradingstore.shared.exception.DuplicateException (exchangeId, userId) 已存在
     */
    ExchangeConfig createExchange(ExchangeConfig exchange);

    // ==================== traders ====================

    void createTrader(TraderRecord trader);

    /**
     * 依建立時間新到舊排序，已套用預設值
     */
    List<TraderRecord> listTraders(String userId);

    void setTraderRunning(String userId, String traderId, boolean running);

    void updateTrader(TraderRecord trader);

    void setTraderCustomPrompt(String userId, String traderId, String customPrompt, boolean overrideBase);

    /**
     * 僅供用戶充值/提現後手動同步，系統不會自動呼叫
     */
    void setTraderInitialBalance(String userId, String traderId, double initialBalance);

    void deleteTrader(String userId, String traderId);

    TraderFullConfig getTraderFullConfig(String userId, String traderId);

    // ==================== system_config ====================

    Optional<String> getSystemConfig(String key);

    void setSystemConfig(String key, String value);

    // ==================== user_signal_sources ====================

    void createOrUpdateSignalSource(String userId, String coinPoolUrl, String oiTopUrl);

    Optional<UserSignalSource> getSignalSource(String userId);

    // ==================== 聚合查詢 ====================

    /**
     * 所有交易員設定的幣種聯集；沒有任何設定時退回 default_coins
     */
    List<String> listCustomCoins();

    /**
     * 所有運行中交易員的時間線聯集
     */
    List<String> listActiveTimeframes();

    // ==================== beta_codes ====================

    /**
     * 載入內測碼清單（空行與 # 開頭的行略過），已存在者不覆蓋
     *
     * @return 新插入的數量
     */
    int loadBetaCodes(List<String> lines);

    boolean validateBetaCode(String code);

    /**
     * 原子領取內測碼
     *
     * @throws com.tradingstore.shared.exception.BetaCodeUnavailableException 不存在或已被使用
     */
    void claimBetaCode(String code, String userEmail);

    Optional<BetaCode> findBetaCode(String code);

    BetaCodeStats betaCodeStats();

    // ==================== decision_logs ====================

    void saveDecisionLog(String userId, String traderId, Map<String, Object> record);

    /**
     * 取最新的 limit 筆，回傳時依時間舊到新排列
     */
    List<Map<String, Object>> getDecisionLogs(String userId, String traderId, int limit);

    @Override
    void close();
}
