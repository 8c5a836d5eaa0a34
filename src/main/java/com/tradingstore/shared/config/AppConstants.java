package com.tradingstore.shared.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * 全域應用常數
 *
 * 透過 Spring 啟動時讀取 application.yml 設定，
 * 寫入 static 欄位供記錄時間戳等靜態 context 使用。
 */
@Component
public class AppConstants {

    /** 應用時區（ZoneId），供 LocalDateTime.now(ZONE_ID) 使用 */
    public static ZoneId ZONE_ID = ZoneId.of("Asia/Taipei");

    @Value("${app.timezone:Asia/Taipei}")
    public void setTimezone(String tz) {
        ZONE_ID = ZoneId.of(tz);
    }

    public static LocalDateTime now() {
        return LocalDateTime.now(ZONE_ID);
    }
}
