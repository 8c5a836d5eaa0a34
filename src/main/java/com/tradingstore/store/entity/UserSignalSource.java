package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

/**
 * 用戶信號源配置，一人一筆
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSignalSource {

    private String userId;

    @Builder.Default
    private String coinPoolUrl = "";

    @Builder.Default
    private String oiTopUrl = "";

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
