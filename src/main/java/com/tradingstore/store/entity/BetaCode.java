package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

/**
 * 內測碼，只能被領取一次
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BetaCode {

    private String code;

    private boolean used;

    /** 領取者 email，未使用時為空字串 */
    @Builder.Default
    private String usedBy = "";

    private LocalDateTime usedAt;
    private LocalDateTime createdAt;
}
