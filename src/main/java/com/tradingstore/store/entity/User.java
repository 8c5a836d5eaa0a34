package com.tradingstore.store.entity;

import lombok.*;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    /** 保留用戶 ID，管理員模式下自動建立 */
    public static final String ADMIN_ID = "admin";
    public static final String ADMIN_EMAIL = "admin@localhost";

    private String id;

    private String email;

    @ToString.Exclude
    @Builder.Default
    private String passwordHash = "";

    @ToString.Exclude
    @Builder.Default
    private String otpSecret = "";

    private boolean otpVerified;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
