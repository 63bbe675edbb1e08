package com.gastro.ledger.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Runtime ledger setting such as {@code realtime_depletion_enabled},
 * {@code max_suggestions} or {@code currency_label}. Values are stored as
 * text and parsed by {@link com.gastro.ledger.service.SettingsService}.
 */
@Entity
@Table(name = "ledger_settings")
@Getter
@Setter
@NoArgsConstructor
public class AppSetting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "setting_key", unique = true, nullable = false, length = 64)
    private String settingKey;

    @Column(name = "setting_value", nullable = false)
    private String settingValue;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public AppSetting(String settingKey, String settingValue, LocalDateTime updatedAt) {
        this.settingKey = settingKey;
        this.settingValue = settingValue;
        this.updatedAt = updatedAt;
    }

    public void changeValue(String value, LocalDateTime at) {
        this.settingValue = value;
        this.updatedAt = at;
    }
}
