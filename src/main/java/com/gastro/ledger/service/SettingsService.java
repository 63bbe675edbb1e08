package com.gastro.ledger.service;

import com.gastro.ledger.model.AppSetting;
import com.gastro.ledger.repository.AppSettingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
public class SettingsService {

    public static final String KEY_REALTIME_DEPLETION = "realtime_depletion_enabled";
    public static final String KEY_MAX_SUGGESTIONS = "max_suggestions";
    public static final String KEY_CURRENCY_LABEL = "currency_label";

    static final int DEFAULT_MAX_SUGGESTIONS = 5;
    static final String DEFAULT_CURRENCY = "PLN";

    private final AppSettingRepository appSettingRepository;
    private final Clock clock;

    public SettingsService(AppSettingRepository appSettingRepository, Clock clock) {
        this.appSettingRepository = appSettingRepository;
        this.clock = clock;
    }

    public boolean isRealtimeDepletionEnabled() {
        return appSettingRepository.findBySettingKey(KEY_REALTIME_DEPLETION)
                .map(AppSetting::getSettingValue)
                .map(val -> Boolean.parseBoolean(val.trim()))
                .orElse(false);
    }

    public int getMaxSuggestions() {
        return appSettingRepository.findBySettingKey(KEY_MAX_SUGGESTIONS)
                .map(AppSetting::getSettingValue)
                .map(val -> {
                    try {
                        int parsed = Integer.parseInt(val.trim());
                        return parsed < 0 ? DEFAULT_MAX_SUGGESTIONS : parsed;
                    } catch (NumberFormatException e) {
                        log.warn("Ignoring invalid {} setting '{}'", KEY_MAX_SUGGESTIONS, val);
                        return DEFAULT_MAX_SUGGESTIONS;
                    }
                })
                .orElse(DEFAULT_MAX_SUGGESTIONS);
    }

    public String getCurrencyLabel() {
        return appSettingRepository.findBySettingKey(KEY_CURRENCY_LABEL)
                .map(AppSetting::getSettingValue)
                .filter(val -> !val.isBlank())
                .orElse(DEFAULT_CURRENCY);
    }

    @Transactional
    public void updateSetting(String key, String value) {
        String stored = value != null ? value : "";
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<AppSetting> existing = appSettingRepository.findBySettingKey(key);
        if (existing.isPresent()) {
            AppSetting setting = existing.get();
            setting.changeValue(stored, now);
            appSettingRepository.save(setting);
        } else {
            appSettingRepository.save(new AppSetting(key, stored, now));
        }
        log.info("Setting {} set to '{}'", key, stored);
    }
}
