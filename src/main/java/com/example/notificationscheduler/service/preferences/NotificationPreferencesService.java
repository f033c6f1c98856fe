package com.example.notificationscheduler.service.preferences;

import com.example.notificationscheduler.domain.entity.NotificationPreferences;
import com.example.notificationscheduler.domain.repository.NotificationPreferencesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Loads notification preferences, creating the default row on first access.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationPreferencesService {

    private final NotificationPreferencesRepository preferencesRepository;

    public NotificationPreferences getOrCreate(String userId) {
        var existing = preferencesRepository.findByUserId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        try {
            var created = preferencesRepository.saveAndFlush(NotificationPreferences.defaultsFor(userId));
            log.debug("Created default notification preferences for user {}", userId);
            return created;
        } catch (DataIntegrityViolationException e) {
            // a concurrent run created the row first
            return preferencesRepository.findByUserId(userId)
                    .orElseThrow(() -> e);
        }
    }

    public List<NotificationPreferences> findDigestSubscribers() {
        return preferencesRepository.findByDailyDigestTrue();
    }
}
