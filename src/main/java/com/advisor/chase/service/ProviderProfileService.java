package com.advisor.chase.service;

import com.advisor.chase.config.ChaseEngineConfig;
import com.advisor.chase.model.ChaseItem;
import com.advisor.chase.model.ProviderProfile;
import com.advisor.chase.repository.ProviderProfileRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Learns provider response behaviour from resolved chases.
 *
 * Updates to one provider are serialized; reads return copies so the predictor never
 * sees a half-applied update.
 */
@Service
public class ProviderProfileService {

    private static final Logger log = LoggerFactory.getLogger(ProviderProfileService.class);

    private final ProviderProfileRepository profileRepository;
    private final ChaseEngineConfig config;
    private final Map<String, ProviderProfile> cache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public ProviderProfileService(ProviderProfileRepository profileRepository, ChaseEngineConfig config) {
        this.profileRepository = profileRepository;
        this.config = config;
    }

    /**
     * Current profile of a provider, or null when nothing has been learned yet.
     */
    public ProviderProfile getProfile(String providerId) {
        if (providerId == null) return null;
        synchronized (lockFor(providerId)) {
            ProviderProfile profile = load(providerId);
            return profile == null ? null : copy(profile);
        }
    }

    /**
     * Fold the realized latency of a received or completed item into its provider's
     * profile, together with whether it went overdue on the way. Items without a provider,
     * or that were never contacted, carry no latency.
     */
    @Observed(name = "profile.record_latency", contextualName = "update-provider-profile")
    public void recordResolution(ChaseItem item) {
        String providerId = item.getProviderRef();
        if (providerId == null || item.getFirstContactAt() <= 0 || item.getResolvedAt() <= 0) {
            return;
        }
        long latency = Math.max(0, item.getResolvedAt() - item.getFirstContactAt());
        recordLatency(providerId, latency, item.isWentOverdue(), item.getResolvedAt());
    }

    public void recordLatency(String providerId, long latencyMillis, long now) {
        recordLatency(providerId, latencyMillis, false, now);
    }

    private void recordLatency(String providerId, long latencyMillis, boolean wentOverdue, long now) {
        synchronized (lockFor(providerId)) {
            ProviderProfile profile = loadOrCreate(providerId);
            double alpha = config.getProfile().getEwmaAlpha();
            long n = profile.getSampleCount();

            if (n == 0) {
                profile.setEwmaLatencyMillis(latencyMillis);
            } else {
                profile.setEwmaLatencyMillis(alpha * latencyMillis + (1 - alpha) * profile.getEwmaLatencyMillis());
            }
            profile.setSampleCount(n + 1);

            List<Long> window = profile.getRecentLatencies();
            window.add(latencyMillis);
            int maxWindow = Math.max(1, config.getProfile().getPercentileWindow());
            while (window.size() > maxWindow) {
                window.remove(0);
            }

            profile.setReceivedCount(profile.getReceivedCount() + 1);
            if (wentOverdue) {
                profile.setOverdueCount(profile.getOverdueCount() + 1);
            }
            profile.setLastUpdated(now);
            save(profile);
            log.debug("Provider {} latency sample {}ms, ewma now {}ms over {} samples",
                    providerId, latencyMillis, Math.round(profile.getEwmaLatencyMillis()), n + 1);
        }
    }

    /**
     * A failed chase counts towards the provider's failure and overdue rates, never its latency.
     */
    public void recordFailure(ChaseItem item) {
        String providerId = item.getProviderRef();
        if (providerId == null) return;
        synchronized (lockFor(providerId)) {
            ProviderProfile profile = loadOrCreate(providerId);
            profile.setFailedCount(profile.getFailedCount() + 1);
            if (item.isWentOverdue()) {
                profile.setOverdueCount(profile.getOverdueCount() + 1);
            }
            profile.setLastUpdated(item.getResolvedAt());
            save(profile);
        }
    }

    private ProviderProfile load(String providerId) {
        ProviderProfile cached = cache.get(providerId);
        if (cached != null) return cached;
        ProviderProfile stored = profileRepository.findByProviderId(providerId);
        if (stored != null) {
            cache.put(providerId, stored);
        }
        return stored;
    }

    private ProviderProfile loadOrCreate(String providerId) {
        ProviderProfile profile = load(providerId);
        if (profile == null) {
            profile = ProviderProfile.builder().providerId(providerId).build();
        }
        return copy(profile);
    }

    private void save(ProviderProfile profile) {
        profileRepository.save(profile);
        cache.put(profile.getProviderId(), profile);
    }

    private Object lockFor(String providerId) {
        return locks.computeIfAbsent(providerId, k -> new Object());
    }

    private static ProviderProfile copy(ProviderProfile profile) {
        return profile.toBuilder()
                .recentLatencies(new ArrayList<>(profile.getRecentLatencies()))
                .build();
    }
}
