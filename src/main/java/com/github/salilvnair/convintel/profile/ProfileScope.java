package com.github.salilvnair.convintel.profile;

import com.github.salilvnair.convintel.engine.exception.ConvIntelErrorCode;
import com.github.salilvnair.convintel.engine.exception.ConvIntelException;

/**
 * Tenant + bot partition every profile lives in.
 */
public record ProfileScope(String tenantId, String botId) {

    public ProfileScope {
        if (tenantId == null || tenantId.isBlank() || botId == null || botId.isBlank()) {
            throw new ConvIntelException(ConvIntelErrorCode.PROFILE_SCOPE_REQUIRED);
        }
        tenantId = tenantId.trim();
        botId = botId.trim();
    }

    public static ProfileScope of(String tenantId, String botId) {
        return new ProfileScope(tenantId, botId);
    }

    public boolean owns(UserProfile profile) {
        return profile != null && tenantId.equals(profile.getTenantId()) && botId.equals(profile.getBotId());
    }
}
