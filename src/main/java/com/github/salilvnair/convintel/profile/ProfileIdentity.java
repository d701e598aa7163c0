package com.github.salilvnair.convintel.profile;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Canonical forms of the identifiers a profile is addressed by.
 */
@UtilityClass
public class ProfileIdentity {

    public static String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    /** Keeps digits and a leading {@code +}; {@code "+1 (555) 010-2000"} becomes {@code "+15550102000"}. */
    public static String normalizePhone(String phone) {
        if (phone == null) {
            return null;
        }
        String trimmed = phone.trim();
        StringBuilder digits = new StringBuilder(trimmed.length());
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (Character.isDigit(c)) {
                digits.append(c);
            }
        }
        if (digits.length() == 0) {
            return null;
        }
        return trimmed.startsWith("+") ? "+" + digits : digits.toString();
    }

    public static String normalizeVisitorId(String visitorId) {
        if (visitorId == null || visitorId.isBlank()) {
            return null;
        }
        return visitorId.trim();
    }
}
