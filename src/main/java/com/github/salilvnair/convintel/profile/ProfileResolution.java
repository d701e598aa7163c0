package com.github.salilvnair.convintel.profile;

public record ProfileResolution(UserProfile profile, boolean isNew) {
}
