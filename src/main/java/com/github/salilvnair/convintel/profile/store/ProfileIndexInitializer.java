package com.github.salilvnair.convintel.profile.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@RequiredArgsConstructor
@Component
public class ProfileIndexInitializer {

    private final ProfileStore profileStore;

    @EventListener(ApplicationReadyEvent.class)
    public void ensureIndexes() {
        log.info("ConvIntel: ensuring user profile indexes store={}", profileStore.getClass().getSimpleName());
        try {
            profileStore.ensureIndexes();
            log.info("ConvIntel: user profile indexes ready.");
        }
        catch (Exception e) {
            log.error("ConvIntel: user profile index creation failed, lookups may be slow", e);
        }
    }
}
