package com.github.salilvnair.convintel.config;

import com.github.salilvnair.convintel.history.NoOpSemanticHistorySearch;
import com.github.salilvnair.convintel.history.SemanticHistorySearch;
import com.github.salilvnair.convintel.profile.store.InMemoryProfileStore;
import com.github.salilvnair.convintel.profile.store.JpaProfileStore;
import com.github.salilvnair.convintel.profile.store.ProfileStore;
import com.github.salilvnair.convintel.repo.UserProfileRepository;
import com.github.salilvnair.convintel.session.InMemorySessionStateStore;
import com.github.salilvnair.convintel.session.SessionStateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Default collaborators. Host applications replace any of them by declaring their own bean.
 * {@code convintel.profile.store=memory} keeps profiles in the JVM (tests, local runs).
 */
@Slf4j
@Configuration
public class ConvIntelStoreConfiguration {

    @Bean
    @ConditionalOnMissingBean(ProfileStore.class)
    @ConditionalOnProperty(prefix = "convintel.profile", name = "store", havingValue = "jpa", matchIfMissing = true)
    public ProfileStore jpaProfileStore(UserProfileRepository repository,
                                        JdbcTemplate jdbcTemplate,
                                        ConvIntelProperties properties) {
        log.info("ConvIntel profile store: jpa");
        return new JpaProfileStore(repository, jdbcTemplate, properties);
    }

    @Bean
    @ConditionalOnMissingBean(ProfileStore.class)
    @ConditionalOnProperty(prefix = "convintel.profile", name = "store", havingValue = "memory")
    public ProfileStore inMemoryProfileStore() {
        log.info("ConvIntel profile store: memory");
        return new InMemoryProfileStore();
    }

    @Bean
    @ConditionalOnMissingBean(SemanticHistorySearch.class)
    public SemanticHistorySearch noOpSemanticHistorySearch() {
        return new NoOpSemanticHistorySearch();
    }

    @Bean
    @ConditionalOnMissingBean(SessionStateStore.class)
    public SessionStateStore inMemorySessionStateStore() {
        return new InMemorySessionStateStore();
    }
}
