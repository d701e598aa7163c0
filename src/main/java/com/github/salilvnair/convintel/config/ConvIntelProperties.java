package com.github.salilvnair.convintel.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convintel")
@Getter
@Setter
public class ConvIntelProperties {

    private Intent intent = new Intent();
    private Stage stage = new Stage();
    private Profile profile = new Profile();
    private Context context = new Context();

    @Getter
    @Setter
    public static class Intent {
        private String defaultLocale = "en";
        private double keywordWeight = 0.35d;
        private double patternWeight = 0.50d;
        private double contextBoost = 0.10d;
        private double secondaryMargin = 0.15d;
        private int maxKeywords = 5;
        private int excerptMaxChars = 200;
        private int maxTrackedIntents = 50;
        /** Per-step decay applied to older intents when picking the dominant one. */
        private double recencyDecay = 0.9d;
        private double phaticWeight = 0.5d;
    }

    @Getter
    @Setter
    public static class Stage {
        private double forwardThreshold = 0.5d;
        private double regressionThreshold = 0.9d;
        private int progressWindow = 3;
        private int stuckWindow = 5;
        private int intentWindow = 3;
        private double recencyDecay = 0.8d;
        private int longConversationMessages = 10;
        private double lengthBias = 0.25d;
        private int maxTrackedStages = 50;
    }

    @Getter
    @Setter
    public static class Profile {
        private StoreType store = StoreType.JPA;
        private int maxSessionSummaries = 20;
        private int contextSummaries = 5;
        private int contextMaxChars = 1500;
        private long callTimeoutMs = 50L;
        private int writeRetries = 1;
        private int casMaxAttempts = 3;
        private int workerThreads = 4;
        private int queueCapacity = 500;
        private int searchMaxLimit = 100;
        private Engagement engagement = new Engagement();
    }

    @Getter
    @Setter
    public static class Engagement {
        private int engagedMinSessions = 5;
        private int disengagedMinSessions = 3;
        private double disengagedBelow = -0.3d;
    }

    @Getter
    @Setter
    public static class Context {
        private int maxChars = 4000;
        private int workingMemoryMessages = 10;
        private int workingMemoryFloor = 2;
        private int historyTopK = 3;
        private double historyMinScore = 0.5d;
        private int historyMaxChars = 1200;
    }

    public enum StoreType {
        JPA,
        MEMORY
    }
}
