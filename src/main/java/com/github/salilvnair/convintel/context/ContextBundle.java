package com.github.salilvnair.convintel.context;

import com.github.salilvnair.convintel.history.HistorySnippet;
import com.github.salilvnair.convintel.intent.IntentCategory;
import com.github.salilvnair.convintel.intent.IntentResult;
import com.github.salilvnair.convintel.stage.ConversationStage;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ContextBundle {

    /** Rendered, size-bounded text for the language model. */
    String promptContext;
    Map<ContextSection, String> sections;
    List<ContextSection> trimmedSections;

    IntentResult intent;
    IntentCategory dominantIntent;
    IntentCategory predictedIntent;

    ConversationStage stage;
    double stageConfidence;
    boolean stageTransitioned;
    boolean progressing;
    boolean stuck;
    String stageGuidance;

    String profileId;
    boolean newProfile;
    List<HistorySnippet> historySnippets;

    long buildTimeMs;
    /** Set when assembly failed and only the minimal bundle could be produced. */
    boolean degraded;
}
