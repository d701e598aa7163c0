package com.github.salilvnair.convintel.context;

/**
 * Bundle sections in priority order. Trimming walks this order backwards.
 */
public enum ContextSection {
    INTENT("## User Intent"),
    STAGE("## Conversation Stage"),
    PROFILE("## User Profile"),
    HISTORY("## Relevant Past Conversations"),
    WORKING_MEMORY("## Recent Messages");

    private final String heading;

    ContextSection(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }
}
