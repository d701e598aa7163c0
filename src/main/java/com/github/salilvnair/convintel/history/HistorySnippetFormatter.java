package com.github.salilvnair.convintel.history;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.Instant;

@UtilityClass
public class HistorySnippetFormatter {

    /**
     * {@code [3 weeks ago] summary}, with an {@code Outcome:} line unless the outcome is blank or undecided.
     */
    public static String format(HistorySnippet snippet, Instant now) {
        StringBuilder line = new StringBuilder(relativeTime(snippet.timestamp(), now))
                .append(' ')
                .append(snippet.text() == null ? "" : snippet.text().trim());
        String outcome = snippet.outcome();
        if (outcome != null && !outcome.isBlank() && !"undecided".equalsIgnoreCase(outcome.trim())) {
            line.append("\n  Outcome: ").append(outcome.trim());
        }
        return line.toString();
    }

    public static String relativeTime(Instant timestamp, Instant now) {
        if (timestamp == null || now == null) {
            return "[Past conversation]";
        }
        long days = Math.max(0L, Duration.between(timestamp, now).toDays());
        if (days == 0) {
            return "[Today]";
        }
        if (days == 1) {
            return "[Yesterday]";
        }
        if (days < 7) {
            return "[" + days + " days ago]";
        }
        if (days < 30) {
            long weeks = days / 7;
            return "[" + weeks + (weeks > 1 ? " weeks ago]" : " week ago]");
        }
        long months = days / 30;
        return "[" + months + (months > 1 ? " months ago]" : " month ago]");
    }
}
