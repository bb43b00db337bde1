package com.raisket.advisor.model;

/**
 * A computed analysis plus its advisory narrative. {@code narrative} is null when none was requested and
 * {@code narrativeGenerated} is false when it holds the fixed fallback text.
 */
public record Advice<T>(T analysis, String narrative, boolean narrativeGenerated, String traceId) {
}
