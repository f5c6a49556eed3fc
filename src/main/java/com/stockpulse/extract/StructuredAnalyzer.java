package com.stockpulse.extract;

import com.stockpulse.core.error.MalformedOutputException;

/**
 * Opaque sentiment/event analysis capability, typically a language model.
 * Transport-level failures surface as unchecked exceptions.
 */
public interface StructuredAnalyzer {
    AnalysisPayload analyze(String text) throws MalformedOutputException;
}
