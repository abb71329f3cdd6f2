package com.testweaver.hints;

import com.testweaver.model.StructureAnalysis;

/**
 * Supplies what is known about a page's structure before a scenario runs on it.
 *
 * Providers may fail; the executor then continues without hints.
 */
public interface StructureHintProvider {

    StructureAnalysis analyze(String url);

    /** A provider that knows nothing about any page. */
    static StructureHintProvider none() {
        return url -> StructureAnalysis.empty();
    }
}
