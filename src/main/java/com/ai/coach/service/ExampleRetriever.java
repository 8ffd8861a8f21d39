package com.ai.coach.service;

import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;

import java.util.List;

/**
 * Finds example coach utterances for a decision. Optional enrichment: callers treat
 * a failure as an empty result.
 */
public interface ExampleRetriever {

    List<RetrievedExample> retrieveExamples(NavigationDecision decision, String rawText, int limit);
}
