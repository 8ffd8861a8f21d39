package com.ai.coach.engine;

import com.ai.coach.dto.GenerativeDecision;
import com.ai.coach.dto.PromptContext;

/**
 * Boundary to the generative reasoning service consulted when no rule fires.
 * Implementations make a single attempt and report any failure as
 * {@link com.ai.coach.exception.GenerativeCallFailedException} or
 * {@link com.ai.coach.exception.MalformedGenerativeResponseException}.
 */
public interface GenerativeDecisionClient {

    GenerativeDecision generateDecision(PromptContext context);
}
