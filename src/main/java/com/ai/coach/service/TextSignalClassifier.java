package com.ai.coach.service;

import com.ai.coach.dto.ClassifiedInput;

/**
 * Spelling, emotion and safety classification of raw user text. Stateless.
 * Implementations signal failure with
 * {@link com.ai.coach.exception.ClassificationUnavailableException}.
 */
public interface TextSignalClassifier {

    ClassifiedInput classify(String rawText);
}
