package com.ai.coach.dto;

import lombok.Value;

@Value
public class RetrievedExample {

    String tag;
    String text;
    double score;
}
