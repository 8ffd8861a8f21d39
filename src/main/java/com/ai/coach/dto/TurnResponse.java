package com.ai.coach.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TurnResponse {

    String sessionId;
    int turn;
    String reply;
    NavigationDecision decision;
    List<RetrievedExample> examples;
    SessionSnapshot state;
}
