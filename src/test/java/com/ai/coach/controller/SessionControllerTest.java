package com.ai.coach.controller;

import com.ai.coach.app.CoachApplication;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = CoachApplication.class)
@AutoConfigureMockMvc
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private void createSession(String id) throws Exception {
        mockMvc.perform(post("/api/v1/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sessionId\":\"" + id + "\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session.sessionId").value(id))
                .andExpect(jsonPath("$.reply").isNotEmpty());
    }

    @Test
    @DisplayName("a goal statement builds the vision and is archived")
    void firstTurn() throws Exception {
        createSession("ctrl-goal");

        mockMvc.perform(post("/api/v1/sessions/ctrl-goal/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userText\":\"I want to feel calm\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.turn").value(1))
                .andExpect(jsonPath("$.decision.action").value("build_vision"))
                .andExpect(jsonPath("$.state.substate").value("1.1_goal_and_vision"))
                .andExpect(jsonPath("$.reply").isNotEmpty());

        mockMvc.perform(get("/api/v1/sessions/ctrl-goal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.turnCount").value(1));

        mockMvc.perform(get("/api/v1/sessions/ctrl-goal/messages"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)));
    }

    @Test
    @DisplayName("blank turns are bad requests")
    void blankTurn() throws Exception {
        createSession("ctrl-blank");

        mockMvc.perform(post("/api/v1/sessions/ctrl-blank/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userText\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.component").value("turn"));
    }

    @Test
    @DisplayName("unknown sessions are not found")
    void unknownSession() throws Exception {
        mockMvc.perform(get("/api/v1/sessions/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.component").value("persistence"));
    }

    @Test
    @DisplayName("ended sessions are gone")
    void endSession() throws Exception {
        createSession("ctrl-end");

        mockMvc.perform(delete("/api/v1/sessions/ctrl-end"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/sessions/ctrl-end"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("health reports the generative switch")
    void health() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.generativeEnabled").value(false));
    }
}
