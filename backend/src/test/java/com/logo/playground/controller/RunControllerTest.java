package com.logo.playground.controller;

import com.logo.playground.dto.RunResponse;
import com.logo.playground.interpreter.LogoInterpreter;
import com.logo.playground.service.LogoInterpreterService;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LogoInterpreterService interpreterService;

    @Test
    void runReturnsSanitizedScriptResult() throws Exception {
        when(interpreterService.run("FD 10\nRT 90")).thenReturn(
                RunResponse.success(new LogoInterpreter().run("FD 10 RT 90"), 3));

        mockMvc.perform(post("/api/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\": \"  FD 10\\r\\nRT 90  \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.resultType").value("success"))
                .andExpect(jsonPath("$.result.segments.length()").value(1))
                .andExpect(jsonPath("$.result.turtleOrder[0]").value("MAIN"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void blankScriptIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.resultType").value("validation_error"));

        verify(interpreterService, never()).run(anyString());
    }

    @Test
    void unexpectedFailureIsAnInternalError() throws Exception {
        when(interpreterService.run(anyString())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"script\": \"FD 1\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.resultType").value("internal_error"))
                .andExpect(jsonPath("$.error").value("Internal server error: boom"));
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Logo Playground Backend is healthy"));
    }
}
