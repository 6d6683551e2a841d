package org.influence.analytics.engine.controller;

import org.influence.analytics.engine.model.OperationResult;
import org.influence.analytics.engine.service.AnalyticsEngine;
import org.influence.analytics.query.catalog.OperationCatalog;
import org.influence.analytics.query.model.OperationId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AnalyticsControllerTest {

    @Mock
    private AnalyticsEngine engine;

    private final OperationCatalog catalog = new OperationCatalog();

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AnalyticsController(engine, catalog)).build();
    }

    @Test
    void successfulOperationIsOk() throws Exception {
        // Arrange
        OperationResult result = OperationResult.success("search_influencers", "country=KR; limit=50",
                List.of("user_id"), List.of(Map.of("user_id", "u1")), 1, "http://minio/a.csv",
                "search_influencers: primary on g INNER p, 1 filter, limit 50");
        when(engine.execute(eq(OperationId.SEARCH_INFLUENCERS), any())).thenReturn(result);

        // Act / Assert
        mockMvc.perform(post("/api/analytics/search_influencers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"country\": [\"KR\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.totalCount").value(1))
                .andExpect(jsonPath("$.exportUrl").value("http://minio/a.csv"))
                .andExpect(jsonPath("$.preview[0].user_id").value("u1"))
                .andExpect(jsonPath("$.errorKind").doesNotExist());
    }

    @Test
    void requestWithoutBodyPassesNoParameters() throws Exception {
        // Arrange
        when(engine.execute(eq(OperationId.ANALYZE_HASHTAG_TRENDS), isNull()))
                .thenReturn(OperationResult.success("analyze_hashtag_trends", "window=30d; limit=50",
                        List.of(), List.of(), 0, null, "analyze_hashtag_trends: primary on g LEFT p"));

        // Act / Assert
        mockMvc.perform(post("/api/analytics/analyze_hashtag_trends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exportUrl").doesNotExist());
        verify(engine).execute(eq(OperationId.ANALYZE_HASHTAG_TRENDS), isNull());
    }

    @Test
    void validationErrorIsBadRequest() throws Exception {
        // Arrange
        when(engine.execute(eq(OperationId.SEARCH_INFLUENCERS), any())).thenReturn(OperationResult.failure(
                "search_influencers", "ValidationError", "Invalid parameter 'skin_type': 'Scaly' is not one of", null));

        // Act / Assert
        mockMvc.perform(post("/api/analytics/search_influencers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"skin_type\": \"Scaly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorKind").value("ValidationError"));
    }

    @Test
    void executionErrorIsBadGateway() throws Exception {
        // Arrange
        when(engine.execute(eq(OperationId.DETECT_EMERGING_HASHTAGS), any())).thenReturn(OperationResult.failure(
                "detect_emerging_hashtags", "ExecutionError", "timed out after 60s", "SQLTimeoutException: Read timed out"));

        // Act / Assert
        mockMvc.perform(post("/api/analytics/detect_emerging_hashtags")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.diagnostic").value("SQLTimeoutException: Read timed out"));
    }

    @Test
    void compilationErrorIsInternalServerError() throws Exception {
        // Arrange
        when(engine.execute(eq(OperationId.ANALYZE_BEAUTY_PERSONA_SEGMENTS), any())).thenReturn(OperationResult.failure(
                "analyze_beauty_persona_segments", "CompilationError", "Cannot compile", null));

        // Act / Assert
        mockMvc.perform(post("/api/analytics/analyze_beauty_persona_segments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void unknownOperationIsNotFound() throws Exception {
        mockMvc.perform(post("/api/analytics/predict_the_future")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
        verifyNoInteractions(engine);
    }

    @Test
    void listsEveryOperation() throws Exception {
        mockMvc.perform(get("/api/analytics/operations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(OperationId.values().length)))
                .andExpect(jsonPath("$[0].name").value("search_influencers"));
    }
}
