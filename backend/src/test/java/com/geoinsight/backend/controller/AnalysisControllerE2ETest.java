package com.geoinsight.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoinsight.backend.BaseE2ETest;
import com.geoinsight.backend.dto.CancelAnalysisRequest;
import com.geoinsight.backend.exception.ProviderException;
import com.geoinsight.backend.model.AmenityCategory;
import com.geoinsight.backend.model.AmenityRecord;
import com.geoinsight.backend.model.AnalysisJob;
import com.geoinsight.backend.model.AnalysisRequest;
import com.geoinsight.backend.model.GeoPoint;
import com.geoinsight.backend.model.InvestmentInput;
import com.geoinsight.backend.repository.AnalysisJobRepository;
import com.geoinsight.backend.service.AnalysisOrchestrator;
import com.geoinsight.backend.support.TestImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class AnalysisControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private AnalysisJobRepository jobRepository;

    @Autowired
    private AnalysisOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        jobRepository.deleteAll();
        when(amenityProvider.fetchAmenities(any(), anyInt())).thenReturn(List.of(
                new AmenityRecord("Corner Market", AmenityCategory.GROCERY, 100),
                new AmenityRecord("Vohuman Cafe", AmenityCategory.CAFE, 200)));
        when(areaImageProvider.fetchImage(any(), anyInt())).thenReturn(TestImages.png(10, 10, 5));
        when(reportSummarizer.summarize(any())).thenReturn("A walkable, moderately green neighbourhood.");
    }

    @Test
    void shouldRunAnalysisToCompletion() throws Exception {
        // Given
        AnalysisRequest request = AnalysisRequest.builder()
                .address("12 MG Road, Pune")
                .latitude(18.5204)
                .longitude(73.8567)
                .radiusMeters(800)
                .investment(InvestmentInput.builder().price("85 L").monthlyRent("40k").build())
                .build();

        // When
        String jobId = submit(request);
        awaitTerminal(jobId);

        // Then
        mockMvc.perform(get("/api/analyses/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.result.address").value("12 MG Road, Pune"))
                .andExpect(jsonPath("$.result.sections.location.data.source").value("request"))
                .andExpect(jsonPath("$.result.sections.walk_score.status").value("AVAILABLE"))
                .andExpect(jsonPath("$.result.sections.walk_score.data.score").value(12.0))
                .andExpect(jsonPath("$.result.sections.vegetation.data.coverage").value(0.5))
                .andExpect(jsonPath("$.result.sections.investment.status").value("AVAILABLE"))
                .andExpect(jsonPath("$.result.sections.investment.data.metrics.purchasePrice").value(8_500_000.0))
                .andExpect(jsonPath("$.result.sections.similarity.status").value("NOT_REQUESTED"))
                .andExpect(jsonPath("$.result.summary").value("A walkable, moderately green neighbourhood."))
                .andExpect(jsonPath("$.result.missingSections").isEmpty())
                .andExpect(jsonPath("$.partialResults.walk_score.status").value("SUCCESS"));
    }

    @Test
    void shouldGeocodeAddressWithoutCoordinates() throws Exception {
        when(geocoder.geocode(eq("Shivajinagar, Pune"))).thenReturn(Optional.of(new GeoPoint(18.5308, 73.8475)));

        String jobId = submit(AnalysisRequest.builder().address("Shivajinagar, Pune").build());
        AnalysisJob job = awaitTerminal(jobId);

        assertThat(job.getResult().getLocation().latitude()).isEqualTo(18.5308);
        assertThat(job.getResult().getSections().get("location").getData()).containsEntry("source", "geocoder");
        assertThat(job.getResult().getRadiusMeters()).isEqualTo(1000);
    }

    @Test
    void shouldDegradeWhenImageryIsUnavailable() throws Exception {
        when(areaImageProvider.fetchImage(any(), anyInt())).thenThrow(new ProviderException("map-tiles", "HTTP 503"));

        String jobId = submit(AnalysisRequest.builder()
                .address("12 MG Road, Pune").latitude(18.5204).longitude(73.8567)
                .referencePropertyId("never-indexed")
                .build());
        awaitTerminal(jobId);

        mockMvc.perform(get("/api/analyses/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SUCCESS"))
                .andExpect(jsonPath("$.result.sections.vegetation.status").value("FAILED"))
                .andExpect(jsonPath("$.result.sections.vegetation.errorType").value("PROVIDER_ERROR"))
                .andExpect(jsonPath("$.result.sections.similarity.status").value("FAILED"))
                .andExpect(jsonPath("$.result.missingSections.length()").value(2));
    }

    @Test
    void shouldFailWhenAmenitiesAreUnavailable() throws Exception {
        when(amenityProvider.fetchAmenities(any(), anyInt())).thenThrow(new ProviderException("overpass", "HTTP 429"));

        String jobId = submit(AnalysisRequest.builder()
                .address("12 MG Road, Pune").latitude(18.5204).longitude(73.8567).build());
        AnalysisJob job = awaitTerminal(jobId);

        assertThat(job.getError()).startsWith("Critical subtask 'walk_score' failed");
        assertThat(job.getResult()).isNull();
        assertThat(job.getPartialResults()).containsKeys("location", "walk_score", "vegetation");
    }

    @Test
    void shouldFailWhenAddressCannotBeGeocoded() throws Exception {
        when(geocoder.geocode(any())).thenReturn(Optional.empty());

        AnalysisJob job = awaitTerminal(submit(AnalysisRequest.builder().address("Atlantis").build()));

        assertThat(job.getError()).contains("location").contains("PARSE_ERROR");
    }

    @Test
    void shouldRejectInvalidRequest() throws Exception {
        mockMvc.perform(post("/api/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latitude\": 18.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"));

        mockMvc.perform(post("/api/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"Pune\", \"radiusMeters\": 10}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() throws Exception {
        mockMvc.perform(get("/api/analyses/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void shouldRejectCancellingFinishedJob() throws Exception {
        String jobId = submit(AnalysisRequest.builder()
                .address("12 MG Road, Pune").latitude(18.5204).longitude(73.8567).build());
        awaitTerminal(jobId);

        mockMvc.perform(post("/api/analyses/" + jobId + "/cancel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CancelAnalysisRequest("changed my mind"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"))
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("already finished")));
    }

    @Test
    void shouldListRecentJobs() throws Exception {
        String first = submit(AnalysisRequest.builder().address("A").latitude(18.5).longitude(73.8).build());
        awaitTerminal(first);
        String second = submit(AnalysisRequest.builder().address("B").latitude(18.6).longitude(73.9).build());
        awaitTerminal(second);

        mockMvc.perform(get("/api/analyses").param("limit", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(second));
    }

    @Test
    void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("geoinsight-backend"));
    }

    private String submit(AnalysisRequest request) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/analyses")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").exists())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("jobId").asText();
    }

    private AnalysisJob awaitTerminal(String jobId) throws InterruptedException {
        for (int i = 0; i < 100; i++) {
            AnalysisJob job = orchestrator.getJob(jobId);
            if (job.getStatus().isTerminal()) {
                return job;
            }
            Thread.sleep(100);
        }
        throw new AssertionError("Job " + jobId + " did not finish");
    }
}
