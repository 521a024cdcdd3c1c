package com.advisor.chase.controller;

import com.advisor.chase.exception.PersistenceUnavailableException;
import com.advisor.chase.model.*;
import com.advisor.chase.service.ChaseItemService;
import com.advisor.chase.service.ChaseOrchestrator;
import com.advisor.chase.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ChaseItemController.class)
class ChaseItemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChaseItemService chaseItemService;

    @MockBean
    private ChaseOrchestrator orchestrator;

    @Test
    void listChaseItems_buildsFilterFromParams() throws Exception {
        when(chaseItemService.list(any())).thenReturn(List.of(
                TestDataFactory.createItem("CHASE-1", ChaseType.LOA, ChaseStatus.OVERDUE, Priority.HIGH)));

        mockMvc.perform(get("/api/v1/chase-items")
                        .param("status", "OVERDUE")
                        .param("type", "LOA")
                        .param("dueOnly", "true")
                        .param("limit", "5000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value("CHASE-1"))
                .andExpect(jsonPath("$[0].providerRef").value("Aviva"));

        ArgumentCaptor<ChaseItemFilter> captor = ArgumentCaptor.forClass(ChaseItemFilter.class);
        verify(chaseItemService).list(captor.capture());
        assertThat(captor.getValue().getStatus()).isEqualTo(ChaseStatus.OVERDUE);
        assertThat(captor.getValue().getType()).isEqualTo(ChaseType.LOA);
        assertThat(captor.getValue().isDueOnly()).isTrue();
        assertThat(captor.getValue().getLimit()).isEqualTo(1000);
    }

    @Test
    void listChaseItems_unknownStatus_returns400() throws Exception {
        mockMvc.perform(get("/api/v1/chase-items").param("status", "LOST"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }

    @Test
    void getChaseItem_found() throws Exception {
        when(chaseItemService.get("CHASE-1")).thenReturn(Optional.of(
                TestDataFactory.createItem("CHASE-1", ChaseType.DOCUMENT, ChaseStatus.SENT, Priority.MEDIUM)));

        mockMvc.perform(get("/api/v1/chase-items/CHASE-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("SENT"))
                .andExpect(jsonPath("$.target.kind").value("CLIENT"));
    }

    @Test
    void getChaseItem_notFound() throws Exception {
        when(chaseItemService.get("MISSING")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/chase-items/MISSING"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getActivities_returnsHistory() throws Exception {
        when(chaseItemService.get("CHASE-1")).thenReturn(Optional.of(
                TestDataFactory.createItem("CHASE-1", ChaseType.DOCUMENT, ChaseStatus.SENT, Priority.MEDIUM)));
        when(chaseItemService.activities("CHASE-1")).thenReturn(List.of(
                TestDataFactory.createActivity("CHASE-1", ChaseStatus.PENDING, ChaseStatus.SENT,
                        ActivityOutcome.SUCCESS, 1_700_000_000_000L)));

        mockMvc.perform(get("/api/v1/chase-items/CHASE-1/activities"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toStatus").value("SENT"))
                .andExpect(jsonPath("$[0].outcome").value("SUCCESS"));
    }

    @Test
    void getActivities_unknownItem_returns404() throws Exception {
        when(chaseItemService.get("MISSING")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/chase-items/MISSING/activities"))
                .andExpect(status().isNotFound());
    }

    @Test
    void createChaseItem_returns201() throws Exception {
        when(chaseItemService.create(any())).thenReturn(
                TestDataFactory.createItem("CHASE-9", ChaseType.LOA, ChaseStatus.PENDING, Priority.HIGH));

        mockMvc.perform(post("/api/v1/chase-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"LOA","priority":"HIGH","providerRef":"Aviva",
                                 "target":{"id":"Aviva","email":"loa@aviva.example"}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("CHASE-9"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<CreateChaseRequest> captor = ArgumentCaptor.forClass(CreateChaseRequest.class);
        verify(chaseItemService).create(captor.capture());
        assertThat(captor.getValue().getProviderRef()).isEqualTo("Aviva");
        assertThat(captor.getValue().getTarget().getEmail()).isEqualTo("loa@aviva.example");
    }

    @Test
    void createChaseItem_invalid_returns400() throws Exception {
        when(chaseItemService.create(any())).thenThrow(new IllegalArgumentException("providerRef is required for LOA chases"));

        mockMvc.perform(post("/api/v1/chase-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"LOA\",\"target\":{\"id\":\"Aviva\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("providerRef is required for LOA chases"));
    }

    @Test
    void createChaseItem_storeDown_returns503() throws Exception {
        when(chaseItemService.create(any())).thenThrow(
                new PersistenceUnavailableException("Aerospike write failed", new RuntimeException("timeout")));

        mockMvc.perform(post("/api/v1/chase-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"DOCUMENT\",\"target\":{\"id\":\"CLIENT-001\"}}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void processNow_returnsOutcome() throws Exception {
        when(orchestrator.processNow("CHASE-1")).thenReturn(ProcessOutcome.builder()
                .itemId("CHASE-1").result(ProcessOutcome.Result.SKIPPED_LEASED).build());

        mockMvc.perform(post("/api/v1/chase-items/CHASE-1/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("SKIPPED_LEASED"));
    }

    @Test
    void processNow_unknownItem_returns404() throws Exception {
        when(orchestrator.processNow("MISSING")).thenReturn(ProcessOutcome.builder()
                .itemId("MISSING").result(ProcessOutcome.Result.NOT_FOUND).build());

        mockMvc.perform(post("/api/v1/chase-items/MISSING/process"))
                .andExpect(status().isNotFound());
    }

    @Test
    void processNow_whileHalted_returns409() throws Exception {
        when(orchestrator.processNow("CHASE-1")).thenThrow(new IllegalStateException("Scheduling halted"));

        mockMvc.perform(post("/api/v1/chase-items/CHASE-1/process"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Scheduling halted"));
    }

    @Test
    void markReceived_passesDetail() throws Exception {
        when(chaseItemService.markReceived("CHASE-1", "LOA returned by post")).thenReturn(Optional.of(
                TestDataFactory.createItem("CHASE-1", ChaseType.LOA, ChaseStatus.RECEIVED, Priority.MEDIUM)));

        mockMvc.perform(post("/api/v1/chase-items/CHASE-1/received")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"detail\":\"LOA returned by post\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RECEIVED"));
    }

    @Test
    void markReceived_fromPending_returns409() throws Exception {
        when(chaseItemService.markReceived("CHASE-1", null))
                .thenThrow(new IllegalStateException("Cannot move chase item CHASE-1 from PENDING to RECEIVED"));

        mockMvc.perform(post("/api/v1/chase-items/CHASE-1/received"))
                .andExpect(status().isConflict());
    }

    @Test
    void markCompleted_unknownItem_returns404() throws Exception {
        when(chaseItemService.markCompleted("MISSING", null)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/chase-items/MISSING/complete"))
                .andExpect(status().isNotFound());
    }
}
