package com.advisor.chase.controller;

import com.advisor.chase.model.AnalyticsSnapshot;
import com.advisor.chase.service.AnalyticsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalyticsService analyticsService;

    @Test
    void getSnapshot_returnsAggregates() throws Exception {
        when(analyticsService.getSnapshot()).thenReturn(AnalyticsSnapshot.builder()
                .totalChaseItems(12)
                .pendingItems(5)
                .overdueItems(2)
                .completedToday(1)
                .avgCompletionDays(11.5)
                .timeSavedHours(6.3)
                .automationRate(96.2)
                .activeAgents(3)
                .statusDistribution(Map.of("OVERDUE", 2))
                .typeDistribution(Map.of("LOA", 7, "DOCUMENT", 5))
                .priorityDistribution(Map.of("HIGH", 4))
                .dailyActivityTrend(List.of(new AnalyticsSnapshot.DailyCount("2025-03-03", 18)))
                .build());

        mockMvc.perform(get("/api/v1/analytics/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalChaseItems").value(12))
                .andExpect(jsonPath("$.automationRate").value(96.2))
                .andExpect(jsonPath("$.typeDistribution.LOA").value(7))
                .andExpect(jsonPath("$.dailyActivityTrend[0].date").value("2025-03-03"))
                .andExpect(jsonPath("$.dailyActivityTrend[0].count").value(18));
    }
}
