package com.advisor.chase.controller;

import com.advisor.chase.service.ProviderProfileService;
import com.advisor.chase.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ProviderController.class)
class ProviderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProviderProfileService profileService;

    @Test
    void getProfile_found() throws Exception {
        when(profileService.getProfile("Aviva"))
                .thenReturn(TestDataFactory.createProfile("Aviva", 12.0, 10, 2));

        mockMvc.perform(get("/api/v1/providers/Aviva/profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.providerId").value("Aviva"))
                .andExpect(jsonPath("$.receivedCount").value(10))
                .andExpect(jsonPath("$.failedCount").value(2));
    }

    @Test
    void getProfile_unknownProvider_returns404() throws Exception {
        when(profileService.getProfile("NewCo")).thenReturn(null);

        mockMvc.perform(get("/api/v1/providers/NewCo/profile"))
                .andExpect(status().isNotFound());
    }
}
