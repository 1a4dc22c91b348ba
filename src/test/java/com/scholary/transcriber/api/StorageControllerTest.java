package com.scholary.transcriber.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.transcriber.session.SessionStatus;
import com.scholary.transcriber.session.StorageStatistics;
import com.scholary.transcriber.session.StorageStatisticsService;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(StorageController.class)
class StorageControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private StorageStatisticsService statisticsService;

  @Test
  void getStatistics_returnsCounts() throws Exception {
    when(statisticsService.collect())
        .thenReturn(
            new StorageStatistics(
                2,
                1,
                Map.of(SessionStatus.RECEIVING, 1, SessionStatus.COMPLETED, 1),
                5,
                4_096,
                819.2,
                3,
                1_024));

    mockMvc
        .perform(get("/api/v1/storage/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalSessions").value(2))
        .andExpect(jsonPath("$.sessionsByStatus.RECEIVING").value(1))
        .andExpect(jsonPath("$.storedAudioBytes").value(4096))
        .andExpect(jsonPath("$.cacheEntries").value(3));
  }
}
