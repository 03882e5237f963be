package com.flamingo.imagelab.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.imagelab.api.dto.response.SystemStats;
import com.flamingo.imagelab.service.health.HealthService;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("HealthController Tests")
class HealthControllerTest {

  @Mock private HealthService healthService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    HealthController controller = new HealthController(healthService);
    ReflectionTestUtils.setField(controller, "version", "9.9.9");
    mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
  }

  @Test
  @DisplayName("Should answer banner with version")
  void shouldAnswerBanner() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ok"))
        .andExpect(jsonPath("$.version").value("9.9.9"));
  }

  @Test
  @DisplayName("Should report stats")
  void shouldReportStats() throws Exception {
    when(healthService.getSystemStats())
        .thenReturn(
            SystemStats.builder()
                .totalImages(3)
                .totalOriginals(1)
                .totalHistoryEntries(2)
                .timestamp(LocalDateTime.now())
                .build());

    mockMvc
        .perform(get("/health/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.totalImages").value(3))
        .andExpect(jsonPath("$.totalOriginals").value(1))
        .andExpect(jsonPath("$.totalHistoryEntries").value(2));
  }
}
