package com.flamingo.imagelab.api.rest;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.exception.ApiError;
import com.flamingo.imagelab.exception.GlobalExceptionHandler;
import com.flamingo.imagelab.exception.HistoryEntryNotFoundException;
import com.flamingo.imagelab.service.auth.CurrentOwnerProvider;
import com.flamingo.imagelab.service.history.HistoryItem;
import com.flamingo.imagelab.service.history.HistoryPage;
import com.flamingo.imagelab.service.history.HistoryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("HistoryController Tests")
class HistoryControllerTest {

  @Mock private HistoryService historyService;
  @Mock private CurrentOwnerProvider currentOwnerProvider;

  private MockMvc mockMvc;
  private UUID ownerId;

  @BeforeEach
  void setUp() {
    HistoryController controller =
        new HistoryController(
            historyService, currentOwnerProvider, new ImageUrlResolver(new ImageLabConfig()));
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
    ownerId = UUID.randomUUID();
    when(currentOwnerProvider.getCurrentOwnerId()).thenReturn(ownerId);
  }

  @Test
  @DisplayName("Should list history with attached image or null")
  void shouldListHistory() throws Exception {
    Image image =
        Image.builder()
            .id(UUID.randomUUID())
            .ownerId(ownerId)
            .width(5)
            .height(5)
            .mimeType("image/png")
            .createdAt(LocalDateTime.now())
            .build();
    HistoryEntry live = entry(image.getId(), "brightness", Map.of("factor", 1.2));
    HistoryEntry orphan = entry(UUID.randomUUID(), "reset", Map.of());
    when(historyService.listHistory(ownerId, null, 50, 0))
        .thenReturn(
            new HistoryPage(
                List.of(new HistoryItem(live, image), new HistoryItem(orphan, null)), 2, 50, 0));

    mockMvc
        .perform(get("/history"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.history[0].operation").value("brightness"))
        .andExpect(jsonPath("$.history[0].params.factor").value(1.2))
        .andExpect(jsonPath("$.history[0].user_id").value(ownerId.toString()))
        .andExpect(jsonPath("$.history[0].image.id").value(image.getId().toString()))
        .andExpect(jsonPath("$.history[1].image").doesNotExist());
  }

  @Test
  @DisplayName("Should filter by image through query or path")
  void shouldFilterByImage() throws Exception {
    UUID imageId = UUID.randomUUID();
    when(historyService.listHistory(ownerId, imageId, 5, 0))
        .thenReturn(new HistoryPage(List.of(), 0, 5, 0));
    when(historyService.listHistory(ownerId, imageId, 50, 0))
        .thenReturn(new HistoryPage(List.of(), 0, 50, 0));

    mockMvc
        .perform(get("/history").param("image_id", imageId.toString()).param("limit", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(0));
    mockMvc.perform(get("/history/{imageId}", imageId)).andExpect(status().isOk());

    verify(historyService).listHistory(ownerId, imageId, 5, 0);
    verify(historyService).listHistory(ownerId, imageId, 50, 0);
  }

  @Test
  @DisplayName("Should delete ledger entry")
  void shouldDeleteEntry() throws Exception {
    UUID entryId = UUID.randomUUID();

    mockMvc
        .perform(delete("/history/{entryId}", entryId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true));

    verify(historyService).deleteEntry(ownerId, entryId);
  }

  @Test
  @DisplayName("Should return 404 for unknown entry")
  void shouldReturnNotFound() throws Exception {
    UUID entryId = UUID.randomUUID();
    doThrow(new HistoryEntryNotFoundException(entryId))
        .when(historyService)
        .deleteEntry(ownerId, entryId);

    mockMvc
        .perform(delete("/history/{entryId}", entryId))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.HISTORY_NOT_FOUND));
  }

  private HistoryEntry entry(UUID imageId, String operation, Map<String, Object> params) {
    return HistoryEntry.builder()
        .id(UUID.randomUUID())
        .ownerId(ownerId)
        .imageId(imageId)
        .rootImageId(UUID.randomUUID())
        .operation(operation)
        .params(params)
        .createdAt(LocalDateTime.now())
        .build();
  }
}
