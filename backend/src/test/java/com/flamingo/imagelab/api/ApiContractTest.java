package com.flamingo.imagelab.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.imagelab.api.rest.HistoryController;
import com.flamingo.imagelab.api.rest.ImageController;
import com.flamingo.imagelab.api.rest.ProcessingController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the controller base paths clients depend on:
 *
 * <ul>
 *   <li>/images - upload, list, metadata, download, delete
 *   <li>/processing - batch, single operations, histogram
 *   <li>/history - ledger listing and deletion
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("ImageController API contract")
  class ImageControllerContract {

    @Test
    @DisplayName("should be mapped to /images")
    void shouldBeMappedToImages() {
      RequestMapping mapping = ImageController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/images");
    }
  }

  @Nested
  @DisplayName("ProcessingController API contract")
  class ProcessingControllerContract {

    @Test
    @DisplayName("should be mapped to /processing")
    void shouldBeMappedToProcessing() {
      RequestMapping mapping = ProcessingController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/processing");
    }
  }

  @Nested
  @DisplayName("HistoryController API contract")
  class HistoryControllerContract {

    @Test
    @DisplayName("should be mapped to /history")
    void shouldBeMappedToHistory() {
      RequestMapping mapping = HistoryController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/history");
    }
  }
}
