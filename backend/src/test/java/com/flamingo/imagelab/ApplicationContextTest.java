package com.flamingo.imagelab;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.imagelab.service.histogram.HistogramService;
import com.flamingo.imagelab.service.history.HistoryService;
import com.flamingo.imagelab.service.image.ImageService;
import com.flamingo.imagelab.service.processing.BatchExecutor;
import com.flamingo.imagelab.service.processing.DerivationResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/** Verifies the Spring application context loads against the in-memory test database. */
@SpringBootTest
@ActiveProfiles("test")
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ImageService.class)).isNotNull();
    assertThat(applicationContext.getBean(DerivationResolver.class)).isNotNull();
    assertThat(applicationContext.getBean(BatchExecutor.class)).isNotNull();
    assertThat(applicationContext.getBean(HistoryService.class)).isNotNull();
    assertThat(applicationContext.getBean(HistogramService.class)).isNotNull();
  }
}
