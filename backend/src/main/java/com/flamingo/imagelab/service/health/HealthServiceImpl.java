package com.flamingo.imagelab.service.health;

import com.flamingo.imagelab.api.dto.response.SystemStats;
import com.flamingo.imagelab.domain.repository.HistoryEntryRepository;
import com.flamingo.imagelab.domain.repository.ImageRepository;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of HealthService for system health checks and statistics. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final ImageRepository imageRepository;
  private final HistoryEntryRepository historyEntryRepository;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "health.stats", description = "Time to get system stats")
  public SystemStats getSystemStats() {
    return SystemStats.builder()
        .totalImages(imageRepository.count())
        .totalOriginals(imageRepository.countByOriginalIdIsNull())
        .totalHistoryEntries(historyEntryRepository.count())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
