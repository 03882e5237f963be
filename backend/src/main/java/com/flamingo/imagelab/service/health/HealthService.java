package com.flamingo.imagelab.service.health;

import com.flamingo.imagelab.api.dto.response.SystemStats;

/** Service interface for health checks and system statistics. */
public interface HealthService {

  /**
   * Gets system-wide statistics: stored images, how many of them are uploads, and history entries.
   *
   * @return system statistics
   */
  SystemStats getSystemStats();
}
