package com.flamingo.imagelab.service.histogram;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.processing.Histogram;
import com.flamingo.imagelab.service.image.ImageService;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Implementation of the HistogramService. Images never change after insert, so a histogram cached
 * under an image id stays valid for as long as that id exists.
 */
@Service
@Slf4j
public class HistogramServiceImpl implements HistogramService {

  private final ImageService imageService;
  private final MeterRegistry meterRegistry;
  private final Cache<UUID, Histogram> cache;

  public HistogramServiceImpl(
      ImageService imageService, ImageLabConfig imageLabConfig, MeterRegistry meterRegistry) {
    this.imageService = imageService;
    this.meterRegistry = meterRegistry;
    ImageLabConfig.Histogram config = imageLabConfig.getHistogram();
    this.cache =
        config.isCacheEnabled()
            ? CacheBuilder.newBuilder().maximumSize(config.getCacheMaxEntries()).build()
            : null;
  }

  @Override
  @Timed(value = "histogram.compute", description = "Time to get an image histogram")
  public Histogram getHistogram(UUID ownerId, UUID imageId) {
    // Ownership is checked on every call, cached or not.
    Image image = imageService.getImage(ownerId, imageId);

    if (cache != null) {
      Histogram cached = cache.getIfPresent(imageId);
      if (cached != null) {
        meterRegistry.counter("histogram.cache.hit").increment();
        return cached;
      }
      meterRegistry.counter("histogram.cache.miss").increment();
    }

    Histogram histogram = Histogram.of(imageService.loadPixels(image));
    log.debug(
        "Computed {} histogram for image {}",
        histogram.isGrayscale() ? "gray" : "rgb",
        imageId);
    if (cache != null) {
      cache.put(imageId, histogram);
    }
    return histogram;
  }
}
