package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.config.ImageLabConfig;
import com.flamingo.imagelab.domain.entity.HistoryEntry;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.exception.PersistenceFailureException;
import com.flamingo.imagelab.exception.ProcessingRejectedException;
import com.flamingo.imagelab.exception.ProcessingTimeoutException;
import com.flamingo.imagelab.processing.ImageOperation;
import com.flamingo.imagelab.processing.ImageTransformer;
import com.flamingo.imagelab.processing.PixelBuffer;
import com.flamingo.imagelab.processing.PixelBufferCodec;
import com.flamingo.imagelab.service.image.ImageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Implementation of the BatchExecutor.
 *
 * <p>Reads happen on the request thread, the pixel fold on the {@code imageProcessingExecutor}
 * pool under the batch timeout, and the write in a single transaction. Nothing is stored unless
 * every operation succeeded.
 */
@Service
@Slf4j
public class BatchExecutorImpl implements BatchExecutor {

  private final DerivationResolver derivationResolver;
  private final ImageService imageService;
  private final ImageTransformer imageTransformer;
  private final PixelBufferCodec pixelBufferCodec;
  private final DerivedImageWriter derivedImageWriter;
  private final ThreadPoolTaskExecutor processingExecutor;
  private final ImageLabConfig imageLabConfig;
  private final MeterRegistry meterRegistry;

  public BatchExecutorImpl(
      DerivationResolver derivationResolver,
      ImageService imageService,
      ImageTransformer imageTransformer,
      PixelBufferCodec pixelBufferCodec,
      DerivedImageWriter derivedImageWriter,
      @Qualifier("imageProcessingExecutor") ThreadPoolTaskExecutor processingExecutor,
      ImageLabConfig imageLabConfig,
      MeterRegistry meterRegistry) {
    this.derivationResolver = derivationResolver;
    this.imageService = imageService;
    this.imageTransformer = imageTransformer;
    this.pixelBufferCodec = pixelBufferCodec;
    this.derivedImageWriter = derivedImageWriter;
    this.processingExecutor = processingExecutor;
    this.imageLabConfig = imageLabConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "processing.batch", description = "Time to execute a processing batch")
  public BatchResult execute(UUID ownerId, UUID anchorImageId, List<ImageOperation> operations) {
    if (operations == null || operations.isEmpty()) {
      throw new InvalidParameterException("operations", "operations must not be empty");
    }
    int max = imageLabConfig.getProcessing().getMaxOperationsPerBatch();
    if (operations.size() > max) {
      throw new InvalidParameterException(
          "operations", "a batch may contain at most " + max + " operations");
    }
    return run(ownerId, anchorImageId, List.copyOf(operations));
  }

  @Override
  @Timed(value = "processing.reset", description = "Time to reset an image to its original")
  public BatchResult resetToOriginal(UUID ownerId, UUID imageId) {
    return run(ownerId, imageId, List.of());
  }

  private BatchResult run(UUID ownerId, UUID anchorImageId, List<ImageOperation> operations) {
    String label = historyLabel(operations);
    log.info(
        "Executing {} ({} operations) on image {} for owner {}",
        label,
        operations.size(),
        anchorImageId,
        ownerId);

    try {
      ResolvedChain chain = derivationResolver.resolve(ownerId, anchorImageId);
      PixelBuffer rootPixels = imageService.loadPixels(chain.root());
      Map<UUID, PixelBuffer> overlays = loadOverlays(ownerId, operations);

      PixelBuffer result = fold(anchorImageId, rootPixels, operations, overlays);

      String format = imageLabConfig.getProcessing().getOutputFormat();
      DerivedImageWriter.EncodedImage encoded =
          new DerivedImageWriter.EncodedImage(
              pixelBufferCodec.encode(result, format),
              pixelBufferCodec.mimeType(format),
              result.width(),
              result.height());

      DerivedImageWriter.Written written =
          persist(ownerId, chain.root(), encoded, label, operations);

      meterRegistry.counter("processing.batch.executed", "operations", label).increment();
      operations.forEach(
          op ->
              meterRegistry
                  .counter("processing.operation.applied", "operation", op.type().wireName())
                  .increment());
      log.info(
          "Batch {} on image {} produced image {} ({}x{}) from root {}",
          label,
          anchorImageId,
          written.image().getId(),
          result.width(),
          result.height(),
          chain.root().getId());
      return new BatchResult(written.image(), chain, operations, written.historyEntry());
    } catch (RuntimeException e) {
      meterRegistry
          .counter("processing.batch.failed", "reason", e.getClass().getSimpleName())
          .increment();
      throw e;
    }
  }

  /** Loads every merge overlay up front, with the same ownership checks as the anchor. */
  private Map<UUID, PixelBuffer> loadOverlays(UUID ownerId, List<ImageOperation> operations) {
    Map<UUID, PixelBuffer> overlays = new LinkedHashMap<>();
    for (ImageOperation operation : operations) {
      if (operation instanceof ImageOperation.MergeImages merge
          && !overlays.containsKey(merge.otherImageId())) {
        Image other = imageService.getImage(ownerId, merge.otherImageId());
        overlays.put(other.getId(), imageService.loadPixels(other));
      }
    }
    return overlays;
  }

  private PixelBuffer fold(
      UUID anchorImageId,
      PixelBuffer rootPixels,
      List<ImageOperation> operations,
      Map<UUID, PixelBuffer> overlays) {
    if (operations.isEmpty()) {
      return rootPixels;
    }
    long timeoutMs = imageLabConfig.getProcessing().getBatchTimeoutMs();
    Future<PixelBuffer> future;
    try {
      future =
          processingExecutor.submit(
              () -> imageTransformer.applyAll(rootPixels, operations, overlays::get));
    } catch (TaskRejectedException e) {
      log.warn("Processing pool saturated, rejecting batch on image {}", anchorImageId);
      throw new ProcessingRejectedException(anchorImageId, e);
    }
    try {
      return future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Batch on image {} timed out after {} ms", anchorImageId, timeoutMs);
      throw new ProcessingTimeoutException(anchorImageId, timeoutMs);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for batch on " + anchorImageId, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new IllegalStateException("Batch on image " + anchorImageId + " failed", e.getCause());
    }
  }

  private DerivedImageWriter.Written persist(
      UUID ownerId,
      Image root,
      DerivedImageWriter.EncodedImage encoded,
      String label,
      List<ImageOperation> operations) {
    try {
      return derivedImageWriter.write(ownerId, root, encoded, label, historyParams(operations));
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to store result of " + label, e);
    }
  }

  static String historyLabel(List<ImageOperation> operations) {
    return switch (operations.size()) {
      case 0 -> HistoryEntry.OPERATION_RESET;
      case 1 -> operations.get(0).type().wireName();
      default -> HistoryEntry.OPERATION_BATCH;
    };
  }

  static Map<String, Object> historyParams(List<ImageOperation> operations) {
    if (operations.size() == 1) {
      return new LinkedHashMap<>(operations.get(0).parameters());
    }
    Map<String, Object> params = new LinkedHashMap<>();
    if (!operations.isEmpty()) {
      List<Map<String, Object>> described = new ArrayList<>();
      for (ImageOperation operation : operations) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("operation", operation.type().wireName());
        item.put("params", operation.parameters());
        described.add(item);
      }
      params.put("operations", described);
    }
    return params;
  }
}
