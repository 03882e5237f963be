package com.flamingo.imagelab.api.rest;

import com.flamingo.imagelab.api.dto.request.BatchOperationRequest;
import com.flamingo.imagelab.api.dto.request.BatchProcessingRequest;
import com.flamingo.imagelab.api.dto.request.BinarizeRequest;
import com.flamingo.imagelab.api.dto.request.BrightnessRequest;
import com.flamingo.imagelab.api.dto.request.ChannelRequest;
import com.flamingo.imagelab.api.dto.request.ContrastRequest;
import com.flamingo.imagelab.api.dto.request.CropRequest;
import com.flamingo.imagelab.api.dto.request.EnlargeRegionRequest;
import com.flamingo.imagelab.api.dto.request.GrayscaleRequest;
import com.flamingo.imagelab.api.dto.request.ImageIdRequest;
import com.flamingo.imagelab.api.dto.request.MergeRequest;
import com.flamingo.imagelab.api.dto.request.ReduceResolutionRequest;
import com.flamingo.imagelab.api.dto.request.RotateRequest;
import com.flamingo.imagelab.api.dto.request.TranslateRequest;
import com.flamingo.imagelab.api.dto.response.BatchProcessingResponse;
import com.flamingo.imagelab.api.dto.response.HistogramResponse;
import com.flamingo.imagelab.api.dto.response.OperationDescriptor;
import com.flamingo.imagelab.api.dto.response.ProcessingOperationResponse;
import com.flamingo.imagelab.domain.entity.Image;
import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.processing.ColorChannel;
import com.flamingo.imagelab.processing.GrayscaleMethod;
import com.flamingo.imagelab.processing.ImageOperation;
import com.flamingo.imagelab.processing.OperationParser;
import com.flamingo.imagelab.processing.OperationType;
import com.flamingo.imagelab.service.auth.CurrentOwnerProvider;
import com.flamingo.imagelab.service.histogram.HistogramService;
import com.flamingo.imagelab.service.processing.BatchExecutor;
import com.flamingo.imagelab.service.processing.BatchResult;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for image edits.
 *
 * <p>Every single-operation endpoint builds a one-element batch and hands it to the same {@link
 * BatchExecutor} as {@code /batch}, so each edit derives from the root and never from a previous
 * result.
 */
@RestController
@RequestMapping("/processing")
@RequiredArgsConstructor
public class ProcessingController {

  private final BatchExecutor batchExecutor;
  private final OperationParser operationParser;
  private final HistogramService histogramService;
  private final CurrentOwnerProvider currentOwnerProvider;
  private final ImageUrlResolver imageUrlResolver;

  /** Applies an ordered list of operations to the root of the given image. */
  @PostMapping("/batch")
  public ResponseEntity<BatchProcessingResponse> batch(
      @Valid @RequestBody BatchProcessingRequest request) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    List<ImageOperation> operations =
        request.getOperations().stream().map(this::parse).toList();

    BatchResult result = batchExecutor.execute(ownerId, request.getImageId(), operations);
    Image image = result.image();
    return ResponseEntity.ok(
        BatchProcessingResponse.builder()
            .id(image.getId())
            .url(imageUrlResolver.downloadUrl(image.getId()))
            .width(image.getWidth())
            .height(image.getHeight())
            .mimeType(image.getMimeType())
            .operationsApplied(result.operations().stream().map(OperationDescriptor::from).toList())
            .originalImageId(request.getImageId())
            .rootImageId(result.chain().root().getId())
            .createdAt(image.getCreatedAt())
            .build());
  }

  @PostMapping("/brightness")
  public ResponseEntity<ProcessingOperationResponse> brightness(
      @Valid @RequestBody BrightnessRequest request) {
    return single(request.getImageId(), "brightness", params("factor", request.getFactor()));
  }

  /** Logarithmic or exponential contrast with intensity k. */
  @PostMapping("/contrast")
  public ResponseEntity<ProcessingOperationResponse> contrast(
      @Valid @RequestBody ContrastRequest request) {
    OperationType type;
    if ("logarithmic".equals(request.getType())) {
      type = OperationType.LOG_CONTRAST;
    } else if ("exponential".equals(request.getType())) {
      type = OperationType.EXP_CONTRAST;
    } else {
      throw new InvalidParameterException("type", "type must be logarithmic or exponential");
    }
    return single(request.getImageId(), type.wireName(), params("k", request.getIntensity()));
  }

  @PostMapping("/channel")
  public ResponseEntity<ProcessingOperationResponse> channel(
      @Valid @RequestBody ChannelRequest request) {
    ColorChannel channel = ColorChannel.fromWireName(request.getChannel());
    return single(
        request.getImageId(),
        channel.operationType().wireName(),
        params("enabled", request.getEnabled()));
  }

  @PostMapping("/grayscale")
  public ResponseEntity<ProcessingOperationResponse> grayscale(
      @Valid @RequestBody GrayscaleRequest request) {
    GrayscaleMethod method = GrayscaleMethod.fromWireName(request.getMethod());
    return single(request.getImageId(), method.operationType().wireName(), Map.of());
  }

  @PostMapping("/binarize")
  public ResponseEntity<ProcessingOperationResponse> binarize(
      @Valid @RequestBody BinarizeRequest request) {
    return single(request.getImageId(), "binarize", params("threshold", request.getThreshold()));
  }

  @PostMapping("/negative")
  public ResponseEntity<ProcessingOperationResponse> negative(
      @Valid @RequestBody ImageIdRequest request) {
    return single(request.getImageId(), OperationType.INVERT.wireName(), Map.of());
  }

  @PostMapping("/translate")
  public ResponseEntity<ProcessingOperationResponse> translate(
      @Valid @RequestBody TranslateRequest request) {
    return single(
        request.getImageId(), "translate", params("dx", request.getDx(), "dy", request.getDy()));
  }

  @PostMapping("/rotate")
  public ResponseEntity<ProcessingOperationResponse> rotate(
      @Valid @RequestBody RotateRequest request) {
    return single(request.getImageId(), "rotate", params("angle", request.getAngle()));
  }

  @PostMapping("/crop")
  public ResponseEntity<ProcessingOperationResponse> crop(@Valid @RequestBody CropRequest request) {
    return single(
        request.getImageId(),
        "crop",
        params(
            "x_start", request.getXStart(),
            "x_end", request.getXEnd(),
            "y_start", request.getYStart(),
            "y_end", request.getYEnd()));
  }

  @PostMapping("/reduce-resolution")
  public ResponseEntity<ProcessingOperationResponse> reduceResolution(
      @Valid @RequestBody ReduceResolutionRequest request) {
    return single(
        request.getImageId(), "reduce_resolution", params("factor", request.getFactor()));
  }

  @PostMapping("/enlarge-region")
  public ResponseEntity<ProcessingOperationResponse> enlargeRegion(
      @Valid @RequestBody EnlargeRegionRequest request) {
    Map<String, Object> params =
        params(
            "x_start", request.getXStart(),
            "x_end", request.getXEnd(),
            "y_start", request.getYStart(),
            "y_end", request.getYEnd());
    params.put("zoom_factor", request.getZoomFactor());
    return single(
        request.getImageId(), "enlarge_region", params, ProcessingController::withZoomFactor);
  }

  /** Blends {@code image2_id} over the root of {@code image1_id}. */
  @PostMapping("/merge")
  public ResponseEntity<ProcessingOperationResponse> merge(
      @Valid @RequestBody MergeRequest request) {
    return single(
        request.getImage1Id(),
        "merge_images",
        params(
            "other_image_id", request.getImage2Id().toString(),
            "transparency", request.getTransparency()));
  }

  /** Writes a fresh copy of the root; recorded in history as {@code reset}. */
  @PostMapping("/reset")
  public ResponseEntity<ProcessingOperationResponse> reset(
      @Valid @RequestBody ImageIdRequest request) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    BatchResult result = batchExecutor.resetToOriginal(ownerId, request.getImageId());
    return ResponseEntity.ok(toResponse(result, "reset", Map.of()));
  }

  /** Returns the gray or red/green/blue intensity histogram of an image. */
  @GetMapping("/{imageId}/histogram")
  public ResponseEntity<HistogramResponse> histogram(@PathVariable UUID imageId) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    return ResponseEntity.ok(
        HistogramResponse.from(histogramService.getHistogram(ownerId, imageId)));
  }

  private ImageOperation parse(BatchOperationRequest request) {
    return operationParser.parse(request.getOperation(), request.getParams());
  }

  private ResponseEntity<ProcessingOperationResponse> single(
      UUID imageId, String operationName, Map<String, Object> params) {
    return single(imageId, operationName, params, UnaryOperator.identity());
  }

  /**
   * Runs one operation as a batch. {@code echo} maps the operation's canonical parameters to the
   * names the endpoint accepted, for the response only.
   */
  private ResponseEntity<ProcessingOperationResponse> single(
      UUID imageId,
      String operationName,
      Map<String, Object> params,
      UnaryOperator<Map<String, Object>> echo) {
    UUID ownerId = currentOwnerProvider.getCurrentOwnerId();
    ImageOperation operation = operationParser.parse(operationName, params);
    BatchResult result = batchExecutor.execute(ownerId, imageId, List.of(operation));
    return ResponseEntity.ok(
        toResponse(result, operation.type().wireName(), echo.apply(operation.parameters())));
  }

  private static Map<String, Object> withZoomFactor(Map<String, Object> canonical) {
    Map<String, Object> echoed = new LinkedHashMap<>(canonical);
    echoed.put("zoom_factor", echoed.remove("factor"));
    return echoed;
  }

  private ProcessingOperationResponse toResponse(
      BatchResult result, String operation, Map<String, Object> parameters) {
    Image image = result.image();
    return ProcessingOperationResponse.builder()
        .id(image.getId())
        .url(imageUrlResolver.downloadUrl(image.getId()))
        .width(image.getWidth())
        .height(image.getHeight())
        .mimeType(image.getMimeType())
        .operation(operation)
        .parameters(parameters)
        .originalImageId(result.chain().root().getId())
        .createdAt(image.getCreatedAt())
        .build();
  }

  /** Builds a mutable parameter map from name/value pairs; values may be null. */
  private static Map<String, Object> params(Object... pairs) {
    Map<String, Object> params = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      params.put((String) pairs[i], pairs[i + 1]);
    }
    return params;
  }
}
