package com.flamingo.imagelab.processing;

import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Applies operations to pixel buffers. Stateless and free of I/O: every pixel it needs, including
 * merge overlays, is handed in by the caller.
 */
@Component
public class ImageTransformer {

  /**
   * Applies a single operation.
   *
   * @param input buffer to read; never modified
   * @param operation the operation
   * @param overlays source for merge overlays
   * @return the transformed buffer
   * @throws com.flamingo.imagelab.exception.InvalidParameterException if the operation's
   *     parameters do not fit this image
   */
  public PixelBuffer apply(PixelBuffer input, ImageOperation operation, OverlaySource overlays) {
    return operation.accept(new Applier(input, overlays));
  }

  /** Folds the operations left to right, each one reading the previous result. */
  public PixelBuffer applyAll(
      PixelBuffer input, List<? extends ImageOperation> operations, OverlaySource overlays) {
    PixelBuffer current = input;
    for (ImageOperation operation : operations) {
      if (Thread.currentThread().isInterrupted()) {
        throw new IllegalStateException("Interrupted while applying " + operation.type());
      }
      current = apply(current, operation, overlays);
    }
    return current;
  }

  private record Applier(PixelBuffer in, OverlaySource overlays)
      implements ImageOperation.Visitor<PixelBuffer> {

    @Override
    public PixelBuffer visitBrightness(ImageOperation.Brightness op) {
      return PointTransforms.brightness(in, op.factor());
    }

    @Override
    public PixelBuffer visitLogContrast(ImageOperation.LogContrast op) {
      return PointTransforms.logContrast(in, op.k());
    }

    @Override
    public PixelBuffer visitExpContrast(ImageOperation.ExpContrast op) {
      return PointTransforms.expContrast(in, op.k());
    }

    @Override
    public PixelBuffer visitInvert(ImageOperation.Invert op) {
      return PointTransforms.invert(in);
    }

    @Override
    public PixelBuffer visitGrayscale(ImageOperation.Grayscale op) {
      return PointTransforms.grayscale(in, op.method());
    }

    @Override
    public PixelBuffer visitBinarize(ImageOperation.Binarize op) {
      return PointTransforms.binarize(in, op.threshold());
    }

    @Override
    public PixelBuffer visitChannelToggle(ImageOperation.ChannelToggle op) {
      return PointTransforms.channel(in, op.channel(), op.enabled());
    }

    @Override
    public PixelBuffer visitTranslate(ImageOperation.Translate op) {
      return GeometricTransforms.translate(in, op.dx(), op.dy());
    }

    @Override
    public PixelBuffer visitRotate(ImageOperation.Rotate op) {
      return GeometricTransforms.rotate(in, op.angle());
    }

    @Override
    public PixelBuffer visitCrop(ImageOperation.Crop op) {
      return GeometricTransforms.crop(in, op.xStart(), op.xEnd(), op.yStart(), op.yEnd());
    }

    @Override
    public PixelBuffer visitReduceResolution(ImageOperation.ReduceResolution op) {
      return GeometricTransforms.reduceResolution(in, op.factor());
    }

    @Override
    public PixelBuffer visitEnlargeRegion(ImageOperation.EnlargeRegion op) {
      return GeometricTransforms.enlargeRegion(
          in, op.xStart(), op.xEnd(), op.yStart(), op.yEnd(), op.factor());
    }

    @Override
    public PixelBuffer visitMergeImages(ImageOperation.MergeImages op) {
      return Compositing.merge(in, overlays.overlay(op.otherImageId()), op.transparency());
    }
  }
}
