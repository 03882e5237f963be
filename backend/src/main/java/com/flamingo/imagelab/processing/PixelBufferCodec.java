package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.UnsupportedImageException;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts between encoded image files and {@link PixelBuffer}s using {@link ImageIO}.
 *
 * <p>Single-band 8-bit images decode to one channel; everything else decodes to RGB with any
 * alpha composited onto black.
 */
@Component
@Slf4j
public class PixelBufferCodec {

  /**
   * Decodes image file bytes.
   *
   * @throws UnsupportedImageException if no installed reader understands the bytes, or the
   *     image has more than {@link PixelBuffer#MAX_PIXELS} pixels
   */
  public PixelBuffer decode(byte[] data) {
    try (ImageInputStream input =
        ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
      Iterator<ImageReader> readers =
          input == null ? Collections.emptyIterator() : ImageIO.getImageReaders(input);
      if (!readers.hasNext()) {
        throw new UnsupportedImageException("Unrecognized image format");
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        // Dimensions come from the header, so oversized images are refused before decoding.
        checkPixelLimit(reader.getWidth(0), reader.getHeight(0));
        return fromBufferedImage(reader.read(0));
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      throw new UnsupportedImageException("Failed to decode image: " + e.getMessage(), e);
    }
  }

  /** Encodes a buffer in the given ImageIO format name, e.g. {@code png}. */
  public byte[] encode(PixelBuffer buffer, String format) {
    BufferedImage image = toBufferedImage(buffer);
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try {
      if (!ImageIO.write(image, format.toLowerCase(Locale.ROOT), baos)) {
        throw new IllegalStateException("No ImageIO writer for format " + format);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to encode image as " + format, e);
    }
    return baos.toByteArray();
  }

  /** MIME type of the bytes produced by {@link #encode} for a format name. */
  public String mimeType(String format) {
    return switch (format.toLowerCase(Locale.ROOT)) {
      case "jpg", "jpeg" -> "image/jpeg";
      case "bmp" -> "image/bmp";
      case "gif" -> "image/gif";
      default -> "image/png";
    };
  }

  PixelBuffer fromBufferedImage(BufferedImage image) {
    int w = image.getWidth();
    int h = image.getHeight();
    checkPixelLimit(w, h);
    if (isEightBitGray(image)) {
      byte[] gray = new byte[w * h];
      image.getRaster().getDataElements(0, 0, w, h, gray);
      return PixelBuffer.wrap(w, h, PixelBuffer.GRAY, gray);
    }

    int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
    byte[] rgb = new byte[w * h * 3];
    for (int p = 0; p < argb.length; p++) {
      int pixel = argb[p];
      int alpha = (pixel >>> 24) & 0xFF;
      int r = (pixel >> 16) & 0xFF;
      int g = (pixel >> 8) & 0xFF;
      int b = pixel & 0xFF;
      if (alpha != 255) {
        r = r * alpha / 255;
        g = g * alpha / 255;
        b = b * alpha / 255;
      }
      rgb[p * 3] = (byte) r;
      rgb[p * 3 + 1] = (byte) g;
      rgb[p * 3 + 2] = (byte) b;
    }
    log.debug("Decoded {}x{} image of type {} as RGB", w, h, image.getType());
    return PixelBuffer.wrap(w, h, PixelBuffer.RGB, rgb);
  }

  BufferedImage toBufferedImage(PixelBuffer buffer) {
    int w = buffer.width();
    int h = buffer.height();
    if (buffer.isGrayscale()) {
      BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
      WritableRaster raster = image.getRaster();
      raster.setDataElements(0, 0, w, h, buffer.toByteArray());
      return image;
    }
    BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
    int[] rgb = new int[w * h];
    for (int p = 0; p < rgb.length; p++) {
      int i = p * 3;
      rgb[p] = (buffer.sampleAt(i) << 16) | (buffer.sampleAt(i + 1) << 8) | buffer.sampleAt(i + 2);
    }
    image.setRGB(0, 0, w, h, rgb, 0, w);
    return image;
  }

  private static void checkPixelLimit(int width, int height) {
    if (!PixelBuffer.withinPixelLimit(width, height)) {
      throw new UnsupportedImageException(
          String.format(
              "Image of %dx%d pixels exceeds the limit of %d pixels",
              width, height, PixelBuffer.MAX_PIXELS));
    }
  }

  private boolean isEightBitGray(BufferedImage image) {
    return image.getType() == BufferedImage.TYPE_BYTE_GRAY
        && image.getRaster().getNumBands() == 1;
  }
}
