package com.flamingo.imagelab.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.imagelab.exception.UnsupportedImageException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PixelBufferCodecTest {

  private PixelBufferCodec codec;

  @BeforeEach
  void setUp() {
    codec = new PixelBufferCodec();
  }

  @Test
  void shouldKeepPixelsExactly_whenEncodingPng() {
    PixelBuffer rgb = ImageTransformerTest.randomRgb(9, 5, 11);

    PixelBuffer decoded = codec.decode(codec.encode(rgb, "png"));

    assertThat(decoded).isEqualTo(rgb);
  }

  @Test
  void shouldDecodeGrayPngToSingleChannel() {
    PixelBuffer gray =
        PixelBuffer.of(3, 1, PixelBuffer.GRAY, ImageTransformerTest.bytes(0, 7, 255));

    PixelBuffer decoded = codec.decode(codec.encode(gray, "png"));

    assertThat(decoded.channels()).isEqualTo(PixelBuffer.GRAY);
    assertThat(decoded).isEqualTo(gray);
  }

  @Test
  void shouldCompositeAlphaOntoBlack() throws Exception {
    BufferedImage argb = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
    argb.setRGB(0, 0, (0 << 24) | 0xFFFFFF);
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ImageIO.write(argb, "png", out);

    PixelBuffer decoded = codec.decode(out.toByteArray());

    assertThat(decoded.channels()).isEqualTo(PixelBuffer.RGB);
    assertThat(decoded.toByteArray()).containsExactly(ImageTransformerTest.bytes(0, 0, 0));
  }

  @Test
  void shouldRejectBytesThatAreNotAnImage() {
    assertThatThrownBy(() -> codec.decode("not an image".getBytes()))
        .isInstanceOf(UnsupportedImageException.class);
  }

  @Test
  void shouldRejectImage_whenHeaderDeclaresTooManyPixels() throws Exception {
    // A valid 1x1 PNG whose IHDR claims 20000x20000 pixels.
    byte[] png = codec.encode(PixelBuffer.blank(1, 1, PixelBuffer.GRAY), "png");
    ByteBuffer header = ByteBuffer.wrap(png);
    header.putInt(16, 20_000).putInt(20, 20_000);
    CRC32 crc = new CRC32();
    crc.update(png, 12, 17);
    header.putInt(29, (int) crc.getValue());

    assertThatThrownBy(() -> codec.decode(png)).isInstanceOf(UnsupportedImageException.class);
  }

  @Test
  void shouldMapFormatToMimeType() {
    assertThat(codec.mimeType("png")).isEqualTo("image/png");
    assertThat(codec.mimeType("JPG")).isEqualTo("image/jpeg");
  }
}
