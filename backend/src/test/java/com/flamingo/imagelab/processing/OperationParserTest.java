package com.flamingo.imagelab.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.imagelab.exception.InvalidParameterException;
import com.flamingo.imagelab.exception.UnknownOperationException;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperationParserTest {

  private OperationParser parser;

  @BeforeEach
  void setUp() {
    parser = new OperationParser();
  }

  @Test
  void shouldParseBrightness_whenFactorIsNumber() {
    ImageOperation op = parser.parse("brightness", Map.of("factor", 1.2));

    assertThat(op).isEqualTo(new ImageOperation.Brightness(1.2));
    assertThat(op.type()).isEqualTo(OperationType.BRIGHTNESS);
    assertThat(op.parameters()).containsEntry("factor", 1.2);
  }

  @Test
  void shouldAcceptIntegerJson_forDoubleParameter() {
    ImageOperation op = parser.parse("rotate", Map.of("angle", 90));

    assertThat(op).isEqualTo(new ImageOperation.Rotate(90.0));
  }

  @Test
  void shouldParseParameterlessOperations_whenParamsMissing() {
    assertThat(parser.parse("invert", null)).isInstanceOf(ImageOperation.Invert.class);
    assertThat(parser.parse("grayscale_midgray", null))
        .isEqualTo(new ImageOperation.Grayscale(GrayscaleMethod.MIDGRAY));
  }

  @Test
  void shouldParseChannelToggle() {
    ImageOperation op = parser.parse("channel_magenta", Map.of("enabled", false));

    assertThat(op).isEqualTo(new ImageOperation.ChannelToggle(ColorChannel.MAGENTA, false));
  }

  @Test
  void shouldAcceptBothFactorNames_forEnlargeRegion() {
    Map<String, Object> zoom =
        Map.of("x_start", 0, "x_end", 10, "y_start", 0, "y_end", 10, "zoom_factor", 3);
    Map<String, Object> factor =
        Map.of("x_start", 0, "x_end", 10, "y_start", 0, "y_end", 10, "factor", 3);

    assertThat(parser.parse("enlarge_region", zoom))
        .isEqualTo(parser.parse("enlarge_region", factor));
  }

  @Test
  void shouldParseMerge_whenOtherImageIdIsString() {
    UUID other = UUID.randomUUID();

    ImageOperation op =
        parser.parse(
            "merge_images", Map.of("other_image_id", other.toString(), "transparency", 0.3));

    assertThat(op).isEqualTo(new ImageOperation.MergeImages(other, 0.3));
  }

  @Test
  void shouldRejectUnknownOperation() {
    assertThatThrownBy(() -> parser.parse("sharpen", Map.of()))
        .isInstanceOf(UnknownOperationException.class);
  }

  @Test
  void shouldRejectMissingParameter() {
    assertThatThrownBy(() -> parser.parse("binarize", new HashMap<>()))
        .isInstanceOf(InvalidParameterException.class)
        .extracting("parameter")
        .isEqualTo("threshold");
  }

  @Test
  void shouldRejectFractionalInteger() {
    assertThatThrownBy(() -> parser.parse("translate", Map.of("dx", 1.5, "dy", 0)))
        .isInstanceOf(InvalidParameterException.class)
        .extracting("parameter")
        .isEqualTo("dx");
  }

  @Test
  void shouldRejectNonNumericValue() {
    assertThatThrownBy(() -> parser.parse("brightness", Map.of("factor", "bright")))
        .isInstanceOf(InvalidParameterException.class);
  }

  @Test
  void shouldRejectOutOfRangeValues() {
    assertThatThrownBy(() -> parser.parse("brightness", Map.of("factor", 0)))
        .isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parser.parse("binarize", Map.of("threshold", 1.5)))
        .isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parser.parse("reduce_resolution", Map.of("factor", 11)))
        .isInstanceOf(InvalidParameterException.class);
    assertThatThrownBy(() -> parser.parse("log_contrast", Map.of("k", -1)))
        .isInstanceOf(InvalidParameterException.class);
  }

  @Test
  void shouldRejectInvertedCrop() {
    Map<String, Object> params = Map.of("x_start", 50, "x_end", 40, "y_start", 0, "y_end", 10);

    assertThatThrownBy(() -> parser.parse("crop", params))
        .isInstanceOf(InvalidParameterException.class);
  }
}
