package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.InvalidParameterException;
import java.util.Locale;

/** Ways of collapsing RGB samples into a single gray level. */
public enum GrayscaleMethod {
  /** {@code (R + G + B) / 3}. */
  AVERAGE(OperationType.GRAYSCALE_AVERAGE),
  /** ITU-R BT.601 luma: {@code 0.299R + 0.587G + 0.114B}. */
  LUMINOSITY(OperationType.GRAYSCALE_LUMINOSITY),
  /** {@code (max + min) / 2}. */
  MIDGRAY(OperationType.GRAYSCALE_MIDGRAY);

  private final OperationType operationType;

  GrayscaleMethod(OperationType operationType) {
    this.operationType = operationType;
  }

  public OperationType operationType() {
    return operationType;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static GrayscaleMethod fromWireName(String name) {
    if (name != null) {
      for (GrayscaleMethod method : values()) {
        if (method.wireName().equalsIgnoreCase(name.trim())) {
          return method;
        }
      }
    }
    throw new InvalidParameterException(
        "method", "method must be one of average, luminosity, midgray");
  }
}
