package com.flamingo.imagelab.processing;

import com.flamingo.imagelab.exception.InvalidParameterException;
import java.util.Locale;

/**
 * A color component that can be switched off. RGB channels address their own sample; CMY
 * channels address the complement of one RGB sample.
 */
public enum ColorChannel {
  RED(0, false, OperationType.CHANNEL_RED),
  GREEN(1, false, OperationType.CHANNEL_GREEN),
  BLUE(2, false, OperationType.CHANNEL_BLUE),
  CYAN(0, true, OperationType.CHANNEL_CYAN),
  MAGENTA(1, true, OperationType.CHANNEL_MAGENTA),
  YELLOW(2, true, OperationType.CHANNEL_YELLOW);

  private final int sampleIndex;
  private final boolean complement;
  private final OperationType operationType;

  ColorChannel(int sampleIndex, boolean complement, OperationType operationType) {
    this.sampleIndex = sampleIndex;
    this.complement = complement;
    this.operationType = operationType;
  }

  /** Index of the RGB sample this channel acts on. */
  public int sampleIndex() {
    return sampleIndex;
  }

  /** Value the sample takes when this channel is switched off. */
  public int disabledValue() {
    return complement ? 255 : 0;
  }

  public OperationType operationType() {
    return operationType;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a channel name such as {@code red} or {@code cyan}.
   *
   * @throws InvalidParameterException for any other name
   */
  public static ColorChannel fromWireName(String name) {
    if (name != null) {
      for (ColorChannel channel : values()) {
        if (channel.wireName().equalsIgnoreCase(name.trim())) {
          return channel;
        }
      }
    }
    throw new InvalidParameterException(
        "channel", "channel must be one of red, green, blue, cyan, magenta, yellow");
  }
}
