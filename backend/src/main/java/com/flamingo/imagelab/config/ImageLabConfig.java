package com.flamingo.imagelab.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for image storage and processing. */
@Configuration
@ConfigurationProperties(prefix = "imagelab")
@Getter
@Setter
public class ImageLabConfig {

  private Storage storage = new Storage();
  private Processing processing = new Processing();
  private Histogram histogram = new Histogram();
  private Auth auth = new Auth();

  /** Where encoded image files live and how clients reach them. */
  @Getter
  @Setter
  public static class Storage {
    /** Images are stored at {@code {basePath}/{ownerId}/{uuid}.{ext}}. */
    private String basePath = "./data/images";

    private long maxFileSizeBytes = 20L * 1024 * 1024;

    /** Prefix for download URLs; empty yields relative URLs. */
    private String publicBaseUrl = "";
  }

  @Getter
  @Setter
  public static class Processing {
    private int maxOperationsPerBatch = 50;

    /** Whole-batch budget for the pixel fold. */
    private long batchTimeoutMs = 30000;

    /** Bound on parent-link walks when resolving a root. */
    private int maxChainDepth = 64;

    /** ImageIO format name for derived images. */
    private String outputFormat = "png";

    private int workerThreads = 4;
    private int queueCapacity = 100;
  }

  @Getter
  @Setter
  public static class Histogram {
    private boolean cacheEnabled = true;
    private int cacheMaxEntries = 256;
  }

  @Getter
  @Setter
  public static class Auth {
    /** Request header carrying the authenticated owner's id, set by the auth gateway. */
    private String ownerHeader = "X-User-Id";
  }
}
