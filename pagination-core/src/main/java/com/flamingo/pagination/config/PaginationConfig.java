package com.flamingo.pagination.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for measuring, caching and paginating flow blocks. */
@Configuration
@ConfigurationProperties(prefix = "pagination")
@Getter
@Setter
public class PaginationConfig {

  private Footnotes footnotes = new Footnotes();
  private Measurement measurement = new Measurement();
  private Cache cache = new Cache();

  @Getter
  @Setter
  public static class Footnotes {
    /** Maximum reserve passes before the last proposal is used as-is. */
    private int maxReservePasses = 6;

    /** Space above the divider in every non-empty footnote band. */
    private double topPadding = 4.0;

    /** Height of the divider line drawn above the footnote bodies. */
    private double dividerHeight = 2.0;
  }

  /** Configuration for the built-in measurement port. */
  @Getter
  @Setter
  public static class Measurement {
    /** Strategy to use: "approximate" (default) or "none" when the host supplies its own port. */
    private String strategy = "approximate";

    /** Estimated advance of one character as a fraction of the font size. */
    private double charWidthFactor = 0.5;

    /** Line height as a multiple of the largest font size on the line. */
    private double lineHeightFactor = 1.2;

    /** Height used for images and drawings that carry no height hint. */
    private double defaultBoxHeight = 100.0;

    /** Worker threads measuring independent blocks concurrently. */
    private int parallelism = 4;
  }

  @Getter
  @Setter
  public static class Cache {
    /** When false every lookup misses and nothing is stored. */
    private boolean enabled = true;
  }
}
