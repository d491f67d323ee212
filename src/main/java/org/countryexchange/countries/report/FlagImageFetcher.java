package org.countryexchange.countries.report;

import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import org.countryexchange.countries.client.SourceResponses;
import org.countryexchange.countries.config.CountryServiceProperties;

/**
 * Downloads flag thumbnails for the summary image. A flag that cannot be fetched or decoded is
 * reported as empty; the caller draws the entry without it.
 */
@Component
public class FlagImageFetcher {

  private static final Logger log = LoggerFactory.getLogger(FlagImageFetcher.class);

  static final int FLAG_WIDTH = 40;
  static final int FLAG_HEIGHT = 30;

  private static final String FLAG_CDN_HOST = "flagcdn.com";

  private final WebClient webClient;
  private final Duration timeout;

  public FlagImageFetcher(WebClient.Builder webClientBuilder, CountryServiceProperties properties) {
    this.webClient =
        webClientBuilder.clone().defaultHeader("User-Agent", SourceResponses.USER_AGENT).build();
    this.timeout = Duration.ofSeconds(properties.getReport().getFlagTimeoutSeconds());
  }

  /**
   * Rewrites vector flag URLs on the flag CDN to their 80px-wide PNG rendition, e.g. {@code
   * https://flagcdn.com/ng.svg} becomes {@code https://flagcdn.com/w80/ng.png}. Other URLs are
   * returned unchanged.
   *
   * @param flagUrl source flag URL
   * @return URL of a raster image
   */
  public static String toRasterUrl(String flagUrl) {
    if (flagUrl.contains(FLAG_CDN_HOST) && flagUrl.endsWith(".svg")) {
      return flagUrl.replace(".svg", ".png").replace(FLAG_CDN_HOST + "/", FLAG_CDN_HOST + "/w80/");
    }
    return flagUrl;
  }

  /**
   * Fetches a flag scaled to the thumbnail size.
   *
   * @param flagUrl flag URL as stored on the country, may be null
   * @return scaled image, empty when there is no URL or the download fails
   */
  public Optional<BufferedImage> fetch(String flagUrl) {
    if (flagUrl == null || flagUrl.isBlank()) {
      return Optional.empty();
    }

    var rasterUrl = toRasterUrl(flagUrl);
    try {
      var bytes =
          webClient
              .get()
              .uri(rasterUrl)
              .retrieve()
              .bodyToMono(byte[].class)
              .timeout(timeout)
              .block();
      if (bytes == null) {
        log.debug("Empty flag response from {}", rasterUrl);
        return Optional.empty();
      }

      var image = ImageIO.read(new ByteArrayInputStream(bytes));
      if (image == null) {
        log.debug("Flag at {} is not a readable raster image", rasterUrl);
        return Optional.empty();
      }

      return Optional.of(scale(image));
    } catch (IOException | RuntimeException e) {
      log.warn("Could not fetch flag {}: {}", rasterUrl, e.getMessage());
      return Optional.empty();
    }
  }

  static BufferedImage scale(BufferedImage source) {
    var scaled = new BufferedImage(FLAG_WIDTH, FLAG_HEIGHT, BufferedImage.TYPE_INT_RGB);
    var graphics = scaled.createGraphics();
    try {
      graphics.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      graphics.drawImage(source, 0, 0, FLAG_WIDTH, FLAG_HEIGHT, null);
    } finally {
      graphics.dispose();
    }
    return scaled;
  }
}
