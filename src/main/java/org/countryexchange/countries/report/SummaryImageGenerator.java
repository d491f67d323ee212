package org.countryexchange.countries.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import javax.imageio.ImageIO;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.repository.spec.CountrySpecifications;
import org.countryexchange.countries.service.exception.ReportGenerationException;

/**
 * Produces the PNG summary of the stored countries at a fixed path.
 *
 * <p>The file is overwritten in place, so a reader running at the same time as a write may see a
 * partial image. Within this process writes are serialized and a summary for an older cycle than
 * the last one written is skipped.
 */
@Service
public class SummaryImageGenerator {

  private static final Logger log = LoggerFactory.getLogger(SummaryImageGenerator.class);

  private static final String FORMAT = "png";

  private final CountryRepository countryRepository;
  private final SummaryImageRenderer renderer;
  private final FlagImageFetcher flagImageFetcher;
  private final CountryServiceProperties properties;

  private final Object writeLock = new Object();
  private Instant lastWrittenAsOf;

  public SummaryImageGenerator(
      CountryRepository countryRepository,
      SummaryImageRenderer renderer,
      FlagImageFetcher flagImageFetcher,
      CountryServiceProperties properties) {
    this.countryRepository = countryRepository;
    this.renderer = renderer;
    this.flagImageFetcher = flagImageFetcher;
    this.properties = properties;
  }

  /**
   * Queries the current count and top countries by GDP, then writes the summary.
   *
   * @param asOf refresh cycle timestamp shown on the image
   * @return true when the image was written, false when a newer summary already exists
   * @throws ReportGenerationException when querying, rendering or writing fails
   */
  public boolean generate(Instant asOf) {
    long total;
    List<Country> top;
    try {
      total = countryRepository.count();
      top =
          countryRepository
              .findAll(
                  CountrySpecifications.orderedByGdp(true),
                  PageRequest.of(0, properties.getReport().getTopCount()))
              .getContent();
    } catch (RuntimeException e) {
      throw new ReportGenerationException("Failed to query countries for summary image", e);
    }

    return generate(total, top, asOf);
  }

  /**
   * Renders and writes the summary.
   *
   * @param totalCountries total stored countries
   * @param topCountries countries ordered by GDP descending, at most the configured top count is
   *     drawn
   * @param asOf refresh cycle timestamp shown on the image
   * @return true when the image was written, false when a newer summary already exists
   * @throws ReportGenerationException when rendering or writing fails
   */
  public boolean generate(long totalCountries, List<Country> topCountries, Instant asOf) {
    var topCount = properties.getReport().getTopCount();
    var entries = new ArrayList<SummaryContent.Entry>();

    for (var i = 0; i < Math.min(topCount, topCountries.size()); i++) {
      var country = topCountries.get(i);
      var flag =
          properties.getReport().isFlagsEnabled()
              ? flagImageFetcher.fetch(country.getFlagUrl()).orElse(null)
              : null;
      entries.add(new SummaryContent.Entry(SummaryImageRenderer.entryLabel(i + 1, country), flag));
    }

    var content = new SummaryContent(totalCountries, topCount, entries, asOf);
    var path = imagePath();

    synchronized (writeLock) {
      if (lastWrittenAsOf != null && asOf.isBefore(lastWrittenAsOf)) {
        log.info(
            "Skipping summary image for cycle {}, image for newer cycle {} already written",
            asOf,
            lastWrittenAsOf);
        return false;
      }

      try {
        var image = renderer.render(content);
        if (path.getParent() != null) {
          Files.createDirectories(path.getParent());
        }
        if (!ImageIO.write(image, FORMAT, path.toFile())) {
          throw new IOException("No image writer available for " + FORMAT);
        }
      } catch (IOException | RuntimeException e) {
        throw new ReportGenerationException("Failed to write summary image to " + path, e);
      }

      lastWrittenAsOf = asOf;
    }

    log.info("Summary image for cycle {} written to {}", asOf, path);
    return true;
  }

  /**
   * Reads the last written summary.
   *
   * @return PNG bytes, empty when no summary has been generated yet
   * @throws ReportGenerationException when the file exists but cannot be read
   */
  public Optional<byte[]> readLatest() {
    var path = imagePath();
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }

    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (IOException e) {
      throw new ReportGenerationException("Failed to read summary image from " + path, e);
    }
  }

  private Path imagePath() {
    return Path.of(properties.getReport().getPath());
  }
}
