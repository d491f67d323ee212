package org.countryexchange.countries.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Caching;
import org.springframework.stereotype.Service;

import org.countryexchange.countries.config.CacheConfig;
import org.countryexchange.countries.config.CountryServiceProperties;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.service.exception.BatchPersistenceException;

/**
 * Writes enriched countries in fixed-size chunks, one upsert statement per chunk.
 *
 * <p><b>Failure policy:</b> chunks run in order and the first failing chunk aborts the rest.
 * Chunks that already succeeded stay committed, so a failed call may have written a prefix of its
 * input. There is no transaction across chunks and no coordination with concurrent callers.
 *
 * <p><b>Affected count:</b> the sum of what the database reports per statement. It is not a count
 * of distinct countries changed.
 */
@Service
public class CountryBatchPersister {

  private static final Logger log = LoggerFactory.getLogger(CountryBatchPersister.class);

  private final CountryRepository countryRepository;
  private final CountryServiceProperties properties;

  public CountryBatchPersister(
      CountryRepository countryRepository, CountryServiceProperties properties) {
    this.countryRepository = countryRepository;
    this.properties = properties;
  }

  /**
   * Upserts the given countries.
   *
   * <p>Names that collide case-insensitively are collapsed first: the last occurrence wins and
   * takes the position of the first.
   *
   * @param countries enriched countries, in order
   * @return total affected rows reported by the database, 0 for empty input
   * @throws BatchPersistenceException when a chunk fails
   */
  @Caching(
      evict = {
        @CacheEvict(cacheNames = CacheConfig.COUNTRIES_CACHE, allEntries = true),
        @CacheEvict(
            cacheNames = CacheConfig.COUNTRIES_CACHE,
            allEntries = true,
            beforeInvocation = true)
      })
  public int persist(List<Country> countries) {
    if (countries.isEmpty()) {
      log.info("No countries to persist");
      return 0;
    }

    var unique = deduplicate(countries);
    var chunks = chunk(unique, properties.getRefresh().getBatchSize());
    var affected = 0;

    for (var i = 0; i < chunks.size(); i++) {
      try {
        affected += countryRepository.upsert(chunks.get(i));
      } catch (RuntimeException e) {
        log.error(
            "Upsert of chunk {}/{} failed, {} earlier chunks remain committed",
            i + 1,
            chunks.size(),
            i,
            e);
        throw new BatchPersistenceException(i + 1, chunks.size(), affected, e);
      }
    }

    log.info(
        "Persisted {} countries in {} chunks, {} rows affected",
        unique.size(),
        chunks.size(),
        affected);
    return affected;
  }

  private List<Country> deduplicate(List<Country> countries) {
    var byKey = new LinkedHashMap<String, Country>();
    for (var country : countries) {
      byKey.put(country.getNameKey(), country);
    }

    if (byKey.size() < countries.size()) {
      log.warn("Collapsed {} countries with duplicate names", countries.size() - byKey.size());
    }
    return new ArrayList<>(byKey.values());
  }

  private static List<List<Country>> chunk(List<Country> countries, int size) {
    var chunks = new ArrayList<List<Country>>();
    for (var start = 0; start < countries.size(); start += size) {
      chunks.add(countries.subList(start, Math.min(start + size, countries.size())));
    }
    return chunks;
  }
}
