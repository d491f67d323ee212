package org.countryexchange.countries.repository;

import java.time.Instant;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import org.countryexchange.countries.domain.Country;

/**
 * Repository for {@link Country} rows.
 *
 * <p>Name based lookups go through {@link Country#nameKeyOf(String)} so callers get
 * case-insensitive matching. Bulk merging lives in {@link CountryRepositoryCustom}.
 */
public interface CountryRepository
    extends JpaRepository<Country, Long>,
        JpaSpecificationExecutor<Country>,
        CountryRepositoryCustom {

  /**
   * Find a country by its merge key.
   *
   * @param nameKey lower-cased trimmed name, see {@link Country#nameKeyOf(String)}
   * @return Optional containing the country if present
   */
  Optional<Country> findByNameKey(String nameKey);

  /**
   * Delete a country by its merge key.
   *
   * @param nameKey lower-cased trimmed name
   * @return number of deleted rows, 0 or 1
   */
  @Modifying
  @Query("DELETE FROM Country c WHERE c.nameKey = :nameKey")
  int deleteByNameKey(@Param("nameKey") String nameKey);

  /**
   * Latest refresh timestamp across all countries.
   *
   * @return Optional containing the newest {@code lastRefreshedAt}, empty when no rows exist
   */
  @Query("SELECT MAX(c.lastRefreshedAt) FROM Country c")
  Optional<Instant> findLastRefreshedAt();
}
