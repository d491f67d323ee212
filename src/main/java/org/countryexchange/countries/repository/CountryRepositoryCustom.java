package org.countryexchange.countries.repository;

import java.util.List;

import org.countryexchange.countries.domain.Country;

/** Bulk write operations that Spring Data cannot derive. */
public interface CountryRepositoryCustom {

  /**
   * Inserts or merges the given countries in one statement, keyed by name case-insensitively.
   *
   * <p>On conflict every non-key column is overwritten, unless the stored row was written by a
   * newer refresh cycle than the incoming one.
   *
   * @param countries rows to merge, at most one per name key
   * @return affected row count as reported by the database
   */
  int upsert(List<Country> countries);
}
