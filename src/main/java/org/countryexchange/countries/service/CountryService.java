package org.countryexchange.countries.service;

import java.util.List;

import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import org.countryexchange.countries.config.CacheConfig;
import org.countryexchange.countries.domain.Country;
import org.countryexchange.countries.repository.CountryRepository;
import org.countryexchange.countries.repository.spec.CountrySpecifications;
import org.countryexchange.countries.service.dto.CountryData;
import org.countryexchange.countries.service.dto.CountryStatus;
import org.countryexchange.countries.service.exception.ResourceNotFoundException;

/** Read and delete operations over stored countries. Name matching is case-insensitive. */
@Service
@Transactional(readOnly = true)
public class CountryService {

  private static final String NAME_KEY =
      "T(org.countryexchange.countries.domain.Country).nameKeyOf(#name)";

  private final CountryRepository countryRepository;

  public CountryService(CountryRepository countryRepository) {
    this.countryRepository = countryRepository;
  }

  /**
   * Lists countries, optionally filtered, ordered by estimated GDP. Countries with unknown GDP are
   * listed last in either direction.
   *
   * @param region region to match, case-insensitive, null for all
   * @param currencyCode currency code to match, case-insensitive, null for all
   * @param sort GDP ordering
   * @return matching countries
   */
  public List<CountryData> list(String region, String currencyCode, CountrySort sort) {
    Specification<Country> spec = CountrySpecifications.orderedByGdp(sort == CountrySort.GDP_DESC);

    if (region != null && !region.isBlank()) {
      spec = spec.and(CountrySpecifications.hasRegion(region));
    }
    if (currencyCode != null && !currencyCode.isBlank()) {
      spec = spec.and(CountrySpecifications.hasCurrencyCode(currencyCode));
    }

    return countryRepository.findAll(spec).stream().map(CountryData::from).toList();
  }

  /**
   * Finds one country by name.
   *
   * @param name country name, any case
   * @return the country
   * @throws ResourceNotFoundException when no country has that name
   */
  @Cacheable(cacheNames = CacheConfig.COUNTRIES_CACHE, key = NAME_KEY)
  public CountryData getByName(String name) {
    return countryRepository
        .findByNameKey(Country.nameKeyOf(name))
        .map(CountryData::from)
        .orElseThrow(() -> notFound(name));
  }

  /**
   * Deletes one country by name.
   *
   * @param name country name, any case
   * @throws ResourceNotFoundException when no country has that name
   */
  @Transactional
  @CacheEvict(cacheNames = CacheConfig.COUNTRIES_CACHE, key = NAME_KEY)
  public void deleteByName(String name) {
    if (countryRepository.deleteByNameKey(Country.nameKeyOf(name)) == 0) {
      throw notFound(name);
    }
  }

  public CountryStatus getStatus() {
    return new CountryStatus(
        countryRepository.count(), countryRepository.findLastRefreshedAt().orElse(null));
  }

  private static ResourceNotFoundException notFound(String name) {
    return new ResourceNotFoundException(
        "Country not found: " + name, CountryServiceError.COUNTRY_NOT_FOUND);
  }
}
