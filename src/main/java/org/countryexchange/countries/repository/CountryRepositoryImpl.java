package org.countryexchange.countries.repository;

import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import org.countryexchange.countries.domain.Country;

/**
 * JDBC implementation of {@link CountryRepositoryCustom}.
 *
 * <p>Each call issues a single multi-row {@code INSERT ... ON CONFLICT (name_key) DO UPDATE}
 * statement. The statement is atomic on its own; nothing spans several calls.
 */
public class CountryRepositoryImpl implements CountryRepositoryCustom {

  private static final Logger log = LoggerFactory.getLogger(CountryRepositoryImpl.class);

  private static final String INSERT_PREFIX =
      "INSERT INTO countries (name, name_key, capital, region, population, currency_code,"
          + " exchange_rate, estimated_gdp, flag_url, last_refreshed_at) VALUES ";

  private static final String ROW_PLACEHOLDER = "(?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final String CONFLICT_CLAUSE =
      " ON CONFLICT (name_key) DO UPDATE SET"
          + " name = EXCLUDED.name,"
          + " capital = EXCLUDED.capital,"
          + " region = EXCLUDED.region,"
          + " population = EXCLUDED.population,"
          + " currency_code = EXCLUDED.currency_code,"
          + " exchange_rate = EXCLUDED.exchange_rate,"
          + " estimated_gdp = EXCLUDED.estimated_gdp,"
          + " flag_url = EXCLUDED.flag_url,"
          + " last_refreshed_at = EXCLUDED.last_refreshed_at"
          // an older cycle finishing late must not roll a row back
          + " WHERE countries.last_refreshed_at <= EXCLUDED.last_refreshed_at";

  private final JdbcTemplate jdbcTemplate;

  public CountryRepositoryImpl(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public int upsert(List<Country> countries) {
    if (countries.isEmpty()) {
      return 0;
    }

    var sql = buildSql(countries.size());
    var args = new ArrayList<Object>(countries.size() * 10);
    var types = new int[countries.size() * 10];

    var i = 0;
    for (var country : countries) {
      args.add(country.getName());
      types[i++] = Types.VARCHAR;
      args.add(country.getNameKey());
      types[i++] = Types.VARCHAR;
      args.add(country.getCapital());
      types[i++] = Types.VARCHAR;
      args.add(country.getRegion());
      types[i++] = Types.VARCHAR;
      args.add(country.getPopulation());
      types[i++] = Types.BIGINT;
      args.add(country.getCurrencyCode());
      types[i++] = Types.VARCHAR;
      args.add(country.getExchangeRate());
      types[i++] = Types.NUMERIC;
      args.add(country.getEstimatedGdp());
      types[i++] = Types.NUMERIC;
      args.add(country.getFlagUrl());
      types[i++] = Types.VARCHAR;
      args.add(OffsetDateTime.ofInstant(country.getLastRefreshedAt(), ZoneOffset.UTC));
      types[i++] = Types.TIMESTAMP_WITH_TIMEZONE;
    }

    var affected = jdbcTemplate.update(sql, args.toArray(), types);
    log.debug(
        "Upserted {} countries, database reported {} affected rows", countries.size(), affected);
    return affected;
  }

  private String buildSql(int rows) {
    var sql = new StringBuilder(INSERT_PREFIX);
    for (var i = 0; i < rows; i++) {
      if (i > 0) {
        sql.append(", ");
      }
      sql.append(ROW_PLACEHOLDER);
    }
    return sql.append(CONFLICT_CLAUSE).toString();
  }
}
