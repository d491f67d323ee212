package org.countryexchange.countries.config;

import java.time.Duration;

import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.countryexchange.countries.service.dto.CountryData;

/**
 * Redis cache configuration for the Country Exchange Service.
 *
 * <p><b>Countries Cache:</b>
 *
 * <ul>
 *   <li><b>Contents:</b> single-country lookups keyed by the lower-cased name
 *   <li><b>TTL:</b> none. Rows only change during a refresh or a delete, both of which evict
 *   <li><b>Eviction:</b> the whole cache is cleared before and after every batch persist, and on
 *       delete
 *   <li><b>Namespace:</b> {@code country-service:} prefix keeps keys apart from other services
 * </ul>
 *
 * <p>Tests run with {@code spring.cache.type=none}; the annotations are then no-ops.
 */
@Configuration
@EnableCaching
public class CacheConfig {

  /** Cache name for single-country lookups. */
  public static final String COUNTRIES_CACHE = "countries";

  @Bean
  public RedisCacheManagerBuilderCustomizer redisCacheManagerBuilderCustomizer(
      ObjectMapper objectMapper) {
    // values are always CountryData, so a typed serializer avoids embedding class names
    var valueSerializer = new Jackson2JsonRedisSerializer<>(objectMapper.copy(), CountryData.class);

    return builder ->
        builder
            .transactionAware()
            .withCacheConfiguration(
                COUNTRIES_CACHE,
                RedisCacheConfiguration.defaultCacheConfig()
                    .entryTtl(Duration.ZERO)
                    .disableCachingNullValues()
                    .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            new StringRedisSerializer()))
                    .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                            valueSerializer))
                    .prefixCacheNameWith("country-service:"));
  }
}
