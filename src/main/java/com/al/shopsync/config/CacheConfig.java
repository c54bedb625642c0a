package com.al.shopsync.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis cache configuration.
 *
 * <p>
 * Caches the field catalogs of both shops ({@code fieldCatalog}), which take
 * several API round trips to build and change rarely, and the declared
 * product metafield types of the target shop ({@code metafieldTypes}). Both
 * share the same TTL.
 *
 * @author Shop Sync Team
 * @since 1.0.0
 */
@Configuration
@EnableCaching
public class CacheConfig {

        /**
         * Configure Redis cache manager with JSON serialization.
         *
         * <p>
         * Configuration:
         * <ul>
         * <li>TTL: {@code shop-sync.cache.field-catalog-ttl} (1 hour by default)</li>
         * <li>Key serialization: String</li>
         * <li>Value serialization: JSON</li>
         * <li>Null values: Not cached</li>
         * </ul>
         *
         * @param factory    Redis connection factory (auto-configured by Spring Boot)
         * @param properties service properties
         * @return Configured cache manager
         */
        @Bean
        public RedisCacheManager cacheManager(RedisConnectionFactory factory, ShopSyncProperties properties) {
                RedisCacheConfiguration config = RedisCacheConfiguration.defaultCacheConfig()
                                .entryTtl(properties.getCache().getFieldCatalogTtl())
                                .prefixCacheNameWith("shop-sync:")
                                .serializeKeysWith(RedisSerializationContext.SerializationPair
                                                .fromSerializer(new StringRedisSerializer()))
                                .serializeValuesWith(RedisSerializationContext.SerializationPair
                                                .fromSerializer(RedisSerializer.json()))
                                .disableCachingNullValues();

                return RedisCacheManager.builder(factory)
                                .cacheDefaults(config)
                                .build();
        }
}
