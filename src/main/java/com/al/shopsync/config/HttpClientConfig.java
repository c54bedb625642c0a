package com.al.shopsync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

/**
 * One {@link RestTemplate} per remote shop, each rooted at the shop's API base
 * URL and carrying its credentials.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Bean
    public RestTemplate shopwareRestTemplate(RestTemplateBuilder builder, ShopSyncProperties properties) {
        ShopSyncProperties.Source source = properties.getSource();
        RestTemplateBuilder configured = builder
                .rootUri(source.getUrl())
                .connectTimeout(source.getConnectTimeout())
                .readTimeout(source.getReadTimeout());
        if (StringUtils.hasText(source.getUsername()) && StringUtils.hasText(source.getApiKey())) {
            configured = configured.basicAuthentication(source.getUsername(), source.getApiKey());
        } else {
            log.warn("No Shopware 5 credentials configured, requests will be sent unauthenticated");
        }
        log.info("Shopware 5 API at {}", source.getUrl());
        return configured.build();
    }

    @Bean
    public RestTemplate shopifyRestTemplate(RestTemplateBuilder builder, ShopSyncProperties properties) {
        ShopSyncProperties.Target target = properties.getTarget();
        RestTemplateBuilder configured = builder
                .rootUri(target.getAdminBaseUrl())
                .connectTimeout(target.getConnectTimeout())
                .readTimeout(target.getReadTimeout());
        if (StringUtils.hasText(target.getAccessToken())) {
            configured = configured.defaultHeader("X-Shopify-Access-Token", target.getAccessToken());
        } else {
            log.warn("No Shopify access token configured, requests will be sent unauthenticated");
        }
        log.info("Shopify admin API at {}", target.getAdminBaseUrl());
        return configured.build();
    }
}
