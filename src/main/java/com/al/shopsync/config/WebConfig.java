package com.al.shopsync.config;

import com.al.shopsync.interceptor.MdcInterceptor;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final MdcInterceptor mdcInterceptor;

    public WebConfig(MdcInterceptor mdcInterceptor) {
        this.mdcInterceptor = mdcInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(mdcInterceptor)
                .addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "POST", "PUT", "DELETE");
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new StringToEntityTypeConverter());
        registry.addConverter(new StringToSyncModeConverter());
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /** Path variables use the lower-case wire names ({@code articles}). */
    public static class StringToEntityTypeConverter implements Converter<String, EntityType> {
        @Override
        public EntityType convert(String source) {
            return EntityType.fromValue(source);
        }
    }

    public static class StringToSyncModeConverter implements Converter<String, SyncMode> {
        @Override
        public SyncMode convert(String source) {
            return SyncMode.fromValue(source);
        }
    }
}
