package com.dingdangmaoup.dock.config;

import com.dingdangmaoup.dock.config.properties.UploadProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class WebFluxConfig implements WebFluxConfigurer {

    private final UploadProperties uploadProperties;

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("Configured ObjectMapper with JavaTimeModule for Java 8 date/time support");
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        // chunk bodies are joined in memory before they reach the upload manager
        int maxInMemory = (int) Math.min(Integer.MAX_VALUE, uploadProperties.getMaxChunkSize().toBytes());
        configurer.defaultCodecs().maxInMemorySize(maxInMemory);
        log.info("Configured server codecs with maxInMemorySize={} bytes", maxInMemory);
    }
}
