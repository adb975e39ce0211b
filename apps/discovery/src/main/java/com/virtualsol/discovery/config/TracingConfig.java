package com.virtualsol.discovery.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Tracer for the discovery spans. Uses an {@link OpenTelemetry} bean when one is on the
 * context (an exporter starter, for instance) and the no-op implementation otherwise.
 */
@Slf4j
@Configuration
public class TracingConfig {

    static final String INSTRUMENTATION_SCOPE = "com.virtualsol.discovery";

    @Bean
    @ConditionalOnMissingBean
    public Tracer discoveryTracer(ObjectProvider<OpenTelemetry> openTelemetry,
                                 @Value("${spring.application.name:token-discovery}") String serviceName) {
        OpenTelemetry sdk = openTelemetry.getIfAvailable(() -> {
            log.info("No OpenTelemetry SDK configured, spans for {} are not exported", serviceName);
            return OpenTelemetry.noop();
        });
        return sdk.getTracer(INSTRUMENTATION_SCOPE);
    }
}
