package com.queryguard.service.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Instants go over the wire as ISO-8601 strings. Null values are kept so that "no data" stays
 * distinguishable from a zero reading.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor objectMapperIsoInstantCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
                    om.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
                }
                return bean;
            }
        };
    }
}
