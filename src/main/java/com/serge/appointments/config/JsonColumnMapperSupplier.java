package com.serge.appointments.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.hypersistence.utils.hibernate.type.util.ObjectMapperSupplier;

/**
 * ObjectMapper behind the jsonb columns (weekly hours). Registered through
 * {@code hypersistence-utils.properties}.
 */
public class JsonColumnMapperSupplier implements ObjectMapperSupplier {

    @Override
    public ObjectMapper get() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
