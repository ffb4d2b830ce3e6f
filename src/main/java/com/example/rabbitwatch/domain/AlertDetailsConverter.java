package com.example.rabbitwatch.domain;

import jakarta.persistence.Converter;

@Converter
public class AlertDetailsConverter extends JsonColumnConverter<AlertDetails> {

    public AlertDetailsConverter() {
        super(AlertDetails.class);
    }
}
