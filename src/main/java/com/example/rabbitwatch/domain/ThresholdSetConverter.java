package com.example.rabbitwatch.domain;

import jakarta.persistence.Converter;

@Converter
public class ThresholdSetConverter extends JsonColumnConverter<ThresholdSet> {

    public ThresholdSetConverter() {
        super(ThresholdSet.class);
    }
}
