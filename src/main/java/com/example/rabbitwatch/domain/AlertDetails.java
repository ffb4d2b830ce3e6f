package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Structured detail attached to an alert.
 *
 * @param current     the observed value: a number for threshold alerts, a short label otherwise
 * @param threshold   the bound that was crossed, if any
 * @param recommended suggested operator action
 * @param affected    resource names touched by the condition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AlertDetails(Object current, Double threshold, String recommended, List<String> affected) {

    public AlertDetails {
        affected = affected != null ? List.copyOf(affected) : null;
    }
}
