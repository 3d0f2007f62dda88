package com.shiprule.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.shiprule.calculation.CalculationResult;
import com.shiprule.exception.ShippingException;

import java.util.Map;

/**
 * Renders calculation results as the JSON "calculation details" stored with an order.
 * Keys are snake_case.
 */
public class CalculationDetailsSerializer {

    private final ObjectMapper objectMapper;

    public CalculationDetailsSerializer() {
        this.objectMapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    /**
     * Render a result as JSON text.
     *
     * @throws ShippingException if the result cannot be written
     */
    public String toJson(CalculationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new ShippingException("Failed to serialize calculation of order " + result.orderId(), e);
        }
    }

    /**
     * Render a result as a generic map tree.
     */
    public Map<String, Object> toMap(CalculationResult result) {
        return objectMapper.convertValue(result, new TypeReference<Map<String, Object>>() {});
    }
}
