package com.weather.gateway.domain.model;

/**
 * Kind of weather data a request asks for.
 */
public enum DataKind {
    CURRENT("current"),
    FORECAST("forecast");

    private final String label;

    DataKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
