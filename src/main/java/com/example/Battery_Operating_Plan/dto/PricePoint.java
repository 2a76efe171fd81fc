package com.example.Battery_Operating_Plan.dto;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Forecast price for one hour ($/MWh)
 */
public class PricePoint {

    public LocalDateTime hourEnding;

    public double price;

    public PricePoint() {}

    public PricePoint(LocalDateTime hourEnding, double price) {
        this.hourEnding = hourEnding;
        this.price = price;
    }

    /**
     * @return null when no forecast was supplied, so the default pattern is used
     */
    public static Map<LocalDateTime, Double> toForecast(List<PricePoint> points) {
        if (points == null) {
            return null;
        }
        Map<LocalDateTime, Double> forecast = new LinkedHashMap<>();
        for (PricePoint point : points) {
            if (point != null && point.hourEnding != null) {
                forecast.put(point.hourEnding, point.price);
            }
        }
        return forecast;
    }
}
