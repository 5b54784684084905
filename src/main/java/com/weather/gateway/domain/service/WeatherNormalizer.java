package com.weather.gateway.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.weather.gateway.domain.exception.NormalizationException;
import com.weather.gateway.domain.model.DailyForecast;
import com.weather.gateway.domain.model.NormalizedForecast;
import com.weather.gateway.domain.model.NormalizedWeather;
import com.weather.gateway.domain.model.RawWeatherPayload;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps OpenWeather (API 2.5) payloads into the internal schema.
 *
 * <p>Stateless and side-effect free. Required fields that are missing, and optional
 * fields that are present with the wrong JSON type, fail with
 * {@link NormalizationException}; absent optional fields take documented defaults
 * (humidity 0, rainfall 0.0, wind speed 0.0, description "unknown").
 *
 * <p>Forecast aggregation: samples are sorted by {@code dt} and bucketed by calendar
 * day in the location's UTC offset ({@code city.timezone}, UTC when absent). Per day,
 * temp_min is the minimum of the sample minimums and temp_max the maximum of the
 * sample maximums (each falling back to {@code main.temp}), humidity is the mean
 * rounded half-up, rainfall is the sum of {@code rain.3h}, and the description is
 * the most frequent one, earliest sample winning ties.
 */
@Component
public class WeatherNormalizer {

    public static final String PROVIDER = "openweather";
    static final String UNKNOWN_DESCRIPTION = "unknown";

    /**
     * Normalize a current-weather payload.
     *
     * @param raw Parsed response of the current weather endpoint
     * @return Normalized current conditions, not marked cached or stale
     * @throws NormalizationException if the payload violates the expected shape
     */
    public NormalizedWeather normalizeCurrent(RawWeatherPayload raw) {
        JsonNode root = requireObject(raw.getBody(), "payload");
        JsonNode main = requireObject(root.get("main"), "main");

        double temperature = requireNumber(main, "temp", "main.temp");
        int humidity = humidity(main, "main.humidity");

        JsonNode wind = optionalObject(root, "wind", "wind");
        Double windSpeed = wind == null ? null : optionalNonNegative(wind, "speed", "wind.speed");

        String description = firstDescription(root, "weather", "weather");

        Instant observedAt = raw.getReceivedAt();
        Double dt = optionalNumber(root, "dt", "dt");
        if (dt != null) {
            observedAt = epochInstant(dt, "dt");
        }

        return NormalizedWeather.builder()
            .temperature(temperature)
            .humidity(humidity)
            .rainfall(currentRainfall(root))
            .windSpeed(windSpeed == null ? 0.0 : windSpeed)
            .description(description == null ? UNKNOWN_DESCRIPTION : description)
            .provider(PROVIDER)
            .cached(false)
            .stale(false)
            .timestamp(observedAt.toString())
            .build();
    }

    /**
     * Normalize a 3-hourly forecast payload into at most {@code horizonDays} daily entries.
     *
     * @param raw Parsed response of the forecast endpoint
     * @param horizonDays Number of calendar days to keep, at least 1
     * @return Daily forecast ordered by date ascending, not marked cached or stale
     * @throws NormalizationException if the payload violates the expected shape
     */
    public NormalizedForecast normalizeForecast(RawWeatherPayload raw, int horizonDays) {
        if (horizonDays < 1) {
            throw new IllegalArgumentException("horizonDays must be positive");
        }
        JsonNode root = requireObject(raw.getBody(), "payload");
        JsonNode list = root.get("list");
        if (list == null || !list.isArray()) {
            throw new NormalizationException("Forecast payload is missing the 'list' array");
        }
        if (list.size() == 0) {
            throw new NormalizationException("Forecast payload contains no samples");
        }

        ZoneOffset offset = forecastOffset(root);
        List<Sample> samples = new ArrayList<>(list.size());
        for (int i = 0; i < list.size(); i++) {
            samples.add(parseSample(list.get(i), "list[" + i + "]", offset));
        }
        samples.sort(Comparator.comparingLong(Sample::getEpochSecond));

        Map<LocalDate, List<Sample>> byDay = new TreeMap<>();
        for (Sample sample : samples) {
            byDay.computeIfAbsent(sample.getDate(), d -> new ArrayList<>()).add(sample);
        }

        NormalizedForecast.NormalizedForecastBuilder builder = NormalizedForecast.builder()
            .provider(PROVIDER)
            .cached(false)
            .stale(false)
            .timestamp(raw.getReceivedAt().toString());
        byDay.entrySet().stream()
            .limit(horizonDays)
            .map(day -> aggregateDay(day.getKey(), day.getValue()))
            .forEach(builder::day);
        return builder.build();
    }

    private DailyForecast aggregateDay(LocalDate date, List<Sample> samples) {
        double tempMin = Double.POSITIVE_INFINITY;
        double tempMax = Double.NEGATIVE_INFINITY;
        double rainfall = 0.0;
        long humiditySum = 0;
        int humidityCount = 0;
        Map<String, Integer> descriptionCounts = new LinkedHashMap<>();

        for (Sample sample : samples) {
            tempMin = Math.min(tempMin, sample.getTempMin());
            tempMax = Math.max(tempMax, sample.getTempMax());
            rainfall += sample.getRainfall();
            if (sample.getHumidity() != null) {
                humiditySum += sample.getHumidity();
                humidityCount++;
            }
            if (sample.getDescription() != null) {
                descriptionCounts.merge(sample.getDescription(), 1, Integer::sum);
            }
        }

        String description = UNKNOWN_DESCRIPTION;
        int best = 0;
        for (Map.Entry<String, Integer> entry : descriptionCounts.entrySet()) {
            if (entry.getValue() > best) {
                best = entry.getValue();
                description = entry.getKey();
            }
        }

        return DailyForecast.builder()
            .date(date.toString())
            .tempMin(tempMin)
            .tempMax(tempMax)
            .humidity(humidityCount == 0 ? 0 : (int) Math.round((double) humiditySum / humidityCount))
            .rainfall(rainfall)
            .description(description)
            .build();
    }

    private Sample parseSample(JsonNode item, String path, ZoneOffset offset) {
        requireObject(item, path);
        Instant time = epochInstant(requireNumber(item, "dt", path + ".dt"), path + ".dt");
        LocalDate date;
        try {
            date = time.atOffset(offset).toLocalDate();
        } catch (DateTimeException e) {
            throw new NormalizationException("Field '" + path + ".dt' has no calendar date at offset " + offset, e);
        }
        JsonNode main = requireObject(item.get("main"), path + ".main");
        double temp = requireNumber(main, "temp", path + ".main.temp");
        Double tempMin = optionalNumber(main, "temp_min", path + ".main.temp_min");
        Double tempMax = optionalNumber(main, "temp_max", path + ".main.temp_max");

        Integer humidity = main.hasNonNull("humidity") ? humidity(main, path + ".main.humidity") : null;

        double rainfall = 0.0;
        JsonNode rain = optionalObject(item, "rain", path + ".rain");
        if (rain != null) {
            Double threeHour = optionalNonNegative(rain, "3h", path + ".rain.3h");
            rainfall = threeHour == null ? 0.0 : threeHour;
        }

        String description = firstDescription(item, "weather", path + ".weather");

        return new Sample(
            time.getEpochSecond(),
            date,
            tempMin == null ? temp : tempMin,
            tempMax == null ? temp : tempMax,
            humidity,
            rainfall,
            description);
    }

    private double currentRainfall(JsonNode root) {
        JsonNode rain = optionalObject(root, "rain", "rain");
        if (rain == null) {
            return 0.0;
        }
        Double oneHour = optionalNonNegative(rain, "1h", "rain.1h");
        if (oneHour != null) {
            return oneHour;
        }
        Double threeHour = optionalNonNegative(rain, "3h", "rain.3h");
        // Spread a 3h accumulation over one hour
        return threeHour == null ? 0.0 : threeHour / 3.0;
    }

    private ZoneOffset forecastOffset(JsonNode root) {
        JsonNode city = optionalObject(root, "city", "city");
        if (city == null) {
            return ZoneOffset.UTC;
        }
        Double seconds = optionalNumber(city, "timezone", "city.timezone");
        if (seconds == null) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneOffset.ofTotalSeconds(seconds.intValue());
        } catch (DateTimeException e) {
            throw new NormalizationException("city.timezone is not a valid UTC offset: " + seconds, e);
        }
    }

    /**
     * Reads {@code <field>[0].description}; null when the array is absent, empty, or has no description.
     */
    private static String firstDescription(JsonNode parent, String field, String path) {
        JsonNode weather = parent.get(field);
        if (weather == null || weather.isNull()) {
            return null;
        }
        if (!weather.isArray()) {
            throw new NormalizationException("Field '" + path + "' must be an array");
        }
        if (weather.size() == 0) {
            return null;
        }
        JsonNode first = requireObject(weather.get(0), path + "[0]");
        JsonNode description = first.get("description");
        if (description == null || description.isNull()) {
            return null;
        }
        if (!description.isTextual()) {
            throw new NormalizationException("Field '" + path + "[0].description' must be a string");
        }
        return description.asText();
    }

    private static Instant epochInstant(double epochSeconds, String path) {
        try {
            return Instant.ofEpochSecond((long) epochSeconds);
        } catch (DateTimeException e) {
            throw new NormalizationException("Field '" + path + "' is not a valid epoch timestamp: " + epochSeconds, e);
        }
    }

    private int humidity(JsonNode main, String path) {
        Double value = optionalNumber(main, "humidity", path);
        if (value == null) {
            return 0;
        }
        if (value < 0 || value > 100) {
            throw new NormalizationException(path + " must be between 0 and 100, got " + value);
        }
        return (int) Math.round(value);
    }

    private static JsonNode requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw new NormalizationException("Expected JSON object at '" + path + "'");
        }
        return node;
    }

    private static JsonNode optionalObject(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new NormalizationException("Expected JSON object at '" + path + "'");
        }
        return node;
    }

    private static double requireNumber(JsonNode parent, String field, String path) {
        Double value = optionalNumber(parent, field, path);
        if (value == null) {
            throw new NormalizationException("Required field '" + path + "' is missing");
        }
        return value;
    }

    private static Double optionalNumber(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new NormalizationException("Field '" + path + "' must be numeric, got " + node.getNodeType());
        }
        double value = node.asDouble();
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new NormalizationException("Field '" + path + "' is not a finite number");
        }
        return value;
    }

    private static Double optionalNonNegative(JsonNode parent, String field, String path) {
        Double value = optionalNumber(parent, field, path);
        if (value != null && value < 0) {
            throw new NormalizationException("Field '" + path + "' must not be negative, got " + value);
        }
        return value;
    }

    /**
     * One validated 3-hour forecast sample.
     */
    @Value
    private static class Sample {
        long epochSecond;
        LocalDate date;
        double tempMin;
        double tempMax;
        Integer humidity;
        double rainfall;
        String description;
    }
}
