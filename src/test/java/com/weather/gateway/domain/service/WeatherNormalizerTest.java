package com.weather.gateway.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.weather.gateway.domain.exception.NormalizationException;
import com.weather.gateway.domain.model.DailyForecast;
import com.weather.gateway.domain.model.NormalizedForecast;
import com.weather.gateway.domain.model.NormalizedWeather;
import com.weather.gateway.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.weather.gateway.module.test.support.TestFixtures.Common;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeatherNormalizerTest {

    private final WeatherNormalizer normalizer = new WeatherNormalizer();

    @Test
    void testNormalizeCurrent_MapsAllFields() {
        ObjectNode json = TestFixtures.currentWeatherJson(24.5, 65, 3.6, "scattered clouds", Common.OBSERVED_AT_EPOCH);
        json.putObject("rain").put("1h", 0.8);

        NormalizedWeather weather = normalizer.normalizeCurrent(TestFixtures.rawCurrent(json));

        assertThat(weather.getTemperature()).isEqualTo(24.5);
        assertThat(weather.getHumidity()).isEqualTo(65);
        assertThat(weather.getRainfall()).isEqualTo(0.8);
        assertThat(weather.getWindSpeed()).isEqualTo(3.6);
        assertThat(weather.getDescription()).isEqualTo("scattered clouds");
        assertThat(weather.getProvider()).isEqualTo("openweather");
        assertThat(weather.getTimestamp()).isEqualTo("2024-06-01T09:50:00Z");
        assertThat(weather.isCached()).isFalse();
        assertThat(weather.isStale()).isFalse();
    }

    @Test
    void testNormalizeCurrent_ThreeHourRainIsSpreadOverOneHour() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        json.putObject("rain").put("3h", 3.0);

        NormalizedWeather weather = normalizer.normalizeCurrent(TestFixtures.rawCurrent(json));

        assertThat(weather.getRainfall()).isEqualTo(1.0);
    }

    @Test
    void testNormalizeCurrent_MissingOptionalFieldsUseDefaults() {
        ObjectNode json = new ObjectMapper().createObjectNode();
        json.putObject("main").put("temp", -3.25);

        NormalizedWeather weather = normalizer.normalizeCurrent(TestFixtures.rawCurrent(json));

        assertThat(weather.getTemperature()).isEqualTo(-3.25);
        assertThat(weather.getHumidity()).isZero();
        assertThat(weather.getRainfall()).isZero();
        assertThat(weather.getWindSpeed()).isZero();
        assertThat(weather.getDescription()).isEqualTo("unknown");
        // no dt: falls back to the receive instant
        assertThat(weather.getTimestamp()).isEqualTo(Common.START.toString());
    }

    @Test
    void testNormalizeCurrent_MissingTemperatureFails() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        ((ObjectNode) json.get("main")).remove("temp");

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("main.temp");
    }

    @Test
    void testNormalizeCurrent_MissingMainObjectFails() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        json.remove("main");

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class);
    }

    @Test
    void testNormalizeCurrent_TextualTemperatureFails() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        ((ObjectNode) json.get("main")).put("temp", "24.5");

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("numeric");
    }

    @Test
    void testNormalizeCurrent_WrongTypeOnOptionalFieldFailsInsteadOfDefaulting() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        json.put("rain", "heavy");

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("rain");
    }

    @Test
    void testNormalizeCurrent_HumidityOutOfRangeFails() {
        ObjectNode json = TestFixtures.currentWeatherJson(20.0, 140, 1.0, "clear sky", Common.OBSERVED_AT_EPOCH);

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("humidity");
    }

    @Test
    void testNormalizeCurrent_NegativeWindSpeedFails() {
        ObjectNode json = TestFixtures.currentWeatherJson(20.0, 50, -1.0, "clear sky", Common.OBSERVED_AT_EPOCH);

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class);
    }

    @Test
    void testNormalizeCurrent_ObservationTimeOutOfRangeFails() {
        ObjectNode json = TestFixtures.currentWeatherJson();
        json.put("dt", 1e20);

        assertThatThrownBy(() -> normalizer.normalizeCurrent(TestFixtures.rawCurrent(json)))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("dt");
    }

    @Test
    void testNormalizeForecast_SampleTimeOutOfRangeFails() {
        ObjectNode json = TestFixtures.fiveDayForecastJson();
        ((ObjectNode) json.get("list").get(3)).put("dt", 1e20);

        assertThatThrownBy(() -> normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("list[3].dt");
    }

    @Test
    void testNormalizeForecast_SampleTimeWithoutLocalDateFails() {
        ObjectNode json = TestFixtures.forecastJson();
        ((ObjectNode) json.get("city")).put("timezone", 3_600);
        TestFixtures.addSample(json, Instant.MAX.getEpochSecond(), 10, 50, null, null);

        assertThatThrownBy(() -> normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("list[0].dt");
    }

    @Test
    void testNormalizeForecast_DailyMinMaxAreTrueExtremes() {
        ObjectNode json = TestFixtures.forecastJson();
        long day = Common.FORECAST_DAY_ONE;
        TestFixtures.addSample(json, day + 3_600, 5, 70, null, "clouds");
        TestFixtures.addSample(json, day + 14_400, 9, 60, null, "clouds");
        TestFixtures.addSample(json, day + 25_200, 2, 80, null, "clouds");

        NormalizedForecast forecast = normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5);

        assertThat(forecast.getForecast()).hasSize(1);
        DailyForecast first = forecast.getForecast().get(0);
        assertThat(first.getTempMin()).isEqualTo(2.0);
        assertThat(first.getTempMax()).isEqualTo(9.0);
        assertThat(first.getHumidity()).isEqualTo(70);
    }

    @Test
    void testNormalizeForecast_UsesSampleMinAndMaxWhenReported() {
        ObjectNode json = TestFixtures.forecastJson();
        ObjectNode sample = TestFixtures.addSample(json, Common.FORECAST_DAY_ONE, 20, 50, null, null);
        ((ObjectNode) sample.get("main")).put("temp_min", 18.5).put("temp_max", 22.5);
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE + 10_800, 21, 50, null, null);

        DailyForecast day = normalizer.normalizeForecast(TestFixtures.rawForecast(json), 1).getForecast().get(0);

        assertThat(day.getTempMin()).isEqualTo(18.5);
        assertThat(day.getTempMax()).isEqualTo(22.5);
        assertThat(day.getDescription()).isEqualTo("unknown");
    }

    @Test
    void testNormalizeForecast_GroupsByCalendarDayAndTruncatesToHorizon() {
        NormalizedForecast forecast = normalizer.normalizeForecast(
            TestFixtures.rawForecast(TestFixtures.fiveDayForecastJson()), 3);

        assertThat(forecast.getForecast())
            .extracting(DailyForecast::getDate)
            .containsExactly("2024-06-02", "2024-06-03", "2024-06-04");
        DailyForecast second = forecast.getForecast().get(1);
        assertThat(second.getTempMin()).isEqualTo(11.0);
        assertThat(second.getTempMax()).isEqualTo(18.0);
        assertThat(second.getHumidity()).isEqualTo(64);
        assertThat(second.getRainfall()).isCloseTo(1.5, within(1e-9));
        assertThat(second.getDescription()).isEqualTo("light rain");
        assertThat(forecast.getProvider()).isEqualTo("openweather");
        assertThat(forecast.getTimestamp()).isEqualTo(Common.START.toString());
    }

    @Test
    void testNormalizeForecast_IsIndependentOfSampleOrderAndDeterministic() {
        ObjectNode ordered = TestFixtures.forecastJson();
        ObjectNode shuffled = TestFixtures.forecastJson();
        long day = Common.FORECAST_DAY_ONE;
        TestFixtures.addSample(ordered, day, 5, 40, 0.5, "rain");
        TestFixtures.addSample(ordered, day + 10_800, 9, 50, null, "clear sky");
        TestFixtures.addSample(ordered, day + 21_600, 2, 60, 1.0, "clear sky");
        TestFixtures.addSample(ordered, day + 86_400, 7, 70, null, "mist");

        TestFixtures.addSample(shuffled, day + 86_400, 7, 70, null, "mist");
        TestFixtures.addSample(shuffled, day + 21_600, 2, 60, 1.0, "clear sky");
        TestFixtures.addSample(shuffled, day, 5, 40, 0.5, "rain");
        TestFixtures.addSample(shuffled, day + 10_800, 9, 50, null, "clear sky");

        NormalizedForecast fromOrdered = normalizer.normalizeForecast(TestFixtures.rawForecast(ordered), 5);
        NormalizedForecast fromShuffled = normalizer.normalizeForecast(TestFixtures.rawForecast(shuffled), 5);
        NormalizedForecast again = normalizer.normalizeForecast(TestFixtures.rawForecast(ordered), 5);

        assertThat(fromShuffled).isEqualTo(fromOrdered);
        assertThat(again).isEqualTo(fromOrdered);
        DailyForecast first = fromOrdered.getForecast().get(0);
        assertThat(first.getTempMin()).isEqualTo(2.0);
        assertThat(first.getTempMax()).isEqualTo(9.0);
        assertThat(first.getRainfall()).isEqualTo(1.5);
        assertThat(first.getDescription()).isEqualTo("clear sky");
    }

    @Test
    void testNormalizeForecast_DescriptionTieGoesToEarliestSample() {
        ObjectNode json = TestFixtures.forecastJson();
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE + 10_800, 10, 50, null, "overcast clouds");
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE, 10, 50, null, "few clouds");

        DailyForecast day = normalizer.normalizeForecast(TestFixtures.rawForecast(json), 1).getForecast().get(0);

        assertThat(day.getDescription()).isEqualTo("few clouds");
    }

    @Test
    void testNormalizeForecast_DayBoundaryFollowsCityTimezone() {
        ObjectNode json = TestFixtures.forecastJson();
        // UTC+05:30: 20:00Z on day one is already the next local day
        ((ObjectNode) json.get("city")).put("timezone", 19_800);
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE + 3_600, 10, 50, null, null);
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE + 72_000, 20, 50, null, null);

        NormalizedForecast forecast = normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5);

        assertThat(forecast.getForecast())
            .extracting(DailyForecast::getDate)
            .containsExactly("2024-06-02", "2024-06-03");
    }

    @Test
    void testNormalizeForecast_MissingListFails() {
        ObjectNode json = TestFixtures.forecastJson();
        json.remove("list");

        assertThatThrownBy(() -> normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("list");
    }

    @Test
    void testNormalizeForecast_EmptyListFails() {
        assertThatThrownBy(() -> normalizer.normalizeForecast(TestFixtures.rawForecast(TestFixtures.forecastJson()), 5))
            .isInstanceOf(NormalizationException.class);
    }

    @Test
    void testNormalizeForecast_SampleWithoutTemperatureFails() {
        ObjectNode json = TestFixtures.forecastJson();
        TestFixtures.addSample(json, Common.FORECAST_DAY_ONE, 10, 50, null, null);
        ObjectNode broken = TestFixtures.addSample(json, Common.FORECAST_DAY_ONE + 10_800, 10, 50, null, null);
        ((ObjectNode) broken.get("main")).remove("temp");

        assertThatThrownBy(() -> normalizer.normalizeForecast(TestFixtures.rawForecast(json), 5))
            .isInstanceOf(NormalizationException.class)
            .hasMessageContaining("list[1].main.temp");
    }
}
