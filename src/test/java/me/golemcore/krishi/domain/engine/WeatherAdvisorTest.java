package me.golemcore.krishi.domain.engine;

import me.golemcore.krishi.domain.model.DailyWeather;
import me.golemcore.krishi.domain.model.WeatherForecast;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WeatherAdvisorTest {

    private static DailyWeather day(double high, double low, double rain) {
        return DailyWeather.builder()
                .date(LocalDate.of(2026, 3, 1))
                .highTemp(high)
                .lowTemp(low)
                .rainfall(rain)
                .humidity(50)
                .windSpeed(5)
                .build();
    }

    private static List<DailyWeather> days(int count, double high, double low, double rain) {
        List<DailyWeather> result = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            result.add(day(high, low, rain));
        }
        return result;
    }

    @Test
    void shouldSummarizeTemperatureAcrossHighsAndLows() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(List.of(day(30, 20, 2), day(34, 18, 0)));

        assertEquals(18, summary.getTemperature().min());
        assertEquals(34, summary.getTemperature().max());
        assertEquals(25.5, summary.getTemperature().avg(), 1e-9);
        assertEquals(0.5, summary.getRainProbability(), 1e-9);
        assertEquals(2, summary.getTotalRainfall(), 1e-9);
    }

    @Test
    void shouldReportFavorableTemperatureOnly() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(days(3, 25, 15, 0));

        assertEquals(List.of(WeatherAdvisor.FAVORABLE_TEMPERATURE), summary.getAgriculturalImplications());
    }

    @Test
    void shouldReportHeatAndFrostTogether() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(List.of(day(38, 12, 0), day(30, 8, 0)));

        assertEquals(List.of(WeatherAdvisor.HEAT_STRESS, WeatherAdvisor.FROST_RISK),
                summary.getAgriculturalImplications());
    }

    @Test
    void shouldReportHeavyRain() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(days(3, 30, 20, 20));

        assertTrue(summary.getAgriculturalImplications().contains(WeatherAdvisor.HEAVY_RAIN));
    }

    @Test
    void shouldReportDrySpellOnlyForAWeekOrMore() {
        assertTrue(WeatherAdvisor.summarize(days(7, 30, 20, 0.5)).getAgriculturalImplications()
                .contains(WeatherAdvisor.DRY_SPELL));
        assertFalse(WeatherAdvisor.summarize(days(6, 30, 20, 0)).getAgriculturalImplications()
                .contains(WeatherAdvisor.DRY_SPELL));
    }

    @Test
    void shouldReportModerateRain() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(days(3, 30, 20, 5));

        assertEquals(List.of(WeatherAdvisor.FAVORABLE_TEMPERATURE, WeatherAdvisor.MODERATE_RAIN),
                summary.getAgriculturalImplications());
    }

    @Test
    void shouldNotAdviseOnRainForShortDryForecast() {
        WeatherForecast.Summary summary = WeatherAdvisor.summarize(days(3, 30, 20, 0));

        assertEquals(1, summary.getAgriculturalImplications().size());
    }
}
