package me.golemcore.krishi.tools;

import me.golemcore.krishi.domain.exception.ProviderException;
import me.golemcore.krishi.domain.model.ToolDefinition;
import me.golemcore.krishi.domain.model.ToolFailureKind;
import me.golemcore.krishi.domain.model.ToolResult;
import me.golemcore.krishi.domain.model.WeatherForecast;
import me.golemcore.krishi.domain.service.RecommendationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WeatherForecastToolTest {

    private RecommendationEngine engine;
    private WeatherForecastTool tool;

    @BeforeEach
    void setUp() {
        engine = mock(RecommendationEngine.class);
        tool = new WeatherForecastTool(engine);
    }

    private static WeatherForecast forecast(String district, int days) {
        WeatherForecast.Summary summary = WeatherForecast.Summary.builder()
                .temperature(new WeatherForecast.TemperatureRange(15, 25, 20))
                .totalRainfall(0)
                .agriculturalImplications(List.of("Temperature conditions are favorable for most crops."))
                .build();
        return WeatherForecast.builder().district(district).days(days).summary(summary).build();
    }

    // ===== Definition =====

    @Test
    void shouldDescribeParameters() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("get_weather_forecast", definition.getName());
        assertEquals(List.of("district"), definition.getInputSchema().get("required"));
        Map<?, ?> properties = (Map<?, ?>) definition.getInputSchema().get("properties");
        assertTrue(properties.containsKey("days"));
    }

    // ===== Execution =====

    @Test
    void shouldUseDefaultDays() {
        when(engine.weatherForecast("Pune", 7)).thenReturn(forecast("Pune", 7));

        ToolResult result = tool.execute(Map.of("district", "Pune")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Weather for Pune over 7 days"));
        assertTrue(result.getOutput().contains("favorable"));
        assertInstanceOf(WeatherForecast.class, result.getData());
    }

    @Test
    void shouldAcceptNumericStringDays() {
        when(engine.weatherForecast("Nashik", 3)).thenReturn(forecast("Nashik", 3));

        ToolResult result = tool.execute(Map.of("district", "Nashik", "days", "3")).join();

        assertTrue(result.isSuccess());
        verify(engine).weatherForecast("Nashik", 3);
    }

    @Test
    void shouldFailWithoutDistrict() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
        assertEquals("District is required", result.getError());
        verifyNoInteractions(engine);
    }

    @Test
    void shouldFailOnFractionalDays() {
        ToolResult result = tool.execute(Map.of("district", "Pune", "days", 2.5)).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENT, result.getFailureKind());
    }

    @Test
    void shouldReportProviderFailure() {
        when(engine.weatherForecast(anyString(), anyInt())).thenThrow(new ProviderException("store offline"));

        ToolResult result = tool.execute(Map.of("district", "Pune")).join();

        assertEquals(ToolFailureKind.PROVIDER_UNAVAILABLE, result.getFailureKind());
        assertEquals("Failed to run get_weather_forecast: store offline", result.getError());
    }
}
