package me.golemcore.krishi.domain.service;

import me.golemcore.krishi.KnowledgeCoreFixture;
import me.golemcore.krishi.domain.engine.WeatherAdvisor;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.model.CropInformation;
import me.golemcore.krishi.domain.model.CropRecommendations;
import me.golemcore.krishi.domain.model.DailyWeather;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.KnowledgeSnippet;
import me.golemcore.krishi.domain.model.MarketPriceReport;
import me.golemcore.krishi.domain.model.MetricPoint;
import me.golemcore.krishi.domain.model.RankedCrop;
import me.golemcore.krishi.domain.model.RecommendationBasis;
import me.golemcore.krishi.domain.model.RelationshipType;
import me.golemcore.krishi.domain.model.SchemeLookupResult;
import me.golemcore.krishi.domain.model.WeatherForecast;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationEngineTest {

    private static final long DAY = KnowledgeCoreFixture.DAY;

    private KnowledgeCoreFixture fixture;
    private RecommendationEngine engine;

    @BeforeEach
    void setUp() {
        fixture = KnowledgeCoreFixture.indexed();
        engine = fixture.engine;
    }

    private void append(String metricId, long timestamp, double value) {
        fixture.metrics.append(MetricPoint.builder().metricId(metricId).timestamp(timestamp).value(value).build());
    }

    // ===== weather =====

    @Test
    void shouldUseDefaultsWhenNoWeatherData() {
        WeatherForecast forecast = engine.weatherForecast("Pune", 3);

        assertEquals(3, forecast.getForecast().size());
        DailyWeather first = forecast.getForecast().get(0);
        assertEquals(LocalDate.of(2026, 3, 1), first.date());
        assertEquals(25, first.highTemp());
        assertEquals(15, first.lowTemp());
        assertEquals(0, first.rainfall());
        assertEquals(50, first.humidity());
        assertEquals(5, first.windSpeed());
        assertTrue(first.estimated());
        assertEquals(LocalDate.of(2026, 3, 3), forecast.getForecast().get(2).date());
        assertEquals(List.of(WeatherAdvisor.FAVORABLE_TEMPERATURE),
                forecast.getSummary().getAgriculturalImplications());
        assertEquals(20, forecast.getSummary().getTemperature().avg(), 1e-9);
    }

    @Test
    void shouldUseStoredSeriesPerDay() {
        long now = fixture.now();
        append("weather:temperature:high:new_delhi", now, 39);
        append("weather:temperature:high:new_delhi", now + 3_600_000, 45);
        append("weather:temperature:low:new_delhi", now, 24);
        append("weather:rainfall:new_delhi", now, 12);
        append("weather:humidity:new_delhi", now, 40);
        append("weather:wind_speed:new_delhi", now, 9);
        append("weather:temperature:high:new_delhi", now - DAY, 10);

        WeatherForecast forecast = engine.weatherForecast("New Delhi", 2);

        DailyWeather today = forecast.getForecast().get(0);
        assertEquals(39, today.highTemp());
        assertEquals(24, today.lowTemp());
        assertEquals(12, today.rainfall());
        assertFalse(today.estimated());
        assertTrue(forecast.getForecast().get(1).estimated());
        assertTrue(forecast.getSummary().getAgriculturalImplications().contains(WeatherAdvisor.HEAT_STRESS));
        assertTrue(forecast.getSummary().getAgriculturalImplications().contains(WeatherAdvisor.MODERATE_RAIN));
    }

    @Test
    void shouldValidateForecastArguments() {
        assertThrows(ValidationException.class, () -> engine.weatherForecast("Pune", 0));
        assertThrows(ValidationException.class,
                () -> engine.weatherForecast("Pune", RecommendationEngine.MAX_FORECAST_DAYS + 1));
        assertThrows(ValidationException.class, () -> engine.weatherForecast(" ", 3));
    }

    // ===== crops =====

    @Test
    void shouldRecommendGraphCropsWithPractices() {
        var graph = fixture.graph;
        String rice = graph.createNode(EntityType.CROP, "Rice");
        String pune = graph.createNode(EntityType.LOCATION, "Pune");
        graph.createEdge(pune, RelationshipType.SUITABLE_FOR, rice);
        graph.createEdge(rice, RelationshipType.GROWN_DURING, graph.createNode(EntityType.SEASON, "Kharif"));
        fixture.vectorStore.ingest("Cultivation practices for rice: transplant 25 day old seedlings",
                Map.of("category", "crop_info"), "rice-practice");
        fixture.vectorStore.ingest("Rice scheme subsidy", Map.of("category", "government_scheme"), "scheme");

        CropRecommendations result = engine.cropRecommendations("Pune", null, "Kharif");

        assertEquals(RecommendationBasis.GRAPH, result.getBasis());
        assertEquals(RecommendationEngine.DEFAULT_SOIL_TYPE, result.getSoilType());
        assertEquals(List.of(rice), result.getRecommendations().stream().map(RankedCrop::cropId).toList());
        assertEquals(0.8, result.getRecommendations().get(0).suitabilityScore());
        assertEquals(List.of("Cultivation practices for rice: transplant 25 day old seedlings"),
                result.getCultivationPractices().get(rice));
    }

    @Test
    void shouldFallBackToStapleCrops() {
        CropRecommendations result = engine.cropRecommendations("Unknown District", "sandy", null);

        assertEquals(RecommendationBasis.DEFAULT_FALLBACK, result.getBasis());
        assertEquals(RecommendationEngine.DEFAULT_SEASON, result.getSeason());
        assertEquals(3, result.getRecommendations().size());
        assertEquals(List.of("crop:wheat", "crop:rice", "crop:maize"),
                List.copyOf(result.getCultivationPractices().keySet()));
    }

    @Test
    void shouldDescribeCrop() {
        var graph = fixture.graph;
        String rice = graph.createNode(EntityType.CROP, "Rice");
        graph.createEdge(rice, RelationshipType.SUSCEPTIBLE_TO, graph.createNode(EntityType.DISEASE, "Blast"));
        fixture.vectorStore.ingest("Rice needs standing water", Map.of("category", "crop_info"), "rice-water");

        CropInformation information = engine.cropInformation("Rice");

        assertEquals("crop:rice", information.cropId());
        assertEquals("Blast", information.relationships().relationships().get("susceptible_to").get(0).name());
        assertEquals(List.of("Rice needs standing water"), information.details());
    }

    // ===== market =====

    @Test
    void shouldReportWeeklyPriceChange() {
        long now = fixture.now();
        append("market:price:wheat", now - 7 * DAY, 2120);
        append("market:price:wheat", now, 2200);

        MarketPriceReport report = engine.marketPrices("Wheat", 30, null);

        assertTrue(report.isDataAvailable());
        assertEquals("market:price:wheat", report.getMetricId());
        assertEquals(RecommendationEngine.ALL, report.getMarketArea());
        assertEquals(2200, report.getCurrentPrice());
        assertEquals("+3.77%", report.getWeeklyChange());
    }

    @Test
    void shouldReadMarketSpecificSeries() {
        append("market:price:onion:lasalgaon", fixture.now() - DAY, 1500);

        MarketPriceReport report = engine.marketPrices("Onion", 30, "Lasalgaon");

        assertEquals("market:price:onion:lasalgaon", report.getMetricId());
        assertEquals(1500, report.getCurrentPrice());
    }

    @Test
    void shouldIgnorePricesOutsideWindow() {
        append("market:price:wheat", fixture.now() - 40 * DAY, 2000);

        assertFalse(engine.marketPrices("wheat", 30, "all").isDataAvailable());
    }

    @Test
    void shouldValidatePriceWindow() {
        assertThrows(ValidationException.class, () -> engine.marketPrices("wheat", 0, null));
        assertThrows(ValidationException.class, () -> engine.marketPrices("wheat", 366, null));
        assertThrows(ValidationException.class, () -> engine.marketPrices(null, 30, null));
    }

    // ===== knowledge =====

    @Test
    void shouldLookUpGovernmentSchemes() {
        fixture.vectorStore.ingest("PM-KISAN\nIncome support for small farmers. benefits: Rs 6000 per year.",
                Map.of("category", "government_scheme"), "pm-kisan");
        fixture.vectorStore.ingest("Rice crop notes", Map.of("category", "crop_info"), "notes");

        SchemeLookupResult result = engine.governmentSchemes("small", "rice", "Maharashtra");

        assertEquals("government scheme for small farmers growing rice in Maharashtra", result.query());
        assertEquals(1, result.schemes().size());
        assertEquals("PM-KISAN", result.schemes().get(0).name());
        assertEquals("Rs 6000 per year", result.schemes().get(0).benefits());
        assertEquals(RecommendationEngine.SCHEME_RESOURCES, result.additionalResources());
    }

    @Test
    void shouldBuildGenericSchemeQueryForAll() {
        SchemeLookupResult result = engine.governmentSchemes("all", null, "ALL");

        assertEquals("government scheme", result.query());
        assertTrue(result.schemes().isEmpty());
    }

    @Test
    void shouldReturnScoredSnippets() {
        fixture.vectorStore.ingest("Neem oil controls aphids on mustard", Map.of("category", "pest"), "neem");

        List<KnowledgeSnippet> snippets = engine.searchKnowledge("aphids mustard", 3);

        assertEquals(1, snippets.size());
        assertEquals("neem", snippets.get(0).id());
        assertEquals("pest", snippets.get(0).metadata().get("category"));
        assertTrue(snippets.get(0).similarity() > 0);
    }

    @Test
    void shouldRejectBlankQuestion() {
        assertThrows(ValidationException.class, () -> engine.searchKnowledge("", 3));
    }
}
