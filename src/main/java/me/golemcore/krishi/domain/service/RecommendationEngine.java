package me.golemcore.krishi.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.krishi.domain.engine.MarketAnalyzer;
import me.golemcore.krishi.domain.engine.SchemeTextExtractor;
import me.golemcore.krishi.domain.engine.WeatherAdvisor;
import me.golemcore.krishi.domain.exception.ValidationException;
import me.golemcore.krishi.domain.model.CropInformation;
import me.golemcore.krishi.domain.model.CropRanking;
import me.golemcore.krishi.domain.model.CropRecommendations;
import me.golemcore.krishi.domain.model.DailyWeather;
import me.golemcore.krishi.domain.model.EntityRelationships;
import me.golemcore.krishi.domain.model.EntityType;
import me.golemcore.krishi.domain.model.GovernmentScheme;
import me.golemcore.krishi.domain.model.KnowledgeItem;
import me.golemcore.krishi.domain.model.KnowledgeSnippet;
import me.golemcore.krishi.domain.model.MarketPriceReport;
import me.golemcore.krishi.domain.model.MetricPoint;
import me.golemcore.krishi.domain.model.NodeIds;
import me.golemcore.krishi.domain.model.RankedCrop;
import me.golemcore.krishi.domain.model.SchemeLookupResult;
import me.golemcore.krishi.domain.model.ScoredKnowledgeItem;
import me.golemcore.krishi.domain.model.WeatherForecast;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Farmer-facing answers composed from the vector store, the relationship graph
 * and the metric series. Holds no state of its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationEngine {

    public static final int DEFAULT_FORECAST_DAYS = 7;
    public static final int MAX_FORECAST_DAYS = 16;
    public static final String DEFAULT_SOIL_TYPE = "medium";
    public static final String DEFAULT_SEASON = "current";
    public static final int DEFAULT_PRICE_DAYS = 30;
    public static final int MAX_PRICE_DAYS = 365;
    public static final String ALL = "all";

    static final String CATEGORY = "category";
    static final String CROP_INFO = "crop_info";
    static final String GOVERNMENT_SCHEME = "government_scheme";
    static final int MAX_RECOMMENDATIONS = 5;
    static final int PRACTICE_CROPS = 3;
    static final int SEARCH_TOP_K = 5;

    static final double DEFAULT_HIGH_TEMP = 25;
    static final double DEFAULT_LOW_TEMP = 15;
    static final double DEFAULT_RAINFALL = 0;
    static final double DEFAULT_HUMIDITY = 50;
    static final double DEFAULT_WIND_SPEED = 5;

    static final List<String> SCHEME_RESOURCES = List.of(
            "Contact your local Krishi Vigyan Kendra for more information",
            "Visit the official PM-KISAN portal at pmkisan.gov.in",
            "Download the Kisan Suvidha mobile app for more government schemes");

    private static final long DAY_MILLIS = 24L * 60 * 60 * 1000;

    private final VectorStoreService vectorStore;
    private final RelationshipGraphService graph;
    private final MetricSeriesService metrics;
    private final Clock clock;

    // ==================== WEATHER ====================

    /**
     * Day-by-day forecast for the next {@code days} days. A day without a
     * stored value for some series uses that series' default and is marked
     * estimated.
     */
    public WeatherForecast weatherForecast(String district, int days) {
        requireText(district, "District is required");
        if (days < 1 || days > MAX_FORECAST_DAYS) {
            throw new ValidationException("Forecast days must be between 1 and " + MAX_FORECAST_DAYS + ", got "
                    + days);
        }

        long now = clock.millis();
        String slug = NodeIds.slug(district);
        String highId = "weather:temperature:high:" + slug;
        String lowId = "weather:temperature:low:" + slug;
        String rainId = "weather:rainfall:" + slug;
        String humidityId = "weather:humidity:" + slug;
        String windId = "weather:wind_speed:" + slug;

        Map<String, List<MetricPoint>> series = metrics.multiRange(List.of(highId, lowId, rainId, humidityId, windId),
                now, now + days * DAY_MILLIS - 1);

        List<DailyWeather> forecast = new ArrayList<>(days);
        Map<String, Double[]> byDay = new LinkedHashMap<>();
        for (Map.Entry<String, List<MetricPoint>> entry : series.entrySet()) {
            byDay.put(entry.getKey(), firstPerDay(entry.getValue(), now, days));
        }
        for (int i = 0; i < days; i++) {
            Double high = byDay.get(highId)[i];
            Double low = byDay.get(lowId)[i];
            Double rain = byDay.get(rainId)[i];
            Double humidity = byDay.get(humidityId)[i];
            Double wind = byDay.get(windId)[i];
            boolean estimated = high == null || low == null || rain == null || humidity == null || wind == null;
            forecast.add(DailyWeather.builder()
                    .date(LocalDate.ofInstant(Instant.ofEpochMilli(now + i * DAY_MILLIS), ZoneOffset.UTC))
                    .highTemp(high != null ? high : DEFAULT_HIGH_TEMP)
                    .lowTemp(low != null ? low : DEFAULT_LOW_TEMP)
                    .rainfall(rain != null ? rain : DEFAULT_RAINFALL)
                    .humidity(humidity != null ? humidity : DEFAULT_HUMIDITY)
                    .windSpeed(wind != null ? wind : DEFAULT_WIND_SPEED)
                    .estimated(estimated)
                    .build());
        }

        log.debug("[Engine] Weather forecast for {} over {} days", district, days);
        return WeatherForecast.builder()
                .district(district)
                .days(days)
                .forecast(forecast)
                .summary(WeatherAdvisor.summarize(forecast))
                .build();
    }

    /**
     * Value of the first point inside each day window
     * {@code [now + i*day, now + (i+1)*day)}, or {@code null}.
     */
    private static Double[] firstPerDay(List<MetricPoint> points, long now, int days) {
        Double[] values = new Double[days];
        for (MetricPoint point : points) {
            long offset = point.getTimestamp() - now;
            if (offset < 0) {
                continue;
            }
            int day = (int) (offset / DAY_MILLIS);
            if (day < days && values[day] == null) {
                values[day] = point.getValue();
            }
        }
        return values;
    }

    // ==================== CROPS ====================

    /**
     * Top ranked crops for the district plus cultivation texts for the best
     * three, fetched concurrently.
     */
    public CropRecommendations cropRecommendations(String district, String soilType, String season) {
        requireText(district, "District is required");
        String soil = textOrDefault(soilType, DEFAULT_SOIL_TYPE);
        String effectiveSeason = textOrDefault(season, DEFAULT_SEASON);

        CropRanking ranking = graph.getRecommendedCrops(district, soil, effectiveSeason);
        List<RankedCrop> top = ranking.crops().size() > MAX_RECOMMENDATIONS
                ? ranking.crops().subList(0, MAX_RECOMMENDATIONS)
                : ranking.crops();

        List<RankedCrop> practiceCrops = top.size() > PRACTICE_CROPS ? top.subList(0, PRACTICE_CROPS) : top;
        List<CompletableFuture<List<String>>> searches = new ArrayList<>();
        for (RankedCrop crop : practiceCrops) {
            searches.add(CompletableFuture.supplyAsync(() -> texts(vectorStore.searchByText(
                    "cultivation practices for " + crop.cropName(), Map.of(CATEGORY, CROP_INFO), SEARCH_TOP_K))));
        }
        List<List<String>> practices = FutureSupport.joinAll(searches, "search cultivation practices");
        Map<String, List<String>> byCrop = new LinkedHashMap<>();
        for (int i = 0; i < practiceCrops.size(); i++) {
            byCrop.put(practiceCrops.get(i).cropId(), practices.get(i));
        }

        log.debug("[Engine] {} crop recommendations for {} ({})", top.size(), district, ranking.basis());
        return CropRecommendations.builder()
                .district(district)
                .soilType(soil)
                .season(effectiveSeason)
                .basis(ranking.basis())
                .recommendations(List.copyOf(top))
                .cultivationPractices(byCrop)
                .build();
    }

    public CropInformation cropInformation(String cropName) {
        requireText(cropName, "Crop name is required");
        String cropId = NodeIds.nodeId(EntityType.CROP, cropName);
        EntityRelationships relationships = graph.getEntityWithRelationships(cropId);
        List<String> details = texts(vectorStore.searchByText(cropName, Map.of(CATEGORY, CROP_INFO), SEARCH_TOP_K));
        return new CropInformation(cropId, cropName, relationships, details);
    }

    public Map<String, List<String>> diseaseTreatments(String cropName) {
        requireText(cropName, "Crop name is required");
        return graph.findDiseaseTreatments(cropName);
    }

    // ==================== MARKET ====================

    /**
     * Price summary of {@code market:price:<crop>[:<area>]} over the last
     * {@code days} days.
     */
    public MarketPriceReport marketPrices(String crop, int days, String marketArea) {
        requireText(crop, "Crop is required");
        if (days < 1 || days > MAX_PRICE_DAYS) {
            throw new ValidationException("Price window must be between 1 and " + MAX_PRICE_DAYS + " days, got "
                    + days);
        }
        String area = textOrDefault(marketArea, ALL);
        String metricId = "market:price:" + NodeIds.slug(crop);
        if (!ALL.equalsIgnoreCase(area)) {
            metricId += ":" + NodeIds.slug(area);
        }

        long now = clock.millis();
        List<MetricPoint> points = metrics.range(metricId, Math.max(0, now - days * DAY_MILLIS), now);
        log.debug("[Engine] {} price points for {}", points.size(), metricId);
        return MarketAnalyzer.analyze(crop, area, metricId, points, now);
    }

    // ==================== KNOWLEDGE ====================

    public SchemeLookupResult governmentSchemes(String farmerType, String cropType, String state) {
        StringBuilder query = new StringBuilder("government scheme");
        if (isFilter(farmerType)) {
            query.append(" for ").append(farmerType.trim()).append(" farmers");
        }
        if (isFilter(cropType)) {
            query.append(" growing ").append(cropType.trim());
        }
        if (isFilter(state)) {
            query.append(" in ").append(state.trim());
        }

        List<GovernmentScheme> schemes = vectorStore.searchByText(query.toString(),
                Map.of(CATEGORY, GOVERNMENT_SCHEME), SEARCH_TOP_K).stream()
                .map(SchemeTextExtractor::extract)
                .toList();
        return new SchemeLookupResult(query.toString(), schemes, SCHEME_RESOURCES);
    }

    public List<KnowledgeSnippet> searchKnowledge(String question, int topK) {
        requireText(question, "Question is required");
        return vectorStore.searchScoredByText(question, null, topK).stream()
                .map(RecommendationEngine::snippet)
                .toList();
    }

    private static KnowledgeSnippet snippet(ScoredKnowledgeItem scored) {
        KnowledgeItem item = scored.item();
        return new KnowledgeSnippet(item.getId(), item.getText(), item.getMetadata(), scored.similarity());
    }

    private static List<String> texts(List<KnowledgeItem> items) {
        return items.stream().map(KnowledgeItem::getText).toList();
    }

    private static boolean isFilter(String value) {
        return value != null && !value.isBlank() && !ALL.equalsIgnoreCase(value.trim());
    }

    private static String textOrDefault(String value, String fallback) {
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
    }
}
