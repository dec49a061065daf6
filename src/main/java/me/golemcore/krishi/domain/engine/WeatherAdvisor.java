package me.golemcore.krishi.domain.engine;

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

import me.golemcore.krishi.domain.model.DailyWeather;
import me.golemcore.krishi.domain.model.WeatherForecast;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarises forecast days and derives farming advisories from them.
 */
public final class WeatherAdvisor {

    public static final String HEAT_STRESS = "High temperatures may cause heat stress in crops. Consider additional irrigation.";
    public static final String FROST_RISK = "Low temperatures may affect sensitive crops. Monitor for frost damage.";
    public static final String FAVORABLE_TEMPERATURE = "Temperature conditions are favorable for most crops.";
    public static final String HEAVY_RAIN = "Heavy rainfall expected. Ensure proper drainage in fields.";
    public static final String DRY_SPELL = "Dry conditions expected. Plan for irrigation if available.";
    public static final String MODERATE_RAIN = "Moderate rainfall expected. Good conditions for most crops.";

    static final double HEAT_THRESHOLD = 35.0;
    static final double FROST_THRESHOLD = 10.0;
    static final double HEAVY_RAIN_MM = 50.0;
    static final double DRY_SPELL_MM = 5.0;
    static final int DRY_SPELL_MIN_DAYS = 7;

    private WeatherAdvisor() {
    }

    public static WeatherForecast.Summary summarize(List<DailyWeather> days) {
        if (days.isEmpty()) {
            return WeatherForecast.Summary.builder().build();
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        double sum = 0;
        double totalRainfall = 0;
        int rainyDays = 0;
        for (DailyWeather day : days) {
            min = Math.min(min, Math.min(day.highTemp(), day.lowTemp()));
            max = Math.max(max, Math.max(day.highTemp(), day.lowTemp()));
            sum += day.highTemp() + day.lowTemp();
            totalRainfall += day.rainfall();
            if (day.rainfall() > 0) {
                rainyDays++;
            }
        }
        WeatherForecast.TemperatureRange temperature = new WeatherForecast.TemperatureRange(min, max,
                sum / (days.size() * 2.0));

        return WeatherForecast.Summary.builder()
                .temperature(temperature)
                .rainProbability((double) rainyDays / days.size())
                .totalRainfall(totalRainfall)
                .agriculturalImplications(advisories(temperature, totalRainfall, days.size()))
                .build();
    }

    static List<String> advisories(WeatherForecast.TemperatureRange temperature, double totalRainfall, int days) {
        List<String> advisories = new ArrayList<>();
        boolean heat = temperature.max() > HEAT_THRESHOLD;
        boolean frost = temperature.min() < FROST_THRESHOLD;
        if (heat) {
            advisories.add(HEAT_STRESS);
        }
        if (frost) {
            advisories.add(FROST_RISK);
        }
        if (!heat && !frost) {
            advisories.add(FAVORABLE_TEMPERATURE);
        }

        if (totalRainfall > HEAVY_RAIN_MM) {
            advisories.add(HEAVY_RAIN);
        } else if (totalRainfall < DRY_SPELL_MM && days >= DRY_SPELL_MIN_DAYS) {
            advisories.add(DRY_SPELL);
        } else if (totalRainfall > 0) {
            advisories.add(MODERATE_RAIN);
        }
        return advisories;
    }
}
