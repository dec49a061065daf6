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

import me.golemcore.krishi.domain.model.MarketPriceReport;
import me.golemcore.krishi.domain.model.MetricPoint;
import me.golemcore.krishi.domain.model.PriceTrend;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link MarketPriceReport} from a window of price points.
 */
public final class MarketAnalyzer {

    static final long DAY_MILLIS = 24L * 60 * 60 * 1000;
    static final int TREND_WINDOW = 7;
    static final double TREND_THRESHOLD_PERCENT = 3.0;

    private static final Map<PriceTrend, String> FORECAST_RANGE = Map.of(
            PriceTrend.RISING, "+5 to +10%",
            PriceTrend.FALLING, "-5 to -10%",
            PriceTrend.STABLE, "±2%");

    private static final Map<PriceTrend, List<String>> MARKETING_TIPS = Map.of(
            PriceTrend.RISING, List.of(
                    "Consider phased selling to benefit from potential further price increases.",
                    "Monitor daily market rates before selling large quantities.",
                    "Explore nearby markets for better price options."),
            PriceTrend.FALLING, List.of(
                    "Consider selling soon if storage costs are high.",
                    "Explore value-added processing options to increase returns.",
                    "Check government procurement programs for minimum support price options."),
            PriceTrend.STABLE, List.of(
                    "Prices are stable. Good time for planned, gradual marketing.",
                    "Compare prices across different markets before selling.",
                    "Consider quality grading to fetch premium prices."));

    private MarketAnalyzer() {
    }

    /**
     * @param points
     *            price points of the window, any order
     * @param nowMillis
     *            reference time for the weekly and monthly baselines
     */
    public static MarketPriceReport analyze(String crop, String marketArea, String metricId,
            List<MetricPoint> points, long nowMillis) {
        if (points.isEmpty()) {
            return MarketPriceReport.builder()
                    .crop(crop)
                    .marketArea(marketArea)
                    .metricId(metricId)
                    .dataAvailable(false)
                    .build();
        }

        List<MetricPoint> newestFirst = points.stream()
                .sorted(Comparator.comparingLong(MetricPoint::getTimestamp).reversed())
                .toList();
        MetricPoint current = newestFirst.get(0);
        double currentPrice = current.getValue();

        Double weekly = changePercent(currentPrice, baseline(newestFirst, nowMillis - 7 * DAY_MILLIS));
        Double monthly = changePercent(currentPrice, baseline(newestFirst, nowMillis - 30 * DAY_MILLIS));
        PriceTrend trend = trend(newestFirst);
        PriceTrend tipsFor = trend != null ? trend : PriceTrend.STABLE;

        return MarketPriceReport.builder()
                .crop(crop)
                .marketArea(marketArea)
                .metricId(metricId)
                .dataAvailable(true)
                .currentPrice(currentPrice)
                .unit(current.getUnit() != null && !current.getUnit().isEmpty() ? current.getUnit() : null)
                .weeklyChangePercent(weekly)
                .weeklyChange(formatChange(weekly))
                .monthlyChangePercent(monthly)
                .monthlyChange(formatChange(monthly))
                .trend(trend)
                .priceForecast(trend != null ? "Based on current trends, prices are expected to change by "
                        + FORECAST_RANGE.get(trend) + " over the next 2 weeks." : null)
                .marketingTips(MARKETING_TIPS.get(tipsFor))
                .build();
    }

    /**
     * Newest price at or before the cutoff. A zero price cannot serve as a
     * baseline.
     */
    private static Double baseline(List<MetricPoint> newestFirst, long cutoff) {
        for (MetricPoint point : newestFirst) {
            if (point.getTimestamp() <= cutoff) {
                return point.getValue() != 0 ? point.getValue() : null;
            }
        }
        return null;
    }

    private static Double changePercent(double current, Double baseline) {
        if (baseline == null) {
            return null;
        }
        return (current - baseline) / baseline * 100.0;
    }

    static String formatChange(Double percent) {
        if (percent == null) {
            return null;
        }
        String sign = percent >= 0 ? "+" : "";
        return sign + String.format(Locale.ROOT, "%.2f", percent) + "%";
    }

    /**
     * Mean of the newest seven points against the mean of the oldest seven.
     */
    private static PriceTrend trend(List<MetricPoint> newestFirst) {
        if (newestFirst.size() < TREND_WINDOW) {
            return null;
        }
        double recent = mean(newestFirst.subList(0, TREND_WINDOW));
        double older = mean(newestFirst.subList(newestFirst.size() - TREND_WINDOW, newestFirst.size()));
        if (older == 0) {
            return PriceTrend.STABLE;
        }
        double changePct = (recent - older) / older * 100.0;
        if (changePct > TREND_THRESHOLD_PERCENT) {
            return PriceTrend.RISING;
        }
        if (changePct < -TREND_THRESHOLD_PERCENT) {
            return PriceTrend.FALLING;
        }
        return PriceTrend.STABLE;
    }

    private static double mean(List<MetricPoint> points) {
        double sum = 0;
        for (MetricPoint point : points) {
            sum += point.getValue();
        }
        return sum / points.size();
    }
}
