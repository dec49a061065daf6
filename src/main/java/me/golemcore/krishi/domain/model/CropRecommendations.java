package me.golemcore.krishi.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CropRecommendations {

    private String district;
    private String soilType;
    private String season;
    private RecommendationBasis basis;

    @Builder.Default
    private List<RankedCrop> recommendations = new ArrayList<>();

    /**
     * Supporting cultivation texts keyed by crop id, for the top ranked crops.
     */
    @Builder.Default
    private Map<String, List<String>> cultivationPractices = new LinkedHashMap<>();
}
