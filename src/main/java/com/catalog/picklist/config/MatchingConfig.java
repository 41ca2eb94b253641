package com.catalog.picklist.config;

import com.catalog.picklist.matching.PicklistMatcher;
import com.catalog.picklist.model.PicklistType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.Map;

@Configuration
public class MatchingConfig {

    private static final Logger logger = LoggerFactory.getLogger(MatchingConfig.class);

    /**
     * Matcher with per-type fuzzy thresholds from {@code app.picklist.matching.threshold.*}.
     */
    @Bean
    public PicklistMatcher picklistMatcher(
            @Value("${app.picklist.matching.threshold.brand:0.70}") double brandThreshold,
            @Value("${app.picklist.matching.threshold.category:0.70}") double categoryThreshold,
            @Value("${app.picklist.matching.threshold.style:0.70}") double styleThreshold,
            @Value("${app.picklist.matching.threshold.attribute:0.60}") double attributeThreshold) {
        Map<PicklistType, Double> thresholds = new EnumMap<>(PicklistType.class);
        thresholds.put(PicklistType.BRAND, brandThreshold);
        thresholds.put(PicklistType.CATEGORY, categoryThreshold);
        thresholds.put(PicklistType.STYLE, styleThreshold);
        thresholds.put(PicklistType.ATTRIBUTE, attributeThreshold);
        logger.info("Picklist match thresholds: {}", thresholds);
        return new PicklistMatcher(thresholds);
    }
}
