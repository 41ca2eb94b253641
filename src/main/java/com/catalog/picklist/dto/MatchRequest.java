package com.catalog.picklist.dto;

import lombok.Data;

import java.util.Map;

@Data
public class MatchRequest {

    private String value;
    private String source;
    private String fieldKey;
    private ProductContext productContext;
    private Map<String, Object> aiContext;
    private Map<String, Object> rawDataContext;

    public MatchContext toContext() {
        return new MatchContext(source, fieldKey, productContext, aiContext, rawDataContext);
    }
}
