package com.catalog.picklist.dto;

import com.catalog.picklist.model.MismatchRecord;

import java.util.List;

public record MismatchPage(List<MismatchRecord> records, long total, int skip, int limit) {
}
