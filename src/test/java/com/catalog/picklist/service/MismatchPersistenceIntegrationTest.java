package com.catalog.picklist.service;

import com.catalog.picklist.dto.MatchContext;
import com.catalog.picklist.dto.MismatchInput;
import com.catalog.picklist.dto.MismatchResolution;
import com.catalog.picklist.dto.ProductContext;
import com.catalog.picklist.matching.MatchKind;
import com.catalog.picklist.model.MismatchRecord;
import com.catalog.picklist.model.PicklistType;
import com.catalog.picklist.model.ResolutionAction;
import com.catalog.picklist.repository.MismatchRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the mismatch upsert and triage queries against a real PostgreSQL.
 * Skipped when no Docker daemon is available.
 */
@SpringBootTest(properties = {
        "spring.jpa.hibernate.ddl-auto=create-drop",
        "app.mismatch.buffer.flush-interval-ms=3600000"
})
@Testcontainers(disabledWithoutDocker = true)
class MismatchPersistenceIntegrationTest {

    private static final String SOURCE = "enrichment";

    @Container
    @ServiceConnection
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    @TempDir
    static Path picklistDir;

    @DynamicPropertySource
    static void picklistStorage(DynamicPropertyRegistry registry) {
        registry.add("app.picklist.storage.dir", () -> picklistDir.toString());
    }

    @Autowired
    private PicklistMatchService matchService;

    @Autowired
    private MismatchRecorder recorder;

    @Autowired
    private MismatchUpsertStore upsertStore;

    @Autowired
    private MismatchRecordRepository repository;

    @BeforeEach
    void clearMismatches() {
        recorder.flush();
        repository.deleteAll();
    }

    @Test
    void repeatedMissIsStoredOnceWithGrowingCount() {
        MatchContext context = MatchContext.of(SOURCE);

        assertThat(matchService.match(PicklistType.CATEGORY, "Random Category", context).kind())
                .isEqualTo(MatchKind.UNMATCHED);
        recorder.flush();
        assertThat(stored(PicklistType.CATEGORY, "random category").getOccurrenceCount()).isEqualTo(1);

        matchService.match(PicklistType.CATEGORY, "  random   CATEGORY ", context);
        recorder.flush();

        MismatchRecord record = stored(PicklistType.CATEGORY, "random category");
        assertThat(record.getOccurrenceCount()).isEqualTo(2);
        assertThat(record.isResolved()).isFalse();
        assertThat(record.getFirstSeen()).isBeforeOrEqualTo(record.getLastSeen());
        assertThat(record.getClosestMatches()).isNotEmpty();
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void laterObservationWithoutContextKeepsStoredContext() {
        ProductContext product = new ProductContext("cat-42", "Kitchen Sink 33in", "K-5707", "KOHLER", "kitchen_sinks", "sess-1");
        upsertStore.upsert(input("Stainles Steal", 0.35, product, Map.of("model", "extractor-v2")));
        upsertStore.upsert(input("stainles steal", 0.35, null, null));

        MismatchRecord record = stored(PicklistType.ATTRIBUTE, "stainles steal");
        assertThat(record.getOccurrenceCount()).isEqualTo(2);
        assertThat(record.getAttemptedValue()).isEqualTo("stainles steal");
        assertThat(record.getCatalogId()).isEqualTo("cat-42");
        assertThat(record.getSessionId()).isEqualTo("sess-1");
        assertThat(record.getAiContext()).containsEntry("model", "extractor-v2");
    }

    @Test
    void nearMissesAreUnresolvedRecordsInsideSimilarityBand() {
        upsertStore.upsert(input("halfway", 0.5, null, null));
        upsertStore.upsert(input("distant", 0.3, null, null));
        upsertStore.upsert(input("borderline", 0.6, null, null));

        assertThat(recorder.nearMisses(50))
                .extracting(MismatchRecord::getNormalizedValue)
                .containsExactly("halfway");
        assertThat(recorder.stats().nearMisses())
                .extracting(MismatchRecord::getNormalizedValue)
                .containsExactly("halfway");
    }

    @Test
    void resolutionIsTerminalButLaterSightingsAreCounted() {
        upsertStore.upsert(input("Mount Styel", 0.45, null, null));
        MismatchResolution resolution = MismatchResolution.of("value_corrected", "Mount Style", null, "typo", "reviewer");

        List<MismatchRecord> resolved = recorder.resolve(PicklistType.ATTRIBUTE, "MOUNT STYEL", null, resolution);

        assertThat(resolved).singleElement().satisfies(record -> {
            assertThat(record.isResolved()).isTrue();
            assertThat(record.getResolutionAction()).isEqualTo(ResolutionAction.VALUE_CORRECTED);
            assertThat(record.getResolvedBy()).isEqualTo("reviewer");
        });
        assertThatThrownBy(() -> recorder.resolve(PicklistType.ATTRIBUTE, "mount styel", null, resolution))
                .isInstanceOf(MismatchAlreadyResolvedException.class);

        upsertStore.upsert(input("Mount Styel", 0.45, null, null));
        MismatchRecord record = stored(PicklistType.ATTRIBUTE, "mount styel");
        assertThat(record.isResolved()).isTrue();
        assertThat(record.getOccurrenceCount()).isEqualTo(2);
    }

    private MismatchRecord stored(PicklistType type, String normalizedValue) {
        List<MismatchRecord> records = repository.findByMatchTypeAndNormalizedValueAndSource(type, normalizedValue, SOURCE);
        assertThat(records).hasSize(1);
        return records.get(0);
    }

    private static MismatchInput input(String value, double similarity, ProductContext product, Map<String, Object> aiContext) {
        return new MismatchInput(PicklistType.ATTRIBUTE, value, SOURCE, "material", similarity, 0.6,
                List.of(), product, aiContext, null, OffsetDateTime.now());
    }
}
