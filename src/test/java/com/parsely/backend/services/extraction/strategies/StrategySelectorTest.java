package com.parsely.backend.services.extraction.strategies;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.parsely.backend.enums.FieldName;
import com.parsely.backend.enums.StrategyId;
import com.parsely.backend.services.extraction.DocumentText;
import com.parsely.backend.services.extraction.FieldMap;
import com.parsely.backend.services.extraction.quality.ConfidenceScorer;
import com.parsely.backend.services.extraction.quality.ConfidenceWeights;

class StrategySelectorTest {

    private static final DocumentText DOC = DocumentText.of(List.of("anything"));

    private final ConfidenceScorer scorer = new ConfidenceScorer(ConfidenceWeights.defaults());
    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private static FieldMap partial() {
        return FieldMap.builder()
                .set(FieldName.SENDER, "Acme Corp")
                .set(FieldName.AMOUNT, "10.00")
                .build();
    }

    private static FieldMap complete() {
        return FieldMap.builder()
                .set(FieldName.SENDER, "Acme Corp")
                .set(FieldName.RECIPIENT, "Globex Ltd")
                .set(FieldName.AMOUNT, "10.00")
                .set(FieldName.CURRENCY, "EUR")
                .set(FieldName.IBAN, "DE89370400440532013000")
                .set(FieldName.BIC, "DEUTDEFF")
                .set(FieldName.SENDER_EMAIL, "billing@acme.com")
                .set(FieldName.RECIPIENT_EMAIL, "jane@globex.com")
                .set(FieldName.SENDER_ADDRESS, "Hauptstraße 5, 10115 Berlin")
                .build();
    }

    @Test
    void highestConfidence_wins() {
        StrategySelector selector = new StrategySelector(scorer);
        List<ExtractionStrategy> order = List.of(
                new FixedStrategy(StrategyId.TWO_COLUMN, true, partial()),
                new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, complete()));

        StrategySelector.Selection selection = selector.select(order, DOC);

        assertEquals(StrategyId.PATTERN_FALLBACK, selection.source());
        assertEquals(complete(), selection.fields());
    }

    @Test
    void equalConfidence_goesToCanonicalPriorityWhateverTheOrder() {
        StrategySelector selector = new StrategySelector(scorer);
        ExtractionStrategy fallback = new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, partial());
        ExtractionStrategy single = new FixedStrategy(StrategyId.SINGLE_COLUMN_LABEL, true, partial());

        assertEquals(StrategyId.SINGLE_COLUMN_LABEL, selector.select(List.of(fallback, single), DOC).source());
        assertEquals(StrategyId.SINGLE_COLUMN_LABEL, selector.select(List.of(single, fallback), DOC).source());
    }

    @Test
    void everyPermutation_selectsTheSameStrategy() {
        StrategySelector selector = new StrategySelector(scorer);
        List<ExtractionStrategy> strategies = List.of(
                new FixedStrategy(StrategyId.TWO_COLUMN, false, complete()),
                new FixedStrategy(StrategyId.SINGLE_COLUMN_LABEL, true, partial()),
                new FixedStrategy(StrategyId.COMPANY_SPECIFIC, true, partial()),
                new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, FieldMap.builder().set(FieldName.SENDER, "Acme Corp").build()));

        for (List<ExtractionStrategy> order : permutations(strategies)) {
            assertEquals(StrategyId.SINGLE_COLUMN_LABEL, selector.select(order, DOC).source(), "order " + order);
        }
    }

    @Test
    void parallelEvaluation_matchesSequential() {
        StrategySelector selector = new StrategySelector(scorer, pool);
        List<ExtractionStrategy> order = List.of(
                new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, partial()),
                new FixedStrategy(StrategyId.COMPANY_SPECIFIC, true, partial()),
                new FixedStrategy(StrategyId.TWO_COLUMN, true, FieldMap.unresolved()),
                new FixedStrategy(StrategyId.SINGLE_COLUMN_LABEL, false, complete()));

        StrategySelector.Selection sequential = selector.select(order, DOC, false);
        for (int i = 0; i < 20; i++) {
            StrategySelector.Selection parallel = selector.select(order, DOC, true);
            assertEquals(sequential.source(), parallel.source());
            assertEquals(sequential.fields(), parallel.fields());
            assertEquals(sequential.confidence(), parallel.confidence());
        }
        assertEquals(StrategyId.COMPANY_SPECIFIC, sequential.source());
    }

    @Test
    void failingStrategy_isTreatedAsNotApplicable() {
        StrategySelector selector = new StrategySelector(scorer);
        ExtractionStrategy broken = new FixedStrategy(StrategyId.TWO_COLUMN, true, null);

        StrategySelector.Selection selection = selector.select(
                List.of(broken, new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, partial())), DOC);

        assertEquals(StrategyId.PATTERN_FALLBACK, selection.source());
    }

    @Test
    void nothingApplicableOrAllZero_yieldsNone() {
        StrategySelector selector = new StrategySelector(scorer);

        StrategySelector.Selection none = selector.select(
                List.of(new FixedStrategy(StrategyId.TWO_COLUMN, false, complete())), DOC);
        assertNull(none.chosen());
        assertEquals(StrategyId.NONE, none.source());
        assertSame(FieldMap.unresolved(), none.fields());
        assertEquals(0.0, none.confidence());

        StrategySelector.Selection zero = selector.select(
                List.of(new FixedStrategy(StrategyId.TWO_COLUMN, true, FieldMap.unresolved())), DOC);
        assertEquals(StrategyId.NONE, zero.source());
    }

    @Test
    void zeroScoringMapWithResolvedFields_isStillChosen() {
        StrategySelector selector = new StrategySelector(scorer);
        FieldMap achOnly = FieldMap.builder().set(FieldName.PAYMENT_METHOD, "ACH").build();

        StrategySelector.Selection selection = selector.select(List.of(
                new FixedStrategy(StrategyId.SINGLE_COLUMN_LABEL, true, FieldMap.unresolved()),
                new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, achOnly)), DOC);

        assertEquals(StrategyId.PATTERN_FALLBACK, selection.source());
        assertEquals("ACH", selection.fields().get(FieldName.PAYMENT_METHOD).get());
        assertEquals(0.0, selection.confidence());
    }

    @Test
    void maximumConfidence_stopsEarlyOnlyWhenNothingLaterOutranksIt() {
        StrategySelector selector = new StrategySelector(scorer);
        FixedStrategy two = new FixedStrategy(StrategyId.TWO_COLUMN, true, complete());
        FixedStrategy fallback = new FixedStrategy(StrategyId.PATTERN_FALLBACK, true, complete());

        StrategySelector.Selection early = selector.select(List.of(two, fallback), DOC);
        assertEquals(1, early.evaluated().size());
        assertEquals(0, fallback.calls.get());

        StrategySelector.Selection full = selector.select(List.of(fallback, two), DOC);
        assertEquals(2, full.evaluated().size());
        assertEquals(StrategyId.TWO_COLUMN, full.source());
    }

    @Test
    void emptyOrder_isRejected() {
        StrategySelector selector = new StrategySelector(scorer);
        assertThrows(IllegalArgumentException.class, () -> selector.select(List.of(), DOC));
    }

    @Test
    void tieBreak_usesPriorityWithinEpsilon() {
        FixedStrategy two = new FixedStrategy(StrategyId.TWO_COLUMN, true, partial());
        FixedStrategy company = new FixedStrategy(StrategyId.COMPANY_SPECIFIC, true, partial());
        StrategySelector.Candidate a = new StrategySelector.Candidate(two, true, partial(), 0.5);
        StrategySelector.Candidate b = new StrategySelector.Candidate(company, true, partial(), 0.5 + 1e-12);

        assertTrue(StrategySelector.isBetter(a, b));
        assertTrue(StrategySelector.isBetter(b, null));
    }

    private static List<List<ExtractionStrategy>> permutations(List<ExtractionStrategy> items) {
        List<List<ExtractionStrategy>> out = new ArrayList<>();
        permute(new ArrayList<>(items), 0, out);
        return out;
    }

    private static void permute(List<ExtractionStrategy> items, int k, List<List<ExtractionStrategy>> out) {
        if (k == items.size()) {
            out.add(List.copyOf(items));
            return;
        }
        for (int i = k; i < items.size(); i++) {
            Collections.swap(items, k, i);
            permute(items, k + 1, out);
            Collections.swap(items, k, i);
        }
    }

    /** Returns a fixed map; a {@code null} map makes {@code parse} throw. */
    private static final class FixedStrategy implements ExtractionStrategy {
        private final StrategyId id;
        private final boolean applicable;
        private final FieldMap fields;
        private final AtomicInteger calls = new AtomicInteger();

        FixedStrategy(StrategyId id, boolean applicable, FieldMap fields) {
            this.id = id;
            this.applicable = applicable;
            this.fields = fields;
        }

        @Override
        public StrategyId id() {
            return id;
        }

        @Override
        public boolean canHandle(DocumentText document) {
            calls.incrementAndGet();
            return applicable;
        }

        @Override
        public FieldMap parse(DocumentText document) {
            if (fields == null) {
                throw new IllegalStateException("parse failure");
            }
            return fields;
        }

        @Override
        public String toString() {
            return id.name();
        }
    }
}
