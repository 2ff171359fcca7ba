package com.lending.scope.analysis;

import com.lending.scope.aggregation.AggregationRequest;
import com.lending.scope.aggregation.AggregationResult;
import com.lending.scope.aggregation.BackendChunkException;
import com.lending.scope.aggregation.BatchedAggregationEngine;
import com.lending.scope.aggregation.ChunkFailure;
import com.lending.scope.aggregation.Dimension;
import com.lending.scope.backend.AvailabilityCounts;
import com.lending.scope.domain.ComparisonGroup;
import com.lending.scope.domain.InvalidAnalysisRequestException;
import com.lending.scope.domain.ResolvedScope;
import com.lending.scope.domain.ScopeSpecification;
import com.lending.scope.domain.ScopeStrategy;
import com.lending.scope.domain.SelectionWindow;
import com.lending.scope.filter.FilterSpecificationTranslator;
import com.lending.scope.geography.GeographyResolver;
import com.lending.scope.geography.NoActivityException;
import com.lending.scope.peer.PeerCohortSelector;
import com.lending.scope.query.AggregateRow;
import com.lending.scope.query.GroupKey;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LenderAnalysisService: step ordering, subject lookup, validation.
 */
@ExtendWith(MockitoExtension.class)
class LenderAnalysisServiceTest {

    @Mock
    private GeographyResolver geographyResolver;
    @Mock
    private BatchedAggregationEngine engine;

    private LenderAnalysisService service;

    @BeforeEach
    void setUp() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        PeerCohortSelector selector = new PeerCohortSelector();
        ReflectionTestUtils.setField(selector, "primaryLower", new BigDecimal("0.5"));
        ReflectionTestUtils.setField(selector, "primaryUpper", new BigDecimal("2.0"));
        ReflectionTestUtils.setField(selector, "expandedLower", new BigDecimal("0.25"));
        ReflectionTestUtils.setField(selector, "expandedUpper", new BigDecimal("4.0"));
        ReflectionTestUtils.setField(selector, "topK", 20);
        service = new LenderAnalysisService(validator, new FilterSpecificationTranslator(), geographyResolver,
                engine, selector, new AnalysisAuditLogger());
        ReflectionTestUtils.setField(service, "maxYears", 5);
    }

    private static AnalysisRequest request(String lenderId) {
        return AnalysisRequest.builder()
                .lenderId(lenderId)
                .scope(ScopeSpecification.of(ScopeStrategy.ALL_ACTIVE))
                .year(2022)
                .build();
    }

    private static AggregateRow lenderRow(String lender, String category, long amount) {
        Map<GroupKey, Object> keys = new HashMap<>();
        keys.put(GroupKey.LENDER_ID, lender);
        keys.put(GroupKey.LENDER_CATEGORY, category);
        return new AggregateRow(keys, BigDecimal.valueOf(amount), 1);
    }

    private void givenScope() {
        when(geographyResolver.resolveScope(eq("LENDERA"), any(), any(), any())).thenReturn(ResolvedScope.builder()
                .strategy(ScopeStrategy.ALL_ACTIVE)
                .geoCode("01001")
                .geoCode("01003")
                .build());
    }

    @Test
    void analyzeRunsVolumePassThenDetailPassForSubjectAndPeers() {
        givenScope();
        AggregationResult volume = AggregationResult.builder()
                .row(lenderRow("LENDERA", "Bank", 1_000_000))
                .row(lenderRow("PEER1", "Bank", 900_000))
                .row(lenderRow("SMALL", "Bank", 1_000))
                .build();
        AggregationResult detail = AggregationResult.builder()
                .row(new AggregateRow(Map.of(GroupKey.LENDER_ID, "LENDERA", GroupKey.GEO_CODE, "01001", GroupKey.YEAR, 2022),
                        BigDecimal.TEN, 1))
                .partial(true)
                .failure(new ChunkFailure(0, 2, 2, "timeout"))
                .build();
        when(engine.aggregate(any())).thenReturn(volume, detail);

        LenderAnalysis analysis = service.analyze(request("LENDERA"));

        ArgumentCaptor<AggregationRequest> captor = ArgumentCaptor.forClass(AggregationRequest.class);
        verify(engine, times(2)).aggregate(captor.capture());
        AggregationRequest volumePass = captor.getAllValues().get(0);
        AggregationRequest detailPass = captor.getAllValues().get(1);
        assertThat(volumePass.getDimension()).isEqualTo(Dimension.GEO_CODE);
        assertThat(volumePass.getIds()).containsExactly("01001", "01003");
        assertThat(volumePass.getGroupKeys()).containsExactly(GroupKey.LENDER_ID, GroupKey.LENDER_CATEGORY);
        assertThat(detailPass.getRestrictionIds()).containsExactly("LENDERA", "PEER1");
        assertThat(detailPass.getGroupKeys()).containsExactly(GroupKey.LENDER_ID, GroupKey.GEO_CODE, GroupKey.YEAR);

        assertThat(analysis.getCohort().getPeerIds()).containsExactly("PEER1");
        assertThat(analysis.getCohort().getWindowUsed()).isEqualTo(SelectionWindow.PRIMARY);
        assertThat(analysis.getDetailRows()).hasSize(1);
        assertThat(analysis.isPartial()).isTrue();
        assertThat(analysis.getFailures()).hasSize(1);
    }

    @Test
    void subjectIsMatchedCaseInsensitivelyUsingPoolSpelling() {
        when(geographyResolver.resolveScope(eq("lendera"), any(), any(), any())).thenReturn(ResolvedScope.builder()
                .strategy(ScopeStrategy.ALL_ACTIVE)
                .geoCode("01001")
                .build());
        when(engine.aggregate(any())).thenReturn(
                AggregationResult.builder().row(lenderRow("LENDERA", "Bank", 1_000)).build(),
                AggregationResult.empty());

        LenderAnalysis analysis = service.analyze(request("lendera"));

        assertThat(analysis.getLenderId()).isEqualTo("LENDERA");
        assertThat(analysis.getCohort().getWindowUsed()).isEqualTo(SelectionWindow.NONE);
        assertThat(analysis.isPartial()).isFalse();
    }

    @Test
    void subjectMissingFromScopeRaisesNoActivity() {
        givenScope();
        when(engine.aggregate(any())).thenReturn(AggregationResult.builder().row(lenderRow("OTHER", "Bank", 10)).build());

        assertThatThrownBy(() -> service.analyze(request("LENDERA")))
                .isInstanceOf(NoActivityException.class)
                .hasMessageContaining("LENDERA");
    }

    @Test
    void volumePassWithEveryChunkFailedIsABackendFailure() {
        givenScope();
        when(engine.aggregate(any())).thenReturn(AggregationResult.builder()
                .partial(true)
                .chunkCount(1)
                .failure(new ChunkFailure(0, 2, 0, "connection refused"))
                .build());

        assertThatThrownBy(() -> service.analyze(request("LENDERA")))
                .isInstanceOf(BackendChunkException.class)
                .hasMessageContaining("connection refused");
        verify(engine, times(1)).aggregate(any());
    }

    @Test
    void invalidRequestIsRejectedBeforeAnyBackendWork() {
        assertThatThrownBy(() -> service.analyze(request(" ")))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("lenderId");
        assertThatThrownBy(() -> service.analyze(request("LENDERA").toBuilder().clearYears().year(1990).build()))
                .isInstanceOf(InvalidAnalysisRequestException.class);
        assertThatThrownBy(() -> service.analyze(request("LENDERA").toBuilder().scope(null).build()))
                .isInstanceOf(InvalidAnalysisRequestException.class)
                .hasMessageContaining("scope");
        verifyNoInteractions(geographyResolver, engine);
    }

    @Test
    void dataCheckCountsLenderRecords() {
        when(engine.countAvailability(any())).thenReturn(new AvailabilityCounts(12, 3));

        DataAvailability availability = service.checkLenderHasData(request("LENDERA").toBuilder()
                .comparisonGroup(ComparisonGroup.BANKS)
                .build());

        ArgumentCaptor<AggregationRequest> captor = ArgumentCaptor.forClass(AggregationRequest.class);
        verify(engine).countAvailability(captor.capture());
        assertThat(captor.getValue().getDimension()).isEqualTo(Dimension.LENDER_ID);
        assertThat(captor.getValue().getIds()).containsExactly("LENDERA");
        assertThat(availability.isHasData()).isTrue();
        assertThat(availability.getRecordCount()).isEqualTo(12);
        assertThat(availability.getGeographyCount()).isEqualTo(3);
        assertThat(availability.getYearLabel()).isEqualTo("2022");
        verifyNoInteractions(geographyResolver);
    }
}
