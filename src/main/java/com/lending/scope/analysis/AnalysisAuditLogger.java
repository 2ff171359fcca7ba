package com.lending.scope.analysis;

import com.lending.scope.domain.PeerCohort;
import com.lending.scope.domain.ResolvedScope;
import com.lending.scope.domain.YearRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of each analysis step, one {@code [AUDIT]} line per step.
 */
@Slf4j
@Component
public class AnalysisAuditLogger {

    public void logRequest(AnalysisRequest request, YearRange years) {
        log.info("[AUDIT] ANALYSIS_REQUEST lenderId={} strategy={} years={} comparisonGroup={}",
                request.getLenderId(),
                request.getScope().getStrategy(),
                years.label(),
                request.getComparisonGroup());
    }

    public void logScope(String lenderId, ResolvedScope scope) {
        log.info("[AUDIT] SCOPE_RESOLVED lenderId={} strategy={} geoCodes={} retainedMetros={} partial={}",
                lenderId,
                scope.getStrategy(),
                scope.size(),
                scope.getRetainedMetros().size(),
                scope.isPartial());
    }

    public void logCohort(PeerCohort cohort) {
        log.info("[AUDIT] PEERS_SELECTED lenderId={} method={} window={} peers={}",
                cohort.getSubject().getLenderId(),
                cohort.getSelectionMethod(),
                cohort.getWindowUsed().label(),
                cohort.getPeerIds());
    }

    public void logResult(LenderAnalysis analysis) {
        log.info("[AUDIT] ANALYSIS_RESULT lenderId={} detailRows={} partial={} failedChunks={}",
                analysis.getLenderId(),
                analysis.getDetailRows().size(),
                analysis.isPartial(),
                analysis.getFailures().size());
    }

    public void logFailure(String lenderId, RuntimeException e) {
        log.info("[AUDIT] ANALYSIS_FAILED lenderId={} reason={} message={}",
                lenderId,
                e.getClass().getSimpleName(),
                e.getMessage());
    }
}
