package org.nowstart.fundnav.service.sync;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.nowstart.fundnav.data.dto.NavSyncOutcome;
import org.nowstart.fundnav.data.type.SourceMode;
import org.nowstart.fundnav.data.type.SyncErrorKind;
import org.nowstart.fundnav.data.type.SyncPhase;

class SyncRunTest {

    @Test
    void finish_withoutFailuresCompletes() {
        SyncRun run = new SyncRun(SourceMode.BULK, 20);
        run.transitionTo(SyncPhase.FETCHING);
        run.addProcessed(3);

        run.finish();

        NavSyncOutcome outcome = run.toOutcome();
        assertThat(outcome.success()).isTrue();
        assertThat(outcome.phase()).isEqualTo(SyncPhase.COMPLETED);
        assertThat(outcome.recordsProcessed()).isEqualTo(3);
        assertThat(run.getCompletedAt()).isNotNull();
        assertThat(run.isActive()).isFalse();
    }

    @Test
    void finish_withFailuresIsPartial() {
        SyncRun run = new SyncRun(SourceMode.PER_SCHEME, 20);
        run.addProcessed(2);
        run.recordFailure("B", SyncErrorKind.TRANSIENT_FETCH, "timeout");

        run.finish();

        assertThat(run.getPhase()).isEqualTo(SyncPhase.PARTIALLY_FAILED);
        assertThat(run.toOutcome().success()).isFalse();
        assertThat(run.toStatus().failedSchemes()).extracting("schemeCode").containsExactly("B");
    }

    @Test
    void fail_claimsNoProcessedRecords() {
        SyncRun run = new SyncRun(SourceMode.PER_SCHEME, 20);
        run.addProcessed(5);

        run.fail("NAV store unreachable");

        assertThat(run.toOutcome().recordsProcessed()).isZero();
        assertThat(run.toOutcome().error()).isEqualTo("NAV store unreachable");
        assertThat(run.toStatus().processedCount()).isEqualTo(5);
    }

    @Test
    void transitionTo_rejectsMovesOutOfTerminalPhase() {
        SyncRun run = new SyncRun(SourceMode.BULK, 20);
        run.finish();

        assertThatThrownBy(() -> run.transitionTo(SyncPhase.FETCHING))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already finished");
    }
}
