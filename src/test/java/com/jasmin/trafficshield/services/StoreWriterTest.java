package com.jasmin.trafficshield.services;

import com.jasmin.trafficshield.exceptions.PersistenceException;
import com.jasmin.trafficshield.models.AnomalyRecord;
import com.jasmin.trafficshield.models.BlockRecord;
import com.jasmin.trafficshield.models.Severity;
import com.jasmin.trafficshield.models.WindowMetrics;
import com.jasmin.trafficshield.store.BlockStore;
import com.jasmin.trafficshield.store.MetricsStore;
import com.jasmin.trafficshield.store.StoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import static com.jasmin.trafficshield.support.TestFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("StoreWriter")
class StoreWriterTest {

    @Mock
    private BlockStore blockStore;
    @Mock
    private MetricsStore metricsStore;

    private StoreProperties props;
    private StoreWriter writer;

    @BeforeEach
    void setUp() {
        props = new StoreProperties();
        writer = new StoreWriter(blockStore, metricsStore, new SyncTaskExecutor(), props);
    }

    private static BlockRecord block(String sourceId) {
        return BlockRecord.builder()
                .sourceId(sourceId)
                .severity(Severity.MEDIUM)
                .blockedAt(T0)
                .expiresAt(T0.plusSeconds(3600))
                .reason("test")
                .build();
    }

    @Test
    @DisplayName("Should pass writes through to the stores")
    void shouldWriteThrough() {
        writer.upsertBlock(block("10.0.0.1"));
        writer.appendMetrics(WindowMetrics.empty(T0));
        writer.appendAnomaly(AnomalyRecord.builder().timestamp(T0).anomalyScore(0.5).build());
        writer.deleteBlock("10.0.0.1");

        verify(blockStore).upsert(any(BlockRecord.class));
        verify(metricsStore).append(any(WindowMetrics.class));
        verify(metricsStore).append(any(AnomalyRecord.class));
        verify(blockStore).delete("10.0.0.1");
        assertThat(writer.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Should hand the store a copy of the block record")
    void shouldCopyBlockRecord() {
        BlockRecord record = block("10.0.0.1");
        writer.upsertBlock(record);
        record.setSeverity(Severity.SEVERE);

        ArgumentCaptor<BlockRecord> captor = ArgumentCaptor.forClass(BlockRecord.class);
        verify(blockStore).upsert(captor.capture());
        assertThat(captor.getValue().getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should retry a failed write before the next one")
    void shouldRetryFailedWrite() {
        doThrow(new PersistenceException("down", new RuntimeException()))
                .doNothing()
                .when(blockStore).upsert(any());

        writer.upsertBlock(block("10.0.0.1"));
        assertThat(writer.pendingCount()).isEqualTo(1);

        writer.deleteBlock("10.0.0.2");

        InOrder order = inOrder(blockStore);
        order.verify(blockStore, times(2)).upsert(any());
        order.verify(blockStore).delete("10.0.0.2");
        assertThat(writer.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Should drop the oldest pending write when the retry queue is full")
    void shouldBoundRetryQueue() {
        props.setRetryCapacity(2);
        writer = new StoreWriter(blockStore, metricsStore, new SyncTaskExecutor(), props);
        doThrow(new PersistenceException("down", new RuntimeException())).when(blockStore).delete(any());

        writer.deleteBlock("10.0.0.1");
        writer.deleteBlock("10.0.0.2");
        writer.deleteBlock("10.0.0.3");
        assertThat(writer.pendingCount()).isEqualTo(2);

        doNothing().when(blockStore).delete(any());
        writer.appendMetrics(WindowMetrics.empty(T0));

        verify(blockStore, times(3)).delete("10.0.0.2");
        verify(blockStore, times(2)).delete("10.0.0.3");
        verify(blockStore, times(3)).delete("10.0.0.1");
        assertThat(writer.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Should queue writes the executor rejects")
    void shouldQueueRejectedWrites() {
        writer = new StoreWriter(blockStore, metricsStore, task -> {
            throw new TaskRejectedException("saturated");
        }, props);

        writer.upsertBlock(block("10.0.0.1"));

        assertThat(writer.pendingCount()).isEqualTo(1);
        verifyNoInteractions(blockStore);
    }
}
