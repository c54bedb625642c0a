package com.al.shopsync.service;

import com.al.shopsync.dto.SyncAggregate;
import com.al.shopsync.model.SyncResult;
import com.al.shopsync.model.SyncRunRecord;
import com.al.shopsync.model.enums.EntityType;
import com.al.shopsync.model.enums.SyncJobState;
import com.al.shopsync.model.enums.SyncMode;
import com.al.shopsync.repository.SyncRunRepository;
import com.al.shopsync.service.sync.SyncJob;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AuditServiceTest {

    @Mock
    private SyncRunRepository syncRunRepository;

    @InjectMocks
    private AuditService auditService;

    private SyncJob finishedJob() {
        SyncJob job = mock(SyncJob.class);
        LocalDateTime started = LocalDateTime.of(2024, 5, 1, 10, 0, 0);
        when(job.getJobId()).thenReturn("job-1");
        when(job.getEntityType()).thenReturn(EntityType.CUSTOMERS);
        when(job.getMode()).thenReturn(SyncMode.UPSERT);
        when(job.getState()).thenReturn(SyncJobState.COMPLETED);
        when(job.isSelected()).thenReturn(false);
        when(job.getStartedAt()).thenReturn(started);
        when(job.getFinishedAt()).thenReturn(started.plusSeconds(2));
        when(job.getTotalCount()).thenReturn(2);
        when(job.getAggregate()).thenReturn(SyncAggregate.of(List.of(
                SyncResult.created("1", 10L), SyncResult.failed("2", "Missing or empty required target fields: email"))));
        return job;
    }

    @Test
    public void testLogRun_SavesSummary() {
        auditService.logRun(finishedJob());

        ArgumentCaptor<SyncRunRecord> captor = ArgumentCaptor.forClass(SyncRunRecord.class);
        verify(syncRunRepository).save(captor.capture());
        SyncRunRecord record = captor.getValue();
        assertEquals("job-1", record.getJobId());
        assertEquals("customers", record.getEntityType());
        assertEquals("upsert", record.getMode());
        assertEquals("COMPLETED", record.getState());
        assertEquals(2000L, record.getDurationMs());
        assertEquals(1, record.getSuccessful());
        assertEquals(1, record.getFailed());
    }

    @Test
    public void testLogRun_RepositoryFailureSwallowed() {
        when(syncRunRepository.save(any(SyncRunRecord.class))).thenThrow(new RuntimeException("Mongo down"));

        assertDoesNotThrow(() -> auditService.logRun(finishedJob()));
    }

    @Test
    public void testRecentRuns_FilteredOrAll() {
        when(syncRunRepository.findByEntityTypeOrderByStartedAtDesc(eq("articles"), any(Pageable.class)))
                .thenReturn(List.of(new SyncRunRecord()));
        when(syncRunRepository.findAllByOrderByStartedAtDesc(any(Pageable.class))).thenReturn(List.of());

        assertEquals(1, auditService.recentRuns("articles").size());
        assertTrue(auditService.recentRuns(null).isEmpty());
    }
}
