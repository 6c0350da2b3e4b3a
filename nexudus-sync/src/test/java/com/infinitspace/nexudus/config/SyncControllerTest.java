package com.infinitspace.nexudus.config;

import com.infinitspace.nexudus.model.SyncLayer;
import com.infinitspace.nexudus.service.NexudusSyncService;
import com.infinitspace.nexudus.service.SyncRunQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SyncControllerTest {

    @Mock
    private NexudusSyncService syncService;

    @Mock
    private SyncRunQueryService runQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SyncController(syncService, runQueryService)).build();
    }

    @Test
    void triggerBronze_Idle_AcceptedAndRunsInBackground() throws Exception {
        when(syncService.isRunning(SyncLayer.BRONZE)).thenReturn(false);

        mockMvc.perform(post("/sync/bronze"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.layer").value("bronze"));

        verify(syncService, timeout(2000)).runBronzeSync(SyncController.TRIGGER_MANUAL);
    }

    @Test
    void triggerSilver_AlreadyRunning_Conflict() throws Exception {
        when(syncService.isRunning(SyncLayer.SILVER)).thenReturn(true);

        mockMvc.perform(post("/sync/silver"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("already running"));

        verify(syncService, never()).runSilverSync(SyncController.TRIGGER_MANUAL);
    }

    @Test
    void status_ReportsRunningFlagsAndOpenRuns() throws Exception {
        when(syncService.isRunning(SyncLayer.BRONZE)).thenReturn(true);
        when(syncService.isRunning(SyncLayer.SILVER)).thenReturn(false);
        when(runQueryService.countRunning()).thenReturn(2);

        mockMvc.perform(get("/sync/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("nexudus-sync"))
                .andExpect(jsonPath("$.bronzeRunning").value(true))
                .andExpect(jsonPath("$.silverRunning").value(false))
                .andExpect(jsonPath("$.openRuns").value(2));
    }

    @Test
    void runs_ReturnsRecentRuns() throws Exception {
        when(runQueryService.recentRuns(10)).thenReturn(List.of(Map.of("entity", "products", "status", "success")));

        mockMvc.perform(get("/sync/runs").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].entity").value("products"));
    }

    @Test
    void runs_LimitOutOfRange_BadRequest() throws Exception {
        when(runQueryService.recentRuns(0)).thenThrow(new IllegalArgumentException("limit must be between 1 and 500"));

        mockMvc.perform(get("/sync/runs").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("limit must be between 1 and 500"));
    }

    @Test
    void errors_StoreDown_InternalServerError() throws Exception {
        when(runQueryService.errorsForRun("run-1")).thenThrow(new DataAccessResourceFailureException("down"));

        mockMvc.perform(get("/sync/runs/run-1/errors"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("down"));
    }
}
