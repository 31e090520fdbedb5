package com.branchsync.ingest.web;

import com.branchsync.ingest.model.AttendanceType;
import com.branchsync.ingest.model.CommitFailure;
import com.branchsync.ingest.model.SyncCursor;
import com.branchsync.ingest.model.SyncResult;
import com.branchsync.ingest.model.UnresolvedIdentity;
import com.branchsync.ingest.service.BranchContext;
import com.branchsync.ingest.service.BranchLogMapper;
import com.branchsync.ingest.service.BranchRegistry;
import com.branchsync.ingest.service.SyncCursorStore;
import com.branchsync.ingest.service.SyncOrchestrator;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
@RequestMapping("/api/attendance")
public class AttendanceSyncController {
    private static final Logger log = LoggerFactory.getLogger(AttendanceSyncController.class);

    private final SyncOrchestrator orchestrator;
    private final BranchLogMapper logMapper;
    private final BranchRegistry branches;
    private final SyncCursorStore cursorStore;

    public AttendanceSyncController(SyncOrchestrator orchestrator,
                                    BranchLogMapper logMapper,
                                    BranchRegistry branches,
                                    SyncCursorStore cursorStore) {
        this.orchestrator = orchestrator;
        this.logMapper = logMapper;
        this.branches = branches;
        this.cursorStore = cursorStore;
    }

    @PostMapping("/sync-from-branch")
    public ResponseEntity<ApiResponse<BranchSyncResponse>> syncFromBranch(@Valid @RequestBody BranchSyncRequest request) {
        String branchId = request.branchId().trim();
        log.info("Receiving {} attendance log(s) from {} (branch {})", request.logs().size(),
                request.branchName() == null ? "branch" : request.branchName(), branchId);

        BranchLogMapper.MappedLogs mapped = logMapper.map(branchId, branches.zoneFor(branchId), request.logs());
        SyncResult result = orchestrator.ingestPushed(branchId, mapped.events(), AttendanceType.BIOMETRIC);

        List<BranchSyncResponse.SyncError> errors = new ArrayList<>();
        for (BranchLogMapper.Rejected rejected : mapped.rejected()) {
            errors.add(new BranchSyncResponse.SyncError(rejected.enrollNumber(), rejected.admissionNumber(),
                    rejected.timestamp(), rejected.message()));
        }
        for (UnresolvedIdentity unresolved : result.unresolvedIdentities()) {
            errors.add(new BranchSyncResponse.SyncError(unresolved.enrollNumber(), unresolved.admissionNumber(),
                    unresolved.timestamp(), unresolved.message()));
        }
        for (CommitFailure failure : result.failures()) {
            errors.add(new BranchSyncResponse.SyncError(null, null, failure.personDay().date(),
                    "Commit failed for user " + failure.personDay().userId() + ": " + failure.error()));
        }

        int errorCount = mapped.rejected().size() + result.unresolved() + result.failed();
        BranchSyncResponse data = new BranchSyncResponse(
                result.batchId(),
                result.committed(),
                errorCount,
                request.logs().size(),
                errors.stream().limit(BranchSyncResponse.MAX_REPORTED_ERRORS).toList(),
                result.newWatermark()
        );
        String message = "Processed " + result.committed() + " attendance records, " + errorCount + " errors";
        return ResponseEntity.ok(ApiResponse.ok(message, data));
    }

    @PostMapping("/sync/{branchId}")
    public ResponseEntity<ApiResponse<SyncResult>> syncBranch(@PathVariable String branchId) {
        SyncResult result = orchestrator.runOnce(branchId);
        return ResponseEntity.ok(ApiResponse.ok("Sync " + result.outcome().name().toLowerCase(Locale.ROOT), result));
    }

    @GetMapping("/branches/{branchId}/connectivity")
    public ResponseEntity<ApiResponse<BranchConnectivity>> connectivity(@PathVariable String branchId) {
        BranchContext branch = branches.verifyConnectivity(branchId);
        BranchConnectivity data = new BranchConnectivity(branch.branchId(), branch.name(), branch.zone().getId());
        return ResponseEntity.ok(ApiResponse.ok("Branch " + branch.branchId() + " log source is reachable", data));
    }

    @GetMapping("/last-sync/{branchId}")
    public ResponseEntity<ApiResponse<LastSyncStatus>> lastSync(@PathVariable String branchId) {
        Optional<SyncCursor> cursor = cursorStore.getCursor(branchId);
        Optional<SyncResult> last = orchestrator.lastResult(branchId);
        LastSyncStatus status = new LastSyncStatus(
                branchId,
                cursor.map(SyncCursor::lastSyncTime).orElse(null),
                cursor.map(SyncCursor::lastSyncBatchId).orElse(null),
                cursor.map(SyncCursor::updatedAt).orElse(null),
                last.map(result -> result.outcome().name()).orElse(null),
                last.map(SyncResult::error).orElse(null)
        );
        String message = cursor.isPresent() ? "Last sync found" : "No sync recorded for this branch";
        return ResponseEntity.ok(ApiResponse.ok(message, status));
    }
}
