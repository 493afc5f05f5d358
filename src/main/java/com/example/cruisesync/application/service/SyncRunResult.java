package com.example.cruisesync.application.service;

import com.example.cruisesync.domain.enumtype.SyncErrorCode;
import com.example.cruisesync.domain.enumtype.TaskStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class SyncRunResult {

    private int discovered;

    private int processed;

    private int inserted;

    private int updated;

    private int failed;

    private int skipped;

    private int priceChanged;

    /** References left for a later run because another run held their line lock. */
    private int lineBusySkipped;

    private int batches;

    private boolean cancelled;

    /** Set when the run stopped early because of a run-level error. */
    private SyncErrorCode abortCode;

    private String abortMessage;

    /** True when the reference stream was consumed to the end. */
    private boolean exhausted;

    private Map<SyncErrorCode, Integer> failuresByCode;

    /** Sailings whose files were listed but skipped as known permanent failures. */
    private List<String> retainedSailingIds = new ArrayList<>();

    public TaskStatus finalStatus() {
        if (cancelled) {
            return TaskStatus.CANCELED;
        }
        if (abortCode != null) {
            return TaskStatus.FAILED;
        }
        return failed > 0 || lineBusySkipped > 0 ? TaskStatus.PARTIAL_SUCCESS : TaskStatus.SUCCESS;
    }

    public String errorSummary() {
        StringBuilder sb = new StringBuilder();
        if (abortCode != null) {
            sb.append("aborted ").append(abortCode).append(": ").append(abortMessage);
        }
        if (failuresByCode != null && !failuresByCode.isEmpty()) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("failures ").append(failuresByCode);
        }
        if (lineBusySkipped > 0) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append("line busy skipped ").append(lineBusySkipped);
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
