package com.flagship.roster_ledger.waiver;

import com.flagship.roster_ledger.waiver.dto.ProcessingStatusResponse;
import com.flagship.roster_ledger.waiver.dto.RunSummaryResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Cross-league waiver operations for operators.
 */
@RestController
@RequestMapping("/api/waivers")
@RequiredArgsConstructor
public class WaiverAdminController {

    private final WaiverRunService waiverRunService;

    @PostMapping("/process-all")
    public List<RunSummaryResponse> processAll() {
        return waiverRunService.processAllPending().stream()
                .map(RunSummaryResponse::from)
                .toList();
    }

    @GetMapping("/status")
    public List<ProcessingStatusResponse> getStatus() {
        return waiverRunService.getProcessingStatus().stream()
                .map(ProcessingStatusResponse::from)
                .toList();
    }
}
