package com.invitehunter.hunt.api;

import com.invitehunter.hunt.model.ActivityLogEntry;
import com.invitehunter.hunt.model.Candidate;
import com.invitehunter.hunt.model.CodesResponse;
import com.invitehunter.hunt.model.PollerStatusResponse;
import com.invitehunter.hunt.model.SourceHealth;
import com.invitehunter.hunt.service.HuntStatusService;
import com.invitehunter.hunt.service.PollDaemonService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class HuntController {
    private final HuntStatusService statusService;
    private final PollDaemonService daemonService;

    public HuntController(HuntStatusService statusService, PollDaemonService daemonService) {
        this.statusService = statusService;
        this.daemonService = daemonService;
    }

    @GetMapping("/codes.json")
    public CodesResponse codes() {
        return statusService.getCodes();
    }

    @GetMapping("/api/candidates")
    public List<Candidate> candidates(
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "minConfidence", required = false) Double minConfidence
    ) {
        return statusService.getNewestCandidates(limit, minConfidence);
    }

    @GetMapping("/api/activity")
    public List<ActivityLogEntry> activity(@RequestParam(name = "limit", required = false) Integer limit) {
        return statusService.getRecentActivity(limit);
    }

    @GetMapping("/api/sources")
    public List<SourceHealth> sources() {
        return statusService.getSources();
    }

    @GetMapping("/api/poller/status")
    public PollerStatusResponse pollerStatus() {
        return daemonService.getStatus();
    }
}
