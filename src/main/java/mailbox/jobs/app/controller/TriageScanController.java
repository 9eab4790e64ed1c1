package mailbox.jobs.app.controller;

import mailbox.jobs.app.dto.ScanRequest;
import mailbox.jobs.app.dto.ScanResult;
import mailbox.jobs.app.service.TriageScanService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/triage")
public class TriageScanController {
    private final TriageScanService scanService;

    public TriageScanController(TriageScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping("/prioritize")
    public ScanResult prioritize(@RequestBody(required = false) ScanRequest request) {
        return scanService.prioritize(request != null ? request : new ScanRequest());
    }
}
