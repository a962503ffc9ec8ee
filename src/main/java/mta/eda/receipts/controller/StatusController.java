package mta.eda.receipts.controller;

import mta.eda.receipts.model.status.Status;
import mta.eda.receipts.service.status.StatusSink;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * StatusController
 * Read-only view of delivery progress for external UIs.
 */
@RestController
@RequestMapping("/receipt-service")
public class StatusController {

    private final StatusSink statusSink;

    public StatusController(StatusSink statusSink) {
        this.statusSink = statusSink;
    }

    /**
     * GET /receipt-service/status
     */
    @GetMapping("/status")
    public ResponseEntity<Status> status() {
        return ResponseEntity.ok(statusSink.getStatus());
    }
}
