package mta.eda.receipts.controller;

import jakarta.validation.Valid;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.request.EnrichOrderRequest;
import mta.eda.receipts.service.enrichment.OrderEnrichmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OrderController
 * REST API endpoints for order enrichment.
 */
@RestController
@RequestMapping("/receipt-service")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderEnrichmentService orderEnrichmentService;

    public OrderController(OrderEnrichmentService orderEnrichmentService) {
        this.orderEnrichmentService = orderEnrichmentService;
    }

    /**
     * Server metadata endpoint - exposes service info and available endpoints.
     * GET /receipt-service
     */
    @GetMapping({"", "/"})
    public ResponseEntity<Map<String, Object>> root() {
        logger.debug("Root endpoint accessed");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("service", "Receipt Service");
        response.put("version", "0.0.1-SNAPSHOT");
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("enrichOrder", Map.of(
                "method", "POST",
                "path", "/receipt-service/orders/enrich",
                "description", "Fetch vendor order details and return the enriched order",
                "query", Map.of("timeoutMs", "optional request timeout in milliseconds"),
                "responses", Map.of(
                        "200", "Enriched order",
                        "400", "Validation error or order without vendor lookup key",
                        "502", "Vendor returned an error status or an unexpected document",
                        "504", "Vendor unreachable or timed out")));
        endpoints.put("status", Map.of(
                "method", "GET",
                "path", "/receipt-service/status",
                "description", "Current progress counters and recent activity"));
        response.put("endpoints", endpoints);

        return ResponseEntity.ok(response);
    }

    /**
     * Enrich a discovered order.
     * POST /receipt-service/orders/enrich
     */
    @PostMapping("/orders/enrich")
    public ResponseEntity<Order> enrichOrder(@Valid @RequestBody EnrichOrderRequest request,
                                             @RequestParam(name = "timeoutMs", required = false) Long timeoutMs) {
        logger.info("Received enrich request for orderId={}", request.id());

        Order discovered = request.toOrder();
        Order enriched = timeoutMs != null && timeoutMs > 0
                ? orderEnrichmentService.enrich(discovered, Duration.ofMillis(timeoutMs))
                : orderEnrichmentService.enrich(discovered);

        return ResponseEntity.ok(enriched);
    }
}
