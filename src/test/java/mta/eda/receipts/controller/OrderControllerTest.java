package mta.eda.receipts.controller;

import mta.eda.receipts.exception.EnrichmentException;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.order.OrderItem;
import mta.eda.receipts.model.status.Activity;
import mta.eda.receipts.model.status.ProgressUpdate;
import mta.eda.receipts.model.status.StatusEvent;
import mta.eda.receipts.service.enrichment.OrderEnrichmentService;
import mta.eda.receipts.service.status.StatusSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Duration;
import java.util.List;

import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
class OrderControllerTest {

    private static final String VALID_BODY = """
            {
              "id": "POS.542.20250629.4.5137",
              "date": "2025-06-29",
              "kind": "in-store",
              "detailsReference": "https://vendor.test/orders/POS.542.20250629.4.5137",
              "vendorLookupKey": "tp-1"
            }
            """;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private StatusSink statusSink;

    @MockBean
    private OrderEnrichmentService orderEnrichmentService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void testRootMetadata() throws Exception {
        mockMvc.perform(get("/receipt-service"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Receipt Service"))
                .andExpect(jsonPath("$.endpoints.enrichOrder.path").value("/receipt-service/orders/enrich"))
                .andExpect(jsonPath("$.endpoints.status.method").value("GET"));
    }

    @Test
    void testEnrichOrder_Success() throws Exception {
        when(orderEnrichmentService.enrich(any(Order.class))).thenAnswer(inv -> {
            Order discovered = inv.getArgument(0);
            return discovered.toBuilder()
                    .items(List.of(OrderItem.builder().sku("24608319").title("DUNKIN ORIGINAL BL").build()))
                    .enriched(true)
                    .build();
        });

        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("POS.542.20250629.4.5137"))
                .andExpect(jsonPath("$.date").value("2025-06-29"))
                .andExpect(jsonPath("$.kind").value("in-store"))
                .andExpect(jsonPath("$.enriched").value(true))
                .andExpect(jsonPath("$.items[0].sku").value("24608319"));

        verify(orderEnrichmentService, times(1)).enrich(any(Order.class));
    }

    @Test
    void testEnrichOrder_TimeoutParameter() throws Exception {
        when(orderEnrichmentService.enrich(any(Order.class), eq(Duration.ofMillis(2000))))
                .thenAnswer(inv -> ((Order) inv.getArgument(0)).toBuilder().enriched(true).build());

        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .param("timeoutMs", "2000")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isOk());

        verify(orderEnrichmentService).enrich(any(Order.class), eq(Duration.ofMillis(2000)));
        verify(orderEnrichmentService, never()).enrich(any(Order.class));
    }

    @Test
    void testEnrichOrder_ValidationError() throws Exception {
        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"\",\"date\":\"29-06-2025\",\"kind\":\"in-store\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation error"))
                .andExpect(jsonPath("$.errors.id").exists())
                .andExpect(jsonPath("$.errors.date").exists());

        verifyNoInteractions(orderEnrichmentService);
    }

    @Test
    void testEnrichOrder_MalformedJson() throws Exception {
        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request body"));
    }

    @Test
    void testEnrichOrder_MissingLookupKey() throws Exception {
        when(orderEnrichmentService.enrich(any(Order.class)))
                .thenThrow(EnrichmentException.missingKey("POS.542.20250629.4.5137"));

        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("MISSING_KEY"))
                .andExpect(jsonPath("$.orderId").value("POS.542.20250629.4.5137"));
    }

    @Test
    void testEnrichOrder_UpstreamError() throws Exception {
        when(orderEnrichmentService.enrich(any(Order.class)))
                .thenThrow(EnrichmentException.upstreamStatus("POS.542.20250629.4.5137", 503));

        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.reason").value("UPSTREAM_STATUS"))
                .andExpect(jsonPath("$.upstreamStatus").value(503));
    }

    @Test
    void testEnrichOrder_TransportFailure() throws Exception {
        when(orderEnrichmentService.enrich(any(Order.class)))
                .thenThrow(EnrichmentException.transportFailure("POS.542.20250629.4.5137", "timed out after 15000ms", null));

        mockMvc.perform(post("/receipt-service/orders/enrich")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VALID_BODY))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.reason").value("TRANSPORT_FAILURE"));
    }

    @Test
    void testStatus() throws Exception {
        statusSink.update(StatusEvent.progress(ProgressUpdate.counters(4, 1, 0)));
        statusSink.update(StatusEvent.activity(Activity.success("Downloaded order 42")));

        mockMvc.perform(get("/receipt-service/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.progress.scheduled").value(4))
                .andExpect(jsonPath("$.progress.completed").value(1))
                .andExpect(jsonPath("$.activities[*].message", hasItem("Downloaded order 42")))
                .andExpect(jsonPath("$.activities[-1].type").value("success"));
    }
}
