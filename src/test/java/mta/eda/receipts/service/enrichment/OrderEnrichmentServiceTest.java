package mta.eda.receipts.service.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import mta.eda.receipts.exception.EnrichmentException;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.order.OrderItem;
import mta.eda.receipts.model.order.OrderKind;
import mta.eda.receipts.model.order.ReturnOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderEnrichmentServiceTest {

    private static final String BASE_URL = "https://vendor.test/orderdetails";
    private static final String ORDER_ID = "POS.542.20250629.4.5137";

    @Mock
    private OrderDetailsFetcher fetcher;

    private OrderEnrichmentService enrichmentService;

    @BeforeEach
    void setUp() {
        enrichmentService = new OrderEnrichmentService(fetcher, new ObjectMapper(),
                BASE_URL, "RetailUS", "in-store_instore", 15000);
    }

    @Test
    void enrich_InStoreOrder_ShouldFlattenItemsAcrossShipments() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-instore.json")));

        Order enriched = enrichmentService.enrich(discovered("tp-sid-1"));

        assertTrue(enriched.enriched());
        assertEquals(3, enriched.items().size(), "2 lines in the first shipment + 1 in the second");

        OrderItem first = enriched.items().get(0);
        assertEquals("24608319", first.sku());
        assertEquals("DUNKIN ORIGINAL BL", first.title());
        assertEquals(36.99, first.unitPrice());
        assertEquals(1, first.quantityOrdered());
        assertEquals(29.99, first.lineTotal());
        assertEquals(7.0, first.couponTotal());
        assertEquals(1, first.couponBreakdown().size());
        assertEquals("Instant Savings #46423", first.couponBreakdown().get(0).name());
        assertEquals(725, first.statusCode());

        OrderItem second = enriched.items().get(1);
        assertEquals("COPY PAPER 8.5X11", second.title(), "Falls back to skuDescription without a title");
        assertEquals("", second.imageRef());
        assertEquals(0.0, second.taxTotal());
        assertTrue(second.couponBreakdown().isEmpty());

        OrderItem third = enriched.items().get(2);
        assertEquals(0, third.quantityFulfilled());
        assertEquals("Backordered", third.statusText());
    }

    @Test
    void enrich_ReturnWithTwoShipments_ShouldProduceOneReturnPerShipment() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-instore.json")));

        Order enriched = enrichmentService.enrich(discovered("tp-sid-1"));

        assertEquals(2, enriched.returns().size());

        ReturnOrder first = enriched.returns().get(0);
        assertEquals("POS.522.20250629.1.18628", first.returnId());
        assertEquals(ORDER_ID, first.parentOrderId());
        assertEquals("CSR_CONTACT", first.dispositionType());
        assertEquals(1400, first.statusCode());
        assertEquals(59.98, first.refundTotal());
        assertEquals(2, first.items().size());
        assertEquals("return-url-key", first.vendorLookupKey());

        ReturnOrder second = enriched.returns().get(1);
        assertEquals(ReturnOrder.UNKNOWN_DISPOSITION, second.dispositionType());
        assertEquals(1300, second.statusCode());
        assertEquals(5.5, second.shippingRefund());
        assertTrue(second.items().isEmpty());
    }

    @Test
    void enrich_InStoreOrder_ShouldPopulateFinancialsStoreAndAccountFields() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-instore.json")));

        Order enriched = enrichmentService.enrich(discovered("tp-sid-1"));

        assertEquals(64.18, enriched.financials().grandTotal());
        assertEquals(14.0, enriched.financials().couponsTotal());
        assertEquals(0.0, enriched.financials().shippingTotal());
        assertNotNull(enriched.storeInfo());
        assertEquals("542", enriched.storeInfo().storeNumber());
        assertEquals("Framingham", enriched.storeInfo().city());
        assertEquals("1012345678", enriched.customerNumber());
        assertEquals("5420629045137", enriched.transactionBarCode());
        assertTrue(enriched.returnable());
        assertEquals("refreshed-url-key", enriched.vendorLookupKey());
    }

    @Test
    void enrich_ShouldKeepDiscoveredIdentityAndLeaveInputUntouched() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-online-empty.json")));
        Order discovered = Order.discovered("W123456", LocalDate.of(2025, 5, 1), OrderKind.ONLINE,
                "https://vendor.test/orders/W123456", "tp-sid-2");

        Order enriched = enrichmentService.enrich(discovered);

        assertEquals("W123456", enriched.id(), "Vendor orderNumber must not replace the discovered id");
        assertEquals(LocalDate.of(2025, 5, 1), enriched.date());
        assertEquals(OrderKind.ONLINE, enriched.kind());
        assertEquals("https://vendor.test/orders/W123456", enriched.detailsReference());

        assertFalse(discovered.enriched());
        assertTrue(discovered.items().isEmpty());
        assertNull(discovered.financials());
    }

    @Test
    void enrich_NoShipmentsOrReturns_ShouldReturnEmptyCollections() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-online-empty.json")));

        Order enriched = enrichmentService.enrich(discovered("tp-sid-2"));

        assertTrue(enriched.enriched());
        assertEquals(List.of(), enriched.items());
        assertEquals(List.of(), enriched.returns());
        assertNull(enriched.storeInfo(), "Online order has no store");
        assertFalse(enriched.returnable());
    }

    @Test
    void enrich_ShouldRequestVendorEndpointWithEncodedQuery() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-online-empty.json")));
        ArgumentCaptor<URI> uriCaptor = ArgumentCaptor.forClass(URI.class);

        enrichmentService.enrich(discovered("a b&c"), Duration.ofMillis(2500));

        verify(fetcher, times(1)).get(uriCaptor.capture(), eq(Duration.ofMillis(2500)));
        URI uri = uriCaptor.getValue();
        assertEquals("vendor.test", uri.getHost());
        assertEquals("/orderdetails", uri.getPath());
        assertEquals("enterpriseCode=RetailUS&orderType=in-store_instore&tp_sid=a%20b%26c&pgIntlO=Y",
                uri.getRawQuery());
    }

    @Test
    void enrich_OrderTypeOnOrder_ShouldOverrideDefault() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-online-empty.json")));
        ArgumentCaptor<URI> uriCaptor = ArgumentCaptor.forClass(URI.class);
        Order order = discovered("tp-sid-3").toBuilder()
                .orderType("online_dotcom")
                .enterpriseCode("RetailCA")
                .build();

        Order enriched = enrichmentService.enrich(order);

        verify(fetcher).get(uriCaptor.capture(), eq(Duration.ofMillis(15000)));
        assertTrue(uriCaptor.getValue().getRawQuery().startsWith("enterpriseCode=RetailCA&orderType=online_dotcom"));
        assertEquals("online_dotcom", enriched.orderType());
    }

    @Test
    void enrich_MissingLookupKey_ShouldFailWithoutRequest() {
        Order order = discovered(null);

        EnrichmentException ex = assertThrows(EnrichmentException.class, () -> enrichmentService.enrich(order));

        assertEquals(EnrichmentException.Reason.MISSING_KEY, ex.getReason());
        assertEquals(ORDER_ID, ex.getOrderId());
        verifyNoInteractions(fetcher);
    }

    @Test
    void enrich_Timeout_ShouldReportTransportFailure() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenThrow(new TimeoutException("No response after 100ms"));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1"), Duration.ofMillis(100)));

        assertEquals(EnrichmentException.Reason.TRANSPORT_FAILURE, ex.getReason());
        assertInstanceOf(TimeoutException.class, ex.getCause());
    }

    @Test
    void enrich_ConnectionError_ShouldReportTransportFailure() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenThrow(new IOException("Connection refused"));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.TRANSPORT_FAILURE, ex.getReason());
        assertTrue(ex.getMessage().contains("Connection refused"));
    }

    @Test
    void enrich_ServerError_ShouldReportUpstreamStatus() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(500, "{\"error\":\"boom\"}"));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.UPSTREAM_STATUS, ex.getReason());
        assertEquals(500, ex.getStatusCode());
    }

    @Test
    void enrich_MissingNestedRecord_ShouldReportMalformedResponse() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-missing-detail.json")));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.MALFORMED_RESPONSE, ex.getReason());
        assertTrue(ex.getMessage().contains("$.ptdOrderDetails.orderDetails.orderDetails"));
    }

    @Test
    void enrich_ShipmentsNotAnArray_ShouldReportMalformedResponse() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, fixture("order-details-bad-shipments.json")));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.MALFORMED_RESPONSE, ex.getReason());
        assertTrue(ex.getMessage().contains("shipments"));
    }

    @Test
    void enrich_NonJsonBody_ShouldReportMalformedResponse() throws Exception {
        when(fetcher.get(any(URI.class), any(Duration.class)))
                .thenReturn(new FetchResponse(200, "<html>Access Denied</html>"));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.MALFORMED_RESPONSE, ex.getReason());
    }

    @Test
    void enrich_NegativeQuantity_ShouldReportMalformedResponse() throws Exception {
        String body = """
                {"ptdOrderDetails":{"orderDetails":{"orderDetails":{
                  "shipments":[{"containerIdVsShipmentLinesMap":{"dummyKey":[
                    {"skuNumber":"111","qtyOrdered":-1}
                  ]}}]
                }}}}
                """;
        when(fetcher.get(any(URI.class), any(Duration.class))).thenReturn(new FetchResponse(200, body));

        EnrichmentException ex = assertThrows(EnrichmentException.class,
                () -> enrichmentService.enrich(discovered("tp-sid-1")));

        assertEquals(EnrichmentException.Reason.MALFORMED_RESPONSE, ex.getReason());
    }

    @Test
    void enrich_LineWithoutSku_ShouldUseUnknownDefaults() throws Exception {
        String body = """
                {"ptdOrderDetails":{"orderDetails":{"orderDetails":{
                  "shipments":[{"containerIdVsShipmentLinesMap":{"dummyKey":[
                    {"unitPrice":"4.50","qtyOrdered":1}
                  ]}}]
                }}}}
                """;
        when(fetcher.get(any(URI.class), any(Duration.class))).thenReturn(new FetchResponse(200, body));

        Order enriched = enrichmentService.enrich(discovered("tp-sid-1"));

        OrderItem item = enriched.items().get(0);
        assertEquals(OrderDetailsParser.UNKNOWN_SKU, item.sku());
        assertEquals(OrderDetailsParser.UNKNOWN_TITLE, item.title());
        assertEquals(4.5, item.unitPrice(), "Numeric strings are accepted");
    }

    private static Order discovered(String lookupKey) {
        return Order.discovered(ORDER_ID, LocalDate.of(2025, 6, 29), OrderKind.IN_STORE,
                "https://vendor.test/orders/" + ORDER_ID, lookupKey);
    }

    private String fixture(String name) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            assertNotNull(in, "Missing fixture " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
