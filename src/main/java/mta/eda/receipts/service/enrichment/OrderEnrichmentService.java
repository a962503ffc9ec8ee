package mta.eda.receipts.service.enrichment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import mta.eda.receipts.exception.EnrichmentException;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.order.OrderItem;
import mta.eda.receipts.model.order.ReturnOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * OrderEnrichmentService
 * Fetches vendor order details for a discovered order and returns a new, fully populated
 * Order. Each call issues exactly one request and holds no state between calls, so
 * independent orders may be enriched concurrently.
 * <p>
 * Whether a failed order is kept in its discovered form or dropped is the caller's decision.
 */
@Service
public class OrderEnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(OrderEnrichmentService.class);

    private final OrderDetailsFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String defaultEnterpriseCode;
    private final String defaultOrderType;
    private final Duration defaultTimeout;

    public OrderEnrichmentService(
            OrderDetailsFetcher fetcher,
            ObjectMapper objectMapper,
            @Value("${order-details.base-url:" + OrderDetailsProtocol.DEFAULT_BASE_URL + "}") String baseUrl,
            @Value("${order-details.enterprise-code:" + OrderDetailsProtocol.DEFAULT_ENTERPRISE_CODE + "}") String defaultEnterpriseCode,
            @Value("${order-details.order-type:" + OrderDetailsProtocol.DEFAULT_ORDER_TYPE + "}") String defaultOrderType,
            @Value("${order-details.timeout.ms:15000}") long defaultTimeoutMs) {
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.defaultEnterpriseCode = defaultEnterpriseCode;
        this.defaultOrderType = defaultOrderType;
        this.defaultTimeout = Duration.ofMillis(defaultTimeoutMs);
    }

    /**
     * Enriches with the configured default timeout.
     *
     * @see #enrich(Order, Duration)
     */
    public Order enrich(Order order) {
        return enrich(order, defaultTimeout);
    }

    /**
     * Fetches and parses the order details of {@code order}.
     *
     * @param order   a discovered order; never modified
     * @param timeout how long to wait for the vendor before giving up
     * @return a new Order with items, returns, financials and store info, {@code enriched = true}
     * @throws EnrichmentException MISSING_KEY without a request when the order has no lookup key;
     *                             TRANSPORT_FAILURE, UPSTREAM_STATUS or MALFORMED_RESPONSE otherwise
     */
    public Order enrich(Order order, Duration timeout) {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(timeout, "timeout");
        String orderId = order.id();

        if (!order.hasVendorLookupKey()) {
            logger.warn("Skipping details request for order {}: no vendor lookup key", orderId);
            throw EnrichmentException.missingKey(orderId);
        }

        String orderType = order.orderType() != null ? order.orderType() : defaultOrderType;
        String enterpriseCode = order.enterpriseCode() != null ? order.enterpriseCode() : defaultEnterpriseCode;
        URI uri = OrderDetailsProtocol.orderDetailsUri(baseUrl, enterpriseCode, orderType, order.vendorLookupKey());

        logger.info("Fetching order details for orderId={}, orderType={}, enterpriseCode={}",
                orderId, orderType, enterpriseCode);

        FetchResponse response;
        try {
            response = fetcher.get(uri, timeout);
        } catch (TimeoutException e) {
            throw EnrichmentException.transportFailure(orderId, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw EnrichmentException.transportFailure(orderId, e.getMessage(), e);
        }

        if (!response.isSuccessful()) {
            logger.warn("Order details API returned HTTP {} for orderId={}", response.status(), orderId);
            throw EnrichmentException.upstreamStatus(orderId, response.status());
        }

        JsonNode detail = OrderDetailLookup.locate(readBody(orderId, response.body()))
                .orElseThrow(missingPath -> EnrichmentException.malformedResponse(orderId,
                        "no order record at " + missingPath));

        OrderDetailsParser parser = new OrderDetailsParser(orderId);
        List<OrderItem> items = parser.parseItems(detail);
        List<ReturnOrder> returns = parser.parseReturns(detail, orderId);

        String vendorOrderNumber = parser.text(detail, "orderNumber", null, "orderDetails");
        if (vendorOrderNumber != null && !vendorOrderNumber.equals(orderId)) {
            logger.warn("Order details for orderId={} report orderNumber={}, keeping the discovered id",
                    orderId, vendorOrderNumber);
        }

        Order enriched = order.toBuilder()
                .customerNumber(parser.text(detail, "masterAccountNumber", order.customerNumber(), "orderDetails"))
                .vendorLookupKey(parser.text(detail, "orderUrlKey", order.vendorLookupKey(), "orderDetails"))
                .orderType(orderType)
                .enterpriseCode(parser.text(detail, "enterpriseCode", enterpriseCode, "orderDetails"))
                .items(items)
                .returns(returns)
                .financials(parser.parseFinancials(detail))
                .storeInfo(parser.parseStoreInfo(detail))
                .transactionBarCode(parser.text(detail, "transactionBarCode", null, "orderDetails"))
                .returnable(parser.flag(detail, "isReturnable"))
                .enriched(true)
                .build();

        logger.info("Enriched orderId={}: items={}, returns={}, store={}",
                orderId, items.size(), returns.size(),
                enriched.storeInfo() != null ? enriched.storeInfo().storeNumber() : "online");
        return enriched;
    }

    private JsonNode readBody(String orderId, String body) {
        if (body == null || body.isBlank()) {
            throw EnrichmentException.malformedResponse(orderId, "empty response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw EnrichmentException.malformedResponse(orderId, "response is not valid JSON", e);
        }
    }
}
