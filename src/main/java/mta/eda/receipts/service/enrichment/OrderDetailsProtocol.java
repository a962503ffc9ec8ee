package mta.eda.receipts.service.enrichment;

import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Wire contract of the vendor order-details endpoint.
 * <p>
 * Request: {@code GET {base}?enterpriseCode={tenant}&orderType={orderType}&tp_sid={lookupKey}&pgIntlO=Y}
 * <br>
 * Response: the order record sits at {@code ptdOrderDetails.orderDetails.orderDetails}.
 */
public final class OrderDetailsProtocol {

    private OrderDetailsProtocol() {}

    public static final String DEFAULT_BASE_URL = "https://www.staples.com/sdc/ptd/api/orderDetails/ptd/orderdetails";
    public static final String DEFAULT_ENTERPRISE_CODE = "RetailUS";
    public static final String DEFAULT_ORDER_TYPE = "in-store_instore";

    /** Outermost envelope of the response document. */
    public static final String ENVELOPE_KEY = "ptdOrderDetails";
    /** Wrapper key, repeated twice below the envelope. */
    public static final String ORDER_DETAILS_KEY = "orderDetails";

    public static final String SHIPMENTS_KEY = "shipments";
    public static final String RETURN_ORDERS_KEY = "returnOrders";
    public static final String RETURN_SHIPMENTS_KEY = "returnShipments";
    public static final String SHIPMENT_LINES_MAP_KEY = "containerIdVsShipmentLinesMap";

    /**
     * The vendor keys every shipment's line list under this literal inside
     * {@value #SHIPMENT_LINES_MAP_KEY}, it is not a container id.
     */
    public static final String SHIPMENT_LINES_KEY = "dummyKey";

    public static URI orderDetailsUri(String baseUrl, String enterpriseCode, String orderType, String lookupKey) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("enterpriseCode", "{enterpriseCode}")
                .queryParam("orderType", "{orderType}")
                .queryParam("tp_sid", "{lookupKey}")
                .queryParam("pgIntlO", "Y")
                .encode()
                .buildAndExpand(Map.of(
                        "enterpriseCode", enterpriseCode,
                        "orderType", orderType,
                        "lookupKey", lookupKey))
                .toUri();
    }
}
