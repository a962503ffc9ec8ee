package mta.eda.receipts.service.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import mta.eda.receipts.exception.EnrichmentException;
import mta.eda.receipts.exception.InvalidModelException;
import mta.eda.receipts.model.order.CouponCharge;
import mta.eda.receipts.model.order.Financials;
import mta.eda.receipts.model.order.OrderItem;
import mta.eda.receipts.model.order.ReturnOrder;
import mta.eda.receipts.model.order.StoreInfo;

import java.util.ArrayList;
import java.util.List;

import static mta.eda.receipts.service.enrichment.OrderDetailsProtocol.*;

/**
 * OrderDetailsParser
 * Turns the vendor order record into model values. Absent collections read as empty and
 * absent numbers as 0, but a field that is present with the wrong JSON type fails the whole
 * parse with {@link EnrichmentException.Reason#MALFORMED_RESPONSE}.
 * <p>
 * One instance per enrichment call; it only carries the order id for error context.
 */
class OrderDetailsParser {

    static final String UNKNOWN_SKU = "UNKNOWN";
    static final String UNKNOWN_TITLE = "Unknown Item";

    private final String orderId;

    OrderDetailsParser(String orderId) {
        this.orderId = orderId;
    }

    /**
     * Flattens {@code shipments[].containerIdVsShipmentLinesMap.dummyKey[]} in shipment order,
     * then line order.
     */
    List<OrderItem> parseItems(JsonNode detail) {
        List<OrderItem> items = new ArrayList<>();
        List<JsonNode> shipments = array(detail, SHIPMENTS_KEY, "orderDetails");
        for (int i = 0; i < shipments.size(); i++) {
            items.addAll(parseShipmentLines(shipments.get(i), "shipments[" + i + "]"));
        }
        return items;
    }

    /**
     * Emits one ReturnOrder per return-shipment. Return-level fields (number, dates, lookup key)
     * come from the return record, totals and status from the shipment.
     */
    List<ReturnOrder> parseReturns(JsonNode detail, String parentOrderId) {
        List<ReturnOrder> returns = new ArrayList<>();
        List<JsonNode> returnOrders = array(detail, RETURN_ORDERS_KEY, "orderDetails");
        for (int r = 0; r < returnOrders.size(); r++) {
            JsonNode ret = returnOrders.get(r);
            String retPath = "returnOrders[" + r + "]";
            requireObject(ret, retPath);

            List<JsonNode> returnShipments = array(ret, RETURN_SHIPMENTS_KEY, retPath);
            for (int s = 0; s < returnShipments.size(); s++) {
                JsonNode shipment = returnShipments.get(s);
                String shipmentPath = retPath + ".returnShipments[" + s + "]";
                List<OrderItem> items = parseShipmentLines(shipment, shipmentPath);
                JsonNode tracking = object(shipment, "trackingInfo", shipmentPath);

                try {
                    returns.add(ReturnOrder.builder()
                            .returnId(text(ret, "returnOrderNumber", null, retPath))
                            .parentOrderId(text(ret, "masterOrderNumber", parentOrderId, retPath))
                            .returnedDate(text(ret, "returnedDate", null, retPath))
                            .dispositionType(text(shipment, "returnDispositionType", ReturnOrder.UNKNOWN_DISPOSITION, shipmentPath))
                            .statusCode(integer(tracking, "statusCode", shipmentPath + ".trackingInfo"))
                            .statusText(text(tracking, "statusDescription", "", shipmentPath + ".trackingInfo"))
                            .merchandiseTotal(number(shipment, "merchandiseTotal", shipmentPath))
                            .couponTotal(number(shipment, "couponTotal", shipmentPath))
                            .shippingRefund(number(shipment, "shippingFees", shipmentPath))
                            .taxRefund(number(shipment, "taxTotal", shipmentPath))
                            .refundTotal(number(shipment, "grandTotal", shipmentPath))
                            .items(items)
                            .vendorLookupKey(text(ret, "orderUrlKey", null, retPath))
                            .build());
                } catch (InvalidModelException e) {
                    throw EnrichmentException.malformedResponse(orderId, shipmentPath + ": " + e.getMessage(), e);
                }
            }
        }
        return returns;
    }

    Financials parseFinancials(JsonNode detail) {
        String path = "orderDetails";
        return new Financials(
                number(detail, "merchandiseTotal", path),
                number(detail, "discountsTotal", path),
                number(detail, "couponsTotal", path),
                number(detail, "shippingAndHandlingFeeTotal", path),
                number(detail, "taxesTotal", path),
                number(detail, "grandTotal", path));
    }

    /**
     * @return store metadata, or {@code null} when the record has no store number (online order)
     */
    StoreInfo parseStoreInfo(JsonNode detail) {
        String storeNumber = text(detail, "storeNumber", null, "orderDetails");
        if (storeNumber == null) {
            return null;
        }
        JsonNode address = object(detail, "storeAddress", "orderDetails");
        String path = "orderDetails.storeAddress";
        return new StoreInfo(
                storeNumber,
                text(address, "addressLine1", "", path),
                text(address, "city", "", path),
                text(address, "state", "", path),
                text(address, "zipCode", "", path));
    }

    String text(JsonNode node, String field, String fallback, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        if (!value.isValueNode()) {
            throw malformed(path + "." + field + " must be a scalar");
        }
        String text = value.asText();
        return text.isBlank() ? fallback : text;
    }

    boolean flag(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            return "true".equalsIgnoreCase(text) || "Y".equalsIgnoreCase(text);
        }
        return value.asBoolean(false);
    }

    private List<OrderItem> parseShipmentLines(JsonNode shipment, String path) {
        requireObject(shipment, path);
        JsonNode lineMap = object(shipment, SHIPMENT_LINES_MAP_KEY, path);
        String linesPath = path + "." + SHIPMENT_LINES_MAP_KEY;
        List<JsonNode> lines = array(lineMap, SHIPMENT_LINES_KEY, linesPath);

        List<OrderItem> items = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String linePath = linesPath + "." + SHIPMENT_LINES_KEY + "[" + i + "]";
            items.add(parseLine(lines.get(i), linePath));
        }
        return items;
    }

    private OrderItem parseLine(JsonNode line, String path) {
        requireObject(line, path);
        String title = text(line, "title", null, path);
        if (title == null) {
            title = text(line, "skuDescription", UNKNOWN_TITLE, path);
        }

        List<CouponCharge> coupons = new ArrayList<>();
        List<JsonNode> couponNodes = array(line, "couponDetails", path);
        for (int i = 0; i < couponNodes.size(); i++) {
            JsonNode coupon = couponNodes.get(i);
            String couponPath = path + ".couponDetails[" + i + "]";
            requireObject(coupon, couponPath);
            coupons.add(new CouponCharge(
                    text(coupon, "chargeName", "", couponPath),
                    number(coupon, "chargeAmount", couponPath)));
        }

        try {
            return OrderItem.builder()
                    .sku(text(line, "skuNumber", UNKNOWN_SKU, path))
                    .title(title)
                    .imageRef(text(line, "image", "", path))
                    .unitPrice(number(line, "unitPrice", path))
                    .quantityOrdered(integer(line, "qtyOrdered", path))
                    .quantityFulfilled(integer(line, "qtyShipped", path))
                    .lineTotal(number(line, "lineTotal", path))
                    .couponTotal(number(line, "couponTotal", path))
                    .couponBreakdown(coupons)
                    .taxTotal(number(line, "taxTotal", path))
                    .statusCode(integer(line, "status", path))
                    .statusText(text(line, "statusDescription", "", path))
                    .build();
        } catch (InvalidModelException e) {
            throw EnrichmentException.malformedResponse(orderId, path + ": " + e.getMessage(), e);
        }
    }

    private double number(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return 0;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.asText().trim());
            } catch (NumberFormatException e) {
                throw malformed(path + "." + field + " is not a number: '" + value.asText() + "'");
            }
        }
        throw malformed(path + "." + field + " must be a number");
    }

    private int integer(JsonNode node, String field, String path) {
        double value = number(node, field, path);
        if (value != Math.rint(value) || value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw malformed(path + "." + field + " must be a whole number, got " + value);
        }
        return (int) value;
    }

    private List<JsonNode> array(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw malformed(path + "." + field + " must be an array");
        }
        List<JsonNode> elements = new ArrayList<>(value.size());
        value.forEach(elements::add);
        return elements;
    }

    /**
     * @return the nested object, or an empty object node when absent
     */
    private JsonNode object(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!value.isObject()) {
            throw malformed(path + "." + field + " must be an object");
        }
        return value;
    }

    private void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw malformed(path + " must be an object");
        }
    }

    private EnrichmentException malformed(String detail) {
        return EnrichmentException.malformedResponse(orderId, detail);
    }
}
