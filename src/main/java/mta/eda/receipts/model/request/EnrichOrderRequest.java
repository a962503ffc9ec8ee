package mta.eda.receipts.model.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import mta.eda.receipts.exception.InvalidModelException;
import mta.eda.receipts.model.order.Order;
import mta.eda.receipts.model.order.OrderKind;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * EnrichOrderRequest - DTO for POST /receipt-service/orders/enrich
 * A discovered order as the order history page reports it.
 */
public record EnrichOrderRequest(

    @NotBlank(message = "id is required")
    @JsonProperty("id")
    String id,

    @NotBlank(message = "date is required")
    @Pattern(regexp = "\\d{4}-\\d{2}-\\d{2}", message = "date must be in ISO format (YYYY-MM-DD)")
    @JsonProperty("date")
    String date,

    @NotNull(message = "kind is required")
    @Pattern(regexp = "(?i)online|in-store|instore", message = "kind must be online or in-store")
    @JsonProperty("kind")
    String kind,

    @JsonProperty("detailsReference")
    String detailsReference,

    @JsonProperty("vendorLookupKey")
    String vendorLookupKey,

    @JsonProperty("orderType")
    String orderType,

    @JsonProperty("enterpriseCode")
    String enterpriseCode,

    @JsonProperty("customerNumber")
    String customerNumber
) {

    public Order toOrder() {
        LocalDate purchaseDate;
        try {
            purchaseDate = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new InvalidModelException("date is not a valid calendar date: '" + date + "'");
        }
        return Order.builder()
                .id(id)
                .date(purchaseDate)
                .kind(OrderKind.fromWire(kind))
                .detailsReference(detailsReference)
                .vendorLookupKey(vendorLookupKey)
                .orderType(orderType)
                .enterpriseCode(enterpriseCode)
                .customerNumber(customerNumber)
                .build();
    }
}
