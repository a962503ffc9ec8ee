package mta.eda.receipts.service.enrichment;

/**
 * Raw outcome of an order-details request: HTTP status and the body as text.
 */
public record FetchResponse(int status, String body) {

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
