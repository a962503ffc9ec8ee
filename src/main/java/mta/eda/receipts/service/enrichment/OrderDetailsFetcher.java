package mta.eda.receipts.service.enrichment;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Issues one GET against the order-details endpoint. Non-2xx responses are returned,
 * not thrown; only transport problems are exceptions.
 */
public interface OrderDetailsFetcher {

    /**
     * @param uri     fully built request URI
     * @param timeout time after which the in-flight request is abandoned
     * @throws IOException      connection or I/O failure
     * @throws TimeoutException no response within {@code timeout}
     */
    FetchResponse get(URI uri, Duration timeout) throws IOException, TimeoutException;
}
