package mta.eda.receipts.service.enrichment;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * RestTemplateOrderDetailsFetcher
 * Each request is sent with the caller's timeout as its own read timeout, so the HTTP client
 * drops the exchange and closes the connection once it passes. The worker thread bounds the
 * body read as well; it is interrupted when the timeout passes.
 * HTTP error statuses come back as a {@link FetchResponse}, I/O problems as {@link IOException}.
 */
@Component
public class RestTemplateOrderDetailsFetcher implements OrderDetailsFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RestTemplateOrderDetailsFetcher.class);

    private final RestTemplate restTemplate;
    private final HttpClient httpClient;
    private final ExecutorService requestExecutor;

    /**
     * @param orderDetailsRestTemplate source of message converters, error handler and interceptors
     * @param orderDetailsHttpClient   shared connection pool used for every request
     */
    public RestTemplateOrderDetailsFetcher(RestTemplate orderDetailsRestTemplate, HttpClient orderDetailsHttpClient) {
        this.restTemplate = orderDetailsRestTemplate;
        this.httpClient = orderDetailsHttpClient;
        AtomicInteger threadCount = new AtomicInteger();
        this.requestExecutor = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, "order-details-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public FetchResponse get(URI uri, Duration timeout) throws IOException, TimeoutException {
        Future<FetchResponse> request = requestExecutor.submit(() -> exchange(uri, timeout));
        try {
            return request.get(timeout.toMillis(), TimeUnit.MILLISECONDS);

        } catch (TimeoutException e) {
            request.cancel(true);
            logger.warn("Order details request timed out after {}ms: {}", timeout.toMillis(), uri.getPath());
            throw new TimeoutException("No response after " + timeout.toMillis() + "ms");

        } catch (InterruptedException e) {
            request.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Order details request interrupted");

        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (isHttpTimeout(cause)) {
                logger.warn("Order details request timed out after {}ms: {}", timeout.toMillis(), uri.getPath());
                throw new TimeoutException("No response after " + timeout.toMillis() + "ms");
            }
            if (cause instanceof IOException io) {
                throw io;
            }
            throw new IOException(cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
        }
    }

    private FetchResponse exchange(URI uri, Duration timeout) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            ResponseEntity<String> response =
                    withReadTimeout(timeout).exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            logger.debug("Order details response status={} for {}", response.getStatusCode().value(), uri.getPath());
            return new FetchResponse(response.getStatusCode().value(), response.getBody());

        } catch (RestClientResponseException e) {
            return new FetchResponse(e.getStatusCode().value(), e.getResponseBodyAsString());
        }
    }

    /**
     * Same converters and error handling as the configured template, with a request factory
     * whose read timeout is {@code timeout}. Requests share the one HTTP client.
     */
    private RestTemplate withReadTimeout(Duration timeout) {
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(timeout);

        RestTemplate perRequest = new RestTemplate(restTemplate.getMessageConverters());
        perRequest.setRequestFactory(requestFactory);
        perRequest.setErrorHandler(restTemplate.getErrorHandler());
        perRequest.setInterceptors(restTemplate.getInterceptors());
        return perRequest;
    }

    private static boolean isHttpTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    @PreDestroy
    public void shutdown() {
        requestExecutor.shutdownNow();
    }
}
