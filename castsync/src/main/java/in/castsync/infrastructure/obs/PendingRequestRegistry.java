package in.castsync.infrastructure.obs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Correlation table for in-flight requests.
 *
 * Each entry owns its expiry timer. An entry leaves the table exactly once: on its response,
 * on its timeout, or when the connection closes. Whichever comes first settles the future.
 */
final class PendingRequestRegistry {
    private static final Logger log = LoggerFactory.getLogger(PendingRequestRegistry.class);

    private final String endpoint;
    private final Duration timeout;
    private final ScheduledExecutorService scheduler;
    private final Map<String, Entry> pending = new ConcurrentHashMap<>();

    PendingRequestRegistry(String endpoint, Duration timeout, ScheduledExecutorService scheduler) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.scheduler = scheduler;
    }

    private static final class Entry {
        final String requestType;
        final CompletableFuture<ObsResponse> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> timer;

        Entry(String requestType) {
            this.requestType = requestType;
        }
    }

    /**
     * Register a request and arm its timer.
     *
     * @return future settled by the matching response, the timeout, or connection closure
     * @throws IllegalArgumentException if a request with the same id is still in flight
     */
    CompletableFuture<ObsResponse> register(String requestId, String requestType) {
        Entry entry = new Entry(requestType);
        if (pending.putIfAbsent(requestId, entry) != null) {
            throw new IllegalArgumentException("Request id already in flight: " + requestId);
        }
        entry.timer = scheduler.schedule(() -> expire(requestId, entry), timeout.toMillis(), TimeUnit.MILLISECONDS);
        return entry.future;
    }

    /**
     * @return false when no request with this id is pending (late or unknown response)
     */
    boolean complete(ObsResponse response) {
        Entry entry = pending.remove(response.requestId());
        if (entry == null) {
            return false;
        }
        cancelTimer(entry);
        entry.future.complete(response);
        return true;
    }

    boolean fail(String requestId, Throwable cause) {
        Entry entry = pending.remove(requestId);
        if (entry == null) {
            return false;
        }
        cancelTimer(entry);
        entry.future.completeExceptionally(cause);
        return true;
    }

    /**
     * Reject every pending request with the same cause.
     *
     * @return number of requests rejected
     */
    int failAll(Throwable cause) {
        List<String> ids = new ArrayList<>(pending.keySet());
        int failed = 0;
        for (String id : ids) {
            if (fail(id, cause)) {
                failed++;
            }
        }
        return failed;
    }

    int size() {
        return pending.size();
    }

    private void expire(String requestId, Entry entry) {
        if (!pending.remove(requestId, entry)) {
            return;  // settled meanwhile
        }
        log.warn("[OBS CLIENT] Request {} ({}) timed out after {}ms", requestId, entry.requestType, timeout.toMillis());
        entry.future.completeExceptionally(
            new ObsRequestTimeoutException(endpoint, entry.requestType, requestId, timeout));
    }

    private static void cancelTimer(Entry entry) {
        ScheduledFuture<?> timer = entry.timer;
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
