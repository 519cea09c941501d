package com.questrail.tso.transport.udp;

import com.questrail.tso.api.NotLeaderException;
import com.questrail.tso.api.Timestamp;
import com.questrail.tso.api.TimestampOracle;
import com.questrail.tso.api.TsoException;
import com.questrail.tso.api.UnknownStreamException;
import com.questrail.tso.codec.TsoRequest;
import com.questrail.tso.codec.TsoResponse;
import com.questrail.tso.codec.TsoResponseStatus;
import com.questrail.tso.codec.TsoWireCodec;
import com.questrail.tso.internal.time.WallClock;
import com.questrail.tso.observability.NullObservabilitySink;
import com.questrail.tso.observability.TsoErrorEvent;
import com.questrail.tso.observability.TsoObservabilitySink;
import com.questrail.tso.transport.DatagramEndpoint;
import com.questrail.tso.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * UdpTimestampService
 * =============================================================================
 * Serves {@code GetTimestamp} over a {@link DatagramEndpoint}.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → TsoWireCodec.decodeRequest
 *            → TimestampOracle.getTimestamp   (on the request executor)
 *                → TsoWireCodec.encodeResponse
 *                    → DatagramEndpoint.send(...)
 * </pre>
 *
 * <p>Allocation may block (logical space exhausted, clock catch-up), so requests
 * are handed to {@code requestExecutor} instead of running on the transport's
 * I/O thread.</p>
 *
 * <h2>Status mapping</h2>
 * <ul>
 *   <li>{@link NotLeaderException} → {@link TsoResponseStatus#NOT_LEADER}</li>
 *   <li>{@link UnknownStreamException}, invalid count → {@link TsoResponseStatus#INVALID_REQUEST}</li>
 *   <li>any other failure → {@link TsoResponseStatus#UNAVAILABLE}</li>
 * </ul>
 *
 * <p>Malformed datagrams are dropped without a reply.</p>
 */
public final class UdpTimestampService implements DatagramEndpointListener {

    private final TimestampOracle oracle;
    private final DatagramEndpoint endpoint;
    private final TsoWireCodec codec;
    private final Executor requestExecutor;
    private final WallClock wallClock;
    private final TsoObservabilitySink observabilitySink;

    private volatile boolean transportUp;

    public UdpTimestampService(TimestampOracle oracle,
                               DatagramEndpoint endpoint,
                               TsoWireCodec codec,
                               Executor requestExecutor,
                               WallClock wallClock,
                               TsoObservabilitySink observabilitySink) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.requestExecutor = Objects.requireNonNull(requestExecutor, "requestExecutor");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportUp = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp = false;
        if (cause != null) {
            reportError("UDP transport went down", cause);
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        Optional<TsoRequest> request = codec.decodeRequest(payload);
        if (request.isEmpty()) {
            return;
        }

        try {
            requestExecutor.execute(() -> serve(remote, request.get()));
        } catch (RejectedExecutionException e) {
            endpoint.send(remote, codec.encodeResponse(
                    TsoResponse.error(request.get().requestId(), TsoResponseStatus.UNAVAILABLE)));
        }
    }

    private void serve(SocketAddress remote, TsoRequest request) {
        TsoResponse response = handle(request);
        endpoint.send(remote, codec.encodeResponse(response));
    }

    /**
     * Runs one request against the oracle and maps the outcome to a response.
     */
    TsoResponse handle(TsoRequest request) {
        try {
            Timestamp first = oracle.getTimestamp(request.stream(), request.count());
            return TsoResponse.ok(request.requestId(), first, request.count());
        } catch (NotLeaderException e) {
            return TsoResponse.error(request.requestId(), TsoResponseStatus.NOT_LEADER);
        } catch (UnknownStreamException | IllegalArgumentException e) {
            return TsoResponse.error(request.requestId(), TsoResponseStatus.INVALID_REQUEST);
        } catch (TsoException e) {
            return TsoResponse.error(request.requestId(), TsoResponseStatus.UNAVAILABLE);
        } catch (RuntimeException e) {
            reportError("GetTimestamp on stream " + request.stream() + " failed", e);
            return TsoResponse.error(request.requestId(), TsoResponseStatus.UNAVAILABLE);
        }
    }

    private void reportError(String message, Throwable cause) {
        observabilitySink.onError(new TsoErrorEvent(Instant.ofEpochMilli(wallClock.nowMillis()), message, cause));
    }
}
