package com.questrail.tso.runtime;

import com.questrail.tso.api.StreamKey;
import com.questrail.tso.api.Timestamp;
import com.questrail.tso.api.TimestampOracle;
import com.questrail.tso.codec.TsoWireCodec;
import com.questrail.tso.config.TsoConfig;
import com.questrail.tso.election.InMemoryLeaderElection;
import com.questrail.tso.election.LeaderElection;
import com.questrail.tso.election.LeadershipGuard;
import com.questrail.tso.internal.alloc.TsoAllocatorManager;
import com.questrail.tso.internal.time.ExecutorTickScheduler;
import com.questrail.tso.internal.time.SystemClock;
import com.questrail.tso.internal.time.SystemSleeper;
import com.questrail.tso.internal.time.TickScheduler;
import com.questrail.tso.observability.Slf4jTsoObservabilitySink;
import com.questrail.tso.observability.TsoObservabilitySink;
import com.questrail.tso.store.CheckpointStore;
import com.questrail.tso.store.InMemoryCheckpointStore;
import com.questrail.tso.transport.DatagramEndpoint;
import com.questrail.tso.transport.udp.UdpTimestampService;
import com.questrail.tso.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * TsoRuntime
 * =============================================================================
 * Composition root and lifecycle owner for a timestamp oracle process.
 *
 * <p>Wires the system clocks, an executor-backed scheduler for the periodic
 * tick, the checkpoint store, the election capability, the leadership guard, the
 * allocator manager and, when {@code listen-addr} is configured or an endpoint
 * is supplied, the UDP {@code GetTimestamp} service.</p>
 *
 * <p>When no election capability is supplied the runtime runs as a single node:
 * it creates an {@link InMemoryLeaderElection} and campaigns for it on
 * {@link #start()}.</p>
 */
public final class TsoRuntime implements TimestampOracle {
    private final TsoAllocatorManager manager;
    private final LeadershipGuard guard;
    private final InMemoryLeaderElection singleNodeElection;
    private final String leaderId;
    private final UdpTimestampService udpService;
    private final List<ExecutorService> executors;

    private TsoRuntime(TsoAllocatorManager manager,
                       LeadershipGuard guard,
                       InMemoryLeaderElection singleNodeElection,
                       String leaderId,
                       UdpTimestampService udpService,
                       List<ExecutorService> executors) {
        this.manager = manager;
        this.guard = guard;
        this.singleNodeElection = singleNodeElection;
        this.leaderId = leaderId;
        this.udpService = udpService;
        this.executors = executors;
    }

    public void start() {
        guard.start();
        if (udpService != null) {
            udpService.start();
        }
        if (singleNodeElection != null) {
            singleNodeElection.campaign(leaderId);
        }
    }

    public void stop() {
        if (udpService != null) {
            udpService.stop();
        }
        guard.resign("shutdown");
        manager.shutdown();

        for (ExecutorService executor : executors) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public Timestamp getTimestamp(StreamKey stream, int count) {
        return manager.getTimestamp(stream, count);
    }

    @Override
    public boolean isReady(StreamKey stream) {
        return manager.isReady(stream);
    }

    public boolean isReady() {
        return manager.isReady();
    }

    public boolean isLeader() {
        return guard.isLeader();
    }

    public TsoAllocatorManager manager() {
        return manager;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses {@code listen-addr}: {@code host:port}, optionally prefixed by a URL
     * scheme ({@code http://127.0.0.1:2379}).
     */
    static InetSocketAddress parseListenAddress(String listenAddr) {
        String addr = listenAddr.trim();
        int scheme = addr.indexOf("://");
        if (scheme >= 0) {
            addr = addr.substring(scheme + 3);
        }
        if (addr.endsWith("/")) {
            addr = addr.substring(0, addr.length() - 1);
        }
        int colon = addr.lastIndexOf(':');
        if (colon < 0) {
            throw new IllegalArgumentException("listen-addr must be host:port: '" + listenAddr + "'");
        }
        String host = addr.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(addr.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in listen-addr '" + listenAddr + "'", e);
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    public static final class Builder {
        private TsoConfig config = TsoConfig.defaults();
        private CheckpointStore store;
        private LeaderElection election;
        private String leaderId = "tso-local";
        private TsoObservabilitySink observabilitySink = new Slf4jTsoObservabilitySink();
        private DatagramEndpoint endpoint;
        private int requestThreads = 4;

        public Builder withConfig(TsoConfig config) {
            this.config = config;
            return this;
        }

        public Builder withCheckpointStore(CheckpointStore store) {
            this.store = store;
            return this;
        }

        /**
         * Election capability of a multi-node deployment. Without one, the runtime
         * leads on its own.
         */
        public Builder withLeaderElection(LeaderElection election) {
            this.election = election;
            return this;
        }

        public Builder withLeaderId(String leaderId) {
            this.leaderId = leaderId;
            return this;
        }

        public Builder withObservabilitySink(TsoObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Datagram endpoint to serve on instead of a Netty socket bound to
         * {@code listen-addr}.
         */
        public Builder withDatagramEndpoint(DatagramEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withRequestThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("requestThreads must be >= 1");
            }
            this.requestThreads = threads;
            return this;
        }

        public TsoRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(leaderId, "leaderId");

            // 1. Time
            SystemClock clock = SystemClock.INSTANCE;
            ScheduledExecutorService tickExec = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "tso-tick");
                t.setDaemon(true);
                return t;
            });
            TickScheduler scheduler = new ExecutorTickScheduler(tickExec);
            List<ExecutorService> executors = new ArrayList<>();
            executors.add(tickExec);

            // 2. Store and leadership
            CheckpointStore checkpointStore = store != null ? store : new InMemoryCheckpointStore();
            InMemoryLeaderElection singleNode = null;
            LeaderElection effectiveElection = election;
            if (effectiveElection == null) {
                singleNode = new InMemoryLeaderElection();
                effectiveElection = singleNode;
            }
            LeadershipGuard guard = new LeadershipGuard(effectiveElection, clock, observabilitySink);

            // 3. Allocators
            TsoAllocatorManager manager = new TsoAllocatorManager(
                config,
                checkpointStore,
                guard,
                clock,
                clock,
                SystemSleeper.INSTANCE,
                scheduler,
                observabilitySink
            );

            // 4. Transport
            UdpTimestampService udpService = null;
            DatagramEndpoint effectiveEndpoint = endpoint;
            if (effectiveEndpoint == null && !config.listenAddr().isBlank()) {
                effectiveEndpoint = new NettyUdpDatagramEndpoint(parseListenAddress(config.listenAddr()));
            }
            if (effectiveEndpoint != null) {
                ExecutorService requestExec = Executors.newFixedThreadPool(requestThreads, r -> {
                    Thread t = new Thread(r, "tso-request");
                    t.setDaemon(true);
                    return t;
                });
                executors.add(requestExec);
                udpService = new UdpTimestampService(
                    manager,
                    effectiveEndpoint,
                    new TsoWireCodec(),
                    requestExec,
                    clock,
                    observabilitySink
                );
            }

            return new TsoRuntime(manager, guard, singleNode, leaderId, udpService, List.copyOf(executors));
        }
    }
}
