package com.questrail.tso.transport.udp.netty;

import com.questrail.tso.transport.DatagramEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Arrays;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyUdpDatagramEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback test of the Netty adapter with a plain {@link DatagramSocket} client.
 */
class NettyUdpDatagramEndpointTest {

    private NettyUdpDatagramEndpoint endpoint;

    @AfterEach
    void tearDown() {
        if (endpoint != null) {
            endpoint.stop();
        }
    }

    @Test
    void receivesAndRepliesOverLoopback() throws Exception {
        CountDownLatch up = new CountDownLatch(1);
        CountDownLatch down = new CountDownLatch(1);
        BlockingQueue<byte[]> received = new LinkedBlockingQueue<>();
        BlockingQueue<SocketAddress> senders = new LinkedBlockingQueue<>();

        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        endpoint.setListener(new DatagramEndpointListener() {
            @Override
            public void onTransportUp() {
                up.countDown();
            }

            @Override
            public void onTransportDown(Throwable cause) {
                down.countDown();
            }

            @Override
            public void onDatagram(SocketAddress remote, byte[] payload) {
                senders.add(remote);
                received.add(payload);
            }
        });
        endpoint.start();
        assertTrue(up.await(5, TimeUnit.SECONDS), "Endpoint should bind");
        InetSocketAddress bound = endpoint.localAddress();
        assertNotNull(bound);

        try (DatagramSocket client = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            client.setSoTimeout(5000);
            byte[] request = {1, 2, 3, 4};
            client.send(new DatagramPacket(request, request.length, bound));

            byte[] payload = received.poll(5, TimeUnit.SECONDS);
            assertArrayEquals(request, payload);
            SocketAddress sender = senders.poll(1, TimeUnit.SECONDS);
            assertEquals(client.getLocalSocketAddress(), sender);

            endpoint.send(sender, new byte[] {9, 8});
            byte[] buf = new byte[16];
            DatagramPacket reply = new DatagramPacket(buf, buf.length);
            client.receive(reply);
            assertArrayEquals(new byte[] {9, 8}, Arrays.copyOf(buf, reply.getLength()));
        }

        endpoint.stop();
        endpoint = null;
        assertTrue(down.await(5, TimeUnit.SECONDS), "Stop should report transport down");
    }

    @Test
    void startRequiresListener() {
        endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
        assertThrows(IllegalStateException.class, endpoint::start);
    }
}
