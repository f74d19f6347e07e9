package com.questrail.rpclink.transport.websocket.netty;

import com.questrail.rpclink.transport.Transport;
import com.questrail.rpclink.transport.TransportException;
import com.questrail.rpclink.transport.TransportFactory;
import com.questrail.rpclink.transport.TransportListener;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * NettyWebSocketTransportFactory
 * =============================================================================
 * Creates {@code ws://} and {@code wss://} client transports on a Netty event
 * loop owned by this factory.
 *
 * <p>One factory serves every connect attempt of a link. Closing the factory
 * shuts the event loop down, which also drops any transport still open.</p>
 */
public final class NettyWebSocketTransportFactory implements TransportFactory, AutoCloseable
{
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 1 << 20;

    private final EventLoopGroup group;
    private final int maxFramePayloadLength;

    private volatile SslContext sslContext;

    public NettyWebSocketTransportFactory()
    {
        this(DEFAULT_MAX_FRAME_PAYLOAD_LENGTH);
    }

    public NettyWebSocketTransportFactory(int maxFramePayloadLength)
    {
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be > 0");
        }
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.group = new NioEventLoopGroup(1);
    }

    /**
     * @throws IllegalArgumentException if the address is not a {@code ws} or {@code wss} URI with a host
     * @throws TransportException       if the TLS context cannot be created
     */
    @Override
    public Transport create(URI address, TransportListener listener)
    {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(listener, "listener");
        if (group.isShuttingDown()) {
            throw new IllegalStateException("NettyWebSocketTransportFactory is closed");
        }

        boolean secure = isSecure(address);
        if (address.getHost() == null) {
            throw new IllegalArgumentException("WebSocket address has no host: " + address);
        }

        NettyWebSocketTransport transport = new NettyWebSocketTransport(address, listener);
        transport.connect(group, secure ? clientSslContext() : null, maxFramePayloadLength);
        return transport;
    }

    @Override
    public void close()
    {
        group.shutdownGracefully().syncUninterruptibly();
    }

    static int portOf(URI address)
    {
        if (address.getPort() != -1) {
            return address.getPort();
        }
        return isSecure(address) ? 443 : 80;
    }

    private static boolean isSecure(URI address)
    {
        String scheme = address.getScheme() == null ? "" : address.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "ws":
                return false;
            case "wss":
                return true;
            default:
                throw new IllegalArgumentException("Unsupported WebSocket scheme: " + address);
        }
    }

    private SslContext clientSslContext()
    {
        SslContext ctx = sslContext;
        if (ctx == null) {
            synchronized (this) {
                ctx = sslContext;
                if (ctx == null) {
                    try {
                        ctx = SslContextBuilder.forClient().build();
                    }
                    catch (SSLException e) {
                        throw new TransportException("Could not initialise TLS", e);
                    }
                    sslContext = ctx;
                }
            }
        }
        return ctx;
    }
}
