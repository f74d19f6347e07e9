package com.questrail.rpclink.transport.websocket.netty;

import com.questrail.rpclink.api.CloseCodes;
import com.questrail.rpclink.transport.Frame;
import com.questrail.rpclink.transport.ReadyState;
import com.questrail.rpclink.transport.Transport;
import com.questrail.rpclink.transport.TransportException;
import com.questrail.rpclink.transport.TransportListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.ssl.SslContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * One WebSocket client connection, backed by a Netty channel.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT
 * interpret frame payloads, reconnect, or enforce the connect timeout; the
 * connection supervisor owns those decisions.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound payloads are copied into
 * {@link Frame}s before the listener sees them.
 *
 * <h2>Close reporting</h2>
 * {@link TransportListener#onClose(int, String)} is called exactly once, when
 * the channel goes inactive or the TCP connect fails. The code is the one
 * carried by the close frame that was exchanged, or {@code 1006} if the
 * connection dropped without one.
 */
final class NettyWebSocketTransport implements Transport
{
    private static final Logger log = LoggerFactory.getLogger(NettyWebSocketTransport.class);

    /** How long to wait for the peer to answer our close frame before dropping the connection. */
    private static final long CLOSE_HANDSHAKE_GRACE_MILLIS = 1000;

    /** Netty requires a handshake timeout; the supervisor's connect timeout is the one that matters. */
    private static final long HANDSHAKE_TIMEOUT_MILLIS = TimeUnit.DAYS.toMillis(1);

    private final URI address;
    private final TransportListener listener;

    private final AtomicBoolean closeReported = new AtomicBoolean();

    private volatile ReadyState readyState = ReadyState.CONNECTING;
    private volatile Channel channel;
    private volatile int closeCode = CloseCodes.ABNORMAL_CLOSURE;
    private volatile String closeReason = "";

    NettyWebSocketTransport(URI address, TransportListener listener)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Starts the TCP connect and WebSocket handshake. Returns immediately.
     */
    void connect(EventLoopGroup group, SslContext sslContext, int maxFramePayloadLength)
    {
        String host = address.getHost();
        int port = NettyWebSocketTransportFactory.portOf(address);

        WebSocketClientProtocolConfig config = WebSocketClientProtocolConfig.newBuilder()
                .webSocketUri(address)
                .maxFramePayloadLength(maxFramePayloadLength)
                .handleCloseFrames(false)
                .dropPongFrames(true)
                .handshakeTimeoutMillis(HANDSHAKE_TIMEOUT_MILLIS)
                .build();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(8192));
                        p.addLast(new WebSocketClientProtocolHandler(config));
                        p.addLast(new WebSocketFrameAggregator(maxFramePayloadLength));
                        p.addLast(new InboundHandler());
                    }
                });

        ChannelFuture f = bootstrap.connect(host, port);
        channel = f.channel();
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                readyState = ReadyState.CLOSED;
                listener.onError(new TransportException("Could not connect to " + address, future.cause()));
                reportClose();
            }
            else if (readyState == ReadyState.CLOSING) {
                // closed by the caller while the TCP connect was in flight
                future.channel().close();
            }
        });
    }

    @Override
    public void send(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");
        Channel ch = channel;
        if (readyState != ReadyState.OPEN || ch == null) {
            throw new IllegalStateException("send(): transport is " + readyState);
        }

        WebSocketFrame out = frame.isText()
                ? new TextWebSocketFrame(frame.asText())
                : new BinaryWebSocketFrame(Unpooled.wrappedBuffer(frame.payload()));

        ch.writeAndFlush(out).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                listener.onError(new TransportException("Write failed", future.cause()));
            }
        });
    }

    @Override
    public void close(int code, String reason)
    {
        ReadyState state = readyState;
        if (state == ReadyState.CLOSING || state == ReadyState.CLOSED) {
            return;
        }
        readyState = ReadyState.CLOSING;
        closeCode = code;
        closeReason = reason == null ? "" : reason;

        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (state == ReadyState.CONNECTING) {
            ch.close();
            return;
        }

        ch.writeAndFlush(new CloseWebSocketFrame(code, closeReason));
        ch.eventLoop().schedule(() -> {
            if (ch.isActive()) {
                log.debug("Peer did not answer close frame within {}ms, dropping connection", CLOSE_HANDSHAKE_GRACE_MILLIS);
                ch.close();
            }
        }, CLOSE_HANDSHAKE_GRACE_MILLIS, TimeUnit.MILLISECONDS);
    }

    @Override
    public ReadyState readyState()
    {
        return readyState;
    }

    private void reportClose()
    {
        if (closeReported.compareAndSet(false, true)) {
            listener.onClose(closeCode, closeReason);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Translates handshake completion, data frames and close frames into
     * listener calls.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<WebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                if (readyState == ReadyState.CONNECTING) {
                    readyState = ReadyState.OPEN;
                    listener.onOpen();
                }
                else {
                    ctx.close();
                }
                return;
            }
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                listener.onError(new TransportException("WebSocket handshake timed out"));
                ctx.close();
                return;
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
        {
            if (frame instanceof TextWebSocketFrame) {
                listener.onMessage(Frame.text(((TextWebSocketFrame) frame).text()));
            }
            else if (frame instanceof BinaryWebSocketFrame) {
                ByteBuf content = frame.content();
                byte[] bytes = new byte[content.readableBytes()];
                content.getBytes(content.readerIndex(), bytes);
                listener.onMessage(Frame.binary(bytes));
            }
            else if (frame instanceof CloseWebSocketFrame) {
                onCloseFrame(ctx, (CloseWebSocketFrame) frame);
            }
        }

        private void onCloseFrame(ChannelHandlerContext ctx, CloseWebSocketFrame frame)
        {
            if (readyState == ReadyState.CLOSING) {
                // peer answered our close; keep the code we sent
                ctx.close();
                return;
            }

            int code = frame.statusCode();
            closeCode = code == -1 ? CloseCodes.NO_STATUS_RECEIVED : code;
            closeReason = frame.reasonText() == null ? "" : frame.reasonText();
            readyState = ReadyState.CLOSING;

            CloseWebSocketFrame echo = code == -1
                    ? new CloseWebSocketFrame()
                    : new CloseWebSocketFrame(code, closeReason);
            ctx.writeAndFlush(echo).addListener(ChannelFutureListener.CLOSE);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception
        {
            readyState = ReadyState.CLOSED;
            reportClose();
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            listener.onError(cause);
            ctx.close();
        }
    }
}
