package minikv.network;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import minikv.PubSub;
import minikv.ServerContext;
import minikv.protocol.ProtocolException;
import minikv.protocol.RespArray;
import minikv.protocol.RespBulkString;
import minikv.protocol.RespError;
import minikv.protocol.RespFrame;
import minikv.protocol.RespInteger;
import minikv.protocol.RespSimpleString;
import minikv.utils.Log;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One client session. Requests arrive on the channel's event loop and are handled one at a
 * time; published messages may arrive from any thread.
 * <p>
 * Pushes are always queued as tasks on the channel's event loop, even from that loop, so they
 * are written in publish order. While any write is queued, replies and close requests queue
 * behind it.
 */
public class ClientHandler extends ChannelInboundHandlerAdapter implements PubSub.Subscriber {
    public static final String MAX_CLIENTS_REACHED = "ERR max number of clients reached";

    private final ServerContext context;
    private final long id;
    private ChannelHandlerContext ctx;

    // Pushes queued or written but not yet flushed to the socket
    private final AtomicInteger pendingPushes = new AtomicInteger();
    // Writes queued on the event loop that have not started yet
    private final AtomicInteger queuedWrites = new AtomicInteger();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private volatile String closeReason;
    private boolean counted = false;
    private boolean refused = false;

    public ClientHandler(ServerContext context) {
        this.context = context;
        this.id = context.nextClientId();
    }

    public ServerContext getContext() {
        return context;
    }

    public long getId() {
        return id;
    }

    public String getRemoteAddress() {
        if (ctx != null && ctx.channel().remoteAddress() != null) {
            return ctx.channel().remoteAddress().toString();
        }
        return "0.0.0.0:0";
    }

    /**
     * True while the session holds at least one channel or pattern subscription.
     */
    public boolean isSubscribed() {
        return context.getPubSub().subscriptionCount(this) > 0;
    }

    public boolean isClosing() {
        return closing.get();
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        this.ctx = ctx;
        int active = context.getActiveConnections().incrementAndGet();
        counted = true;
        context.getTotalConnections().incrementAndGet();

        int maxClients = context.getConfig().maxClients;
        if (maxClients > 0 && active > maxClients) {
            refused = true;
            context.getRejectedConnections().incrementAndGet();
            Log.warn("Refusing client " + getRemoteAddress() + ": max number of clients (" + maxClients + ") reached");
            closing.set(true);
            closeReason = "max number of clients reached";
            ctx.writeAndFlush(new RespError(MAX_CLIENTS_REACHED)).addListener(ChannelFutureListener.CLOSE);
            return;
        }
        Log.debug("Client " + id + " connected from " + getRemoteAddress());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        cleanup();
        String reason = closeReason != null ? closeReason : "connection closed";
        Log.debug("Client " + id + " (" + getRemoteAddress() + ") disconnected: " + reason);
        super.channelInactive(ctx);
    }

    private void cleanup() {
        context.getPubSub().unsubscribeAll(this);
        if (counted) {
            counted = false;
            context.getActiveConnections().decrementAndGet();
        }
    }

    @Override
    public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
        if (refused || !(msg instanceof RespFrame)) return;
        RespFrame frame = (RespFrame) msg;
        if (frame == RespFrame.END) {
            if (closeReason == null) closeReason = "peer closed the connection";
            ctx.close();
            return;
        }
        if (closing.get()) return;
        context.getDispatcher().dispatch(this, frame);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ProtocolException) {
            sendError("ERR Protocol error: " + cause.getMessage());
            close("protocol error: " + cause.getMessage());
        } else if (cause instanceof IOException) {
            closeReason = "I/O error: " + cause.getMessage();
            ctx.close();
        } else {
            Log.error("Unexpected error on client " + id + " (" + getRemoteAddress() + ")", cause);
            closeReason = "internal error: " + cause;
            ctx.close();
        }
    }

    /**
     * Flushes what was already written, then closes the connection.
     */
    public void close(String reason) {
        if (!closing.compareAndSet(false, true)) return;
        closeReason = reason;
        if (ctx != null) {
            inOrder(() -> ctx.writeAndFlush(Unpooled.EMPTY_BUFFER).addListener(ChannelFutureListener.CLOSE));
        }
    }

    /**
     * Runs {@code write} now when on the event loop with nothing queued, otherwise queues it
     * behind the earlier writes.
     */
    private void inOrder(Runnable write) {
        if (queuedWrites.get() == 0 && ctx.executor().inEventLoop()) {
            write.run();
        } else {
            enqueue(write);
        }
    }

    /**
     * @return false when the event loop no longer accepts tasks
     */
    private boolean enqueue(Runnable write) {
        queuedWrites.incrementAndGet();
        try {
            ctx.executor().execute(() -> {
                queuedWrites.decrementAndGet();
                write.run();
            });
            return true;
        } catch (RejectedExecutionException e) {
            queuedWrites.decrementAndGet();
            Log.debug("Client " + id + ": event loop is shutting down, dropping write");
            return false;
        }
    }

    // ---------------------------------------------------------------- replies

    /**
     * Single sink for every reply frame.
     */
    public void send(RespFrame frame) {
        if (ctx != null) inOrder(() -> ctx.writeAndFlush(frame));
    }

    public void sendSimpleString(String msg) {
        send(new RespSimpleString(msg));
    }

    public void sendOk() {
        send(RespSimpleString.OK);
    }

    /**
     * @param msg the full error text, prefix included
     */
    public void sendError(String msg) {
        send(new RespError(msg.replace('\r', ' ').replace('\n', ' ')));
    }

    public void sendInteger(long i) {
        send(RespInteger.of(i));
    }

    public void sendNull() {
        send(RespBulkString.NULL);
    }

    public void sendBulkString(String s) {
        send(s == null ? RespBulkString.NULL : RespBulkString.of(s));
    }

    public void sendBulkString(byte[] b) {
        send(b == null ? RespBulkString.NULL : RespBulkString.of(b));
    }

    public void sendArray(List<byte[]> list) {
        send(RespArray.ofBulkStrings(list));
    }

    /**
     * Null elements are sent as null bulk strings.
     */
    public void sendStringArray(List<String> list) {
        send(RespArray.ofStrings(list));
    }

    // ---------------------------------------------------------------- pub/sub

    @Override
    public boolean send(String channel, byte[] message, String pattern) {
        RespFrame push;
        if (pattern != null) {
            push = RespArray.of(RespBulkString.of("pmessage"), RespBulkString.of(pattern),
                    RespBulkString.of(channel), RespBulkString.of(message));
        } else {
            push = RespArray.of(RespBulkString.of("message"), RespBulkString.of(channel),
                    RespBulkString.of(message));
        }
        return push(push);
    }

    /**
     * Queues a push frame on the channel's event loop. A subscriber whose backlog exceeds the
     * configured limit is disconnected.
     *
     * @return false when the frame was dropped
     */
    protected boolean push(RespFrame frame) {
        if (ctx == null) {
            send(frame);
            return true;
        }
        if (closing.get()) return false;
        int limit = context.getConfig().pubsubBacklogLimit;
        if (pendingPushes.incrementAndGet() > limit) {
            pendingPushes.decrementAndGet();
            if (closing.compareAndSet(false, true)) {
                closeReason = "pub/sub backlog exceeded " + limit + " messages";
                Log.warn("Disconnecting slow subscriber " + id + " (" + getRemoteAddress()
                        + "): more than " + limit + " undelivered messages");
                ctx.channel().close();
            }
            return false;
        }
        if (!enqueue(() -> ctx.writeAndFlush(frame).addListener(f -> pendingPushes.decrementAndGet()))) {
            pendingPushes.decrementAndGet();
            return false;
        }
        return true;
    }

    int getPendingPushes() {
        return pendingPushes.get();
    }
}
