package minikv.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import minikv.protocol.ProtocolException;
import minikv.protocol.RespCodec;
import minikv.protocol.RespFrame;
import minikv.utils.Log;

import java.util.List;

/**
 * Turns the inbound byte stream into {@link RespFrame}s, one per decode call.
 * Emits {@link RespFrame#END} when the peer closes its side of the connection.
 */
public class NettyRespDecoder extends ByteToMessageDecoder {

    private final RespCodec codec;

    // Set after a protocol error; everything after it is garbage.
    private boolean failed = false;

    public NettyRespDecoder() {
        this(RespCodec.DEFAULT);
    }

    public NettyRespDecoder(RespCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        try {
            RespFrame frame = codec.decode(in);
            if (frame != null) {
                out.add(frame);
            }
        } catch (ProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) return;
        if (in.isReadable()) {
            Log.debug("Peer " + ctx.channel().remoteAddress() + " closed with "
                    + in.readableBytes() + " bytes of an incomplete frame");
            in.skipBytes(in.readableBytes());
        }
        out.add(RespFrame.END);
    }
}
