package minikv.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import minikv.protocol.RespCodec;
import minikv.protocol.RespFrame;

/**
 * Writes outbound {@link RespFrame}s in their wire form.
 */
@ChannelHandler.Sharable
public class NettyRespEncoder extends MessageToByteEncoder<RespFrame> {

    private final RespCodec codec;

    public NettyRespEncoder() {
        this(RespCodec.DEFAULT);
    }

    public NettyRespEncoder(RespCodec codec) {
        super(RespFrame.class);
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RespFrame msg, ByteBuf out) {
        codec.encode(msg, out);
    }
}
