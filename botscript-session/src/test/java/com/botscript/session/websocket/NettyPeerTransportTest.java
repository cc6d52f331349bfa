package com.botscript.session.websocket;

import com.botscript.session.ConnectionEvent;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.util.ReferenceCountUtil;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NettyPeerTransportTest {

    private static int closeFramesWritten(EmbeddedChannel channel) {
        int count = 0;
        Object out;
        while ((out = channel.readOutbound()) != null) {
            if (out instanceof CloseWebSocketFrame) {
                count++;
            }
            ReferenceCountUtil.release(out);
        }
        return count;
    }

    @Test
    void close_sendsOneCloseFrame_andClosesTheChannel() {
        EmbeddedChannel channel = new EmbeddedChannel();
        NettyPeerTransport transport = new NettyPeerTransport(channel);

        transport.close();
        transport.close();

        assertEquals(1, closeFramesWritten(channel));
        assertFalse(channel.isActive());
    }

    @Test
    void close_afterPeerCloseWasClaimed_sendsNothing() {
        EmbeddedChannel channel = new EmbeddedChannel();
        NettyPeerTransport transport = new NettyPeerTransport(channel);

        assertTrue(transport.claimClose());
        transport.close();

        assertEquals(0, closeFramesWritten(channel));
        assertFalse(transport.claimClose());
        channel.finishAndReleaseAll();
    }

    @Test
    void frameOf_mapsMessageTypes() {
        WebSocketFrame text = NettyPeerTransport.frameOf(ConnectionEvent.TEXT_MESSAGE, "hi");
        WebSocketFrame binary = NettyPeerTransport.frameOf(ConnectionEvent.BINARY_MESSAGE, new byte[]{1, 2});
        try {
            assertEquals("hi", ((TextWebSocketFrame) text).text());
            assertEquals(2, ((BinaryWebSocketFrame) binary).content().readableBytes());
        } finally {
            text.release();
            binary.release();
        }
        assertThrows(IllegalArgumentException.class, () -> NettyPeerTransport.frameOf(9, "x"));
    }
}
