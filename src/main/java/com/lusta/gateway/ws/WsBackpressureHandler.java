package com.lusta.gateway.ws;

import com.lusta.gateway.config.WsBackpressureProperties;
import com.lusta.gateway.session.ConnectionSession;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 慢消费者保护：写缓冲越过高水位后开始计时，持续不可写超过阈值就断开。
 * 期间的推送由 {@link WsWriter} 直接判失败，消息保持 SENT。
 */
@Slf4j
public final class WsBackpressureHandler extends ChannelInboundHandlerAdapter {

    private final WsBackpressureProperties props;

    private long unwritableSinceMs;
    private ScheduledFuture<?> closeTask;

    public WsBackpressureHandler(WsBackpressureProperties props) {
        this.props = props;
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        if (props != null && props.enabledEffective()) {
            Channel ch = ctx.channel();
            if (ch.isWritable()) {
                reset();
            } else {
                onUnwritable(ch);
            }
        }
        super.channelWritabilityChanged(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        reset();
        super.channelInactive(ctx);
    }

    private void onUnwritable(Channel ch) {
        if (unwritableSinceMs <= 0) {
            unwritableSinceMs = System.currentTimeMillis();
        }
        long closeAfterMs = props.closeUnwritableAfterMsEffective();
        if (closeAfterMs < 0 || closeTask != null) {
            return;
        }
        closeTask = ch.eventLoop().schedule(() -> closeIfStillUnwritable(ch), closeAfterMs, TimeUnit.MILLISECONDS);
    }

    // 只在 eventLoop 上调用，字段无需同步
    private void closeIfStillUnwritable(Channel ch) {
        closeTask = null;
        if (!ch.isActive()) {
            return;
        }
        if (ch.isWritable()) {
            reset();
            return;
        }
        ConnectionSession session = ch.attr(ConnectionSession.ATTR_SESSION).get();
        log.warn("ws backpressure: closing slow consumer: session={}, unwritableMs={}, bytesBeforeWritable={}",
                session, System.currentTimeMillis() - unwritableSinceMs, ch.bytesBeforeWritable());
        ch.close();
    }

    private void reset() {
        unwritableSinceMs = 0;
        if (closeTask != null) {
            closeTask.cancel(false);
            closeTask = null;
        }
    }
}
