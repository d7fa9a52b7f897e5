package com.lusta.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.auth.service.AuthService;
import com.lusta.gateway.config.GatewayProperties;
import com.lusta.gateway.config.WsBackpressureProperties;
import com.lusta.gateway.config.WsInboundQueueProperties;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 实时通道：独立于 Spring MVC 的 Netty WebSocket 服务，随 Spring 容器启停。
 */
@Slf4j
@Component
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final WsBackpressureProperties backpressureProps;
    private final WsInboundQueueProperties inboundQueueProps;
    private final ObjectMapper objectMapper;
    private final AuthService authService;
    private final MessageRouter router;
    private final WsWriter wsWriter;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         WsBackpressureProperties backpressureProps,
                         WsInboundQueueProperties inboundQueueProps,
                         ObjectMapper objectMapper,
                         AuthService authService,
                         MessageRouter router,
                         WsWriter wsWriter) {
        this.props = props;
        this.backpressureProps = backpressureProps;
        this.inboundQueueProps = inboundQueueProps;
        this.objectMapper = objectMapper;
        this.authService = authService;
        this.router = router;
        this.wsWriter = wsWriter;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("starting ws gateway on {}:{}{}", props.host(), props.port(), props.path());

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));
                        // readerIdle 内没有任何入站（包括 pong）视为对端已死；writerIdle 内没写过就发 ping
                        p.addLast(new IdleStateHandler(props.readerIdleSecondsEffective(), props.writerIdleSecondsEffective(), 0));
                        p.addLast(new WsHandshakeAuthHandler(props.path(), authService));
                        p.addLast(new WebSocketServerProtocolHandler(WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(props.path())
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build()));
                        p.addLast(new WsBackpressureHandler(backpressureProps));
                        p.addLast(new WsFrameHandler(objectMapper, router, wsWriter, inboundQueueProps));
                    }
                });

        if (backpressureProps.enabledEffective()) {
            b.childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                    backpressureProps.lowWaterMarkBytesEffective(),
                    backpressureProps.highWaterMarkBytesEffective()));
        }

        try {
            serverChannel = b.bind(props.host(), props.port()).syncUninterruptibly().channel();
            log.info("ws gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("failed to start ws gateway on {}:{}{}", props.host(), props.port(), props.path(), e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("stopping ws gateway");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("ws gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 晚于数据源等基础设施启动、早于它们停止
        return Integer.MAX_VALUE - 1000;
    }
}
