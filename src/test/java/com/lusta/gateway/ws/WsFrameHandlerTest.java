package com.lusta.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lusta.domain.cache.UserDirectoryCache;
import com.lusta.domain.config.MessagePolicyProperties;
import com.lusta.domain.config.UserDirectoryCacheProperties;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.entity.MessageEntity;
import com.lusta.domain.entity.UserEntity;
import com.lusta.domain.store.InMemoryMessageStore;
import com.lusta.gateway.config.WsBackpressureProperties;
import com.lusta.gateway.config.WsInboundQueueProperties;
import com.lusta.gateway.config.WsPushProperties;
import com.lusta.gateway.session.ConnectionSession;
import com.lusta.gateway.session.PresenceRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class WsFrameHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WsWriter writer = new WsWriter(objectMapper, new WsBackpressureProperties(null, null, null, null, null));

    private InMemoryMessageStore store;
    private PresenceRegistry presence;
    private MessageRouter router;
    private Identity alice;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        presence = new PresenceRegistry();
        router = new MessageRouter(presence, store,
                new UserDirectoryCache(store, new UserDirectoryCacheProperties()),
                new MessagePolicyProperties(null, null, null),
                new WsPushProperties(null),
                Runnable::run);
        UserEntity a = store.createUser("alice", "h");
        store.createUser("bob", "h");
        alice = new Identity(a.getId(), a.getUsername());
    }

    private EmbeddedChannel handshaken(MessageRouter router, int maxPending) {
        WsFrameHandler handler = new WsFrameHandler(objectMapper, router, writer, new WsInboundQueueProperties(maxPending));
        EmbeddedChannel ch = new EmbeddedChannel(handler);
        ch.attr(WsHandshakeAuthHandler.ATTR_IDENTITY).set(alice);
        handler.onHandshakeComplete(ch);
        return ch;
    }

    @Test
    void handshakeComplete_registersActiveSession() {
        EmbeddedChannel ch = handshaken(router, 16);

        ConnectionSession session = ch.attr(ConnectionSession.ATTR_SESSION).get();
        assertThat(session).isNotNull();
        assertThat(session.state()).isEqualTo(ConnectionSession.State.ACTIVE);
        assertThat(presence.lookup(alice.userId())).isSameAs(session);
    }

    @Test
    void handshakeWithoutIdentity_closesChannel() {
        WsFrameHandler handler = new WsFrameHandler(objectMapper, router, writer, new WsInboundQueueProperties(16));
        EmbeddedChannel ch = new EmbeddedChannel(handler);
        handler.onHandshakeComplete(ch);

        assertThat(ch.isActive()).isFalse();
        assertThat(presence.onlineCount()).isZero();
    }

    @Test
    void textFrame_isRoutedAndAcked() throws Exception {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.writeInbound(new TextWebSocketFrame("{\"action\":\"send_message\",\"to\":\"bob\",\"message\":\"hi\"}"));

        TextWebSocketFrame out = ch.readOutbound();
        try {
            WsEnvelope ack = objectMapper.readValue(out.text(), WsEnvelope.class);
            assertThat(ack.getType()).isEqualTo(WsEnvelope.TYPE_MESSAGE_SENT);
            assertThat(ack.getTo()).isEqualTo("bob");
        } finally {
            out.release();
        }
        assertThat(store.countMessages()).isEqualTo(1);
    }

    @Test
    void backToBackSends_persistInArrivalOrderOnPooledDbExecutor() throws Exception {
        int n = 40;
        ExecutorService db = Executors.newFixedThreadPool(4);
        try {
            MessageRouter pooled = new MessageRouter(presence, store,
                    new UserDirectoryCache(store, new UserDirectoryCacheProperties()),
                    new MessagePolicyProperties(null, null, null),
                    new WsPushProperties(null),
                    db);
            EmbeddedChannel ch = handshaken(pooled, n);

            for (int i = 0; i < n; i++) {
                ch.writeInbound(new TextWebSocketFrame(
                        "{\"action\":\"send_message\",\"to\":\"bob\",\"message\":\"m" + i + "\"}"));
            }

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (store.countMessages() < n || WsChannelSerialQueue.pending(ch) > 0) {
                assertThat(System.nanoTime()).as("all sends settled").isLessThan(deadline);
                Thread.sleep(5);
            }

            List<Long> ackIds = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                TextWebSocketFrame out = ch.readOutbound();
                assertThat(out).isNotNull();
                try {
                    WsEnvelope ack = objectMapper.readValue(out.text(), WsEnvelope.class);
                    assertThat(ack.getType()).isEqualTo(WsEnvelope.TYPE_MESSAGE_SENT);
                    ackIds.add(ack.getMessageId());
                } finally {
                    out.release();
                }
            }
            assertThat(ackIds).isSorted().doesNotHaveDuplicates();

            long bobId = store.findUserByUsername("bob").getId();
            List<String> contents = new ArrayList<>();
            for (MessageEntity m : store.findConversation(alice.userId(), bobId)) {
                contents.add(m.getContent());
            }
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                expected.add("m" + i);
            }
            assertThat(contents).containsExactlyElementsOf(expected);
        } finally {
            db.shutdownNow();
        }
    }

    @Test
    void unknownFieldsAreTolerated() {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.writeInbound(new TextWebSocketFrame("{\"action\":\"get_online_users\",\"extra\":{\"x\":1}}"));

        TextWebSocketFrame out = ch.readOutbound();
        try {
            assertThat(out.text()).contains("\"type\":\"online_users\"");
        } finally {
            out.release();
        }
    }

    @Test
    void malformedFrame_closesWithProtocolErrorAndDeregisters() {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.writeInbound(new TextWebSocketFrame("not json"));

        CloseWebSocketFrame close = ch.readOutbound();
        try {
            assertThat(close.statusCode()).isEqualTo(ConnectionSession.CLOSE_PROTOCOL_ERROR);
            assertThat(close.reasonText()).isEqualTo("protocol_error");
        } finally {
            close.release();
        }
        assertThat(ch.isActive()).isFalse();
        assertThat(presence.lookup(alice.userId())).isNull();
        assertThat(store.countMessages()).isZero();
    }

    @Test
    void jsonNull_isTreatedAsMalformed() {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.writeInbound(new TextWebSocketFrame("null"));

        assertThat(ch.isActive()).isFalse();
    }

    @Test
    void channelClose_deregisters() {
        EmbeddedChannel ch = handshaken(router, 16);
        ConnectionSession session = ch.attr(ConnectionSession.ATTR_SESSION).get();

        ch.close();

        assertThat(presence.lookup(alice.userId())).isNull();
        assertThat(session.state()).isEqualTo(ConnectionSession.State.CLOSED);
    }

    @Test
    void queueOverflow_repliesServerBusy() throws Exception {
        MessageRouter stuck = mock(MessageRouter.class);
        when(stuck.handle(any(), any())).thenReturn(new CompletableFuture<>());
        EmbeddedChannel ch = handshaken(stuck, 1);

        ch.writeInbound(new TextWebSocketFrame("{\"action\":\"get_online_users\"}"));
        ch.writeInbound(new TextWebSocketFrame("{\"action\":\"get_online_users\"}"));

        TextWebSocketFrame out = ch.readOutbound();
        try {
            WsEnvelope err = objectMapper.readValue(out.text(), WsEnvelope.class);
            assertThat(err.getType()).isEqualTo(WsEnvelope.TYPE_ERROR);
            assertThat(err.getReason()).isEqualTo(MessageRouter.REASON_SERVER_BUSY);
        } finally {
            out.release();
        }
    }

    @Test
    void writerIdle_sendsPing() {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.pipeline().fireUserEventTriggered(IdleStateEvent.WRITER_IDLE_STATE_EVENT);

        Object out = ch.readOutbound();
        assertThat(out).isInstanceOf(PingWebSocketFrame.class);
        ((PingWebSocketFrame) out).release();
        assertThat(ch.isActive()).isTrue();
    }

    @Test
    void readerIdle_closesAndDeregisters() {
        EmbeddedChannel ch = handshaken(router, 16);

        ch.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);

        assertThat(ch.isActive()).isFalse();
        assertThat(presence.onlineCount()).isZero();
    }
}
