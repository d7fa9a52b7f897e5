package com.lusta.domain.controller;

import com.lusta.auth.web.AuthContext;
import com.lusta.common.api.AuthFailureException;
import com.lusta.common.api.Result;
import com.lusta.domain.dto.ConversationSummaryDto;
import com.lusta.domain.dto.HistoryMessageDto;
import com.lusta.domain.service.ChatSummaryService;
import com.lusta.domain.store.InMemoryMessageStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatControllerTest {

    private InMemoryMessageStore store;
    private ChatController controller;
    private long alice;
    private long bob;

    @BeforeEach
    void setUp() {
        store = new InMemoryMessageStore();
        controller = new ChatController(new ChatSummaryService(store));
        alice = store.createUser("alice", "h").getId();
        bob = store.createUser("bob", "h").getId();
        store.createMessage(alice, bob, "hi", LocalDateTime.now());
    }

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void anonymousCaller_isRejected() {
        assertThatThrownBy(() -> controller.chats())
                .isInstanceOf(AuthFailureException.class)
                .hasMessage("unauthorized");
        assertThatThrownBy(() -> controller.history(alice))
                .isInstanceOf(AuthFailureException.class);
    }

    @Test
    void chatsThenHistory_forCaller() {
        AuthContext.setUserId(bob);

        Result<List<ConversationSummaryDto>> chats = controller.chats();
        assertThat(chats.ok()).isTrue();
        assertThat(chats.data()).singleElement().satisfies(c -> {
            assertThat(c.partnerUsername()).isEqualTo("alice");
            assertThat(c.unreadCount()).isEqualTo(1);
        });

        Result<List<HistoryMessageDto>> history = controller.history(alice);
        assertThat(history.data()).extracting(HistoryMessageDto::content).containsExactly("hi");
        assertThat(controller.chats().data().get(0).unreadCount()).isZero();
    }

    @Test
    void badPartnerId_isRejected() {
        AuthContext.setUserId(bob);

        assertThatThrownBy(() -> controller.history(0L)).isInstanceOf(IllegalArgumentException.class);
    }
}
