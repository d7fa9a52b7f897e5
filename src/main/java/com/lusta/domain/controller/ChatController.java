package com.lusta.domain.controller;

import com.lusta.auth.web.AuthContext;
import com.lusta.common.api.Result;
import com.lusta.domain.dto.ConversationSummaryDto;
import com.lusta.domain.dto.HistoryMessageDto;
import com.lusta.domain.service.ChatSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
public class ChatController {

    private final ChatSummaryService chatSummaryService;

    @GetMapping("/chats")
    public Result<List<ConversationSummaryDto>> chats() {
        long userId = AuthContext.requireUserId();
        return Result.ok(chatSummaryService.conversationsFor(userId));
    }

    /**
     * 与 partnerId 的完整历史。拉取即已读：对方发给我的未读消息会被标为 READ。
     */
    @GetMapping("/messages/{partnerId}")
    public Result<List<HistoryMessageDto>> history(@PathVariable Long partnerId) {
        long userId = AuthContext.requireUserId();
        if (partnerId == null || partnerId <= 0) {
            throw new IllegalArgumentException("bad_partner_id");
        }
        return Result.ok(chatSummaryService.history(userId, partnerId));
    }
}
