package com.lusta.gateway.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.lusta.domain.dto.Identity;
import com.lusta.domain.entity.MessageEntity;
import lombok.Data;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * WS 文本协议的信封：每个 TextWebSocketFrame 都是一个 JSON 对象。
 *
 * <p>入站帧用 action 区分（send_message / get_online_users），出站帧用 type 区分
 * （new_message / message_sent / online_users / error）。字段名沿用 snake_case 线上格式。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WsEnvelope {

    public static final String ACTION_SEND_MESSAGE = "send_message";
    public static final String ACTION_GET_ONLINE_USERS = "get_online_users";

    public static final String TYPE_NEW_MESSAGE = "new_message";
    public static final String TYPE_MESSAGE_SENT = "message_sent";
    public static final String TYPE_ONLINE_USERS = "online_users";
    public static final String TYPE_ERROR = "error";

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    /** 入站动作。未知 action 直接忽略，便于向前兼容。 */
    private String action;

    /** 出站类型。 */
    private String type;

    /** send_message：接收方显示名；message_sent：回显接收方显示名。 */
    private String to;

    /** new_message：发送方显示名。 */
    private String from;

    /** new_message：发送方 userId。 */
    @JsonProperty("from_id")
    private Long fromId;

    /** 消息正文；error 帧里是给人看的说明。 */
    private String message;

    @JsonProperty("message_id")
    private Long messageId;

    /** 消息落库时间，ISO-8601（不带时区，服务端本地时间）。 */
    private String timestamp;

    private List<String> users;

    private Integer count;

    /** error 帧：稳定的机器可读原因。 */
    private String reason;

    public static WsEnvelope newMessage(Identity sender, MessageEntity saved) {
        WsEnvelope out = new WsEnvelope();
        out.type = TYPE_NEW_MESSAGE;
        out.from = sender.username();
        out.fromId = sender.userId();
        out.message = saved.getContent();
        out.timestamp = formatTimestamp(saved.getCreatedAt());
        out.messageId = saved.getId();
        return out;
    }

    public static WsEnvelope messageSent(String to, MessageEntity saved) {
        WsEnvelope out = new WsEnvelope();
        out.type = TYPE_MESSAGE_SENT;
        out.to = to;
        out.messageId = saved.getId();
        out.timestamp = formatTimestamp(saved.getCreatedAt());
        return out;
    }

    public static WsEnvelope onlineUsers(List<String> users) {
        WsEnvelope out = new WsEnvelope();
        out.type = TYPE_ONLINE_USERS;
        out.users = users;
        out.count = users.size();
        return out;
    }

    public static WsEnvelope error(String reason, String message) {
        WsEnvelope out = new WsEnvelope();
        out.type = TYPE_ERROR;
        out.reason = reason;
        out.message = message;
        return out;
    }

    static String formatTimestamp(LocalDateTime time) {
        return time == null ? null : TIMESTAMP_FORMAT.format(time);
    }
}
