package com.lusta.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.lusta.domain.enums.DeliveryState;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 单聊消息。除 deliveryState 外创建后不可变，也不会删除。
 */
@Data
@TableName("t_message")
public class MessageEntity {

    /** msgId，数据库自增，created_at 相同时用它排序。 */
    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    private Long senderId;

    private Long receiverId;

    private String content;

    /** 投递状态：见 {@link DeliveryState}（数据库存数字）。 */
    private DeliveryState deliveryState;

    private LocalDateTime createdAt;
}
