package com.lusta.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息投递状态（对应表字段：t_message.delivery_state）。
 *
 * <p>数字与类型映射：</p>
 * <ul>
 *   <li>0 = 已发送（SENT）：已落库，接收方尚未在线收到</li>
 *   <li>1 = 已投递（DELIVERED）：实时推送写入接收方连接成功</li>
 *   <li>2 = 已读（READ）：接收方拉取了与发送方的历史</li>
 * </ul>
 *
 * <p>状态只能按 code 单调前进，不允许回退；落库侧用 {@code where delivery_state < target} 保证。</p>
 */
@Getter
@RequiredArgsConstructor
public enum DeliveryState {

    SENT(0, "sent"),
    DELIVERED(1, "delivered"),
    READ(2, "read");

    @EnumValue
    private final Integer code;

    private final String desc;

    public boolean canAdvanceTo(DeliveryState target) {
        return target != null && target.code > this.code;
    }
}
