package com.lusta.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lusta.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 会话对端：我发给过的人 ∪ 发给过我的人（union 已去重）。
     */
    @Select("""
            select receiver_id as partner_id
            from t_message
            where sender_id = #{userId}
            union
            select sender_id as partner_id
            from t_message
            where receiver_id = #{userId}
            """)
    List<Long> selectPartnerIds(@Param("userId") long userId);
}
