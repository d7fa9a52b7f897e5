package com.lusta.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_user")
public class UserEntity {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    /** 显示名，全局唯一（uk_username），注册后不可修改。 */
    private String username;

    private String passwordHash;

    private LocalDateTime createdAt;
}
