package com.lusta.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lusta.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
