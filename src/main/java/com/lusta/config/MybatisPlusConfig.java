package com.lusta.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.lusta.**.mapper")
public class MybatisPlusConfig {
}
