package com.lusta.domain.dto;

import java.util.List;

public record OnlineUsersDto(
        List<String> users,
        int count
) {
}
