package com.imperium.identitygate.model.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageListResponse {

    private String conversationId;
    private int messageCount;
    private List<MessageItemDto> messages;
}
