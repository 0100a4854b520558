package com.imperium.identitygate.model.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LedgerEventResponse {

    /** recorded | empty | skipped | ignored */
    private String status;
    private String role;
    private String conversationId;
    private String messageId;
}
