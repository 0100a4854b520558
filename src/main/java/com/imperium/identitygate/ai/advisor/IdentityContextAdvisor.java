package com.imperium.identitygate.ai.advisor;

import com.imperium.identitygate.model.identity.AgentTurnContext;
import com.imperium.identitygate.service.AgentTurnContextService;
import org.springframework.ai.chat.client.ChatClientRequest;
import org.springframework.ai.chat.client.ChatClientResponse;
import org.springframework.ai.chat.client.advisor.api.CallAdvisor;
import org.springframework.ai.chat.client.advisor.api.CallAdvisorChain;
import org.springframework.ai.chat.client.advisor.api.StreamAdvisor;
import org.springframework.ai.chat.client.advisor.api.StreamAdvisorChain;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.HashMap;
import java.util.Map;

/**
 * 身份上下文 Advisor：
 * - 从 ChatClientRequest context 读取 {@link #SESSION_KEY}（必填）与 {@link #MESSAGE_PROVIDER}（可选）
 * - 调用 {@link AgentTurnContextService} 解析身份与记忆作用域
 * - 把 [USER_IDENTITY] / [MEMORY_SCOPE] 文本拼到 user message 前面，并将结构化结果放入 context（key: {@link #TURN_CONTEXT}）
 * 上下文为空（共享会话、库不可用等）时请求原样下传。
 */
public class IdentityContextAdvisor implements CallAdvisor, StreamAdvisor {

    public static final String SESSION_KEY = "identity_session_key";
    public static final String MESSAGE_PROVIDER = "identity_message_provider";
    public static final String TURN_CONTEXT = "identity_turn_context";

    private final AgentTurnContextService contextService;
    private final int order;

    public IdentityContextAdvisor(AgentTurnContextService contextService, int order) {
        this.contextService = contextService;
        this.order = order;
    }

    @Override
    public String getName() {
        return this.getClass().getSimpleName();
    }

    @Override
    public int getOrder() {
        return this.order;
    }

    @Override
    public ChatClientResponse adviseCall(ChatClientRequest chatClientRequest, CallAdvisorChain callAdvisorChain) {
        return callAdvisorChain.nextCall(prependIdentity(chatClientRequest));
    }

    @Override
    public Flux<ChatClientResponse> adviseStream(ChatClientRequest chatClientRequest, StreamAdvisorChain chain) {
        return Mono.just(chatClientRequest)
                .publishOn(Schedulers.boundedElastic())
                .map(this::prependIdentity)
                .flatMapMany(chain::nextStream);
    }

    ChatClientRequest prependIdentity(ChatClientRequest chatClientRequest) {
        if (chatClientRequest == null || chatClientRequest.prompt() == null
                || chatClientRequest.prompt().getUserMessage() == null) {
            return chatClientRequest;
        }
        Map<String, Object> context = chatClientRequest.context() != null ? chatClientRequest.context() : Map.of();
        String sessionKey = asText(context.get(SESSION_KEY));
        if (sessionKey == null) {
            return chatClientRequest;
        }

        AgentTurnContext turn = contextService.buildContext(sessionKey, asText(context.get(MESSAGE_PROVIDER)));
        if (turn.isEmpty()) {
            return chatClientRequest;
        }

        String userText = chatClientRequest.prompt().getUserMessage().getText();
        String augmented = turn.prependContext() + "\n\n" + (userText != null ? userText : "");

        Map<String, Object> ctx = new HashMap<>(context);
        ctx.put(TURN_CONTEXT, turn);

        return chatClientRequest.mutate()
                .prompt(chatClientRequest.prompt().augmentUserMessage(augmented))
                .context(ctx)
                .build();
    }

    private static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString();
        return s.isBlank() ? null : s;
    }
}
