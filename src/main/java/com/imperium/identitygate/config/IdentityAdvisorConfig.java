package com.imperium.identitygate.config;

import com.imperium.identitygate.ai.advisor.IdentityContextAdvisor;
import com.imperium.identitygate.service.AgentTurnContextService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 提供 {@link IdentityContextAdvisor} bean，宿主的 ChatClient 通过 defaultAdvisors(...) 挂载。
 * order 越小越先执行；身份块需要先于记忆检索类 Advisor 注入。
 */
@Configuration
public class IdentityAdvisorConfig {

    @Bean
    public IdentityContextAdvisor identityContextAdvisor(AgentTurnContextService contextService,
            @Value("${app.identity.advisor.order:0}") int order) {
        return new IdentityContextAdvisor(contextService, order);
    }
}
