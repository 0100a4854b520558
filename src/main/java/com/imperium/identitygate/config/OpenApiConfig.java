package com.imperium.identitygate.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI identityGateOpenApi(@Value("${server.port:8094}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("IdentityGate API")
                        .description("跨渠道用户身份解析、记忆作用域与会话消息落库接口")
                        .version("v0")
                        .contact(new Contact().name("IdentityGate Team")))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local")
                ));
    }
}
