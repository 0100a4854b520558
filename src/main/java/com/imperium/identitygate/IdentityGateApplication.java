package com.imperium.identitygate;

import com.imperium.identitygate.config.DotenvLoader;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("com.imperium.identitygate.mapper")
public class IdentityGateApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，DATABASE_URL 会被转换为 JDBC 形式
        SpringApplication.run(IdentityGateApplication.class, args);
    }
}
