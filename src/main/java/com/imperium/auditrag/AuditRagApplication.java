package com.imperium.auditrag;

import com.imperium.auditrag.config.DotenvLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AuditRagApplication {

    public static void main(String[] args) {
        DotenvLoader.load(); // 加载 .env 到系统属性，供 application.yaml 中的 ${VAR} 使用
        SpringApplication.run(AuditRagApplication.class, args);
    }
}
