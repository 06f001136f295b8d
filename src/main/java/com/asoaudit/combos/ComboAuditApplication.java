package com.asoaudit.combos;

import com.asoaudit.combos.config.ComboProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ComboProperties.class)
public class ComboAuditApplication {
    public static void main(String[] args) {
        SpringApplication.run(ComboAuditApplication.class, args);
    }
}
