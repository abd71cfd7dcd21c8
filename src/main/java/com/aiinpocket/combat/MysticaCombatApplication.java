package com.aiinpocket.combat;

import com.aiinpocket.combat.config.CombatProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CombatProperties.class)
public class MysticaCombatApplication {

    public static void main(String[] args) {
        SpringApplication.run(MysticaCombatApplication.class, args);
    }
}
