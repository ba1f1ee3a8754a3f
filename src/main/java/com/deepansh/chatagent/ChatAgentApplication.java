package com.deepansh.chatagent;

import com.deepansh.chatagent.config.AgentProperties;
import com.deepansh.chatagent.config.TelegramProperties;
import com.deepansh.chatagent.config.ToolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, TelegramProperties.class})
public class ChatAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChatAgentApplication.class, args);
    }
}
