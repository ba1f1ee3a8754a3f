package com.deepansh.chatagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "telegram")
@Data
public class TelegramProperties {

    private String botToken = "";
    private String baseUrl = "https://api.telegram.org";
}
