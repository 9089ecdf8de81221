package com.webhookinbox.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.webhookinbox")
public class WebhookInboxApp {

    public static void main(String[] args) {
        SpringApplication.run(WebhookInboxApp.class, args);
    }
}
