package com.yoursp.oauthconnect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OAuthConnectApplication {

    public static void main(String[] args) {
        SpringApplication.run(OAuthConnectApplication.class, args);
    }
}
