package me.go_gradually.liveavatar.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "me.go_gradually.liveavatar")
public class LiveAvatarApplication {
    public static void main(String[] args) {
        SpringApplication.run(LiveAvatarApplication.class, args);
    }
}
