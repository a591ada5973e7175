package com.staydesk.platform;

import jakarta.annotation.PostConstruct;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Hooks;

@Slf4j
@SpringBootApplication
@EnableJpaRepositories
public class StayDeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(StayDeskApplication.class, args);
    }

    @PostConstruct
    public void init() {
        Hooks.enableAutomaticContextPropagation();
        log.info("Reactor automatic context propagation enabled");
    }
}
