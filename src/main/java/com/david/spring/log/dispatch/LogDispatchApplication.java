package com.david.spring.log.dispatch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication
public class LogDispatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(LogDispatchApplication.class, args);
    }
}
