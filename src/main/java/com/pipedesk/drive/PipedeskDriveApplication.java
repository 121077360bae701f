package com.pipedesk.drive;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@SpringBootApplication
@EnableTransactionManagement
@EnableAsync
public class PipedeskDriveApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipedeskDriveApplication.class, args);
    }

}
