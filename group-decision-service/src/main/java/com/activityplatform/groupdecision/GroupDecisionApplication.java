package com.activityplatform.groupdecision;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GroupDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupDecisionApplication.class, args);
    }
}
