package com.tencent.taskboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Taskboard Application Entry Point
 *
 * @author taskboard
 */
@SpringBootApplication(scanBasePackages = "com.tencent.taskboard")
public class TaskboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskboardApplication.class, args);
    }
}
