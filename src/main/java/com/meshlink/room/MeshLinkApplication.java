package com.meshlink.room;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeshLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshLinkApplication.class, args);
    }
}
