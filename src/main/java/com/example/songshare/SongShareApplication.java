package com.example.songshare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SongShareApplication {

    public static void main(String[] args) {
        SpringApplication.run(SongShareApplication.class, args);
    }
}
