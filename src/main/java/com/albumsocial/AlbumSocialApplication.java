package com.albumsocial;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AlbumSocialApplication {
    public static void main(String[] args) {
        SpringApplication.run(AlbumSocialApplication.class, args);
    }
}
