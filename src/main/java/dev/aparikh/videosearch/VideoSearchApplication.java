package dev.aparikh.videosearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VideoSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(VideoSearchApplication.class, args);
    }
}
