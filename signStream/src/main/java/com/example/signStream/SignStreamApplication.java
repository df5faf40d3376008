package com.example.signStream;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.example.signStream.config.ConnectionProperties;
import com.example.signStream.config.DetectorProperties;
import com.example.signStream.config.GestureProperties;
import com.example.signStream.config.VideoProperties;

@SpringBootApplication(scanBasePackages = "com.example.signStream")
@MapperScan("com.example.signStream.mapper")
@EnableConfigurationProperties({
    VideoProperties.class,
    GestureProperties.class,
    DetectorProperties.class,
    ConnectionProperties.class
})
public class SignStreamApplication {
  public static void main(String[] args) {
    SpringApplication.run(SignStreamApplication.class, args);
  }
}
