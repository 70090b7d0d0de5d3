package com.invitehunter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InviteHunterApplication {

  public static void main(String[] args) {
    SpringApplication.run(InviteHunterApplication.class, args);
  }
}
