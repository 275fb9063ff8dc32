package com.scholary.meeting.handler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeetingHandlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(MeetingHandlerApplication.class, args);
  }
}
