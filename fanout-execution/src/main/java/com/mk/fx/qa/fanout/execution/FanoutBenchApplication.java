package com.mk.fx.qa.fanout.execution;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FanoutBenchApplication {

  public static void main(String[] args) {
    var application = new SpringApplication(FanoutBenchApplication.class);
    application.setWebApplicationType(WebApplicationType.NONE);
    System.exit(SpringApplication.exit(application.run(args)));
  }
}
