package io.b2mash.timesheet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TimesheetApplication {

  public static void main(String[] args) {
    SpringApplication.run(TimesheetApplication.class, args);
  }
}
