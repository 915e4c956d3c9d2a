package com.flamingo.pagination;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Boots the pagination core as a standalone Spring application. */
@SpringBootApplication
public class PaginationApplication {

  public static void main(String[] args) {
    SpringApplication.run(PaginationApplication.class, args);
  }
}
