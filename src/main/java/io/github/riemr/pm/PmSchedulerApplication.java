package io.github.riemr.pm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PmSchedulerApplication {

	public static void main(String[] args) {
		SpringApplication.run(PmSchedulerApplication.class, args);
	}

}
