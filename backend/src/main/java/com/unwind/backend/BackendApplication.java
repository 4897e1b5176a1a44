package com.unwind.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

/**
 * The pool is owned by {@code PooledQueryExecutor}, not by Boot's auto-configured
 * {@code DataSource}.
 */
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class BackendApplication {

	public static void main(String[] args) {
		// Fix default JVM timezone to UTC for consistent logs and token timestamps
		TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
		SpringApplication.run(BackendApplication.class, args);
	}

}
