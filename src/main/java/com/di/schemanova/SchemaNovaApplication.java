package com.di.schemanova;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

@SpringBootApplication
@EnableAspectJAutoProxy
public class SchemaNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(SchemaNovaApplication.class, args);
	}
}
