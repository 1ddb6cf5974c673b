package com.sommerph.zkkeyset;

import com.sommerph.zkkeyset.config.KeySetProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(KeySetProperties.class)
public class ZkKeySetApplication {

	public static void main(String[] args) {
		SpringApplication.run(ZkKeySetApplication.class, args);
	}

}
