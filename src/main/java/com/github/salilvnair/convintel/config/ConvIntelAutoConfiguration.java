package com.github.salilvnair.convintel.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@AutoConfiguration
@AutoConfigurationPackage(basePackages = "com.github.salilvnair.convintel")
@ComponentScan(basePackages = "com.github.salilvnair.convintel")
@EntityScan(basePackages = "com.github.salilvnair.convintel.entity")
@EnableJpaRepositories(basePackages = "com.github.salilvnair.convintel.repo")
public class ConvIntelAutoConfiguration {
}
