package org.devfriend.webserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "org.devfriend.webserver")
@EntityScan(basePackages = {
        "org.devfriend.core.model"
})
@ComponentScan(basePackages = {
        "org.devfriend.webserver",
        "org.devfriend.providerclient",
        "org.devfriend.security.jwt.utils",
        "org.devfriend.security.web",
        "org.devfriend.security.service"
})
@EnableJpaRepositories(basePackages = "org.devfriend.core.persistence.repository")
@EnableScheduling
public class WebserverApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebserverApplication.class, args);
    }
}
