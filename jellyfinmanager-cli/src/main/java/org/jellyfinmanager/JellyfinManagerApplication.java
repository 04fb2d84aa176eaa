package org.jellyfinmanager;

import org.jellyfinmanager.config.CommandLineAliases;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JellyfinManagerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(JellyfinManagerApplication.class, CommandLineAliases.expand(args))));
    }
}
