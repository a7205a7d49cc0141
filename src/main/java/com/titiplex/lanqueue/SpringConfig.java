package com.titiplex.lanqueue;

import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SpringConfig {
}
