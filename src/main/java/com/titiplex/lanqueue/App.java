package com.titiplex.lanqueue;

import com.titiplex.lanqueue.ui.QueueRunner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

public class App {

    public static void main(String[] args) throws InterruptedException {
        ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .run(args);
        try {
            context.getBean(QueueRunner.class).awaitExit();
        } finally {
            context.close();
        }
    }
}
