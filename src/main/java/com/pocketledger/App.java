package com.pocketledger;

import com.pocketledger.cli.MenuShell;
import com.pocketledger.cli.Terminal;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

public class App {

    public static void main(String[] args) {
        int code;
        try (ConfigurableApplicationContext context = new SpringApplicationBuilder(SpringConfig.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .run(args)) {
            code = context.getBean(MenuShell.class).run(Terminal.system());
        }
        System.exit(code);
    }
}
