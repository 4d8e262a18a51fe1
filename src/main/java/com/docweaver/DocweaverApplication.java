package com.docweaver;

import com.docweaver.dispatch.cli.DocweaverCli;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Runs either the HTTP server ({@code docweaver serve}) or a single CLI command, after which
 * the process exits with that command's exit code.
 */
@SpringBootApplication
public class DocweaverApplication {

    public static void main(String[] args) {
        boolean serveMode = DocweaverCli.isServeMode(args);
        ConfigurableApplicationContext context = new SpringApplicationBuilder(DocweaverApplication.class)
                .web(serveMode ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .run(args);
        if (serveMode) {
            return;
        }
        int exitCode = context.getBean(DocweaverCli.class).execute(args);
        System.exit(SpringApplication.exit(context, () -> exitCode));
    }
}
