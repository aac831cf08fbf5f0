package com.williamcallahan.docarchive;

import com.williamcallahan.docarchive.cli.ManagementCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DocArchiveApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(DocArchiveApplication.class);
        boolean managementCommand = args.length > 0 && ManagementCommand.fromName(args[0]).isPresent();
        if (managementCommand) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        ConfigurableApplicationContext context = application.run(args);
        if (managementCommand) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
