package com.example.subtitlecodec;

import com.example.subtitlecodec.cli.ConvertCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class SubtitleCodecApplication {

    public static void main(String[] args) {
        if (args.length > 0 && ConvertCommand.NAME.equals(args[0])) {
            // one-shot conversion: no web server, exit with the command's status
            ConfigurableApplicationContext context = new SpringApplicationBuilder(SubtitleCodecApplication.class)
                    .web(WebApplicationType.NONE)
                    .logStartupInfo(false)
                    .run(args);
            System.exit(SpringApplication.exit(context));
        }
        SpringApplication.run(SubtitleCodecApplication.class, args);
    }
}
