package app.toolwatch;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import app.toolwatch.cli.OperatorCommandRunner;

@SpringBootApplication
@EnableScheduling
public class ToolwatchApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ToolwatchApplication.class);
        if (OperatorCommandRunner.isOperatorCommand(args)) {
            // Kommandos: kein Webserver, Logs auf stderr (Profil "cli")
            application.setWebApplicationType(WebApplicationType.NONE);
            application.setBannerMode(Banner.Mode.OFF);
            application.setAdditionalProfiles("cli");
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
