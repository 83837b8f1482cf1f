package dev.talentmatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
@RequiredArgsConstructor
public class TalentMatchApplication implements CommandLineRunner, ExitCodeGenerator {

    private final ScreeningRunner screeningRunner;

    private int exitCode;

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TalentMatchApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        try {
            screeningRunner.execute();
            exitCode = 0;
        } catch (RuntimeException e) {
            log.error("Talent Match exiting with failure: {}", e.getMessage());
            exitCode = 1;
        }
        log.info("Talent Match exiting...");
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
