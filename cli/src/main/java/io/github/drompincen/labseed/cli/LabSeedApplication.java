package io.github.drompincen.labseed.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.labseed")
public class LabSeedApplication {

    public static void main(String[] args) {
        SeedArguments arguments;
        try {
            arguments = SeedArguments.parse(args, System.getenv());
        } catch (IllegalArgumentException e) {
            System.err.println("  " + e.getMessage() + "\n");
            System.err.print(SeedArguments.USAGE);
            System.exit(1);
            return;
        }

        arguments.toProperties().forEach(System::setProperty);
        System.exit(SpringApplication.exit(SpringApplication.run(LabSeedApplication.class)));
    }
}
