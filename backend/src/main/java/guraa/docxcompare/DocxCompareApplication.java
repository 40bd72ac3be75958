package guraa.docxcompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for the DOCX comparison service.
 */
@Slf4j
@SpringBootApplication
public class DocxCompareApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();
        SpringApplication.run(DocxCompareApplication.class, args);
        logStartupInfo(Duration.between(startTime, Instant.now()));
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("DOCX Compare application started in {}.{}s",
                startupTime.toSecondsPart() + startupTime.toMinutes() * 60, String.format("%03d", startupTime.toMillisPart()));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }
}
