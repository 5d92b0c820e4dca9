package jobtrack.gmail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.PropertySource;


@PropertySource(value = "file:./src/main/resources/secrets.properties", ignoreResourceNotFound = true)
@SpringBootApplication
public class GmailSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(GmailSyncApplication.class, args);
    }

}
