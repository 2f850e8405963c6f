package hvlc.billing.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BillingIngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(BillingIngestApplication.class, args);
    }
}
