package io.hhplus.eventledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling  // 발행 실패 재시도 스케줄러 (PublicationRetryScheduler)
@ConfigurationPropertiesScan
public class EventLedgerApplication {

	public static void main(String[] args) {
		SpringApplication.run(EventLedgerApplication.class, args);
	}

}
