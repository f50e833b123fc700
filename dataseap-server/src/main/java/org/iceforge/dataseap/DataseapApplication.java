package org.iceforge.dataseap;

import org.iceforge.dataseap.config.EngineProperties;
import org.iceforge.dataseap.ingest.IngestProperties;
import org.iceforge.dataseap.search.SearchProperties;
import org.iceforge.dataseap.txn.TransactionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({EngineProperties.class, SearchProperties.class,
		TransactionProperties.class, IngestProperties.class})
public class DataseapApplication {

	public static void main(String[] args) {
		SpringApplication.run(DataseapApplication.class, args);
	}
}
