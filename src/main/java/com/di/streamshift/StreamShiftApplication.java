package com.di.streamshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;

/**
 * Boots the StreamShift context. Hosts obtain
 * {@link com.di.streamshift.relation.WarehouseSourceProvider} from it.
 */
@SpringBootApplication(exclude = {
		DataSourceAutoConfiguration.class,
		DataSourceTransactionManagerAutoConfiguration.class
})
public class StreamShiftApplication {

	public static void main(String[] args) {
		SpringApplication.run(StreamShiftApplication.class, args);
	}
}
