package my.creativeaudit.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for job timestamps, deadlines and the stale-job cutoff. All stored times are UTC.
 */
@Configuration
public class TimeConfig {
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}
}
