package io.b2mash.b2b.dunning.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Business clock. Overdue detection, notice timestamps and sweep dates all read "now" from this
 * bean, so tests can replace it with {@link Clock#fixed}.
 */
@Configuration
public class ClockConfig {

  @Bean
  public ZoneId businessZoneId(@Value("${dunning.clock.zone:Europe/Berlin}") String zone) {
    return ZoneId.of(zone);
  }

  @Bean
  public Clock businessClock(ZoneId businessZoneId) {
    return Clock.system(businessZoneId);
  }
}
