package com.retailerp.erp_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;

import java.util.TimeZone;

/**
 * Applies {@code app.timezone} as the JVM default zone as soon as the environment is loaded. Registered in
 * {@code META-INF/spring.factories} so it runs before the DataSource and Hibernate capture the default zone.
 */
@Slf4j
public class TimezoneConfig implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    public static final String DEFAULT_TIMEZONE = "Africa/Nairobi";

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        String zone = event.getEnvironment().getProperty("app.timezone", DEFAULT_TIMEZONE);
        // Sale and expense dates default to "today" in the business timezone
        TimeZone.setDefault(TimeZone.getTimeZone(zone));
        log.info("Application timezone set to: {}", TimeZone.getDefault().getID());
    }
}
