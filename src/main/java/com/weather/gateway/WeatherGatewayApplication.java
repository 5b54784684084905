package com.weather.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

@SpringBootApplication
public class WeatherGatewayApplication {

    private static final Logger logger = LoggerFactory.getLogger(WeatherGatewayApplication.class);

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(WeatherGatewayApplication.class, args);

        Environment environment = context.getEnvironment();
        logger.info("Cache TTL: {} seconds", environment.getProperty("app.cache.ttl-seconds", "600"));
        if (!StringUtils.hasText(environment.getProperty("app.openweather.api-key"))) {
            logger.warn("OPENWEATHER_API_KEY is NOT set, only cached data can be served");
        }
    }
}
