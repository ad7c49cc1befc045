package com.hotelrates.infrastructure.scraper.browser;

import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts local Chrome sessions through ChromeDriver.
 */
@Component
public class ChromeSessionFactory implements BrowserSessionFactory {

    private static final Logger logger = LoggerFactory.getLogger(ChromeSessionFactory.class);

    private final boolean headless;
    private final Duration pageLoadTimeout;
    private final String userAgent;

    public ChromeSessionFactory(
            @Value("${hotelrates.browser.headless:true}") boolean headless,
            @Value("${hotelrates.browser.page-load-timeout-ms:30000}") long pageLoadTimeoutMs,
            @Value("${hotelrates.browser.user-agent:Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36}")
            String userAgent) {
        this.headless = headless;
        this.pageLoadTimeout = Duration.ofMillis(pageLoadTimeoutMs);
        this.userAgent = userAgent;
    }

    @Override
    public WebDriver createSession() {
        ChromeOptions options = new ChromeOptions();
        if (headless) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--disable-gpu",
            "--no-sandbox",
            "--window-size=1920,1080",
            "--lang=en-US",
            "--user-agent=" + userAgent
        );

        WebDriver driver = new ChromeDriver(options);
        driver.manage().timeouts().pageLoadTimeout(pageLoadTimeout);
        logger.debug("Started Chrome session (headless={})", headless);
        return driver;
    }
}
