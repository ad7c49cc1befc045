package com.hotelrates.infrastructure.scraper.browser;

import org.openqa.selenium.WebDriver;

/**
 * Creates browser sessions for scrapers. Each session is owned by exactly one scrape and quit by
 * it when the scrape ends.
 */
public interface BrowserSessionFactory {

    /**
     * @throws org.openqa.selenium.WebDriverException if no session could be started
     */
    WebDriver createSession();
}
