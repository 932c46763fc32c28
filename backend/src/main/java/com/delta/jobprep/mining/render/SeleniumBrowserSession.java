package com.delta.jobprep.mining.render;

import com.delta.jobprep.config.MinerProperties;
import jakarta.annotation.PreDestroy;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WindowType;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.remote.UnreachableBrowserException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Function;

/**
 * Chrome-backed {@link BrowserSession}. The driver is launched on first use and every page is
 * its own tab.
 *
 * <p>A single driver has one focused window, so every driver call, navigation included, holds
 * {@code driverLock}: concurrent rendered fetches load one page at a time. Settle delays and
 * retries run outside the lock. When the browser dies the driver is discarded and the next
 * {@link #openPage()} launches a fresh one; tabs of the dead driver fail as closed.
 */
@Component
public class SeleniumBrowserSession implements BrowserSession {
    private static final Logger log = LoggerFactory.getLogger(SeleniumBrowserSession.class);

    private final MinerProperties properties;
    private final Function<ChromeOptions, WebDriver> driverFactory;
    private final Object driverLock = new Object();
    private WebDriver driver;
    private String rootHandle;

    @Autowired
    public SeleniumBrowserSession(MinerProperties properties) {
        this(properties, ChromeDriver::new);
    }

    SeleniumBrowserSession(MinerProperties properties, Function<ChromeOptions, WebDriver> driverFactory) {
        this.properties = properties;
        this.driverFactory = driverFactory;
    }

    @Override
    public RenderedPage openPage() {
        synchronized (driverLock) {
            WebDriver active = ensureDriver();
            try {
                active.switchTo().window(rootHandle);
                active.switchTo().newWindow(WindowType.TAB);
                return new TabPage(active, active.getWindowHandle());
            } catch (WebDriverException e) {
                throw failure("Unable to open browser tab", e);
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (driverLock) {
            discardDriver();
        }
    }

    static boolean isSessionLost(WebDriverException e) {
        return e instanceof NoSuchSessionException || e instanceof UnreachableBrowserException;
    }

    // Callers hold driverLock.
    private BrowserSessionException failure(String message, WebDriverException e) {
        if (isSessionLost(e)) {
            log.warn("Browser session lost ({}); relaunching on next use", e.getClass().getSimpleName());
            discardDriver();
        }
        return new BrowserSessionException(message, e);
    }

    private void discardDriver() {
        if (driver == null) {
            return;
        }
        try {
            driver.quit();
        } catch (WebDriverException e) {
            log.warn("Browser shutdown failed: {}", e.getMessage());
        } finally {
            driver = null;
            rootHandle = null;
        }
    }

    private WebDriver ensureDriver() {
        if (driver != null) {
            return driver;
        }
        ChromeOptions options = new ChromeOptions();
        if (properties.getFetch().getRendered().isHeadless()) {
            options.addArguments("--headless=new");
        }
        options.addArguments(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--user-agent=" + properties.getFetch().getUserAgent()
        );
        try {
            driver = driverFactory.apply(options);
            rootHandle = driver.getWindowHandle();
            log.info("Browser session started (headless={})", properties.getFetch().getRendered().isHeadless());
            return driver;
        } catch (WebDriverException e) {
            driver = null;
            throw new BrowserSessionException("Unable to launch browser", e);
        }
    }

    private final class TabPage implements RenderedPage {
        private final WebDriver owner;
        private final String handle;

        private TabPage(WebDriver owner, String handle) {
            this.owner = owner;
            this.handle = handle;
        }

        @Override
        public void navigate(String url, Duration timeout) {
            synchronized (driverLock) {
                WebDriver active = focus();
                try {
                    active.manage().timeouts().pageLoadTimeout(timeout);
                    active.get(url);
                } catch (WebDriverException e) {
                    throw failure("Navigation failed for " + url, e);
                }
            }
        }

        @Override
        public String title() {
            synchronized (driverLock) {
                try {
                    return focus().getTitle();
                } catch (WebDriverException e) {
                    throw failure("Unable to read page title", e);
                }
            }
        }

        @Override
        public String html() {
            synchronized (driverLock) {
                try {
                    return focus().getPageSource();
                } catch (WebDriverException e) {
                    throw failure("Unable to read page source", e);
                }
            }
        }

        @Override
        public void close() {
            synchronized (driverLock) {
                if (driver == null || driver != owner) {
                    return;
                }
                try {
                    driver.switchTo().window(handle);
                    driver.close();
                    driver.switchTo().window(rootHandle);
                } catch (WebDriverException e) {
                    log.debug("Closing browser tab {} failed: {}", handle, e.getMessage());
                }
            }
        }

        private WebDriver focus() {
            if (driver == null || driver != owner) {
                throw new BrowserSessionException("Browser session is closed");
            }
            try {
                return driver.switchTo().window(handle);
            } catch (WebDriverException e) {
                throw failure("Browser tab is gone", e);
            }
        }
    }
}
