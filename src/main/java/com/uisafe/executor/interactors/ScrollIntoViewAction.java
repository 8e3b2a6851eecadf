package com.uisafe.executor.interactors;

import com.uisafe.executor.CorrectiveAction;
import com.uisafe.model.ScrollBlock;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.WrapsDriver;
import org.openqa.selenium.WrapsElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scrolls an element into the viewport with JavaScript.
 *
 * The driver is taken from the element itself ({@link WrapsDriver}); decorated elements
 * are unwrapped through {@link WrapsElement} first. Throws when no JavaScript-capable
 * driver can be reached, which the enclosing policy treats as a failed recovery.
 */
public class ScrollIntoViewAction implements CorrectiveAction<WebElement> {

    private static final Logger log = LoggerFactory.getLogger(ScrollIntoViewAction.class);

    static final String SCROLL_SCRIPT =
        "arguments[0].scrollIntoView({block: arguments[1], inline: 'nearest'});";

    private final ScrollBlock block;

    public ScrollIntoViewAction(ScrollBlock block) {
        this.block = block != null ? block : ScrollBlock.CENTER;
    }

    @Override
    public void perform(WebElement element) {
        WebElement target = unwrap(element);
        WebDriver  driver = driverOf(target);
        if (!(driver instanceof JavascriptExecutor js)) {
            throw new UnsupportedOperationException(
                "Driver " + driver.getClass().getSimpleName() + " cannot execute JavaScript");
        }
        log.debug("ScrollIntoViewAction: Scrolling {} into view (block={})", target, block.cssValue());
        js.executeScript(SCROLL_SCRIPT, target, block.cssValue());
    }

    public ScrollBlock getBlock() { return block; }

    private static WebElement unwrap(WebElement element) {
        WebElement current = element;
        while (current instanceof WrapsElement wrapper && wrapper.getWrappedElement() != current) {
            current = wrapper.getWrappedElement();
        }
        return current;
    }

    private static WebDriver driverOf(WebElement element) {
        if (element instanceof WrapsDriver wd && wd.getWrappedDriver() != null) {
            return wd.getWrappedDriver();
        }
        throw new IllegalStateException("Cannot resolve the WebDriver owning element " + element);
    }
}
