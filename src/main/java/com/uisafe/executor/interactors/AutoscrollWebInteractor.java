package com.uisafe.executor.interactors;

import com.uisafe.core.UiSafeConfig;
import com.uisafe.executor.FailureClassifier;
import com.uisafe.executor.InteractsWith;
import com.uisafe.executor.RecoveringInteractor;
import org.openqa.selenium.ElementNotInteractableException;
import org.openqa.selenium.WebElement;

/**
 * Element interactions that fail because the element cannot be acted upon
 * ({@link ElementNotInteractableException}, including {@code ElementClickInterceptedException})
 * are retried once after scrolling the element into view.
 *
 * With autoscroll disabled in {@link UiSafeConfig} every failure propagates untouched.
 */
@InteractsWith(WebElement.class)
public class AutoscrollWebInteractor extends RecoveringInteractor<WebElement> {

    public AutoscrollWebInteractor() {
        this(UiSafeConfig.defaults());
    }

    public AutoscrollWebInteractor(UiSafeConfig config) {
        super(config.isAutoscrollEnabled()
                ? FailureClassifier.ofType(ElementNotInteractableException.class)
                : FailureClassifier.none(),
            new ScrollIntoViewAction(config.getScrollBlock()));
    }
}
