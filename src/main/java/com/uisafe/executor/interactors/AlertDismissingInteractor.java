package com.uisafe.executor.interactors;

import com.uisafe.core.UiSafeConfig;
import com.uisafe.executor.FailureClassifier;
import com.uisafe.executor.InteractsWith;
import com.uisafe.executor.RecoveringInteractor;
import org.openqa.selenium.UnhandledAlertException;
import org.openqa.selenium.WebDriver;

/**
 * Driver-level interactions blocked by an unexpected alert ({@link UnhandledAlertException})
 * are retried once after the alert is closed. Whether the alert is dismissed or accepted
 * follows {@link UiSafeConfig#isAcceptAlerts()}.
 */
@InteractsWith(WebDriver.class)
public class AlertDismissingInteractor extends RecoveringInteractor<WebDriver> {

    public AlertDismissingInteractor() {
        this(UiSafeConfig.defaults());
    }

    public AlertDismissingInteractor(UiSafeConfig config) {
        super(config.isDismissAlertsEnabled()
                ? FailureClassifier.ofType(UnhandledAlertException.class)
                : FailureClassifier.none(),
            new HandleAlertAction(config.isAcceptAlerts()));
    }
}
