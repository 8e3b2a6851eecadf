package com.uisafe.executor.interactors;

import com.uisafe.executor.CorrectiveAction;
import org.openqa.selenium.Alert;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closes the browser alert that is blocking the driver, by dismissing or accepting it.
 */
public class HandleAlertAction implements CorrectiveAction<WebDriver> {

    private static final Logger log = LoggerFactory.getLogger(HandleAlertAction.class);

    private final boolean accept;

    public HandleAlertAction(boolean accept) {
        this.accept = accept;
    }

    @Override
    public void perform(WebDriver driver) {
        Alert alert = driver.switchTo().alert();
        String text = alert.getText();
        if (accept) {
            alert.accept();
        } else {
            alert.dismiss();
        }
        log.info("HandleAlertAction: {} alert '{}'", accept ? "Accepted" : "Dismissed", text);
    }

    public boolean isAccept() { return accept; }
}
