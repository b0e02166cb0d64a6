package com.browserpilot.dispatch.cli;

import com.browserpilot.core.captcha.CaptchaGate;
import com.browserpilot.core.errors.BrowserPilotException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: browserpilot captcha &lt;id&gt;
 * <p>
 * Signals that the captcha blocking a session has been solved by hand.
 */
@Command(name = "captcha", mixinStandardHelpOptions = true,
        description = "Tell the service a captcha has been solved")
@Component
public class CaptchaCommand implements Runnable {

    @Parameters(index = "0", paramLabel = "SESSION_ID", description = "Session waiting for the captcha")
    private String sessionId;

    private final CaptchaGate captchaGate;

    public CaptchaCommand(CaptchaGate captchaGate) {
        this.captchaGate = captchaGate;
    }

    @Override
    public void run() {
        try {
            captchaGate.resolve(sessionId);
            ConsoleOutput.success("Captcha resolved for session " + sessionId);
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }
}
