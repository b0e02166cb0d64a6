package com.browserpilot.dispatch.cli;

import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.session.SessionManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * CLI command: browserpilot session status|stop &lt;id&gt;
 */
@Command(name = "session", mixinStandardHelpOptions = true,
        description = "Inspect or stop a browser session on the service")
@Component
public class SessionCommand implements Runnable {

    private final SessionManager sessionManager;

    public SessionCommand(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    @Command(name = "status", description = "Show the status of a session")
    void status(@Parameters(paramLabel = "SESSION_ID", description = "Session id") String sessionId) {
        try {
            ConsoleOutput.session(sessionManager.inspect(sessionId));
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }

    @Command(name = "stop", description = "Stop a session; stopping an unknown session is not an error")
    void stop(@Parameters(paramLabel = "SESSION_ID", description = "Session id") String sessionId) {
        try {
            sessionManager.stop(sessionId);
            ConsoleOutput.success("Session " + sessionId + " stopped");
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }
}
