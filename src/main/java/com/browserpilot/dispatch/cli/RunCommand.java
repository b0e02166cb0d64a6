package com.browserpilot.dispatch.cli;

import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.command.CommandHandle;
import com.browserpilot.core.command.CommandOrchestrator;
import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.session.SessionManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;

/**
 * CLI command: browserpilot run "&lt;command&gt;"
 * <p>
 * Starts a session, runs one command to completion while printing progress,
 * then stops the session.
 */
@picocli.CommandLine.Command(name = "run", mixinStandardHelpOptions = true,
        description = "Run one natural-language command in a fresh browser session")
@Component
public class RunCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language command, e.g. \"go to example.com\"")
    private String instruction;

    @Option(names = {"--timeout", "-t"}, description = "Command timeout in seconds")
    private Integer timeout;

    @Mixin
    private BrowserOptions browserOptions = new BrowserOptions();

    private final SessionManager sessionManager;
    private final CommandOrchestrator orchestrator;
    private final EventBus eventBus;
    private final PilotProperties properties;

    public RunCommand(SessionManager sessionManager, CommandOrchestrator orchestrator,
                      EventBus eventBus, PilotProperties properties) {
        this.sessionManager = sessionManager;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        Session session;
        try {
            session = sessionManager.start(browserOptions.toConfig(properties));
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
            return;
        }
        ConsoleOutput.info("Session " + session.sessionId() + " started");

        var subscription = eventBus.subscribe(session.sessionId(), ConsoleOutput::event);
        try {
            int seconds = timeout != null ? timeout : properties.getCommandTimeoutSeconds();
            CommandHandle handle = orchestrator.submit(session.sessionId(), instruction, seconds);
            Command result = orchestrator.await(handle,
                    Duration.ofSeconds(seconds + properties.getPollGraceSeconds() + 5L));
            if (!result.isTerminal()) {
                orchestrator.abandon(handle.commandId());
                result = result.withStatus(CommandStatus.ABANDONED);
            }
            System.out.println();
            ConsoleOutput.commandResult(result);
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        } finally {
            subscription.unsubscribe();
            stopQuietly(session.sessionId());
        }
    }

    private void stopQuietly(String sessionId) {
        try {
            sessionManager.stop(sessionId);
            ConsoleOutput.info("Session " + sessionId + " stopped");
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }
}
