package com.browserpilot.dispatch.cli;

import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.captcha.CaptchaGate;
import com.browserpilot.core.command.CommandHandle;
import com.browserpilot.core.command.CommandOrchestrator;
import com.browserpilot.core.conversation.ConversationLog;
import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.events.EventBus;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.CommandStatus;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.screenshot.ScreenshotService;
import com.browserpilot.core.session.SessionManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Mixin;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * CLI command: browserpilot shell
 * <p>
 * Chat-style REPL over one browser session. Plain lines are sent as commands;
 * lines starting with a colon control the session.
 */
@picocli.CommandLine.Command(name = "shell", mixinStandardHelpOptions = true,
        description = "Interactive chat with one browser session")
@Component
public class ShellCommand implements Runnable {

    static final String HELP = ":status  refresh session status | :captcha  captcha solved | "
            + ":shot  save latest screenshot | :log  show conversation | :quit  stop and exit";

    private static final Duration AWAIT_SLICE = Duration.ofSeconds(1);

    @Mixin
    private BrowserOptions browserOptions = new BrowserOptions();

    private final SessionManager sessionManager;
    private final CommandOrchestrator orchestrator;
    private final CaptchaGate captchaGate;
    private final ConversationLog conversation;
    private final ScreenshotService screenshots;
    private final EventBus eventBus;
    private final PilotProperties properties;

    public ShellCommand(SessionManager sessionManager, CommandOrchestrator orchestrator,
                        CaptchaGate captchaGate, ConversationLog conversation,
                        ScreenshotService screenshots, EventBus eventBus, PilotProperties properties) {
        this.sessionManager = sessionManager;
        this.orchestrator = orchestrator;
        this.captchaGate = captchaGate;
        this.conversation = conversation;
        this.screenshots = screenshots;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public void run() {
        run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    void run(BufferedReader input) {
        ConsoleOutput.printBanner();

        Session session;
        try {
            session = sessionManager.start(browserOptions.toConfig(properties));
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
            return;
        }
        String sessionId = session.sessionId();
        ConsoleOutput.info("Session " + sessionId + " started. Type a command, or " + HELP);

        var subscription = eventBus.subscribe(sessionId, ConsoleOutput::event);
        try {
            String line;
            while (sessionManager.current().isPresent() && (line = prompt(input)) != null) {
                if (!handle(sessionId, line.trim(), input)) {
                    break;
                }
            }
        } finally {
            subscription.unsubscribe();
            if (sessionManager.current().isPresent()) {
                try {
                    sessionManager.stop(sessionId);
                    ConsoleOutput.info("Session " + sessionId + " stopped");
                } catch (BrowserPilotException e) {
                    ConsoleOutput.error(e);
                }
            } else {
                ConsoleOutput.warn("Session " + sessionId + " has ended");
            }
        }
    }

    /** @return false when the shell should exit */
    boolean handle(String sessionId, String line, BufferedReader input) {
        if (line.isEmpty()) return true;
        try {
            switch (line) {
                case ":quit", ":exit" -> {
                    return false;
                }
                case ":help" -> ConsoleOutput.info(HELP);
                case ":status" -> ConsoleOutput.session(sessionManager.refreshStatus(sessionId));
                case ":captcha" -> {
                    captchaGate.resolve(sessionId);
                    ConsoleOutput.success("Captcha resolved, you can send commands again");
                }
                case ":shot" -> saveLatestScreenshot();
                case ":log" -> conversation.messages().forEach(ConsoleOutput::message);
                default -> runCommand(sessionId, line, input);
            }
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
        return true;
    }

    /**
     * Waits for the command in short slices so a captcha pause can be handed
     * back to the user while the command is still running.
     */
    private void runCommand(String sessionId, String line, BufferedReader input) {
        CommandHandle handle = orchestrator.submit(sessionId, line);
        long deadline = System.currentTimeMillis() + Duration.ofSeconds(
                properties.getCommandTimeoutSeconds() + properties.getPollGraceSeconds() + 5L).toMillis();
        Command result = orchestrator.await(handle, AWAIT_SLICE);
        while (!result.isTerminal() && System.currentTimeMillis() < deadline) {
            if (captchaGate.isPending()) {
                ConsoleOutput.warn("Solve the captcha in the browser window, then press Enter");
                if (prompt(input) == null) break;
                captchaGate.resolve(sessionId);
            }
            result = orchestrator.await(handle, AWAIT_SLICE);
        }
        if (!result.isTerminal()) {
            orchestrator.abandon(handle.commandId());
            result = result.withStatus(CommandStatus.ABANDONED);
        }
        ConsoleOutput.commandResult(result);
    }

    private void saveLatestScreenshot() {
        var reference = sessionManager.current().map(Session::screenshotPath).orElse(null);
        if (reference == null) {
            ConsoleOutput.warn("No screenshot reported yet");
            return;
        }
        ConsoleOutput.success("Saved " + screenshots.save(reference));
    }

    private static String prompt(BufferedReader input) {
        System.out.print("pilot> ");
        System.out.flush();
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }
}
