package com.browserpilot.dispatch.cli;

import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.events.PilotEvent;
import com.browserpilot.core.model.Command;
import com.browserpilot.core.model.Message;
import com.browserpilot.core.model.ProgressEvent;
import com.browserpilot.core.model.Session;
import com.browserpilot.core.model.StepResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the BrowserPilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) BROWSERPILOT v0.1.0|@"));
        System.out.println("----------------------------------");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [PILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void error(BrowserPilotException e) {
        error("[" + e.kind() + "] " + e.describe());
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void session(Session session) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [SESSION]|@ " + session.sessionId()
                + " " + (session.active() ? "@|fg(green) active|@" : "@|fg(red) inactive|@")
                + " (" + session.browserType().wireName() + (session.headless() ? ", headless" : "") + ")"));
        if (session.status() != null) {
            System.out.println("  Status:   " + session.status());
        }
        if (session.currentUrl() != null) {
            System.out.println("  URL:      " + session.currentUrl());
        }
        System.out.println("  Pending:  " + session.pendingCommands());
        if (session.lastActivity() != null) {
            System.out.println("  Activity: " + session.lastActivity());
        }
        if (session.screenshotPath() != null) {
            System.out.println("  Shot:     " + session.screenshotPath());
        }
    }

    public static void progress(ProgressEvent event) {
        String marker = switch (event.outcome()) {
            case COMPLETED -> "@|fg(green) +|@";
            case FAILED -> "@|fg(red) x|@";
            case IN_PROGRESS -> "@|fg(yellow) ~|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + marker + " " + event.action()
                + (event.message() != null && !event.message().isBlank() ? ": " + event.message() : "")));
    }

    public static void commandResult(Command command) {
        for (ProgressEvent event : command.events()) {
            progress(event);
        }
        switch (command.status()) {
            case COMPLETED -> success(command.explanation() != null ? command.explanation() : "Command executed");
            case FAILED -> error("Command failed: " + command.error());
            case ABANDONED -> warn("Command abandoned");
            default -> warn("Command still running after " + command.pollCount() + " polls");
        }
        if (command.result() != null && command.result().screenshotPath() != null) {
            System.out.println("  Screenshot: " + command.result().screenshotPath());
        }
    }

    public static void step(StepResult step, int stepCount, int maxSteps) {
        String status = step.isError() ? "@|fg(red) ERROR|@" : "@|fg(green) OK|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(blue) [AGENT " + stepCount + "/" + maxSteps + "]|@ " + status + " "
                + (step.message() != null ? step.message() : "")));
        if (step.currentUrl() != null) {
            System.out.println("  URL: " + step.currentUrl());
        }
        if (step.screenshotPath() != null) {
            System.out.println("  Screenshot: " + step.screenshotPath());
        }
    }

    public static void message(Message message) {
        String prefix = switch (message.role()) {
            case USER -> "@|bold you>|@";
            case SYSTEM -> "@|fg(cyan) [SYSTEM]|@";
            case RESULT -> "@|fg(green) [RESULT]|@";
            case ERROR -> "@|fg(red) [ERROR]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + message.content()));
    }

    /** One line per client event, used while a command or task is running. */
    public static void event(PilotEvent event) {
        String prefix = switch (event.eventType()) {
            case "session.started" -> "@|fg(magenta) [SESSION]|@";
            case "session.ended" -> "@|fg(magenta) [SESSION]|@";
            case "session.lost" -> "@|fg(red),bold [SESSION LOST]|@";
            case "captcha.required" -> "@|fg(yellow),bold [CAPTCHA]|@";
            case "captcha.resolved", "captcha.cleared" -> "@|fg(green) [CAPTCHA]|@";
            case "command.submitted" -> "@|fg(cyan) [COMMAND]|@";
            case "command.progress" -> "@|fg(blue) [PROGRESS]|@";
            case "command.poll_failed" -> "@|fg(yellow) [RETRY]|@";
            case "command.completed" -> "@|fg(green),bold [COMPLETE]|@";
            case "command.failed" -> "@|fg(red),bold [FAILED]|@";
            case "command.abandoned" -> "@|fg(yellow) [ABANDONED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + describe(event)));
    }

    private static String describe(PilotEvent event) {
        var payload = event.payload();
        if (payload.containsKey("explanation")) return String.valueOf(payload.get("explanation"));
        if (payload.containsKey("error")) return String.valueOf(payload.get("error"));
        if (payload.containsKey("reason")) return String.valueOf(payload.get("reason"));
        if (payload.containsKey("instruction")) return String.valueOf(payload.get("instruction"));
        return event.commandId() != null ? event.commandId() : String.valueOf(event.sessionId());
    }
}
