package com.browserpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for BrowserPilot.
 * Routes to subcommands: run, shell, agent, session, captcha, screenshot.
 */
@Command(
        name = "browserpilot",
        mixinStandardHelpOptions = true,
        version = "BrowserPilot 0.1.0",
        description = "Drive a remote browser automation service with natural-language commands",
        subcommands = {
                RunCommand.class,
                ShellCommand.class,
                AgentCommand.class,
                SessionCommand.class,
                CaptchaCommand.class,
                ScreenshotCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class PilotCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
