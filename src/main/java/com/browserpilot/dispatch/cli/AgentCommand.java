package com.browserpilot.dispatch.cli;

import com.browserpilot.client.AgentSessionStatus;
import com.browserpilot.config.PilotProperties;
import com.browserpilot.core.agent.InteractiveStepController;
import com.browserpilot.core.agent.TaskHandle;
import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.model.InteractiveTask;
import com.browserpilot.core.model.StepResult;
import com.browserpilot.core.model.TaskResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * CLI command: browserpilot agent "&lt;task&gt;"
 * <p>
 * Runs an agent task. With {@code --interactive} the task is advanced step by
 * step: Enter runs one step, a number runs that many, {@code f} runs the rest
 * of the budget, {@code s} shows the remote session status and {@code q} ends
 * the task.
 */
@Command(name = "agent", mixinStandardHelpOptions = true, description = "Run an autonomous agent task")
@Component
public class AgentCommand implements Runnable {

    @Parameters(index = "0", description = "What the agent should do")
    private String task;

    @Option(names = {"--url", "-u"}, description = "Start URL (default: browserpilot.agent.start-url)")
    private String url;

    @Option(names = {"--interactive", "-i"}, description = "Advance the task step by step")
    private boolean interactive;

    @Option(names = {"--max-steps", "-n"}, description = "Step budget, 1 to 100")
    private Integer maxSteps;

    private final InteractiveStepController controller;
    private final PilotProperties properties;

    public AgentCommand(InteractiveStepController controller, PilotProperties properties) {
        this.controller = controller;
        this.properties = properties;
    }

    @Override
    public void run() {
        run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
    }

    void run(BufferedReader input) {
        ConsoleOutput.printBanner();
        int budget = maxSteps != null ? maxSteps : properties.getDefaultMaxSteps();

        TaskHandle handle;
        try {
            handle = controller.executeTask(task, url, interactive, budget);
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
            return;
        }

        if (!handle.isSteppable()) {
            TaskResult result = handle.result();
            ConsoleOutput.step(result.asStep(), result.stepsCompleted(), budget);
            if (result.finalUrl() != null) {
                ConsoleOutput.info("Finished at " + result.finalUrl());
            }
            return;
        }

        ConsoleOutput.info("Agent session " + handle.sessionId()
                + " ready. Enter = 1 step, <n> = n steps, f = finish, s = status, q = quit");
        stepLoop(handle.sessionId(), input);
    }

    private void stepLoop(String sessionId, BufferedReader input) {
        while (true) {
            InteractiveTask current = controller.current().orElse(null);
            if (current == null || !current.isSteppable()) {
                if (current != null && current.sessionId() != null) {
                    ConsoleOutput.warn("Step budget used up without completing the task");
                    cleanupQuietly(sessionId);
                }
                ConsoleOutput.success("Agent task finished");
                return;
            }

            String line = read(input);
            if (line == null || line.trim().equalsIgnoreCase("q")) {
                cleanupQuietly(sessionId);
                ConsoleOutput.info("Agent task ended");
                return;
            }
            if (line.trim().equalsIgnoreCase("s")) {
                showStatus(sessionId);
                continue;
            }
            int steps = parseSteps(line.trim(), current.remainingSteps());
            if (steps < 1) {
                ConsoleOutput.error("Unrecognised input: " + line.trim());
                continue;
            }
            try {
                StepResult result = controller.executeStep(sessionId, steps);
                InteractiveTask after = controller.current().orElse(current);
                ConsoleOutput.step(result, after.stepCount(), after.maxSteps());
            } catch (BrowserPilotException e) {
                ConsoleOutput.error(e);
                if (controller.current().map(InteractiveTask::isSteppable).orElse(false)) continue;
                return;
            }
        }
    }

    static int parseSteps(String line, int remaining) {
        if (line.isEmpty()) return 1;
        if (line.equalsIgnoreCase("f")) return remaining;
        try {
            return Integer.parseInt(line);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private void showStatus(String sessionId) {
        try {
            AgentSessionStatus status = controller.status(sessionId);
            ConsoleOutput.info("Step " + (status.currentStep() != null ? status.currentStep() : 0)
                    + (status.currentUrl() != null ? " at " + status.currentUrl() : "")
                    + (Boolean.TRUE.equals(status.isComplete()) ? " (complete)" : ""));
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }

    private void cleanupQuietly(String sessionId) {
        try {
            controller.cleanup(sessionId);
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        }
    }

    private static String read(BufferedReader input) {
        System.out.print("agent> ");
        System.out.flush();
        try {
            return input.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }
}
