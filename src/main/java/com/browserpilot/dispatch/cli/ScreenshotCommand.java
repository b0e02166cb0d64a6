package com.browserpilot.dispatch.cli;

import com.browserpilot.core.errors.BrowserPilotException;
import com.browserpilot.core.screenshot.ScreenshotService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * CLI command: browserpilot screenshot &lt;reference&gt; [--out dir]
 */
@Command(name = "screenshot", mixinStandardHelpOptions = true,
        description = "Download a screenshot reported by the service")
@Component
public class ScreenshotCommand implements Runnable {

    @Parameters(index = "0", paramLabel = "REFERENCE", description = "Screenshot path as reported by the service")
    private String reference;

    @Option(names = {"--out", "-o"}, description = "Target directory (default: browserpilot.screenshots.directory)")
    private Path out;

    private final ScreenshotService screenshots;

    public ScreenshotCommand(ScreenshotService screenshots) {
        this.screenshots = screenshots;
    }

    @Override
    public void run() {
        try {
            Path saved = out != null ? screenshots.save(reference, out) : screenshots.save(reference);
            ConsoleOutput.success("Saved " + saved);
        } catch (BrowserPilotException e) {
            ConsoleOutput.error(e);
        } catch (UncheckedIOException e) {
            ConsoleOutput.error(e.getMessage());
        }
    }
}
