package com.taskpilot.dispatch.cli;

import com.taskpilot.core.engine.OrchestratorRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: taskpilot serve
 * <p>
 * Runs the orchestration loop in the background and exposes the control surface over
 * HTTP. The web server is enabled by {@link com.taskpilot.TaskPilotApplication#main}
 * detecting "serve" in args, and {@link CliRunner} skips picocli in that mode. The loop
 * starts once Tomcat is ready; when it stops, the application exits with its code.
 * <p>
 * Configure port via: {@code SERVER_PORT=9090 taskpilot serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the orchestrator with the HTTP control surface")
@Component
public class ServeCommand implements Runnable {

    @Value("${server.port:8080}")
    private int port;

    private final OrchestratorRunner runner;
    private final ApplicationContext context;

    public ServeCommand(OrchestratorRunner runner, ApplicationContext context) {
        this.runner = runner;
        this.context = context;
    }

    @Override
    public void run() {
        // Not called in serve mode, CliRunner skips picocli.
        // Kept for picocli subcommand registration and --help.
        printBanner(port);
    }

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        printBanner(event.getWebServer().getPort());
        if (runner.isRunning()) {
            return;
        }
        runner.startInBackground(code -> System.exit(SpringApplication.exit(context, () -> code)));
    }

    private static void printBanner(int port) {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("TaskPilot running on port " + port);
        System.out.println();
        System.out.println("  Control: http://localhost:" + port + "/api/v1/control");
        System.out.println("  Health:  http://localhost:" + port + "/api/v1/health");
        System.out.println();
        ConsoleOutput.info("Press Ctrl+C to stop.");
    }

    public int getPort() {
        return port;
    }
}
