package com.giftsbuyer.cli;

import com.giftsbuyer.application.config.ConfigValidationResult;
import com.giftsbuyer.application.config.ConfigValidator;
import com.giftsbuyer.application.engine.GiftMonitor;
import com.giftsbuyer.application.ports.ConfigPort;
import com.giftsbuyer.cli.bootstrap.Bootstrap;
import com.giftsbuyer.cli.tools.ConfigDoctor;
import com.giftsbuyer.infrastructure.config.FileConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    public static void main(String[] args) {
        int code;
        try {
            code = dispatch(args);
        } catch (RuntimeException e) {
            log.error("Unexpected error, terminating", e);
            code = 1;
        }
        if (code != 0) System.exit(code);
    }

    static int dispatch(String[] args) {
        String cmd = (args.length == 0) ? "run" : args[0].trim().toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "run":
                return runMonitor();

            case "validate-config":
                return withConfig(cfg -> ConfigDoctor.run(cfg, System.out));

            case "help":
            case "--help":
            case "-h":
                printHelp();
                return 0;

            default:
                System.err.println("Unknown command: " + args[0]);
                printHelp();
                return 2;
        }
    }

    private static int runMonitor() {
        System.out.println(Banner.render());
        return withConfig(cfg -> {
            ConfigValidationResult res = new ConfigValidator().validate(cfg);
            if (!res.isValid()) {
                for (String err : res.errors()) log.error("Config: {}", err);
                log.error("Fix the configuration (see: validate-config) and try again");
                return 2;
            }

            GiftMonitor monitor = Bootstrap.createMonitor(cfg);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                monitor.stop();
                try {
                    if (!monitor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                        log.warn("Monitor did not finish its cycle within {}s", SHUTDOWN_WAIT_SECONDS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "giftsbuyer-shutdown"));

            monitor.run();
            return 0;
        });
    }

    private static int withConfig(ConfigCommand command) {
        ConfigPort config;
        try {
            config = FileConfigService.defaultFromWorkingDir();
        } catch (IOException e) {
            log.error("Failed to load config from working directory: {}", e.getMessage());
            return 2;
        }
        return command.run(config);
    }

    private static void printHelp() {
        System.out.println("""
                Usage: java -jar giftsbuyer-cli.jar [command]

                Commands:
                  run              start monitoring and buying (default)
                  validate-config  check config/config.properties and env overrides
                  help             show this help

                Configuration: config/config.properties, config/.env, config/secrets.properties,
                environment (GIFTS_<KEY>, TELEGRAM_BOT_TOKEN).
                """);
    }

    @FunctionalInterface
    private interface ConfigCommand {
        int run(ConfigPort config);
    }
}
