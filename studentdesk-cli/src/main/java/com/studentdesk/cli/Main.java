package com.studentdesk.cli;

import com.studentdesk.application.config.ConfigValidationResult;
import com.studentdesk.application.config.ConfigValidator;
import com.studentdesk.application.error.StoreConnectionException;
import com.studentdesk.application.error.StoreException;
import com.studentdesk.application.ports.ConfigPort;
import com.studentdesk.application.service.StudentService;
import com.studentdesk.cli.bootstrap.Bootstrap;
import com.studentdesk.cli.menu.MenuIO;
import com.studentdesk.cli.menu.StudentMenu;
import com.studentdesk.infrastructure.config.FileConfigService;
import com.studentdesk.infrastructure.db.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * StudentDesk entry point. Takes no arguments.
 *
 * Exit codes:
 *  0 normal exit, or the start-up connectivity check failed
 *  1 schema bootstrap or terminal setup failed
 *  2 configuration could not be loaded or is invalid
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        ConfigPort config;
        try {
            config = FileConfigService.defaultFromWorkingDir();
        } catch (IOException e) {
            System.err.println("Failed to load config from working directory: " + e.getMessage());
            return 2;
        }

        try (MenuIO io = Bootstrap.openMenuIO()) {
            return run(config, io);
        } catch (IOException e) {
            log.error("Terminal failure", e);
            System.err.println("Terminal error: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Validates config, checks connectivity, optionally creates the schema, then hands {@code io} to the menu.
     */
    static int run(ConfigPort config, MenuIO io) {
        ConfigValidationResult validation = new ConfigValidator().validate(config);
        if (!validation.ok()) {
            io.println("Invalid configuration:");
            validation.errors().forEach(err -> io.println("  - " + err));
            return 2;
        }

        Database database = Bootstrap.createDatabase(config);
        log.info("Starting with {}", database.settings());

        // verify that we can connect with the given config before showing the menu
        try {
            database.ping();
        } catch (StoreConnectionException e) {
            log.warn("Start-up connectivity check failed", e);
            io.println("[ERROR] Could not connect to database with current configuration:\n" + e.diagnostic());
            return 0;
        }

        if (database.settings().initSchema()) {
            try {
                database.initSchema();
            } catch (StoreException e) {
                log.error("Schema bootstrap failed", e);
                io.println("[ERROR] Could not create the students table:\n" + e.diagnostic());
                return 1;
            }
        }

        StudentService service = Bootstrap.createStudentService(database);
        return new StudentMenu(service, io).run();
    }
}
