package com.studentdesk.cli.bootstrap;

import com.studentdesk.application.config.DatabaseSettings;
import com.studentdesk.application.ports.ConfigPort;
import com.studentdesk.application.ports.StudentRepository;
import com.studentdesk.application.service.StudentService;
import com.studentdesk.cli.menu.JLineMenuIO;
import com.studentdesk.cli.menu.MenuIO;
import com.studentdesk.cli.menu.StreamMenuIO;
import com.studentdesk.infrastructure.db.Database;
import com.studentdesk.infrastructure.db.JdbcStudentRepository;

import java.io.IOException;

public final class Bootstrap {

    private Bootstrap() {
    }

    /**
     * Builds the connection provider from config. Nothing is opened yet.
     */
    public static Database createDatabase(ConfigPort config) {
        return new Database(DatabaseSettings.from(config));
    }

    /**
     * Wires the record operations over the JDBC repository.
     */
    public static StudentService createStudentService(Database database) {
        StudentRepository repository = new JdbcStudentRepository(database);
        return new StudentService(repository);
    }

    /**
     * JLine when a console is attached, plain streams otherwise (piped input).
     */
    public static MenuIO openMenuIO() throws IOException {
        if (System.console() != null) {
            return JLineMenuIO.open();
        }
        return new StreamMenuIO(System.in, System.out);
    }
}
