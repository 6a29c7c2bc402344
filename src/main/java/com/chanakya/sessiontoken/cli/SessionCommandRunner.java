package com.chanakya.sessiontoken.cli;

import com.chanakya.sessiontoken.service.SessionTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.PrintStream;

@Component
public class SessionCommandRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(SessionCommandRunner.class);

    private final SessionTokenService sessionTokenService;
    private final PrintStream out;

    @Autowired
    public SessionCommandRunner(SessionTokenService sessionTokenService) {
        this(sessionTokenService, System.out);
    }

    SessionCommandRunner(SessionTokenService sessionTokenService, PrintStream out) {
        this.sessionTokenService = sessionTokenService;
        this.out = out;
    }

    /**
     * {@code secret} prints a new secret key, {@code session-id} prints a session token
     * built from the configured defaults.
     */
    @Override
    public void run(String... args) {
        if (args.length == 0) {
            return;
        }
        String command = args[0];
        if ("secret".equals(command)) {
            out.println(sessionTokenService.generateSecretKey());
        } else if ("session-id".equals(command)) {
            out.println(sessionTokenService.generateSessionId());
        } else {
            log.warn("Unknown command '{}', expected 'secret' or 'session-id'", command);
        }
    }
}
